/*-
 * #%L
 * Computation of convolution kernels that homogenize point-spread functions
 * of different instruments by regularized Wiener deconvolution.
 * %%
 * Copyright (C) 2015 - 2026 PSF Homogenization developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.homogenization.process.regularization;

import java.util.Arrays;

/**
 * State of the Gibbs sampler after a number of iterations. Instances are never
 * modified, {@link UnsupervisedWienerHunt#step(WienerHuntState)} creates the
 * next one.
 */
public class WienerHuntState
{
	// index of the last completed iteration, -1 before the first one
	final int iteration;

	// precision samples, entry 0 is the initial value
	final double[] noiseChain;
	final double[] priorChain;

	// sum of the object samples (interleaved complex) drawn after the burn-in
	final double[] postMeanSum;

	// relative change of the running posterior mean, NaN until it can be computed
	final double delta;

	WienerHuntState( final int iteration, final double[] noiseChain, final double[] priorChain, final double[] postMeanSum, final double delta )
	{
		this.iteration = iteration;
		this.noiseChain = noiseChain;
		this.priorChain = priorChain;
		this.postMeanSum = postMeanSum;
		this.delta = delta;
	}

	static WienerHuntState initial( final int numPixels )
	{
		return new WienerHuntState( -1, new double[] { 1 }, new double[] { 1 }, new double[ 2 * numPixels ], Double.NaN );
	}

	public int getIteration() { return iteration; }
	public double getDelta() { return delta; }
	public double getNoisePrecision() { return noiseChain[ noiseChain.length - 1 ]; }
	public double getPriorPrecision() { return priorChain[ priorChain.length - 1 ]; }
	public double[] getNoiseChain() { return noiseChain.clone(); }
	public double[] getPriorChain() { return priorChain.clone(); }

	/**
	 * @param burnin - number of discarded iterations
	 * @return how many object samples contributed to the posterior mean
	 */
	public int numPosteriorSamples( final int burnin )
	{
		return Math.max( 0, iteration - burnin );
	}

	static double[] append( final double[] chain, final double value )
	{
		final double[] extended = Arrays.copyOf( chain, chain.length + 1 );
		extended[ chain.length ] = value;
		return extended;
	}
}
