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

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * The estimated regularization factor together with the by-products of the
 * Gibbs sampler.
 */
public class WienerHuntResult
{
	final double regularization;

	// posterior mean of the object in image space
	final ArrayImg< DoubleType, DoubleArray > image;

	final double noise, prior;
	final double noiseUncertainty, priorUncertainty, regularizationUncertainty;

	final int iterations;
	final boolean converged;
	final WienerHuntState finalState;

	WienerHuntResult(
			final double regularization,
			final ArrayImg< DoubleType, DoubleArray > image,
			final double noise,
			final double prior,
			final double noiseUncertainty,
			final double priorUncertainty,
			final double regularizationUncertainty,
			final int iterations,
			final boolean converged,
			final WienerHuntState finalState )
	{
		this.regularization = regularization;
		this.image = image;
		this.noise = noise;
		this.prior = prior;
		this.noiseUncertainty = noiseUncertainty;
		this.priorUncertainty = priorUncertainty;
		this.regularizationUncertainty = regularizationUncertainty;
		this.iterations = iterations;
		this.converged = converged;
		this.finalState = finalState;
	}

	/**
	 * @return mean prior precision / mean noise precision over the samples after the burn-in
	 */
	public double getRegularization() { return regularization; }
	public ArrayImg< DoubleType, DoubleArray > getImage() { return image; }
	public double getNoise() { return noise; }
	public double getPrior() { return prior; }
	public double getNoiseUncertainty() { return noiseUncertainty; }
	public double getPriorUncertainty() { return priorUncertainty; }
	public double getRegularizationUncertainty() { return regularizationUncertainty; }

	/**
	 * @return the number of iterations that were run
	 */
	public int getIterations() { return iterations; }

	/**
	 * @return true if the chain stopped on the threshold rather than on max_iter
	 */
	public boolean hasConverged() { return converged; }
	public WienerHuntState getFinalState() { return finalState; }
}
