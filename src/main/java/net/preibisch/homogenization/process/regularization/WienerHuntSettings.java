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

import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;

/**
 * Parameters of the Gibbs sampler that estimates the regularization factor.
 */
public class WienerHuntSettings
{
	public static double defaultThreshold = 1e-4;
	public static int defaultMaxIter = 200;
	public static int defaultMinIter = 100;
	public static int defaultBurnin = 30;

	// relative change of the posterior mean below which the chain may stop
	final double threshold;

	final int maxIter, minIter;

	// number of initial samples that are discarded
	final int burnin;

	public WienerHuntSettings( final double threshold, final int maxIter, final int minIter, final int burnin )
	{
		this.threshold = threshold;
		this.maxIter = maxIter;
		this.minIter = minIter;
		this.burnin = burnin;

		validate();
	}

	public WienerHuntSettings()
	{
		this( defaultThreshold, defaultMaxIter, defaultMinIter, defaultBurnin );
	}

	public double getThreshold() { return threshold; }
	public int getMaxIter() { return maxIter; }
	public int getMinIter() { return minIter; }
	public int getBurnin() { return burnin; }

	public WienerHuntSettings setThreshold( final double threshold ) { return new WienerHuntSettings( threshold, maxIter, minIter, burnin ); }
	public WienerHuntSettings setMaxIter( final int maxIter ) { return new WienerHuntSettings( threshold, maxIter, minIter, burnin ); }
	public WienerHuntSettings setMinIter( final int minIter ) { return new WienerHuntSettings( threshold, maxIter, minIter, burnin ); }
	public WienerHuntSettings setBurnin( final int burnin ) { return new WienerHuntSettings( threshold, maxIter, minIter, burnin ); }

	private void validate()
	{
		if ( !( threshold > 0 ) )
			throw new ValidationException( Kind.ESTIMATOR_SETTINGS, "threshold must be > 0, got " + threshold );

		if ( maxIter < 1 )
			throw new ValidationException( Kind.ESTIMATOR_SETTINGS, "max_iter must be >= 1, got " + maxIter );

		if ( minIter < 0 )
			throw new ValidationException( Kind.ESTIMATOR_SETTINGS, "min_iter must be >= 0, got " + minIter );

		if ( burnin < 0 || burnin >= maxIter )
			throw new ValidationException( Kind.ESTIMATOR_SETTINGS, "burnin must be in [0, max_iter), got " + burnin );
	}

	@Override
	public String toString()
	{
		return "threshold=" + threshold + ", max_iter=" + maxIter + ", min_iter=" + minIter + ", burnin=" + burnin;
	}
}
