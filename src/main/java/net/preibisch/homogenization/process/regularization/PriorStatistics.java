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

/**
 * How the prior statistics of an estimation are reported.
 */
public enum PriorStatistics
{
	/**
	 * prior and its uncertainty are computed from the noise chain and the
	 * uncertainty of the regularization is always 1, as reported by earlier
	 * releases of the command line tool
	 */
	COMPATIBLE,

	/**
	 * prior and its uncertainty are computed from the prior chain, the
	 * uncertainty of the regularization is the standard deviation of the
	 * per-sample ratio prior/noise
	 */
	CORRECTED
}
