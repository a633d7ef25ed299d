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
package net.preibisch.homogenization.psf;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.process.regularization.WienerHuntResult;

public class HomogenizationResult
{
	final ArrayImg< DoubleType, DoubleArray > kernel;
	final ArrayImg< ComplexDoubleType, DoubleArray > spectrum;
	final double pixelScale;
	final double regularizationFactor;
	final WienerHuntResult estimation;

	public HomogenizationResult(
			final ArrayImg< DoubleType, DoubleArray > kernel,
			final ArrayImg< ComplexDoubleType, DoubleArray > spectrum,
			final double pixelScale,
			final double regularizationFactor,
			final WienerHuntResult estimation )
	{
		this.kernel = kernel;
		this.spectrum = spectrum;
		this.pixelScale = pixelScale;
		this.regularizationFactor = regularizationFactor;
		this.estimation = estimation;
	}

	public ArrayImg< DoubleType, DoubleArray > getKernel() { return kernel; }

	/**
	 * @return the unitary Fourier transform of the kernel
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > getSpectrum() { return spectrum; }

	/**
	 * @return the pixel scale of the kernel in arcsec, which is the one of the target PSF
	 */
	public double getPixelScale() { return pixelScale; }

	/**
	 * @return the regularization factor the kernel was computed with
	 */
	public double getRegularizationFactor() { return regularizationFactor; }

	/**
	 * @return the outcome of the Gibbs sampler, null if the regularization factor was not estimated
	 */
	public WienerHuntResult getEstimation() { return estimation; }
}
