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
package net.preibisch.homogenization.process.deconvolution;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.process.fourier.OpticalTransferFunction;
import net.preibisch.homogenization.process.fourier.UnitaryFFT;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Wiener deconvolution with an l2 penalty on the discrete Laplacian of the
 * solution. Working with optical transfer functions instead of plain Fourier
 * transforms keeps the phase of the PSF in place.
 */
public class WienerDeconvolution
{
	public static double defaultRegularizationFactor = 1e-4;
	public static boolean defaultClip = true;

	private static final double[] LAPLACIAN = new double[] {
			0, -1, 0,
			-1, 4, -1,
			0, -1, 0 };

	/**
	 * @return a new 3x3 image of the discrete Laplacian used as high-pass regularization operator
	 */
	public static ArrayImg< DoubleType, DoubleArray > laplacian()
	{
		return ImgTools.wrap( LAPLACIAN.clone(), 3, 3 );
	}

	/**
	 * Computes conj(H) / ( |H|^2 + reg * |L|^2 ), with H the OTF of the PSF and L the
	 * OTF of the Laplacian, both at the size of the PSF. Frequencies where the
	 * denominator vanishes are set to 0.
	 *
	 * @param psf - the source PSF
	 * @param regularizationFactor - weight of the Laplacian penalty, &gt;= 0
	 * @return the Wiener filter in Fourier space
	 */
	public static < T extends RealType< T > > ArrayImg< ComplexDoubleType, DoubleArray > wienerFilter(
			final RandomAccessibleInterval< T > psf,
			final double regularizationFactor )
	{
		validateRegularization( regularizationFactor );

		final long[] dim = ImgTools.dimensions( psf );

		final double[] transFunc = ImgTools.storage( OpticalTransferFunction.psfToOtf( psf, dim ) );
		final double[] regOp = ImgTools.storage( OpticalTransferFunction.psfToOtf( laplacian(), dim ) );

		final double[] wiener = new double[ transFunc.length ];

		for ( int i = 0; i < wiener.length; i += 2 )
		{
			final double hr = transFunc[ i ];
			final double hi = transFunc[ i + 1 ];
			final double lr = regOp[ i ];
			final double li = regOp[ i + 1 ];

			final double denominator = hr * hr + hi * hi + regularizationFactor * ( lr * lr + li * li );

			if ( denominator != 0 )
			{
				wiener[ i ] = hr / denominator;
				wiener[ i + 1 ] = -hi / denominator;
			}
		}

		return ImgTools.wrapComplex( wiener, dim );
	}

	/**
	 * Compute the homogenization kernel that transforms the source PSF into the
	 * target PSF. Both PSFs must have the same dimensions.
	 *
	 * @param psfTarget - the PSF with the lower resolution
	 * @param psfSource - the PSF with the higher resolution
	 * @param regularizationFactor - weight of the Laplacian penalty
	 * @param clip - if true, kernel values are clamped to [-1, 1] to avoid noise amplification
	 * @return the kernel image and its (unitary) Fourier transform
	 */
	public static < S extends RealType< S >, T extends RealType< T > > Pair< ArrayImg< DoubleType, DoubleArray >, ArrayImg< ComplexDoubleType, DoubleArray > > homogenizationKernel(
			final RandomAccessibleInterval< T > psfTarget,
			final RandomAccessibleInterval< S > psfSource,
			final double regularizationFactor,
			final boolean clip )
	{
		final long[] dim = ImgTools.dimensions( psfSource );
		ValidationException.requireSameShape( ImgTools.dimensions( psfTarget ), dim, "KERNEL" );

		final double[] wiener = ImgTools.storage( wienerFilter( psfSource, regularizationFactor ) );
		final double[] target = ImgTools.storage( UnitaryFFT.fft( psfTarget ) );

		final double[] kernelFourier = new double[ wiener.length ];

		for ( int i = 0; i < kernelFourier.length; i += 2 )
		{
			kernelFourier[ i ] = wiener[ i ] * target[ i ] - wiener[ i + 1 ] * target[ i + 1 ];
			kernelFourier[ i + 1 ] = wiener[ i ] * target[ i + 1 ] + wiener[ i + 1 ] * target[ i ];
		}

		final ArrayImg< ComplexDoubleType, DoubleArray > kernelSpectrum = ImgTools.wrapComplex( kernelFourier, dim );
		ArrayImg< DoubleType, DoubleArray > kernelImage = ImgTools.realPart( UnitaryFFT.ifft( kernelSpectrum ) );

		if ( clip )
			kernelImage = ImgTools.clip( kernelImage, -1, 1 );

		return new ValuePair<>( kernelImage, kernelSpectrum );
	}

	public static < S extends RealType< S >, T extends RealType< T > > Pair< ArrayImg< DoubleType, DoubleArray >, ArrayImg< ComplexDoubleType, DoubleArray > > homogenizationKernel(
			final RandomAccessibleInterval< T > psfTarget,
			final RandomAccessibleInterval< S > psfSource )
	{
		return homogenizationKernel( psfTarget, psfSource, defaultRegularizationFactor, defaultClip );
	}

	public static void validateRegularization( final double regularizationFactor )
	{
		if ( !( regularizationFactor >= 0 ) || Double.isInfinite( regularizationFactor ) )
			throw new ValidationException( Kind.REGULARIZATION, "Regularization factor must be finite and >= 0, got " + regularizationFactor );
	}
}
