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
package net.preibisch.homogenization.process.fourier;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.geometry.GeometricTransforms;
import net.preibisch.homogenization.process.geometry.PadPosition;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Conversion of a point-spread function into an optical transfer function
 * that is not influenced by the off-centering of the PSF.
 * <p>
 * The PSF is zero-padded (down and to the right) to the output size and then
 * circularly shifted until its central pixel is at (0,0), so the resulting OTF
 * carries no linear phase. Adapted from MATLAB's psf2otf.
 */
public class OpticalTransferFunction
{
	/**
	 * @param psf - the PSF
	 * @param shape - the dimensions of the OTF, not smaller than the PSF
	 * @return the (non-unitary) OTF, with imaginary parts set to exactly 0 if they are all within round-off
	 */
	public static < T extends RealType< T > > ArrayImg< ComplexDoubleType, DoubleArray > psfToOtf(
			final RandomAccessibleInterval< T > psf,
			final long... shape )
	{
		ValidationException.requireTwoDimensional( shape.length, "PSF2OTF" );
		ValidationException.requirePositive( shape, "PSF2OTF" );

		final long[] inDim = ImgTools.dimensions( psf );
		final double[] in = ImgTools.toArray( psf );

		if ( ImgTools.allZero( in ) )
			return ImgTools.wrapComplex( new double[ 2 * ImgTools.numPixels( shape ) ], shape.clone() );

		final double[] padded = ImgTools.storage( GeometricTransforms.zeroPad( ImgTools.wrap( in, inDim ), shape, PadPosition.CORNER ) );
		final double[] shifted = circularShift( padded, shape, -( inDim[ 0 ] / 2 ), -( inDim[ 1 ] / 2 ) );

		final double[] otf = UnitaryFFT.toComplex( shifted );
		UnitaryFFT.forward( otf, shape );

		if ( maxImaginary( otf ) < roundOffTolerance( shape ) )
			for ( int i = 1; i < otf.length; i += 2 )
				otf[ i ] = 0;

		return ImgTools.wrapComplex( otf, shape.clone() );
	}

	public static < T extends RealType< T > > ArrayImg< ComplexDoubleType, DoubleArray > psfToOtf( final RandomAccessibleInterval< T > psf )
	{
		return psfToOtf( psf, ImgTools.dimensions( psf ) );
	}

	/**
	 * Rough number of operations of the FFT times the machine epsilon.
	 *
	 * @param dim - dimensions of the transform
	 * @return the largest imaginary magnitude that is considered round-off
	 */
	public static double roundOffTolerance( final long[] dim )
	{
		final double size = ImgTools.numPixels( dim );

		double nOps = 0;
		for ( final long d : dim )
			nOps += size * ( Math.log( d ) / Math.log( 2 ) );

		return nOps * Math.ulp( 1.0 );
	}

	/**
	 * Circular shift of a 2d image, out[ (x + sx) mod w, (y + sy) mod h ] = in[ x, y ].
	 */
	public static double[] circularShift( final double[] data, final long[] dim, final long shiftX, final long shiftY )
	{
		final int w = (int)dim[ 0 ];
		final int h = (int)dim[ 1 ];
		final double[] out = new double[ data.length ];

		for ( int y = 0; y < h; ++y )
		{
			final int ty = (int)Math.floorMod( y + shiftY, (long)h );

			for ( int x = 0; x < w; ++x )
			{
				final int tx = (int)Math.floorMod( x + shiftX, (long)w );
				out[ ty * w + tx ] = data[ y * w + x ];
			}
		}

		return out;
	}

	private static double maxImaginary( final double[] complex )
	{
		double max = 0;

		for ( int i = 1; i < complex.length; i += 2 )
			max = Math.max( max, Math.abs( complex[ i ] ) );

		return max;
	}
}
