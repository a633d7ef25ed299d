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
package net.preibisch.homogenization.process.geometry;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.homogenization.process.ResourceLimitException;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Rotation, resampling, trimming and zero-padding of 2d PSF images. Every
 * method returns a new image, the input is never modified. Centering is
 * preserved by only allowing even size changes where an image is cut or
 * padded symmetrically.
 */
public class GeometricTransforms
{
	// the maximal edge length of a resampled image
	public static long maxResampledSize = 10000;

	public static int defaultInterpolationOrder = 1;

	/**
	 * Rotate an image from North to East, i.e. by the negated angle in the
	 * mathematical sense, around its geometric center. The output has the size of
	 * the input, everything rotated in from outside is 0.
	 *
	 * @param img - the input image
	 * @param angle - angle in degrees
	 * @param interpolationOrder - spline interpolation order [0, 5]
	 * @return the rotated image
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > rotate(
			final RandomAccessibleInterval< T > img,
			final double angle,
			final int interpolationOrder )
	{
		Interpolation.validateOrder( interpolationOrder );

		final ArrayImg< DoubleType, DoubleArray > input = ImgTools.copy( img );
		final long[] dim = ImgTools.dimensions( input );

		final RealRandomAccess< DoubleType > rra = Interpolation.interpolate( input, interpolationOrder ).realRandomAccess();

		final double theta = Math.toRadians( angle );
		final double cos = Math.cos( theta );
		final double sin = Math.sin( theta );

		final double cx = ( dim[ 0 ] - 1 ) / 2.0;
		final double cy = ( dim[ 1 ] - 1 ) / 2.0;

		final double[] out = new double[ ImgTools.numPixels( dim ) ];

		int i = 0;
		for ( long y = 0; y < dim[ 1 ]; ++y )
		{
			final double dy = y - cy;

			for ( long x = 0; x < dim[ 0 ]; ++x )
			{
				final double dx = x - cx;

				// inverse mapping: where in the input does this output pixel come from
				rra.setPosition( cos * dx + sin * dy + cx, 0 );
				rra.setPosition( -sin * dx + cos * dy + cy, 1 );

				out[ i++ ] = rra.get().getRealDouble();
			}
		}

		return ImgTools.wrap( out, dim );
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > rotate( final RandomAccessibleInterval< T > img, final double angle )
	{
		return rotate( img, angle, defaultInterpolationOrder );
	}

	/**
	 * Computes the edge length of an image resampled from one pixel scale to
	 * another. The size difference to the old size is kept even so the image stays
	 * centered.
	 *
	 * @param oldSize - edge length of the image
	 * @param sourceScale - pixel scale of the image (arcsec)
	 * @param targetScale - pixel scale to resample to (arcsec)
	 * @return the new edge length
	 * @throws ResourceLimitException if the new edge length exceeds {@link #maxResampledSize}
	 */
	public static long resampledSize( final long oldSize, final double sourceScale, final double targetScale )
	{
		validateScale( sourceScale, "source" );
		validateScale( targetScale, "target" );

		long newSize = (long)Math.ceil( oldSize * sourceScale / targetScale );

		if ( newSize > maxResampledSize )
			throw new ResourceLimitException( newSize, maxResampledSize );

		if ( ( oldSize - newSize ) % 2 != 0 )
			++newSize;

		return newSize;
	}

	/**
	 * Resample an image from one pixel scale to another. The result is divided by
	 * the squared zoom ratio so the total flux is conserved. Unlike
	 * {@link #rotate(RandomAccessibleInterval, double, int)} the spline is
	 * prefiltered, so the zoom passes through the input samples.
	 *
	 * @param img - the input image
	 * @param sourceScale - pixel scale of img (arcsec)
	 * @param targetScale - pixel scale of the output (arcsec)
	 * @param interpolationOrder - spline interpolation order [0, 5]
	 * @return the resampled image
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > resample(
			final RandomAccessibleInterval< T > img,
			final double sourceScale,
			final double targetScale,
			final int interpolationOrder )
	{
		ValidationException.requireTwoDimensional( img.numDimensions(), "RESAMPLE" );
		Interpolation.validateOrder( interpolationOrder );

		final long[] dim = ImgTools.dimensions( img );
		final long newSize = resampledSize( dim[ 0 ], sourceScale, targetScale );
		final double ratio = (double)newSize / (double)dim[ 0 ];

		final long[] newDim = new long[ dim.length ];
		final double[] step = new double[ dim.length ];

		for ( int d = 0; d < dim.length; ++d )
		{
			newDim[ d ] = Math.max( 1, Math.round( dim[ d ] * ratio ) );

			if ( newDim[ d ] > maxResampledSize )
				throw new ResourceLimitException( newDim[ d ], maxResampledSize );

			step[ d ] = newDim[ d ] > 1 ? ( dim[ d ] - 1 ) / (double)( newDim[ d ] - 1 ) : 0;
		}

		final ArrayImg< DoubleType, DoubleArray > input = ImgTools.copy( img );
		final RealRandomAccess< DoubleType > rra = Interpolation.interpolateSamples( input, interpolationOrder ).realRandomAccess();

		final double norm = ratio * ratio;
		final double[] out = new double[ ImgTools.numPixels( newDim ) ];

		int i = 0;
		for ( long y = 0; y < newDim[ 1 ]; ++y )
		{
			rra.setPosition( y * step[ 1 ], 1 );

			for ( long x = 0; x < newDim[ 0 ]; ++x )
			{
				rra.setPosition( x * step[ 0 ], 0 );
				out[ i++ ] = rra.get().getRealDouble() / norm;
			}
		}

		return ImgTools.wrap( out, newDim );
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > resample(
			final RandomAccessibleInterval< T > img,
			final double sourceScale,
			final double targetScale )
	{
		return resample( img, sourceScale, targetScale, defaultInterpolationOrder );
	}

	/**
	 * Cut the centered region of the given shape out of an image.
	 *
	 * @param img - the input image
	 * @param shape - the output dimensions, not larger than img and of the same parity
	 * @return the trimmed image (a copy of img if the shape already matches)
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > trim(
			final RandomAccessibleInterval< T > img,
			final long... shape )
	{
		ValidationException.requireTwoDimensional( img.numDimensions(), "TRIM" );

		final long[] dim = ImgTools.dimensions( img );

		if ( Arrays.equals( dim, shape ) )
			return ImgTools.copy( img );

		ValidationException.requireTwoDimensional( shape.length, "TRIM" );
		ValidationException.requirePositive( shape, "TRIM" );

		final long[] diff = new long[ dim.length ];

		for ( int d = 0; d < dim.length; ++d )
		{
			diff[ d ] = dim[ d ] - shape[ d ];

			if ( diff[ d ] < 0 )
				throw new ValidationException( Kind.TARGET_TOO_LARGE, "TRIM: target size bigger than source one " + Arrays.toString( shape ) + " > " + Arrays.toString( dim ) );
		}

		ValidationException.requireEvenDifference( diff, "TRIM" );

		final long[] offset = new long[ dim.length ];

		for ( int d = 0; d < dim.length; ++d )
			offset[ d ] = diff[ d ] / 2;

		return ImgTools.copy( Views.offsetInterval( Views.zeroMin( img ), offset, shape ) );
	}

	/**
	 * Extend an image to a given shape with zeros.
	 *
	 * @param img - the input image
	 * @param shape - the output dimensions, not smaller than img
	 * @param position - {@link PadPosition#CORNER} or {@link PadPosition#CENTER} (requires even size differences)
	 * @return the padded image (a copy of img if the shape already matches)
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > zeroPad(
			final RandomAccessibleInterval< T > img,
			final long[] shape,
			final PadPosition position )
	{
		ValidationException.requireTwoDimensional( img.numDimensions(), "ZERO_PAD" );

		final long[] dim = ImgTools.dimensions( img );

		if ( Arrays.equals( dim, shape ) )
			return ImgTools.copy( img );

		ValidationException.requireTwoDimensional( shape.length, "ZERO_PAD" );
		ValidationException.requirePositive( shape, "ZERO_PAD" );

		final long[] diff = new long[ dim.length ];

		for ( int d = 0; d < dim.length; ++d )
		{
			diff[ d ] = shape[ d ] - dim[ d ];

			if ( diff[ d ] < 0 )
				throw new ValidationException( Kind.TARGET_TOO_SMALL, "ZERO_PAD: target size smaller than source one " + Arrays.toString( shape ) + " < " + Arrays.toString( dim ) );
		}

		final long offX, offY;

		if ( position == PadPosition.CENTER )
		{
			ValidationException.requireEvenDifference( diff, "ZERO_PAD" );
			offX = diff[ 0 ] / 2;
			offY = diff[ 1 ] / 2;
		}
		else
		{
			offX = offY = 0;
		}

		final double[] in = ImgTools.toArray( img );
		final double[] out = new double[ ImgTools.numPixels( shape ) ];

		final int w = (int)dim[ 0 ];
		final int h = (int)dim[ 1 ];
		final int outW = (int)shape[ 0 ];

		for ( int y = 0; y < h; ++y )
			System.arraycopy( in, y * w, out, (int)( ( y + offY ) * outW + offX ), w );

		return ImgTools.wrap( out, shape );
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > zeroPad(
			final RandomAccessibleInterval< T > img,
			final long... shape )
	{
		return zeroPad( img, shape, PadPosition.CORNER );
	}

	private static void validateScale( final double scale, final String what )
	{
		if ( !( scale > 0 ) || Double.isInfinite( scale ) )
			throw new ValidationException( Kind.PIXEL_SCALE, "RESAMPLE: " + what + " pixel scale must be positive and finite, got " + scale );
	}
}
