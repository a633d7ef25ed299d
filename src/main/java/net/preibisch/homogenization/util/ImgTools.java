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
package net.preibisch.homogenization.util;

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.homogenization.process.ValidationException;

/**
 * Conversions between imglib2 images and the flat double arrays the numerical
 * code works on. All arrays are in flat iteration order (x fastest), complex
 * arrays interleave real and imaginary parts.
 */
public class ImgTools
{
	public static long[] dimensions( final Interval interval )
	{
		final long[] dim = new long[ interval.numDimensions() ];
		interval.dimensions( dim );
		return dim;
	}

	public static int numPixels( final long[] dim )
	{
		final long n = Intervals.numElements( dim );

		if ( n > Integer.MAX_VALUE / 2 )
			throw new IllegalArgumentException( "image too large for a single array: " + n + " pixels" );

		return (int)n;
	}

	/**
	 * @return the pixel values of img in flat iteration order, the image must be 2d
	 */
	public static < T extends RealType< T > > double[] toArray( final RandomAccessibleInterval< T > img )
	{
		ValidationException.requireTwoDimensional( img.numDimensions(), "image" );

		final double[] data = new double[ numPixels( dimensions( img ) ) ];

		int i = 0;
		for ( final T t : Views.flatIterable( img ) )
			data[ i++ ] = t.getRealDouble();

		return data;
	}

	/**
	 * @return the pixel values of img in flat iteration order as interleaved (re, im) pairs
	 */
	public static < C extends ComplexType< C > > double[] toComplexArray( final RandomAccessibleInterval< C > img )
	{
		ValidationException.requireTwoDimensional( img.numDimensions(), "spectrum" );

		final double[] data = new double[ 2 * numPixels( dimensions( img ) ) ];

		int i = 0;
		for ( final C c : Views.flatIterable( img ) )
		{
			data[ i++ ] = c.getRealDouble();
			data[ i++ ] = c.getImaginaryDouble();
		}

		return data;
	}

	public static ArrayImg< DoubleType, DoubleArray > wrap( final double[] data, final long... dim )
	{
		return ArrayImgs.doubles( data, dim );
	}

	public static ArrayImg< ComplexDoubleType, DoubleArray > wrapComplex( final double[] data, final long... dim )
	{
		return ArrayImgs.complexDoubles( data, dim );
	}

	/**
	 * @return the array backing img (not a copy)
	 */
	public static double[] storage( final ArrayImg< ?, DoubleArray > img )
	{
		return img.update( null ).getCurrentStorageArray();
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > copy( final RandomAccessibleInterval< T > img )
	{
		return wrap( toArray( img ), dimensions( img ) );
	}

	/**
	 * @return a copy of img where all NaN values are replaced by 0
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > replaceNaN( final RandomAccessibleInterval< T > img )
	{
		final double[] data = toArray( img );

		for ( int i = 0; i < data.length; ++i )
			if ( Double.isNaN( data[ i ] ) )
				data[ i ] = 0;

		return wrap( data, dimensions( img ) );
	}

	/**
	 * @return a copy of img with every value clamped to [min, max]
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > clip( final RandomAccessibleInterval< T > img, final double min, final double max )
	{
		final double[] data = toArray( img );

		for ( int i = 0; i < data.length; ++i )
			data[ i ] = Math.max( min, Math.min( max, data[ i ] ) );

		return wrap( data, dimensions( img ) );
	}

	public static < T extends RealType< T > > double sum( final RandomAccessibleInterval< T > img )
	{
		double sum = 0;

		for ( final T t : Views.flatIterable( img ) )
			sum += t.getRealDouble();

		return sum;
	}

	/**
	 * @return a copy of img divided by the sum of its values, or a plain copy if the sum is 0
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > normalize( final RandomAccessibleInterval< T > img )
	{
		final double[] data = toArray( img );

		double sum = 0;
		for ( final double v : data )
			sum += v;

		if ( sum != 0 )
			for ( int i = 0; i < data.length; ++i )
				data[ i ] /= sum;

		return wrap( data, dimensions( img ) );
	}

	/**
	 * @return the real part of a complex image
	 */
	public static < C extends ComplexType< C > > ArrayImg< DoubleType, DoubleArray > realPart( final RandomAccessibleInterval< C > img )
	{
		final double[] complex = toComplexArray( img );
		final double[] real = new double[ complex.length / 2 ];

		for ( int i = 0; i < real.length; ++i )
			real[ i ] = complex[ 2 * i ];

		return wrap( real, dimensions( img ) );
	}

	public static boolean allZero( final double[] data )
	{
		for ( final double v : data )
			if ( v != 0 )
				return false;

		return true;
	}
}
