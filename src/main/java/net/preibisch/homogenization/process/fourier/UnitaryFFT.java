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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.util.ImgTools;

/**
 * 2d discrete Fourier transforms of arbitrary size. The unitary variants scale
 * by 1/sqrt(N) in both directions so that the energy of an image equals the
 * energy of its spectrum.
 */
public class UnitaryFFT
{
	// FFT plans kept for reuse, the least recently used plan is dropped first
	public static int maxCachedPlans = 16;

	private static final Map< String, DoubleFFT_2D > FFT_CACHE = planCache();
	private static final Map< Long, DoubleFFT_1D > FFT_1D_CACHE = planCache();

	private static < K, P > Map< K, P > planCache()
	{
		return Collections.synchronizedMap( new LinkedHashMap< K, P >( 16, 0.75f, true )
		{
			private static final long serialVersionUID = 1L;

			@Override
			protected boolean removeEldestEntry( final Map.Entry< K, P > eldest )
			{
				return size() > maxCachedPlans;
			}
		} );
	}

	static int numCachedPlans()
	{
		return FFT_CACHE.size() + FFT_1D_CACHE.size();
	}

	private static DoubleFFT_2D fftFor( final long[] dim )
	{
		// JTransforms is row-major: rows are imglib2's dimension 1
		return FFT_CACHE.computeIfAbsent( dim[ 1 ] + "x" + dim[ 0 ], k -> new DoubleFFT_2D( dim[ 1 ], dim[ 0 ] ) );
	}

	private static DoubleFFT_1D fft1dFor( final long size )
	{
		return FFT_1D_CACHE.computeIfAbsent( size, k -> new DoubleFFT_1D( size ) );
	}

	/**
	 * In-place forward DFT without normalization.
	 *
	 * @param complex - interleaved (re, im) data in flat iteration order
	 * @param dim - the dimensions (x, y) of the data
	 */
	public static void forward( final double[] complex, final long[] dim )
	{
		ValidationException.requireTwoDimensional( dim.length, "FFT" );

		// DoubleFFT_2D needs more than one row and column
		if ( dim[ 0 ] == 1 && dim[ 1 ] == 1 )
			return;
		else if ( dim[ 0 ] == 1 || dim[ 1 ] == 1 )
			fft1dFor( dim[ 0 ] * dim[ 1 ] ).complexForward( complex );
		else
			fftFor( dim ).complexForward( complex );
	}

	/**
	 * In-place inverse DFT including the 1/N factor.
	 *
	 * @param complex - interleaved (re, im) data in flat iteration order
	 * @param dim - the dimensions (x, y) of the data
	 */
	public static void inverse( final double[] complex, final long[] dim )
	{
		ValidationException.requireTwoDimensional( dim.length, "FFT" );

		if ( dim[ 0 ] == 1 && dim[ 1 ] == 1 )
			return;
		else if ( dim[ 0 ] == 1 || dim[ 1 ] == 1 )
			fft1dFor( dim[ 0 ] * dim[ 1 ] ).complexInverse( complex, true );
		else
			fftFor( dim ).complexInverse( complex, true );
	}

	public static double[] toComplex( final double[] real )
	{
		final double[] complex = new double[ real.length * 2 ];

		for ( int i = 0; i < real.length; ++i )
			complex[ 2 * i ] = real[ i ];

		return complex;
	}

	/**
	 * @param img - a real 2d image
	 * @return its unitary spectrum
	 */
	public static < T extends RealType< T > > ArrayImg< ComplexDoubleType, DoubleArray > fft( final RandomAccessibleInterval< T > img )
	{
		final long[] dim = ImgTools.dimensions( img );
		final double[] complex = toComplex( ImgTools.toArray( img ) );

		forward( complex, dim );
		scale( complex, 1.0 / Math.sqrt( complex.length / 2 ) );

		return ImgTools.wrapComplex( complex, dim );
	}

	/**
	 * @param spectrum - a complex 2d image
	 * @return its unitary inverse transform (complex)
	 */
	public static < C extends ComplexType< C > > ArrayImg< ComplexDoubleType, DoubleArray > ifft( final RandomAccessibleInterval< C > spectrum )
	{
		final long[] dim = ImgTools.dimensions( spectrum );
		final double[] complex = ImgTools.toComplexArray( spectrum );

		inverse( complex, dim );
		scale( complex, Math.sqrt( complex.length / 2 ) );

		return ImgTools.wrapComplex( complex, dim );
	}

	static void scale( final double[] data, final double factor )
	{
		for ( int i = 0; i < data.length; ++i )
			data[ i ] *= factor;
	}
}
