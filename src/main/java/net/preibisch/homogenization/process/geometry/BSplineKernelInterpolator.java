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

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessible;
import net.imglib2.RealPoint;
import net.imglib2.RealRandomAccess;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Evaluates the B-spline kernel of a given degree directly on the samples of a
 * {@link RandomAccessible}, i.e. the samples are used as spline coefficients
 * without pre-filtering. For degree 0 and 1 this is nearest neighbor and
 * n-linear interpolation.
 */
public class BSplineKernelInterpolator extends RealPoint implements RealRandomAccess< DoubleType >
{
	final RandomAccessible< DoubleType > source;
	final RandomAccess< DoubleType > access;
	final int order;
	final int support;

	final long[] start;
	final double[][] weights;
	final int[] index;
	final DoubleType value = new DoubleType();

	public BSplineKernelInterpolator( final RandomAccessible< DoubleType > source, final int order )
	{
		super( source.numDimensions() );

		this.source = source;
		this.access = source.randomAccess();
		this.order = order;
		this.support = order + 1;

		this.start = new long[ n ];
		this.weights = new double[ n ][ support ];
		this.index = new int[ n ];
	}

	@Override
	public DoubleType get()
	{
		final double half = support / 2.0;

		for ( int d = 0; d < n; ++d )
		{
			start[ d ] = (long)Math.floor( position[ d ] - half ) + 1;

			for ( int k = 0; k < support; ++k )
				weights[ d ][ k ] = bspline( order, position[ d ] - ( start[ d ] + k ) );
		}

		double sum = 0;

		// iterate the support neighborhood, first dimension fastest
		for ( int d = 0; d < n; ++d )
			index[ d ] = 0;

		boolean done = false;

		while ( !done )
		{
			double w = 1;

			for ( int d = 0; d < n; ++d )
			{
				w *= weights[ d ][ index[ d ] ];
				access.setPosition( start[ d ] + index[ d ], d );
			}

			if ( w != 0 )
				sum += w * access.get().getRealDouble();

			done = true;
			for ( int d = 0; d < n; ++d )
			{
				if ( ++index[ d ] < support )
				{
					done = false;
					break;
				}
				index[ d ] = 0;
			}
		}

		value.set( sum );
		return value;
	}

	@Override
	public BSplineKernelInterpolator copy()
	{
		final BSplineKernelInterpolator copy = new BSplineKernelInterpolator( source, order );
		copy.setPosition( this );
		return copy;
	}

	public BSplineKernelInterpolator copyRealRandomAccess()
	{
		return copy();
	}

	/**
	 * Centered B-spline basis function of the given degree (Cox-de Boor recursion).
	 *
	 * @param degree - the degree, &gt;= 0
	 * @param t - the distance to the knot center
	 * @return the value of the basis function at t
	 */
	public static double bspline( final int degree, final double t )
	{
		if ( degree == 0 )
		{
			final double a = Math.abs( t );

			if ( a < 0.5 )
				return 1;
			else if ( a == 0.5 )
				return 0.5;
			else
				return 0;
		}

		final double h = ( degree + 1 ) / 2.0;

		if ( Math.abs( t ) >= h )
			return 0;

		return ( ( t + h ) * bspline( degree - 1, t + 0.5 ) + ( h - t ) * bspline( degree - 1, t - 0.5 ) ) / degree;
	}
}
