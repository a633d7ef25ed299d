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

import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccessible;
import net.imglib2.algorithm.bspline.BSplineDecomposition;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Maps a spline interpolation order [0, 5] to an imglib2 interpolator.
 */
public class Interpolation
{
	public static int minOrder = 0;
	public static int maxOrder = 5;

	public static void validateOrder( final int order )
	{
		if ( order < minOrder || order > maxOrder )
			throw new ValidationException( Kind.INTERPOLATION_ORDER, "Interpolation order must be in [" + minOrder + ", " + maxOrder + "], got " + order );
	}

	public static InterpolatorFactory< DoubleType, RandomAccessible< DoubleType > > factory( final int order )
	{
		validateOrder( order );

		if ( order == 0 )
			return new NearestNeighborInterpolatorFactory<>();
		else if ( order == 1 )
			return new NLinearInterpolatorFactory<>();
		else
			return new BSplineKernelInterpolatorFactory( order );
	}

	/**
	 * @return img interpolated with the given order, 0 outside of the image
	 */
	public static RealRandomAccessible< DoubleType > interpolate( final RandomAccessibleInterval< DoubleType > img, final int order )
	{
		return Views.interpolate( Views.extendZero( img ), factory( order ) );
	}

	/**
	 * Interpolates img such that the result passes through the samples. For orders
	 * above 1 the image is first decomposed into B-spline coefficients, the border
	 * is mirrored. Only positions inside the image are meaningful.
	 *
	 * @return img interpolated with the given order
	 */
	public static RealRandomAccessible< DoubleType > interpolateSamples( final RandomAccessibleInterval< DoubleType > img, final int order )
	{
		validateOrder( order );

		if ( order < 2 )
			return interpolate( img, order );

		final ArrayImg< DoubleType, DoubleArray > coefficients = ArrayImgs.doubles( ImgTools.dimensions( img ) );
		new BSplineDecomposition< DoubleType, DoubleType >( order, extendMirror( img ) ).accept( coefficients );

		return Views.interpolate( extendMirror( coefficients ), factory( order ) );
	}

	// mirroring needs at least two samples per dimension
	private static RandomAccessible< DoubleType > extendMirror( final RandomAccessibleInterval< DoubleType > img )
	{
		for ( int d = 0; d < img.numDimensions(); ++d )
			if ( img.dimension( d ) < 2 )
				return Views.extendBorder( img );

		return Views.extendMirrorSingle( img );
	}
}
