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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import net.imglib2.RealRandomAccess;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.util.ImgTools;

public class BSplineKernelInterpolatorTest
{
	@Test
	public void testBasisValues()
	{
		assertEquals( 1.0, BSplineKernelInterpolator.bspline( 0, 0.2 ), 0 );
		assertEquals( 0.0, BSplineKernelInterpolator.bspline( 0, 0.7 ), 0 );

		assertEquals( 1.0, BSplineKernelInterpolator.bspline( 1, 0 ), 1e-15 );
		assertEquals( 0.25, BSplineKernelInterpolator.bspline( 1, 0.75 ), 1e-15 );

		assertEquals( 2.0 / 3.0, BSplineKernelInterpolator.bspline( 3, 0 ), 1e-15 );
		assertEquals( 1.0 / 6.0, BSplineKernelInterpolator.bspline( 3, 1 ), 1e-15 );
		assertEquals( 0.0, BSplineKernelInterpolator.bspline( 3, 2 ), 0 );
	}

	@Test
	public void testPartitionOfUnity()
	{
		for ( int degree = 0; degree <= 5; ++degree )
		{
			double sum = 0;
			for ( int k = -4; k <= 4; ++k )
				sum += BSplineKernelInterpolator.bspline( degree, 0.3 - k );

			assertEquals( "degree " + degree, 1.0, sum, 1e-12 );
		}
	}

	@Test
	public void testConstantInterior()
	{
		final double[] data = new double[ 100 ];
		Arrays.fill( data, 2.0 );

		for ( int order = 2; order <= 5; ++order )
		{
			final RealRandomAccess< DoubleType > rra = Interpolation.interpolate( ImgTools.wrap( data, 10, 10 ), order ).realRandomAccess();
			rra.setPosition( new double[] { 5.3, 4.7 } );

			assertEquals( "order " + order, 2.0, rra.get().get(), 1e-12 );
		}
	}

	@Test
	public void testZeroOutside()
	{
		final double[] data = new double[ 25 ];
		Arrays.fill( data, 1.0 );

		final RealRandomAccess< DoubleType > rra = Interpolation.interpolate( ImgTools.wrap( data, 5, 5 ), 3 ).realRandomAccess();

		rra.setPosition( new double[] { -3, 2 } );
		assertEquals( 0.0, rra.get().get(), 0 );

		// at the border, only half of the cubic support is inside
		rra.setPosition( new double[] { -0.5, 2 } );
		assertEquals( 0.5, rra.get().get(), 1e-12 );
	}
}
