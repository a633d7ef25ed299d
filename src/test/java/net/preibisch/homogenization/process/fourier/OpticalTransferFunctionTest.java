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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.process.deconvolution.WienerDeconvolution;
import net.preibisch.homogenization.util.ImgTools;

public class OpticalTransferFunctionTest
{
	@Test
	public void testCenteredImpulseIsFlat()
	{
		final double[] psf = new double[ 25 ];
		psf[ 2 * 5 + 2 ] = 1;

		final double[] otf = ImgTools.storage( OpticalTransferFunction.psfToOtf( ImgTools.wrap( psf, 5, 5 ), 8, 6 ) );

		assertEquals( 2 * 8 * 6, otf.length );

		for ( int i = 0; i < otf.length; i += 2 )
		{
			assertEquals( 1, otf[ i ], 1e-12 );
			assertEquals( 0, otf[ i + 1 ], 0 );
		}
	}

	@Test
	public void testSymmetricPSFIsReal()
	{
		final double[] psf = new double[] {
				1, 2, 1,
				2, 4, 2,
				1, 2, 1 };

		final double[] otf = ImgTools.storage( OpticalTransferFunction.psfToOtf( ImgTools.wrap( psf, 3, 3 ), 7, 7 ) );

		assertEquals( 16, otf[ 0 ], 1e-12 );

		// imaginary round-off is removed entirely
		for ( int i = 1; i < otf.length; i += 2 )
			assertEquals( 0, otf[ i ], 0 );
	}

	@Test
	public void testOffCenterImpulseKeepsPhase()
	{
		final double[] psf = new double[ 25 ];
		psf[ 2 * 5 + 3 ] = 1; // one pixel right of the center

		final double[] otf = ImgTools.storage( OpticalTransferFunction.psfToOtf( ImgTools.wrap( psf, 5, 5 ) ) );

		// frequency ( 1, 0 )
		assertEquals( Math.cos( 2 * Math.PI / 5 ), otf[ 2 ], 1e-12 );
		assertEquals( -Math.sin( 2 * Math.PI / 5 ), otf[ 3 ], 1e-12 );

		for ( int i = 0; i < otf.length; i += 2 )
			assertEquals( 1, otf[ i ] * otf[ i ] + otf[ i + 1 ] * otf[ i + 1 ], 1e-12 );
	}

	@Test
	public void testLaplacian()
	{
		final double[] otf = ImgTools.storage( OpticalTransferFunction.psfToOtf( WienerDeconvolution.laplacian(), 4, 4 ) );

		// 4 - 2 cos( 2 pi kx / 4 ) - 2 cos( 2 pi ky / 4 )
		assertEquals( 0, otf[ 0 ], 1e-12 );
		assertEquals( 2, otf[ 2 * 1 ], 1e-12 );
		assertEquals( 4, otf[ 2 * 2 ], 1e-12 );
		assertEquals( 8, otf[ 2 * ( 2 * 4 + 2 ) ], 1e-12 );
	}

	@Test
	public void testZeroPSF()
	{
		final double[] otf = ImgTools.storage( OpticalTransferFunction.psfToOtf( ImgTools.wrap( new double[ 9 ], 3, 3 ), 6, 4 ) );

		assertArrayEquals( new double[ 2 * 6 * 4 ], otf, 0 );
	}

	@Test
	public void testShapeSmallerThanPSF()
	{
		try
		{
			OpticalTransferFunction.psfToOtf( ImgTools.wrap( new double[] { 0, 1, 0, 0 }, 2, 2 ), 1, 2 );
			fail( "expected a ValidationException" );
		}
		catch ( final ValidationException e )
		{
			assertEquals( Kind.TARGET_TOO_SMALL, e.getKind() );
		}
	}

	@Test
	public void testCircularShift()
	{
		final double[] data = new double[] {
				0, 1, 2,
				3, 4, 5 };

		assertArrayEquals( new double[] {
				4, 5, 3,
				1, 2, 0 }, OpticalTransferFunction.circularShift( data, new long[] { 3, 2 }, -1, -1 ), 0 );

		assertArrayEquals( data, OpticalTransferFunction.circularShift( data, new long[] { 3, 2 }, 3, 2 ), 0 );
	}

	@Test
	public void testRoundOffTolerance()
	{
		// 8 * 8 * ( 3 + 3 ) operations
		assertEquals( 384 * Math.ulp( 1.0 ), OpticalTransferFunction.roundOffTolerance( new long[] { 8, 8 } ), 1e-25 );
	}
}
