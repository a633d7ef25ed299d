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
package net.preibisch.homogenization.headless;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.io.FitsIO;
import net.preibisch.homogenization.util.ImgTools;

public class HomogenizeTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	final ByteArrayOutputStream out = new ByteArrayOutputStream();
	final ByteArrayOutputStream err = new ByteArrayOutputStream();

	File source, target;

	static ArrayImg< DoubleType, DoubleArray > gaussian( final int size, final double sigma )
	{
		final double c = ( size - 1 ) / 2.0;
		final double[] data = new double[ size * size ];

		for ( int y = 0; y < size; ++y )
			for ( int x = 0; x < size; ++x )
				data[ y * size + x ] = Math.exp( -( ( x - c ) * ( x - c ) + ( y - c ) * ( y - c ) ) / ( 2 * sigma * sigma ) );

		return ImgTools.wrap( data, size, size );
	}

	@Before
	public void writePSFs() throws Exception
	{
		source = new File( folder.getRoot(), "source.fits" );
		target = new File( folder.getRoot(), "target.fits" );

		FitsIO.writeImage( source, gaussian( 15, 1 ), Collections.emptyList(), 0.1 );
		FitsIO.writeImage( target, gaussian( 15, 2 ), Collections.emptyList(), 0.1 );
	}

	private int run( final String... args )
	{
		return Homogenize.run( new PrintStream( out ), new PrintStream( err ), args );
	}

	@Test
	public void testKernelIsWritten() throws Exception
	{
		final String output = new File( folder.getRoot(), "kernel.txt" ).getAbsolutePath();

		assertEquals( Homogenize.EXIT_OK, run( source.getAbsolutePath(), target.getAbsolutePath(), output, "-r", "1e-3", "--no_clip" ) );

		final File kernel = new File( folder.getRoot(), "kernel.fits" );
		assertTrue( kernel.exists() );
		assertTrue( new File( folder.getRoot(), "kernel.log" ).exists() );

		assertArrayEquals( new long[] { 15, 15 }, ImgTools.dimensions( FitsIO.readImage( kernel ) ) );
		assertEquals( 0.1, FitsIO.readPixelScale( kernel ), 0 );
		assertEquals( 1.0, ImgTools.sum( FitsIO.readImage( kernel ) ), 1e-6 );
		assertTrue( out.toString().contains( "kernel.fits" ) );
	}

	@Test
	public void testEstimatedRegularization()
	{
		final String output = new File( folder.getRoot(), "estimated.fits" ).getAbsolutePath();

		assertEquals( Homogenize.EXIT_OK, run( source.getAbsolutePath(), target.getAbsolutePath(), output, "-e", "--seed", "3", "-s", "-30", "-t", "-30" ) );
		assertTrue( new File( output ).exists() );
	}

	@Test
	public void testArgumentErrors()
	{
		assertEquals( Homogenize.EXIT_ARGUMENTS, run( source.getAbsolutePath() ) );
		assertEquals( Homogenize.EXIT_ARGUMENTS, run( source.getAbsolutePath(), target.getAbsolutePath(), "out.fits", "-r", "abc" ) );
		assertEquals( Homogenize.EXIT_ARGUMENTS, run( source.getAbsolutePath(), target.getAbsolutePath(), "out.fits", "--unknown" ) );
		assertTrue( err.toString().contains( "psf_source" ) );
	}

	@Test
	public void testValidationErrors() throws Exception
	{
		final String output = new File( folder.getRoot(), "kernel.fits" ).getAbsolutePath();

		assertEquals( Homogenize.EXIT_VALIDATION, run( source.getAbsolutePath(), target.getAbsolutePath(), output, "-o", "7" ) );
		assertEquals( Homogenize.EXIT_VALIDATION, run( source.getAbsolutePath(), target.getAbsolutePath(), output, "-r", "-1" ) );

		final File even = new File( folder.getRoot(), "even.fits" );
		FitsIO.writeImage( even, gaussian( 14, 1 ), Collections.emptyList(), 0.1 );

		assertEquals( Homogenize.EXIT_VALIDATION, run( even.getAbsolutePath(), target.getAbsolutePath(), output ) );
	}

	@Test
	public void testResourceLimit() throws Exception
	{
		final File coarse = new File( folder.getRoot(), "coarse.fits" );
		FitsIO.writeImage( coarse, gaussian( 15, 1 ), Collections.emptyList(), 10 );

		final File fine = new File( folder.getRoot(), "fine.fits" );
		FitsIO.writeImage( fine, gaussian( 15, 2 ), Collections.emptyList(), 0.001 );

		final String output = new File( folder.getRoot(), "kernel.fits" ).getAbsolutePath();

		assertEquals( Homogenize.EXIT_RESOURCE_LIMIT, run( coarse.getAbsolutePath(), fine.getAbsolutePath(), output ) );
		assertTrue( err.toString().contains( "kernel.log" ) );
	}

	@Test
	public void testIOErrors() throws Exception
	{
		final String output = new File( folder.getRoot(), "kernel.fits" ).getAbsolutePath();

		assertEquals( Homogenize.EXIT_IO, run( new File( folder.getRoot(), "missing.fits" ).getAbsolutePath(), target.getAbsolutePath(), output ) );

		final File noScale = new File( folder.getRoot(), "noscale.fits" );
		FitsIO.writeImage( noScale, gaussian( 15, 1 ), Collections.emptyList(), Double.NaN );

		assertEquals( Homogenize.EXIT_IO, run( noScale.getAbsolutePath(), target.getAbsolutePath(), output ) );
	}

	@Test
	public void testUnexpectedFailure()
	{
		final int code = Homogenize.unexpectedFailure( new IllegalStateException( "broken state" ), new PrintStream( err ) );

		assertEquals( Homogenize.EXIT_UNEXPECTED, code );
		assertTrue( err.toString().contains( "broken state" ) );

		// distinct from every mapped failure
		for ( final int other : new int[] { Homogenize.EXIT_OK, Homogenize.EXIT_ARGUMENTS, Homogenize.EXIT_VALIDATION, Homogenize.EXIT_RESOURCE_LIMIT, Homogenize.EXIT_IO } )
			assertTrue( code != other );
	}
}
