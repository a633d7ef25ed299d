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
package net.preibisch.homogenization.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.BufferedFile;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Reading PSF images and their pixel scale from FITS files, writing kernels.
 */
public class FitsIO
{
	private static final Logger LOG = LoggerFactory.getLogger( FitsIO.class );

	// keywords that hold the pixel scale in arcsec, in order of preference
	public static String[] pixelScaleKeys = new String[] { "PIXSCALE", "PIXSIZE", "PIXELSCL", "PIXSCL", "SECPIX" };

	// keywords that hold the pixel scale in degrees
	public static String[] pixelScaleKeysDegrees = new String[] { "CDELT1", "CD1_1" };

	public static final String PIXEL_SCALE_KEY = "PIXSCALE";

	/**
	 * Loads the primary image of a FITS file, applying BSCALE and BZERO. NaN values
	 * are replaced by 0.
	 *
	 * @param file - the FITS file
	 * @return the image as doubles, dimension 0 is NAXIS1
	 * @throws IOException if the file cannot be read or holds no 2d image
	 */
	public static ArrayImg< DoubleType, DoubleArray > readImage( final File file ) throws IOException
	{
		Fits fits = null;

		try
		{
			fits = new Fits( file );
			final ImageHDU hdu = primaryImage( fits, file );
			final Header header = hdu.getHeader();

			final double bscale = header.getDoubleValue( "BSCALE", 1.0 );
			final double bzero = header.getDoubleValue( "BZERO", 0.0 );

			Object kernel = ArrayFuncs.convertArray( hdu.getKernel(), double.class );

			// squeeze leading singleton axes, e.g. NAXIS3 = 1
			while ( kernel instanceof double[][][] && ( (double[][][])kernel ).length == 1 )
				kernel = ( (double[][][])kernel )[ 0 ];

			if ( !( kernel instanceof double[][] ) )
				throw new IOException( "FITS file '" + file + "' does not contain a 2d image." );

			final double[][] rows = (double[][])kernel;
			final int h = rows.length;
			final int w = h == 0 ? 0 : rows[ 0 ].length;

			if ( w == 0 || h == 0 )
				throw new IOException( "FITS file '" + file + "' contains an empty image." );

			final double[] data = new double[ w * h ];
			int numNaN = 0;

			for ( int y = 0; y < h; ++y )
				for ( int x = 0; x < w; ++x )
				{
					final double v = rows[ y ][ x ] * bscale + bzero;

					if ( Double.isNaN( v ) )
						++numNaN;
					else
						data[ y * w + x ] = v;
				}

			if ( numNaN > 0 )
				LOG.info( "Replaced " + numNaN + " NaN pixel(s) of '" + file.getName() + "' by 0." );

			return ImgTools.wrap( data, w, h );
		}
		catch ( final FitsException e )
		{
			throw new IOException( "Cannot read FITS image '" + file + "': " + e.getMessage(), e );
		}
		finally
		{
			if ( fits != null )
				fits.close();
		}
	}

	/**
	 * Retrieves the pixel scale from the primary header, either from one of
	 * {@link #pixelScaleKeys} (arcsec) or from {@link #pixelScaleKeysDegrees}
	 * (converted from degrees).
	 *
	 * @param file - the FITS file
	 * @return the pixel scale in arcsec
	 * @throws IOException if the file cannot be read or has no pixel scale keyword
	 */
	public static double readPixelScale( final File file ) throws IOException
	{
		Fits fits = null;

		try
		{
			fits = new Fits( file );
			return pixelScale( primaryImage( fits, file ).getHeader(), file );
		}
		catch ( final FitsException e )
		{
			throw new IOException( "Cannot read FITS header of '" + file + "': " + e.getMessage(), e );
		}
		finally
		{
			if ( fits != null )
				fits.close();
		}
	}

	public static double pixelScale( final Header header, final File file ) throws IOException
	{
		for ( final String key : pixelScaleKeys )
			if ( header.containsKey( key ) )
				return header.getDoubleValue( key, Double.NaN );

		for ( final String key : pixelScaleKeysDegrees )
			if ( header.containsKey( key ) )
				return Math.abs( header.getDoubleValue( key, Double.NaN ) ) * 3600.0;

		throw new IOException( "Pixel scale keyword not found in header of '" + file + "'." );
	}

	/**
	 * Writes an image as primary HDU (BITPIX -64) of a new FITS file, replacing an
	 * existing file.
	 *
	 * @param file - the output file
	 * @param img - the 2d image
	 * @param comments - COMMENT cards to add to the header
	 * @param pixelScale - written as {@link #PIXEL_SCALE_KEY} (arcsec), ignored if NaN
	 * @throws IOException if the file cannot be written
	 */
	public static < T extends RealType< T > > void writeImage(
			final File file,
			final RandomAccessibleInterval< T > img,
			final List< String > comments,
			final double pixelScale ) throws IOException
	{
		final long[] dim = ImgTools.dimensions( img );
		final double[] data = ImgTools.toArray( img );

		final int w = (int)dim[ 0 ];
		final int h = (int)dim[ 1 ];
		final double[][] rows = new double[ h ][ w ];

		for ( int y = 0; y < h; ++y )
			System.arraycopy( data, y * w, rows[ y ], 0, w );

		Files.deleteIfExists( file.toPath() );

		final Fits fits = new Fits();
		BufferedFile out = null;

		try
		{
			final BasicHDU< ? > hdu = FitsFactory.hduFactory( rows );
			final Header header = hdu.getHeader();

			for ( final String comment : comments )
				header.insertComment( comment );

			if ( !Double.isNaN( pixelScale ) )
				header.addValue( PIXEL_SCALE_KEY, pixelScale, "Pixel scale [arcsec]" );

			fits.addHDU( hdu );

			out = new BufferedFile( file, "rw" );
			fits.write( out );
		}
		catch ( final FitsException e )
		{
			throw new IOException( "Cannot write FITS image '" + file + "': " + e.getMessage(), e );
		}
		finally
		{
			if ( out != null )
				out.close();

			fits.close();
		}
	}

	private static ImageHDU primaryImage( final Fits fits, final File file ) throws FitsException, IOException
	{
		final BasicHDU< ? > hdu = fits.readHDU();

		if ( !( hdu instanceof ImageHDU ) )
			throw new IOException( "The primary HDU of '" + file + "' is not an image." );

		return (ImageHDU)hdu;
	}
}
