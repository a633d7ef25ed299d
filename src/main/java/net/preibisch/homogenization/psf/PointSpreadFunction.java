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
package net.preibisch.homogenization.psf;

import java.io.File;
import java.io.IOException;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.io.FitsIO;
import net.preibisch.homogenization.util.ImgTools;

/**
 * A PSF image together with its pixel scale in arcsec. When created from a
 * file, image and pixel scale are loaded on first access.
 */
public class PointSpreadFunction
{
	private final File file;
	private ArrayImg< DoubleType, DoubleArray > img;
	private double pixelScale;

	public < T extends RealType< T > > PointSpreadFunction( final String name, final RandomAccessibleInterval< T > img, final double pixelScale )
	{
		this.file = new File( name );
		this.img = ImgTools.copy( img ); // avoid changes to the PSF from outside
		this.pixelScale = pixelScale;
	}

	public PointSpreadFunction( final File file )
	{
		this.file = file;
		this.img = null;
		this.pixelScale = Double.NaN;
	}

	public File getFile() { return file; }
	public String getName() { return file.getName(); }
	public synchronized boolean isLoaded() { return img != null; }

	public synchronized ArrayImg< DoubleType, DoubleArray > getPSFCopy() throws IOException
	{
		if ( img == null )
			load();

		return ImgTools.copy( img );
	}

	public synchronized double getPixelScale() throws IOException
	{
		if ( img == null )
			load();

		return pixelScale;
	}

	public synchronized void load() throws IOException
	{
		final double scale = FitsIO.readPixelScale( file );
		this.img = FitsIO.readImage( file );
		this.pixelScale = scale;
	}
}
