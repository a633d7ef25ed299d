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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Pair;
import net.preibisch.homogenization.io.FitsIO;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.process.deconvolution.WienerDeconvolution;
import net.preibisch.homogenization.process.event.HomogenizationEvent.Type;
import net.preibisch.homogenization.process.event.HomogenizationListener;
import net.preibisch.homogenization.process.geometry.GeometricTransforms;
import net.preibisch.homogenization.process.geometry.Interpolation;
import net.preibisch.homogenization.process.geometry.PadPosition;
import net.preibisch.homogenization.process.regularization.UnsupervisedWienerHunt;
import net.preibisch.homogenization.process.regularization.WienerHuntResult;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Brings a source and a target PSF to the same orientation, pixel scale and size
 * and computes the kernel that homogenizes the source PSF to the target PSF.
 */
public class HomogenizationPipeline
{
	private static final Logger LOG = LoggerFactory.getLogger( HomogenizationPipeline.class );

	final HomogenizationParameters params;
	final HomogenizationListener listener;

	public HomogenizationPipeline( final HomogenizationParameters params, final HomogenizationListener listener )
	{
		this.params = params;
		this.listener = listener;
	}

	public HomogenizationPipeline( final HomogenizationParameters params )
	{
		this( params, HomogenizationListener.NONE );
	}

	public HomogenizationParameters getParameters() { return params; }

	/**
	 * Loads both PSFs (if necessary) and computes the kernel.
	 *
	 * @param source - the PSF with the higher resolution
	 * @param target - the PSF with the lower resolution
	 * @return the kernel at the pixel scale of the target
	 * @throws IOException if a PSF cannot be loaded
	 */
	public HomogenizationResult compute( final PointSpreadFunction source, final PointSpreadFunction target ) throws IOException
	{
		final ArrayImg< DoubleType, DoubleArray > psfSource = source.getPSFCopy();
		listener.event( Type.PSF_LOADED, "Source PSF loaded: " + source.getFile() );

		final ArrayImg< DoubleType, DoubleArray > psfTarget = target.getPSFCopy();
		listener.event( Type.PSF_LOADED, "Target PSF loaded: " + target.getFile() );

		final double scaleSource = source.getPixelScale();
		final double scaleTarget = target.getPixelScale();

		listener.event( Type.PIXEL_SCALE, String.format( Locale.ROOT, "Source PSF pixel scale: %.2f arcsec", scaleSource ) );
		listener.event( Type.PIXEL_SCALE, String.format( Locale.ROOT, "Target PSF pixel scale: %.2f arcsec", scaleTarget ) );

		return compute( psfSource, scaleSource, psfTarget, scaleTarget );
	}

	/**
	 * Computes the kernel from two images.
	 *
	 * @param psfSource - the PSF with the higher resolution
	 * @param scaleSource - its pixel scale (arcsec)
	 * @param psfTarget - the PSF with the lower resolution
	 * @param scaleTarget - its pixel scale (arcsec)
	 * @return the kernel at the pixel scale of the target
	 */
	public < S extends RealType< S >, T extends RealType< T > > HomogenizationResult compute(
			final RandomAccessibleInterval< S > psfSource,
			final double scaleSource,
			final RandomAccessibleInterval< T > psfTarget,
			final double scaleTarget )
	{
		ValidationException.requireTwoDimensional( psfSource.numDimensions(), "SOURCE" );
		ValidationException.requireTwoDimensional( psfTarget.numDimensions(), "TARGET" );
		validatePixelScale( scaleSource, "source" );
		validatePixelScale( scaleTarget, "target" );
		WienerDeconvolution.validateRegularization( params.regularizationFactor );
		Interpolation.validateOrder( params.interpolationOrder );

		LOG.debug( "Computing kernel with " + params );

		ArrayImg< DoubleType, DoubleArray > source = ImgTools.replaceNaN( psfSource );
		ArrayImg< DoubleType, DoubleArray > target = ImgTools.replaceNaN( psfTarget );

		if ( params.angleSource != 0.0 )
			source = GeometricTransforms.rotate( source, params.angleSource, params.interpolationOrder );

		if ( params.angleTarget != 0.0 )
			target = GeometricTransforms.rotate( target, params.angleTarget, params.interpolationOrder );

		listener.event( Type.ROTATED, String.format( Locale.ROOT, "Source PSF rotated by %.2f degrees", params.angleSource ) );
		listener.event( Type.ROTATED, String.format( Locale.ROOT, "Target PSF rotated by %.2f degrees", params.angleTarget ) );

		source = normalize( source, "Source" );
		target = normalize( target, "Target" );

		if ( scaleSource != scaleTarget )
		{
			source = GeometricTransforms.resample( source, scaleSource, scaleTarget, params.interpolationOrder );
			listener.event( Type.RESAMPLED, "Source PSF resampled to the target pixel scale: " + Arrays.toString( ImgTools.dimensions( source ) ) );
		}

		source = matchSize( source, ImgTools.dimensions( target ) );
		listener.event( Type.SIZE_MATCHED, "Source PSF brought to the target size " + Arrays.toString( ImgTools.dimensions( target ) ) );

		double regularizationFactor = params.regularizationFactor;
		WienerHuntResult estimation = null;

		if ( params.estimateRegularization )
		{
			final RandomGenerator rng = params.seed == null ? new Well19937c() : new Well19937c( params.seed );

			estimation = UnsupervisedWienerHunt.estimate( target, source, params.clip, params.wienerHuntSettings, params.priorStatistics, rng, listener );
			regularizationFactor = estimation.getRegularization();

			listener.event( Type.REGULARIZATION_ESTIMATED, String.format( Locale.ROOT, "Regularisation parameter estimated: r = %.2e", regularizationFactor ) );
		}

		final Pair< ArrayImg< DoubleType, DoubleArray >, ArrayImg< ComplexDoubleType, DoubleArray > > kernel =
				WienerDeconvolution.homogenizationKernel( target, source, regularizationFactor, params.clip );

		listener.event( Type.KERNEL_COMPUTED, String.format( Locale.ROOT, "Kernel computed using Wiener filtering and a regularisation parameter r = %.2e", regularizationFactor ) );

		return new HomogenizationResult( kernel.getA(), kernel.getB(), scaleTarget, regularizationFactor, estimation );
	}

	/**
	 * Writes the kernel as FITS file, with the names of both PSFs and the
	 * regularization factor as comments.
	 */
	public void save( final HomogenizationResult result, final File file, final String sourceName, final String targetName ) throws IOException
	{
		FitsIO.writeImage( file, result.getKernel(), kernelComments( sourceName, targetName, result.getRegularizationFactor() ), result.getPixelScale() );
		listener.event( Type.KERNEL_SAVED, "Kernel saved in " + file );
	}

	/**
	 * Trims the source if it is larger than the target along both axes, pads it
	 * centered if it is smaller or equal along both axes.
	 */
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > matchSize( final RandomAccessibleInterval< T > img, final long[] shape )
	{
		final long[] dim = ImgTools.dimensions( img );

		if ( dim[ 0 ] > shape[ 0 ] && dim[ 1 ] > shape[ 1 ] )
			return GeometricTransforms.trim( img, shape );
		else if ( dim[ 0 ] <= shape[ 0 ] && dim[ 1 ] <= shape[ 1 ] )
			return GeometricTransforms.zeroPad( img, shape, PadPosition.CENTER );
		else
			throw new ValidationException( Kind.SHAPE_MISMATCH, "Source PSF " + Arrays.toString( dim ) + " is larger than the target PSF " + Arrays.toString( shape ) + " along one axis only." );
	}

	public static List< String > kernelComments( final String sourceName, final String targetName, final double regularizationFactor )
	{
		final String line = new String( new char[ 50 ] ).replace( '\0', '=' );

		final List< String > comments = new ArrayList<>();

		comments.add( line );
		comments.add( "" );
		comments.add( "File written with PSF homogenization" );
		comments.add( "------------------------------------" );
		comments.add( "" );
		comments.add( "Kernel from PSF" );
		comments.add( "" );
		comments.add( "=> " + new File( sourceName ).getName() );
		comments.add( "" );
		comments.add( "to PSF" );
		comments.add( "" );
		comments.add( "=> " + new File( targetName ).getName() );
		comments.add( "" );
		comments.add( String.format( Locale.ROOT, "using a regularisation parameter R = %.1e", regularizationFactor ) );
		comments.add( "" );
		comments.add( line );

		return comments;
	}

	/**
	 * @return the output path with its extension replaced by .fits
	 */
	public static File kernelFile( final String output )
	{
		return new File( basename( output ) + ".fits" );
	}

	public static File logFile( final String output )
	{
		return new File( basename( output ) + ".log" );
	}

	protected static String basename( final String output )
	{
		final String name = new File( output ).getName();
		final int dot = name.lastIndexOf( '.' );

		if ( dot <= 0 )
			return output;

		return output.substring( 0, output.length() - ( name.length() - dot ) );
	}

	protected ArrayImg< DoubleType, DoubleArray > normalize( final ArrayImg< DoubleType, DoubleArray > psf, final String which )
	{
		final double sum = ImgTools.sum( psf );

		if ( sum == 0 )
		{
			LOG.warn( which + " PSF has zero flux, it is not normalized." );
			listener.event( Type.NORMALIZED, which + " PSF has zero flux and was not normalized" );
			return psf;
		}

		listener.event( Type.NORMALIZED, which + " PSF normalized, total flux was " + sum );
		return ImgTools.normalize( psf );
	}

	private static void validatePixelScale( final double scale, final String which )
	{
		if ( !( scale > 0 ) || Double.isInfinite( scale ) )
			throw new ValidationException( Kind.PIXEL_SCALE, "Pixel scale of the " + which + " PSF must be finite and > 0, got " + scale );
	}
}
