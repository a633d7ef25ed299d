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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Serializable;
import java.nio.file.Files;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import net.preibisch.homogenization.process.ResourceLimitException;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.deconvolution.WienerDeconvolution;
import net.preibisch.homogenization.process.event.LoggingListener;
import net.preibisch.homogenization.process.geometry.GeometricTransforms;
import net.preibisch.homogenization.process.regularization.EstimationException;
import net.preibisch.homogenization.psf.HomogenizationParameters;
import net.preibisch.homogenization.psf.HomogenizationPipeline;
import net.preibisch.homogenization.psf.HomogenizationResult;
import net.preibisch.homogenization.psf.PointSpreadFunction;

/**
 * Computes the kernel that homogenizes a source PSF to a target PSF and writes
 * it as FITS file.
 */
public class Homogenize
{
	private static final Logger LOG = LoggerFactory.getLogger( Homogenize.class );

	public static final int EXIT_OK = 0;
	public static final int EXIT_ARGUMENTS = 1;
	public static final int EXIT_VALIDATION = 2;
	public static final int EXIT_RESOURCE_LIMIT = 3;
	public static final int EXIT_IO = 4;
	public static final int EXIT_UNEXPECTED = 5;

	public static void main( String[] args )
	{
		System.exit( run( System.out, System.err, args ) );
	}

	public static int run( final PrintStream out, final PrintStream err, final String... args )
	{
		final Arguments arg = new Arguments();
		final CmdLineParser parser = new CmdLineParser( arg );

		try
		{
			parser.parseArgument( args );
		}
		catch ( final CmdLineException e )
		{
			err.println( e.getMessage() );
			err.println( "usage: Homogenize psf_source psf_target output [options]" );
			parser.printUsage( err );
			return EXIT_ARGUMENTS;
		}

		final File kernelFile = HomogenizationPipeline.kernelFile( arg.output );
		final File logFile = HomogenizationPipeline.logFile( arg.output );

		FileAppender< ILoggingEvent > appender = null;

		try
		{
			appender = attachLogFile( logFile );

			final HomogenizationPipeline pipeline = new HomogenizationPipeline( arg.toParameters(), new LoggingListener() );

			final HomogenizationResult result = pipeline.compute( new PointSpreadFunction( new File( arg.psfSource ) ), new PointSpreadFunction( new File( arg.psfTarget ) ) );
			pipeline.save( result, kernelFile, arg.psfSource, arg.psfTarget );

			out.println( "Output kernel saved to " + kernelFile );
			return EXIT_OK;
		}
		catch ( final ResourceLimitException e )
		{
			LOG.error( "- COMPUTATION ABORTED -" );
			LOG.error( e.getMessage() );
			err.println( "Issue during the resampling step - see " + logFile );
			return EXIT_RESOURCE_LIMIT;
		}
		catch ( final ValidationException e )
		{
			LOG.error( "Invalid input (" + e.getKind() + "): " + e.getMessage() );
			err.println( "Invalid input: " + e.getMessage() );
			return EXIT_VALIDATION;
		}
		catch ( final EstimationException e )
		{
			LOG.error( "Estimation of the regularization factor failed: " + e.getMessage() );
			err.println( "Estimation of the regularization factor failed: " + e.getMessage() );
			return EXIT_VALIDATION;
		}
		catch ( final IOException e )
		{
			LOG.error( "I/O error: " + e.getMessage() );
			err.println( "I/O error: " + e.getMessage() );
			return EXIT_IO;
		}
		catch ( final RuntimeException e )
		{
			return unexpectedFailure( e, err );
		}
		finally
		{
			if ( appender != null )
				detachLogFile( appender );
		}
	}

	static int unexpectedFailure( final RuntimeException e, final PrintStream err )
	{
		LOG.error( "Unexpected failure: " + e, e );
		err.println( "Unexpected failure: " + e );
		return EXIT_UNEXPECTED;
	}

	/**
	 * Adds a file appender to the root logger, an existing log file is replaced.
	 */
	protected static FileAppender< ILoggingEvent > attachLogFile( final File logFile ) throws IOException
	{
		Files.deleteIfExists( logFile.toPath() );

		final LoggerContext context = (LoggerContext)LoggerFactory.getILoggerFactory();

		final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext( context );
		encoder.setPattern( "%d{yyyy-MM-dd HH:mm:ss,SSS} - %logger{0} - %level - %msg%n" );
		encoder.start();

		final FileAppender< ILoggingEvent > appender = new FileAppender<>();
		appender.setContext( context );
		appender.setName( "kernel-log" );
		appender.setFile( logFile.getAbsolutePath() );
		appender.setAppend( false );
		appender.setEncoder( encoder );
		appender.start();

		context.getLogger( Logger.ROOT_LOGGER_NAME ).addAppender( appender );

		return appender;
	}

	protected static void detachLogFile( final FileAppender< ILoggingEvent > appender )
	{
		final LoggerContext context = (LoggerContext)LoggerFactory.getILoggerFactory();
		context.getLogger( Logger.ROOT_LOGGER_NAME ).detachAppender( appender );
		appender.stop();
	}

	private static class Arguments implements Serializable
	{
		private static final long serialVersionUID = 4017843567240893113L;

		@Argument( index = 0, required = true, metaVar = "psf_source",
				usage = "FITS file of the PSF with the higher resolution" )
		private String psfSource;

		@Argument( index = 1, required = true, metaVar = "psf_target",
				usage = "FITS file of the PSF with the lower resolution" )
		private String psfTarget;

		@Argument( index = 2, required = true, metaVar = "output",
				usage = "output kernel, written as <basename>.fits together with <basename>.log" )
		private String output;

		@Option( name = "-s", aliases = { "--angle_source" },
				usage = "rotation angle of the source PSF from North to East in degrees (default: 0)" )
		private double angleSource = HomogenizationParameters.defaultAngleSource;

		@Option( name = "-t", aliases = { "--angle_target" },
				usage = "rotation angle of the target PSF from North to East in degrees (default: 0)" )
		private double angleTarget = HomogenizationParameters.defaultAngleTarget;

		@Option( name = "-r", aliases = { "--reg_fact" },
				usage = "regularization factor (default: 1e-4)" )
		private double regularizationFactor = WienerDeconvolution.defaultRegularizationFactor;

		@Option( name = "-o", aliases = { "--interp_order" },
				usage = "spline interpolation order for rotation and resampling, 0-5 (default: 1)" )
		private int interpolationOrder = GeometricTransforms.defaultInterpolationOrder;

		@Option( name = "--no_clip",
				usage = "do not clamp the kernel to [-1, 1]" )
		private boolean noClip = false;

		@Option( name = "-e", aliases = { "--estimate_reg" },
				usage = "estimate the regularization factor with a Gibbs sampler instead of using -r" )
		private boolean estimateRegularization = HomogenizationParameters.defaultEstimateRegularization;

		@Option( name = "--seed",
				usage = "seed of the random generator used by --estimate_reg" )
		private Long seed = null;

		public HomogenizationParameters toParameters()
		{
			final HomogenizationParameters params = new HomogenizationParameters();

			params.angleSource = angleSource;
			params.angleTarget = angleTarget;
			params.regularizationFactor = regularizationFactor;
			params.interpolationOrder = interpolationOrder;
			params.clip = !noClip;
			params.estimateRegularization = estimateRegularization;
			params.seed = seed;

			return params;
		}
	}
}
