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
package net.preibisch.homogenization.process.regularization;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.deconvolution.WienerDeconvolution;
import net.preibisch.homogenization.process.event.HomogenizationEvent.Type;
import net.preibisch.homogenization.process.event.HomogenizationListener;
import net.preibisch.homogenization.process.fourier.OpticalTransferFunction;
import net.preibisch.homogenization.process.fourier.UnitaryFFT;
import net.preibisch.homogenization.util.ImgTools;

/**
 * Estimation of the regularization factor by unsupervised Wiener-Hunt
 * deconvolution: a Gibbs sampler that alternately draws the object (in Fourier
 * space), the noise precision and the prior (smoothness) precision.
 * <p>
 * François Orieux, Jean-François Giovannelli, and Thomas Rodet, "Bayesian
 * estimation of regularization and point spread function parameters for
 * Wiener-Hunt deconvolution", J. Opt. Soc. Am. A 27, 1593-1607 (2010)
 */
public class UnsupervisedWienerHunt
{
	private static final Logger LOG = LoggerFactory.getLogger( UnsupervisedWienerHunt.class );

	final WienerHuntSettings settings;
	final RandomGenerator rng;

	final long[] dim;
	final int dataSize;

	// OTFs of the source PSF and of the Laplacian, the data spectrum (all interleaved complex)
	final double[] transFunc, regOp, data;

	// squared magnitudes of the OTFs
	final double[] atf2, areg2;

	/**
	 * @param data - the observed image (e.g. the target PSF)
	 * @param source - the PSF the data is assumed to be blurred with, same dimensions as data
	 * @param settings - the sampler parameters
	 * @param rng - the random source for all draws
	 */
	public < T extends RealType< T >, S extends RealType< S > > UnsupervisedWienerHunt(
			final RandomAccessibleInterval< T > data,
			final RandomAccessibleInterval< S > source,
			final WienerHuntSettings settings,
			final RandomGenerator rng )
	{
		this.dim = ImgTools.dimensions( source );
		ValidationException.requireSameShape( ImgTools.dimensions( data ), dim, "ESTIMATOR" );

		this.settings = settings;
		this.rng = rng;

		this.transFunc = ImgTools.storage( OpticalTransferFunction.psfToOtf( source, dim ) );
		this.regOp = ImgTools.storage( OpticalTransferFunction.psfToOtf( WienerDeconvolution.laplacian(), dim ) );

		this.dataSize = ImgTools.numPixels( dim );
		this.data = ImgTools.storage( UnitaryFFT.fft( data ) );

		this.atf2 = new double[ dataSize ];
		this.areg2 = new double[ dataSize ];

		for ( int i = 0; i < dataSize; ++i )
		{
			atf2[ i ] = abs2( transFunc, i );
			areg2[ i ] = abs2( regOp, i );

			if ( atf2[ i ] == 0 && areg2[ i ] == 0 )
				throw new EstimationException( "The source PSF and the regularization operator both vanish at frequency index " + i + ", the object cannot be sampled there (PSF with zero flux?)." );
		}
	}

	public < T extends RealType< T >, S extends RealType< S > > UnsupervisedWienerHunt(
			final RandomAccessibleInterval< T > data,
			final RandomAccessibleInterval< S > source,
			final WienerHuntSettings settings )
	{
		this( data, source, settings, new Well19937c() );
	}

	public WienerHuntSettings getSettings() { return settings; }

	public WienerHuntState initialState()
	{
		return WienerHuntState.initial( dataSize );
	}

	/**
	 * Runs one iteration of the chain.
	 *
	 * @param state - the state after the previous iteration
	 * @return the new state and whether the chain should continue
	 */
	public Pair< WienerHuntState, Boolean > step( final WienerHuntState state )
	{
		final int iteration = state.iteration + 1;
		final int burnin = settings.getBurnin();

		final double gn = state.getNoisePrecision();
		final double gx = state.getPriorPrecision();

		// sample of p(x | gn, gx, y): mean is the Wiener solution for the current
		// precisions, the (real) excursion is weighted by the precision
		final double[] xSample = new double[ 2 * dataSize ];

		for ( int i = 0; i < dataSize; ++i )
		{
			final double precision = gn * atf2[ i ] + gx * areg2[ i ];
			final double excursion = rng.nextGaussian() / Math.sqrt( precision );

			final int r = 2 * i, c = r + 1;

			// gn * conj(H) / precision * y
			final double wr = gn * transFunc[ r ] / precision;
			final double wi = -gn * transFunc[ c ] / precision;

			xSample[ r ] = wr * data[ r ] - wi * data[ c ] + excursion;
			xSample[ c ] = wr * data[ c ] + wi * data[ r ];
		}

		// sample of p(gn | x, gx, y)
		double likelihood = 0;
		double smoothness = 0;

		for ( int i = 0; i < dataSize; ++i )
		{
			final int r = 2 * i, c = r + 1;

			final double hr = xSample[ r ] * transFunc[ r ] - xSample[ c ] * transFunc[ c ];
			final double hi = xSample[ r ] * transFunc[ c ] + xSample[ c ] * transFunc[ r ];
			final double dr = data[ r ] - hr;
			final double di = data[ c ] - hi;
			likelihood += dr * dr + di * di;

			final double lr = xSample[ r ] * regOp[ r ] - xSample[ c ] * regOp[ c ];
			final double li = xSample[ r ] * regOp[ c ] + xSample[ c ] * regOp[ r ];
			smoothness += lr * lr + li * li;
		}

		if ( !( likelihood > 0 ) || Double.isInfinite( likelihood ) )
			throw new EstimationException( "Invalid likelihood " + likelihood + " in iteration " + iteration + ", cannot sample the noise precision." );

		if ( !( smoothness > 0 ) || Double.isInfinite( smoothness ) )
			throw new EstimationException( "Invalid smoothness " + smoothness + " in iteration " + iteration + ", cannot sample the prior precision." );

		final double gnNext = new GammaDistribution( rng, dataSize / 2.0, 2.0 / likelihood ).sample();

		// sample of p(gx | x, gn, y)
		final double gxNext = new GammaDistribution( rng, ( dataSize - 1 ) / 2.0, 2.0 / smoothness ).sample();

		// current empirical average
		final double[] previousSum = state.postMeanSum;
		final double[] postMeanSum;

		if ( iteration > burnin )
		{
			postMeanSum = new double[ previousSum.length ];
			for ( int i = 0; i < postMeanSum.length; ++i )
				postMeanSum[ i ] = previousSum[ i ] + xSample[ i ];
		}
		else
		{
			postMeanSum = previousSum;
		}

		double delta = state.delta;

		if ( iteration > burnin + 1 )
		{
			final double n = iteration - burnin;
			final double nPrev = iteration - burnin - 1;

			double norm = 0;
			double change = 0;

			for ( int i = 0; i < dataSize; ++i )
			{
				final int r = 2 * i, c = r + 1;

				norm += Math.hypot( postMeanSum[ r ], postMeanSum[ c ] );
				change += Math.hypot( postMeanSum[ r ] / n - previousSum[ r ] / nPrev, postMeanSum[ c ] / n - previousSum[ c ] / nPrev );
			}

			delta = change / ( norm / n );
		}

		final WienerHuntState next = new WienerHuntState(
				iteration,
				WienerHuntState.append( state.noiseChain, gnNext ),
				WienerHuntState.append( state.priorChain, gxNext ),
				postMeanSum,
				delta );

		final boolean proceed = !shouldStop( iteration, delta, settings ) && iteration < settings.getMaxIter() - 1;

		return new ValuePair<>( next, proceed );
	}

	/**
	 * The stopping rule: enough iterations were run and the posterior mean has
	 * stabilized. A NaN delta never stops the chain.
	 */
	public static boolean shouldStop( final int iteration, final double delta, final WienerHuntSettings settings )
	{
		return iteration > settings.getMinIter() && delta < settings.getThreshold();
	}

	/**
	 * Runs the chain until it stops and summarizes it.
	 *
	 * @param clip - clamp the posterior mean image to [-1, 1]
	 * @param priorStatistics - how prior statistics are reported
	 * @param listener - receives one event per iteration and one when the chain stops
	 * @return the estimate
	 */
	public WienerHuntResult run( final boolean clip, final PriorStatistics priorStatistics, final HomogenizationListener listener )
	{
		LOG.debug( "Running Gibbs sampler on " + dim[ 0 ] + "x" + dim[ 1 ] + " pixels: " + settings );

		WienerHuntState state = initialState();
		boolean proceed = true;

		while ( proceed )
		{
			final Pair< WienerHuntState, Boolean > step = step( state );
			state = step.getA();
			proceed = step.getB();

			listener.event( Type.CHAIN_ITERATION, "Iteration " + state.iteration + ": noise precision " + state.getNoisePrecision() + ", prior precision " + state.getPriorPrecision() + ", delta " + state.delta );
		}

		final WienerHuntResult result = summarize( state, clip, priorStatistics );

		listener.event(
				Type.CHAIN_STOPPED,
				( result.hasConverged() ? "Chain converged" : "Chain reached max_iter" ) + " after " + result.getIterations() + " iterations, regularization factor " + result.getRegularization() );

		return result;
	}

	public WienerHuntResult run()
	{
		return run( WienerDeconvolution.defaultClip, PriorStatistics.COMPATIBLE, HomogenizationListener.NONE );
	}

	/**
	 * Turns the final state of a chain into a {@link WienerHuntResult}.
	 */
	public WienerHuntResult summarize( final WienerHuntState state, final boolean clip, final PriorStatistics priorStatistics )
	{
		final int burnin = settings.getBurnin();
		final int numSamples = state.numPosteriorSamples( burnin );

		// empirical average ~ posterior mean
		final double[] postMean = new double[ state.postMeanSum.length ];

		if ( numSamples > 0 )
			for ( int i = 0; i < postMean.length; ++i )
				postMean[ i ] = state.postMeanSum[ i ] / numSamples;

		ArrayImg< DoubleType, DoubleArray > image = ImgTools.realPart( UnitaryFFT.ifft( ImgTools.wrapComplex( postMean, dim.clone() ) ) );

		if ( clip )
			image = ImgTools.clip( image, -1, 1 );

		final double[] gn = state.noiseChain;
		final double[] gx = state.priorChain;
		final int length = gn.length - burnin;

		final double noiseMean = new Mean().evaluate( gn, burnin, length );
		final double priorMean = new Mean().evaluate( gx, burnin, length );
		final double noiseStd = new StandardDeviation( false ).evaluate( gn, burnin, length );
		final double priorStd = new StandardDeviation( false ).evaluate( gx, burnin, length );

		final double prior, priorUncertainty, regularizationUncertainty;

		if ( priorStatistics == PriorStatistics.CORRECTED )
		{
			final double[] ratio = new double[ length ];
			for ( int i = 0; i < length; ++i )
				ratio[ i ] = gx[ burnin + i ] / gn[ burnin + i ];

			prior = priorMean;
			priorUncertainty = priorStd;
			regularizationUncertainty = new StandardDeviation( false ).evaluate( ratio );
		}
		else
		{
			// prior fields are taken from the noise chain, see PriorStatistics.COMPATIBLE
			prior = noiseMean;
			priorUncertainty = noiseStd;
			regularizationUncertainty = noiseStd / noiseStd;
		}

		final boolean converged = shouldStop( state.iteration, state.delta, settings );

		return new WienerHuntResult(
				priorMean / noiseMean,
				image,
				noiseMean,
				prior,
				noiseStd,
				priorUncertainty,
				regularizationUncertainty,
				state.iteration + 1,
				converged,
				state );
	}

	/**
	 * Estimate the regularization factor that deconvolving data by source requires.
	 */
	public static < T extends RealType< T >, S extends RealType< S > > WienerHuntResult estimate(
			final RandomAccessibleInterval< T > data,
			final RandomAccessibleInterval< S > source,
			final boolean clip,
			final WienerHuntSettings settings,
			final PriorStatistics priorStatistics,
			final RandomGenerator rng,
			final HomogenizationListener listener )
	{
		return new UnsupervisedWienerHunt( data, source, settings, rng ).run( clip, priorStatistics, listener );
	}

	private static double abs2( final double[] complex, final int i )
	{
		final double r = complex[ 2 * i ];
		final double c = complex[ 2 * i + 1 ];
		return r * r + c * c;
	}
}
