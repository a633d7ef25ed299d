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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.homogenization.process.ValidationException;
import net.preibisch.homogenization.process.ValidationException.Kind;
import net.preibisch.homogenization.process.event.HomogenizationEvent;
import net.preibisch.homogenization.process.event.HomogenizationEvent.Type;
import net.preibisch.homogenization.process.event.HomogenizationListener;
import net.preibisch.homogenization.util.ImgTools;

public class UnsupervisedWienerHuntTest
{
	// threshold, max_iter, min_iter, burnin
	final WienerHuntSettings quick = new WienerHuntSettings( 1.0, 50, 10, 5 );

	static ArrayImg< DoubleType, DoubleArray > gaussian( final int size, final double sigma )
	{
		final double c = ( size - 1 ) / 2.0;
		final double[] data = new double[ size * size ];

		for ( int y = 0; y < size; ++y )
			for ( int x = 0; x < size; ++x )
				data[ y * size + x ] = Math.exp( -( ( x - c ) * ( x - c ) + ( y - c ) * ( y - c ) ) / ( 2 * sigma * sigma ) );

		return ImgTools.normalize( ImgTools.wrap( data, size, size ) );
	}

	private WienerHuntResult estimate( final WienerHuntSettings settings, final PriorStatistics priorStatistics, final long seed, final HomogenizationListener listener )
	{
		return UnsupervisedWienerHunt.estimate( gaussian( 15, 2 ), gaussian( 15, 1 ), true, settings, priorStatistics, new Well19937c( seed ), listener );
	}

	@Test
	public void testConvergesBeforeMaxIter()
	{
		final WienerHuntResult result = estimate( quick, PriorStatistics.COMPATIBLE, 1, HomogenizationListener.NONE );

		assertTrue( result.hasConverged() );
		assertTrue( result.getIterations() > quick.getMinIter() );
		assertTrue( result.getIterations() < quick.getMaxIter() );

		assertTrue( result.getRegularization() > 0 );
		assertFalse( Double.isInfinite( result.getRegularization() ) );

		// one precision sample per iteration plus the initial value
		assertEquals( result.getIterations() + 1, result.getFinalState().getNoiseChain().length );
		assertEquals( result.getIterations() + 1, result.getFinalState().getPriorChain().length );
		assertTrue( result.getFinalState().getDelta() < quick.getThreshold() );
	}

	@Test
	public void testStopsAtMaxIter()
	{
		final WienerHuntSettings settings = new WienerHuntSettings( 1e-12, 20, 5, 2 );
		final WienerHuntResult result = estimate( settings, PriorStatistics.COMPATIBLE, 3, HomogenizationListener.NONE );

		assertFalse( result.hasConverged() );
		assertEquals( 20, result.getIterations() );
		assertEquals( 20 - 1 - 2, result.getFinalState().numPosteriorSamples( 2 ) );
	}

	@Test
	public void testSameSeedSameChain()
	{
		final WienerHuntResult a = estimate( quick, PriorStatistics.COMPATIBLE, 17, HomogenizationListener.NONE );
		final WienerHuntResult b = estimate( quick, PriorStatistics.COMPATIBLE, 17, HomogenizationListener.NONE );

		assertEquals( a.getIterations(), b.getIterations() );
		assertEquals( a.getRegularization(), b.getRegularization(), 0 );
		assertArrayEquals( a.getFinalState().getNoiseChain(), b.getFinalState().getNoiseChain(), 0 );
	}

	@Test
	public void testRegularizationIsRatioOfMeans()
	{
		final WienerHuntResult result = estimate( quick, PriorStatistics.CORRECTED, 5, HomogenizationListener.NONE );

		final double[] gn = result.getFinalState().getNoiseChain();
		final double[] gx = result.getFinalState().getPriorChain();
		final int burnin = quick.getBurnin();

		final double noise = new Mean().evaluate( gn, burnin, gn.length - burnin );
		final double prior = new Mean().evaluate( gx, burnin, gx.length - burnin );

		assertEquals( prior / noise, result.getRegularization(), 1e-12 * result.getRegularization() );
		assertEquals( noise, result.getNoise(), 1e-12 * noise );
		assertEquals( prior, result.getPrior(), 1e-12 * prior );
		assertTrue( result.getRegularizationUncertainty() >= 0 );
	}

	@Test
	public void testCompatibleStatisticsReportNoiseChainAsPrior()
	{
		// known discrepancy kept for compatibility: prior fields come from the noise
		// chain and the regularization uncertainty is a self-ratio
		final WienerHuntResult result = estimate( quick, PriorStatistics.COMPATIBLE, 5, HomogenizationListener.NONE );

		assertEquals( result.getNoise(), result.getPrior(), 0 );
		assertEquals( result.getNoiseUncertainty(), result.getPriorUncertainty(), 0 );
		assertEquals( 1.0, result.getRegularizationUncertainty(), 0 );

		// the regularization itself still uses the prior chain
		final double[] gx = result.getFinalState().getPriorChain();
		final double prior = new Mean().evaluate( gx, quick.getBurnin(), gx.length - quick.getBurnin() );
		assertEquals( prior / result.getNoise(), result.getRegularization(), 1e-12 * result.getRegularization() );
	}

	@Test
	public void testPosteriorImage()
	{
		final WienerHuntResult result = estimate( quick, PriorStatistics.COMPATIBLE, 9, HomogenizationListener.NONE );

		assertArrayEquals( new long[] { 15, 15 }, ImgTools.dimensions( result.getImage() ) );

		for ( final double v : ImgTools.toArray( result.getImage() ) )
			assertTrue( v >= -1 && v <= 1 );
	}

	@Test
	public void testEvents()
	{
		final List< HomogenizationEvent > events = new ArrayList<>();
		final WienerHuntResult result = estimate( quick, PriorStatistics.COMPATIBLE, 11, events::add );

		int iterations = 0, stopped = 0;

		for ( final HomogenizationEvent e : events )
			if ( e.getType() == Type.CHAIN_ITERATION )
				++iterations;
			else if ( e.getType() == Type.CHAIN_STOPPED )
				++stopped;

		assertEquals( result.getIterations(), iterations );
		assertEquals( 1, stopped );
		assertEquals( Type.CHAIN_STOPPED, events.get( events.size() - 1 ).getType() );
	}

	@Test
	public void testStepByStep()
	{
		final UnsupervisedWienerHunt sampler = new UnsupervisedWienerHunt( gaussian( 9, 2 ), gaussian( 9, 1 ), quick, new Well19937c( 2 ) );

		WienerHuntState state = sampler.initialState();
		assertEquals( -1, state.getIteration() );
		assertEquals( 1.0, state.getNoisePrecision(), 0 );
		assertTrue( Double.isNaN( state.getDelta() ) );

		// no delta before two samples after the burn-in
		for ( int i = 0; i <= quick.getBurnin() + 1; ++i )
		{
			state = sampler.step( state ).getA();
			assertTrue( Double.isNaN( state.getDelta() ) );
		}

		state = sampler.step( state ).getA();
		assertFalse( Double.isNaN( state.getDelta() ) );
		assertEquals( quick.getBurnin() + 2, state.getIteration() );
		assertEquals( 2, state.numPosteriorSamples( quick.getBurnin() ) );
	}

	@Test
	public void testStoppingRule()
	{
		assertTrue( UnsupervisedWienerHunt.shouldStop( 11, 0.5, quick ) );
		assertFalse( UnsupervisedWienerHunt.shouldStop( 10, 0.5, quick ) );
		assertFalse( UnsupervisedWienerHunt.shouldStop( 11, 1.0, quick ) );
		assertFalse( UnsupervisedWienerHunt.shouldStop( 11, Double.NaN, quick ) );
	}

	@Test
	public void testZeroSourceCannotBeSampled()
	{
		try
		{
			new UnsupervisedWienerHunt( gaussian( 9, 2 ), ImgTools.wrap( new double[ 81 ], 9, 9 ), quick );
			fail( "expected an EstimationException" );
		}
		catch ( final EstimationException e )
		{
			assertTrue( e.getMessage().contains( "vanish" ) );
		}
	}

	@Test
	public void testShapeMismatch()
	{
		try
		{
			new UnsupervisedWienerHunt( gaussian( 9, 2 ), gaussian( 11, 1 ), quick );
			fail( "expected a ValidationException" );
		}
		catch ( final ValidationException e )
		{
			assertEquals( Kind.SHAPE_MISMATCH, e.getKind() );
		}
	}

	@Test
	public void testSettingsValidation()
	{
		final WienerHuntSettings defaults = new WienerHuntSettings();

		assertEquals( 1e-4, defaults.getThreshold(), 0 );
		assertEquals( 200, defaults.getMaxIter() );
		assertEquals( 100, defaults.getMinIter() );
		assertEquals( 30, defaults.getBurnin() );

		for ( final Runnable invalid : new Runnable[] {
				() -> defaults.setThreshold( 0 ),
				() -> defaults.setMaxIter( 0 ),
				() -> defaults.setMinIter( -1 ),
				() -> defaults.setBurnin( 200 ),
				() -> defaults.setBurnin( -1 ) } )
		{
			try
			{
				invalid.run();
				fail( "expected a ValidationException" );
			}
			catch ( final ValidationException e )
			{
				assertEquals( Kind.ESTIMATOR_SETTINGS, e.getKind() );
			}
		}

		assertEquals( 50, defaults.setMaxIter( 50 ).setBurnin( 10 ).getMaxIter() );
	}
}
