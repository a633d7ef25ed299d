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
package net.preibisch.homogenization.process.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards events to SLF4J, chain iterations at debug level.
 */
public class LoggingListener implements HomogenizationListener
{
	private static final Logger LOG = LoggerFactory.getLogger( LoggingListener.class );

	@Override
	public void event( final HomogenizationEvent event )
	{
		if ( event.getType() == HomogenizationEvent.Type.CHAIN_ITERATION )
			LOG.debug( event.getMessage() );
		else
			LOG.info( event.getMessage() );
	}
}
