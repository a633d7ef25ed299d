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

/**
 * Receives the progress events of a kernel computation. Implementations decide
 * whether events are logged, collected or dropped.
 */
@FunctionalInterface
public interface HomogenizationListener
{
	public static final HomogenizationListener NONE = e -> {};

	public void event( final HomogenizationEvent event );

	public default void event( final HomogenizationEvent.Type type, final String message )
	{
		event( new HomogenizationEvent( type, message ) );
	}
}
