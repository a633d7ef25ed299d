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
package net.preibisch.homogenization.process;

/**
 * Thrown before allocating an image that would exceed the size the
 * computation is willing to hold in memory.
 */
public class ResourceLimitException extends RuntimeException
{
	private static final long serialVersionUID = 4482009531562264517L;

	private final long requestedSize;
	private final long maxSize;

	public ResourceLimitException( final long requestedSize, final long maxSize )
	{
		super( "The resampling will yield a too large image (" + requestedSize + "x" + requestedSize +
				", maximum is " + maxSize + "x" + maxSize + "). Please resize the input PSF image." );

		this.requestedSize = requestedSize;
		this.maxSize = maxSize;
	}

	public long getRequestedSize() { return requestedSize; }
	public long getMaxSize() { return maxSize; }
}
