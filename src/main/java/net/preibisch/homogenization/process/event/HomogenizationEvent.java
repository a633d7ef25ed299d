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
 * A progress or diagnostic message emitted while computing a kernel.
 */
public class HomogenizationEvent
{
	public static enum Type
	{
		PSF_LOADED,
		PIXEL_SCALE,
		ROTATED,
		NORMALIZED,
		RESAMPLED,
		SIZE_MATCHED,
		KERNEL_COMPUTED,
		REGULARIZATION_ESTIMATED,
		CHAIN_ITERATION,
		CHAIN_STOPPED,
		KERNEL_SAVED
	};

	private final Type type;
	private final String message;

	public HomogenizationEvent( final Type type, final String message )
	{
		this.type = type;
		this.message = message;
	}

	public Type getType() { return type; }
	public String getMessage() { return message; }

	@Override
	public String toString()
	{
		return type + ": " + message;
	}
}
