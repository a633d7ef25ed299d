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

import java.util.Arrays;

/**
 * Thrown when an image or a shape request does not satisfy the preconditions of
 * an operation. The {@link Kind} tells the caller which precondition failed.
 */
public class ValidationException extends IllegalArgumentException
{
	private static final long serialVersionUID = -2215406542128497104L;

	public static enum Kind
	{
		NON_POSITIVE_SHAPE,
		TARGET_TOO_LARGE,
		TARGET_TOO_SMALL,
		PARITY_MISMATCH,
		SHAPE_MISMATCH,
		DIMENSIONALITY,
		INTERPOLATION_ORDER,
		PIXEL_SCALE,
		REGULARIZATION,
		ESTIMATOR_SETTINGS
	};

	private final Kind kind;

	public ValidationException( final Kind kind, final String message )
	{
		super( message );
		this.kind = kind;
	}

	public Kind getKind() { return kind; }

	public static void requireTwoDimensional( final int numDimensions, final String what )
	{
		if ( numDimensions != 2 )
			throw new ValidationException( Kind.DIMENSIONALITY, what + ": only 2d images are supported, got " + numDimensions + " dimensions" );
	}

	public static void requirePositive( final long[] shape, final String what )
	{
		for ( final long s : shape )
			if ( s <= 0 )
				throw new ValidationException( Kind.NON_POSITIVE_SHAPE, what + ": null or negative shape given " + Arrays.toString( shape ) );
	}

	public static void requireSameShape( final long[] a, final long[] b, final String what )
	{
		if ( !Arrays.equals( a, b ) )
			throw new ValidationException( Kind.SHAPE_MISMATCH, what + ": shapes differ " + Arrays.toString( a ) + " vs " + Arrays.toString( b ) );
	}

	/**
	 * @param difference - per-axis size difference between two shapes
	 * @param what - name of the operation for the message
	 */
	public static void requireEvenDifference( final long[] difference, final String what )
	{
		for ( final long d : difference )
			if ( d % 2 != 0 )
				throw new ValidationException( Kind.PARITY_MISMATCH, what + ": source and target shapes have different parity " + Arrays.toString( difference ) );
	}
}
