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
package net.preibisch.homogenization.process.geometry;

import net.imglib2.RandomAccessible;
import net.imglib2.RealInterval;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;

public class BSplineKernelInterpolatorFactory implements InterpolatorFactory< DoubleType, RandomAccessible< DoubleType > >
{
	final int order;

	public BSplineKernelInterpolatorFactory( final int order )
	{
		this.order = order;
	}

	@Override
	public BSplineKernelInterpolator create( final RandomAccessible< DoubleType > randomAccessible )
	{
		return new BSplineKernelInterpolator( randomAccessible, order );
	}

	@Override
	public BSplineKernelInterpolator create( final RandomAccessible< DoubleType > randomAccessible, final RealInterval interval )
	{
		return create( randomAccessible );
	}
}
