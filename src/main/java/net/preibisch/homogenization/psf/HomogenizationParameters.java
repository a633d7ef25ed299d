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

import net.preibisch.homogenization.process.deconvolution.WienerDeconvolution;
import net.preibisch.homogenization.process.geometry.GeometricTransforms;
import net.preibisch.homogenization.process.regularization.PriorStatistics;
import net.preibisch.homogenization.process.regularization.WienerHuntSettings;

public class HomogenizationParameters
{
	public static double defaultAngleSource = 0.0;
	public static double defaultAngleTarget = 0.0;
	public static boolean defaultEstimateRegularization = false;
	public static PriorStatistics defaultPriorStatistics = PriorStatistics.COMPATIBLE;

	// rotation of the PSFs from north to east in degrees
	public double angleSource = defaultAngleSource;
	public double angleTarget = defaultAngleTarget;

	public double regularizationFactor = WienerDeconvolution.defaultRegularizationFactor;
	public int interpolationOrder = GeometricTransforms.defaultInterpolationOrder;
	public boolean clip = WienerDeconvolution.defaultClip;

	// if true, regularizationFactor is replaced by the estimate of the Gibbs sampler
	public boolean estimateRegularization = defaultEstimateRegularization;
	public WienerHuntSettings wienerHuntSettings = new WienerHuntSettings();
	public PriorStatistics priorStatistics = defaultPriorStatistics;

	// seed of the sampler, null for a random one
	public Long seed = null;

	@Override
	public String toString()
	{
		return "angleSource=" + angleSource + ", angleTarget=" + angleTarget +
				", regularizationFactor=" + regularizationFactor + ", interpolationOrder=" + interpolationOrder +
				", clip=" + clip + ", estimateRegularization=" + estimateRegularization +
				( estimateRegularization ? ", " + wienerHuntSettings + ", priorStatistics=" + priorStatistics + ", seed=" + seed : "" );
	}
}
