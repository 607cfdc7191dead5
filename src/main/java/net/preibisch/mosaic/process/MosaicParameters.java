/*-
 * #%L
 * Photometric correction and seam blending of overlapping
 * astronomical image tiles.
 * %%
 * Copyright (C) 2020 - 2025 Photometric Mosaic developers.
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
package net.preibisch.mosaic.process;

import net.preibisch.mosaic.exception.InvalidConfigurationException;
import net.preibisch.mosaic.process.fusion.BlendMode;
import net.preibisch.mosaic.process.gradient.GradientAxis;
import net.preibisch.mosaic.process.sampling.SampleStatistic;

/**
 * All options of one mosaic computation. Passed explicitly into every pipeline
 * call; nothing here is global.
 */
public class MosaicParameters
{
	// sample grid
	public int cellSize = 20;
	public SampleStatistic sampleStatistic = SampleStatistic.MEDIAN;
	public double clipSigma = 3.0;
	public int clipIterations = 5;
	public int minPixelsPerCell = 20;

	// pixels <= minIntensity count as "no data" (black border), pixels >= maxIntensity as saturated
	// Double.NaN disables the threshold
	public double minIntensity = 0.0;
	public double maxIntensity = Double.NaN;

	// star exclusion
	public double limitSampleStarsPercent = 100;
	public double starRadiusGrowth = 1.0;

	// super-sample binning, maxSamples == 0 : no binning
	public int maxSamples = 0;
	public int minJoinThickness = 5;

	// robust linear fit
	public double rejectionSigma = 3.0;
	public int maxRejectionIterations = 10;
	public int minFitSamples = 3;

	// gradient, gradientSections == 0 : interpolate every sample column
	public GradientAxis gradientAxis = GradientAxis.AUTO;
	public int gradientSections = 0;

	// compositing
	public BlendMode blendMode = BlendMode.WEIGHTED_AVERAGE;
	public double ditherProbability = 0.5;
	public long ditherSeed = 17;
	public boolean truncate = false;

	// entries of each cache of a PhotometricMosaic( MosaicParameters ), ignored by the individual calls
	public int cacheCapacity = 16;

	public MosaicParameters() {}

	public MosaicParameters copy()
	{
		final MosaicParameters p = new MosaicParameters();
		p.cellSize = cellSize;
		p.sampleStatistic = sampleStatistic;
		p.clipSigma = clipSigma;
		p.clipIterations = clipIterations;
		p.minPixelsPerCell = minPixelsPerCell;
		p.minIntensity = minIntensity;
		p.maxIntensity = maxIntensity;
		p.limitSampleStarsPercent = limitSampleStarsPercent;
		p.starRadiusGrowth = starRadiusGrowth;
		p.maxSamples = maxSamples;
		p.minJoinThickness = minJoinThickness;
		p.rejectionSigma = rejectionSigma;
		p.maxRejectionIterations = maxRejectionIterations;
		p.minFitSamples = minFitSamples;
		p.gradientAxis = gradientAxis;
		p.gradientSections = gradientSections;
		p.blendMode = blendMode;
		p.ditherProbability = ditherProbability;
		p.ditherSeed = ditherSeed;
		p.truncate = truncate;
		p.cacheCapacity = cacheCapacity;
		return p;
	}

	public boolean hasMinIntensity() { return Double.isFinite( minIntensity ); }

	public boolean hasMaxIntensity() { return Double.isFinite( maxIntensity ); }

	/**
	 * @return this
	 * @throws InvalidConfigurationException naming the first option that is out of range
	 */
	public MosaicParameters validate()
	{
		if ( cellSize <= 0 )
			throw new InvalidConfigurationException( "cellSize", "must be > 0, was " + cellSize );
		if ( sampleStatistic == null )
			throw new InvalidConfigurationException( "sampleStatistic", "must not be null" );
		if ( !( clipSigma > 0 ) )
			throw new InvalidConfigurationException( "clipSigma", "must be > 0, was " + clipSigma );
		if ( clipIterations < 0 )
			throw new InvalidConfigurationException( "clipIterations", "must be >= 0, was " + clipIterations );
		if ( minPixelsPerCell < 1 )
			throw new InvalidConfigurationException( "minPixelsPerCell", "must be >= 1, was " + minPixelsPerCell );
		if ( hasMinIntensity() && hasMaxIntensity() && maxIntensity <= minIntensity )
			throw new InvalidConfigurationException( "maxIntensity", "must be > minIntensity (" + minIntensity + "), was " + maxIntensity );
		if ( !( limitSampleStarsPercent >= 0 && limitSampleStarsPercent <= 100 ) )
			throw new InvalidConfigurationException( "limitSampleStarsPercent", "must be within [0, 100], was " + limitSampleStarsPercent );
		if ( !( starRadiusGrowth > 0 ) )
			throw new InvalidConfigurationException( "starRadiusGrowth", "must be > 0, was " + starRadiusGrowth );
		if ( maxSamples < 0 )
			throw new InvalidConfigurationException( "maxSamples", "must be >= 0, was " + maxSamples );
		if ( minJoinThickness < 1 )
			throw new InvalidConfigurationException( "minJoinThickness", "must be >= 1, was " + minJoinThickness );
		if ( !( rejectionSigma > 0 ) )
			throw new InvalidConfigurationException( "rejectionSigma", "must be > 0, was " + rejectionSigma );
		if ( maxRejectionIterations < 0 )
			throw new InvalidConfigurationException( "maxRejectionIterations", "must be >= 0, was " + maxRejectionIterations );
		if ( minFitSamples < 3 )
			throw new InvalidConfigurationException( "minFitSamples", "must be >= 3, was " + minFitSamples );
		if ( gradientAxis == null )
			throw new InvalidConfigurationException( "gradientAxis", "must not be null" );
		if ( gradientSections < 0 )
			throw new InvalidConfigurationException( "gradientSections", "must be >= 0, was " + gradientSections );
		if ( gradientSections > 0 && gradientSections < 5 )
			throw new InvalidConfigurationException( "gradientSections", "must be 0 or >= 5, was " + gradientSections );
		if ( blendMode == null )
			throw new InvalidConfigurationException( "blendMode", "must not be null" );
		if ( !( ditherProbability >= 0 && ditherProbability <= 1 ) )
			throw new InvalidConfigurationException( "ditherProbability", "must be within [0, 1], was " + ditherProbability );
		if ( cacheCapacity < 1 )
			throw new InvalidConfigurationException( "cacheCapacity", "must be >= 1, was " + cacheCapacity );
		return this;
	}

	@Override
	public String toString()
	{
		return "MosaicParameters{" +
				"cellSize=" + cellSize +
				", sampleStatistic=" + sampleStatistic +
				", clipSigma=" + clipSigma +
				", clipIterations=" + clipIterations +
				", minPixelsPerCell=" + minPixelsPerCell +
				", minIntensity=" + minIntensity +
				", maxIntensity=" + maxIntensity +
				", limitSampleStarsPercent=" + limitSampleStarsPercent +
				", starRadiusGrowth=" + starRadiusGrowth +
				", maxSamples=" + maxSamples +
				", minJoinThickness=" + minJoinThickness +
				", rejectionSigma=" + rejectionSigma +
				", maxRejectionIterations=" + maxRejectionIterations +
				", minFitSamples=" + minFitSamples +
				", gradientAxis=" + gradientAxis +
				", gradientSections=" + gradientSections +
				", blendMode=" + blendMode +
				", ditherProbability=" + ditherProbability +
				", ditherSeed=" + ditherSeed +
				", truncate=" + truncate +
				", cacheCapacity=" + cacheCapacity +
				'}';
	}
}
