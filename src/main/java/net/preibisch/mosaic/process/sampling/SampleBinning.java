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
package net.preibisch.mosaic.process.sampling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import net.imglib2.Interval;
import net.imglib2.util.Intervals;
import net.preibisch.mosaic.process.gradient.GradientAxis;

/**
 * Merges neighbouring samples into super-samples when there are too many of
 * them. Binning along the join and across it may differ, so that the join does
 * not become thinner than {@code minJoinThickness} samples.
 */
public class SampleBinning
{
	private SampleBinning() {}

	/**
	 * @param samples samples of one grid, all with weight 1
	 * @param box bounding box of the overlap
	 * @param cellSize grid cell size
	 * @param maxSamples try to reduce the number of samples below this
	 * @param minJoinThickness limit binning across the join if the join would become thinner than this
	 */
	public static List< SamplePair > limit(
			final List< SamplePair > samples,
			final Interval box,
			final int cellSize,
			final int maxSamples,
			final int minJoinThickness )
	{
		if ( maxSamples <= 0 || samples.size() <= maxSamples )
			return samples;

		List< SamplePair > binned = bin( samples, box, cellSize, factors( samples, box, cellSize, maxSamples, minJoinThickness ) );
		if ( binned.size() > maxSamples )
		{
			// happens when many grid cells were rejected, e.g. by stars
			final double limit = ( double ) maxSamples * maxSamples / binned.size();
			binned = bin( samples, box, cellSize, factors( samples, box, cellSize, limit, minJoinThickness ) );
		}
		return binned;
	}

	/**
	 * @return binning factors {x, y}
	 */
	static int[] factors(
			final List< SamplePair > samples,
			final Interval box,
			final int cellSize,
			final double maxSamples,
			final int minJoinThickness )
	{
		final int joinDim = GradientAxis.joinDimension( box );
		final int thickness = thickness( samples, cellSize, 1 - joinDim );
		final double factor = samples.size() / maxSamples;

		final int join;
		final int perp;
		if ( factor > 16 )
		{
			join = ( int ) Math.ceil( Math.sqrt( factor ) );
			perp = join;
		}
		else if ( factor > 9 )
		{
			if ( thickness >= minJoinThickness * 4 ) { join = 4; perp = 4; }
			else if ( thickness >= minJoinThickness * 3 ) { join = 5; perp = 3; }
			else if ( thickness >= minJoinThickness * 2 ) { join = 8; perp = 2; }
			else { join = 16; perp = 1; }
		}
		else if ( factor > 4 )
		{
			if ( thickness >= minJoinThickness * 3 ) { join = 3; perp = 3; }
			else if ( thickness >= minJoinThickness * 2 ) { join = 4; perp = 2; }
			else { join = 8; perp = 1; }
		}
		else if ( factor > 2 )
		{
			if ( thickness >= minJoinThickness * 2 ) { join = 2; perp = 2; }
			else { join = 4; perp = 1; }
		}
		else
		{
			if ( thickness >= minJoinThickness * 2 ) { join = 1; perp = 2; }
			else { join = 2; perp = 1; }
		}

		return joinDim == 0 ? new int[] { join, perp } : new int[] { perp, join };
	}

	/**
	 * Number of grid rows (or columns) that samples occupy across the join.
	 */
	static int thickness( final List< SamplePair > samples, final int cellSize, final int d )
	{
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for ( final SamplePair s : samples )
		{
			min = Math.min( min, s.getBounds().min( d ) );
			max = Math.max( max, s.getBounds().min( d ) );
		}
		return samples.isEmpty() ? 0 : ( int ) Math.floor( ( max - min ) / cellSize ) + 1;
	}

	static List< SamplePair > bin( final List< SamplePair > samples, final Interval box, final int cellSize, final int[] factors )
	{
		final long binWidth = ( long ) cellSize * factors[ 0 ];
		final long binHeight = ( long ) cellSize * factors[ 1 ];
		final long numColumns = box.dimension( 0 ) / binWidth + 1;

		final Map< Long, List< SamplePair > > bins = new LinkedHashMap<>();
		for ( final SamplePair s : samples )
		{
			final long bx = ( long ) Math.floor( ( s.getX() - box.min( 0 ) ) / binWidth );
			final long by = ( long ) Math.floor( ( s.getY() - box.min( 1 ) ) / binHeight );
			bins.computeIfAbsent( by * numColumns + bx, k -> new ArrayList<>() ).add( s );
		}

		final List< SamplePair > binned = new ArrayList<>( bins.size() );
		for ( final List< SamplePair > inside : bins.values() )
			binned.add( merge( inside ) );
		return binned;
	}

	/**
	 * Center of mass of the merged centers, weighted mean of the per channel
	 * values over the merged samples that are valid for that channel.
	 */
	static SamplePair merge( final List< SamplePair > inside )
	{
		final int numChannels = inside.get( 0 ).numChannels();
		final double[] reference = new double[ numChannels ];
		final double[] target = new double[ numChannels ];
		final int[] count = new int[ numChannels ];
		final boolean[] valid = new boolean[ numChannels ];
		final double[] channelWeight = new double[ numChannels ];

		int weight = 0;
		double x = 0;
		double y = 0;
		Interval bounds = inside.get( 0 ).getBounds();
		for ( final SamplePair s : inside )
		{
			final int w = s.getWeight();
			weight += w;
			x += w * s.getX();
			y += w * s.getY();
			bounds = Intervals.union( bounds, s.getBounds() );
			for ( int c = 0; c < numChannels; ++c )
			{
				if ( !s.isValid( c ) )
					continue;
				valid[ c ] = true;
				reference[ c ] += w * s.getReference( c );
				target[ c ] += w * s.getTarget( c );
				count[ c ] += s.getCount( c );
				channelWeight[ c ] += w;
			}
		}

		for ( int c = 0; c < numChannels; ++c )
		{
			if ( valid[ c ] )
			{
				reference[ c ] /= channelWeight[ c ];
				target[ c ] /= channelWeight[ c ];
			}
			else
			{
				reference[ c ] = Double.NaN;
				target[ c ] = Double.NaN;
			}
		}

		return new SamplePair( bounds, x / weight, y / weight, reference, target, count, valid, weight );
	}
}
