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
package net.preibisch.mosaic.process.gradient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import net.imglib2.Interval;
import net.preibisch.mosaic.exception.DegenerateIntervalException;
import net.preibisch.mosaic.exception.InsufficientDataException;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.sampling.SamplePair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Models what is left after the linear fit, {@code reference - (scale * target + offset)}
 * at every accepted sample, as a smooth {@link GradientSurface}.
 * <p>
 * Residuals are projected onto the gradient axis; samples that share a
 * projected position (a grid column) are merged into their weighted mean, and
 * optionally into {@code sections} equal-width sections, before an Akima curve
 * is fitted through them. For {@link GradientAxis#XY} the curve along the join
 * is subtracted and the remainder is modelled across the join.
 */
public class GradientModeler
{
	private static final Logger LOG = LoggerFactory.getLogger( GradientModeler.class );

	private final GradientAxis axis;

	private final int sections;

	public GradientModeler( final GradientAxis axis, final int sections )
	{
		this.axis = axis;
		this.sections = sections;
	}

	/**
	 * @param samples samples of one channel, indexed as in {@code fit}
	 * @param channel the channel
	 * @param fit linear fit of these samples
	 * @param overlap bounding box of the overlap, decides the join direction
	 */
	public GradientSurface model(
			final List< SamplePair > samples,
			final int channel,
			final LinearFit fit,
			final Interval overlap ) throws InsufficientDataException, DegenerateIntervalException
	{
		if ( axis == GradientAxis.NONE )
			return GradientSurface.zero();

		if ( !fit.isValid() )
			throw new IllegalArgumentException( "cannot model the gradient of an invalid fit: " + fit );

		final int[] inliers = fit.getInliers();
		final int n = inliers.length;
		final double[] x = new double[ n ];
		final double[] y = new double[ n ];
		final double[] residual = new double[ n ];
		final double[] weight = new double[ n ];
		for ( int i = 0; i < n; ++i )
		{
			final SamplePair s = samples.get( inliers[ i ] );
			x[ i ] = s.getX();
			y[ i ] = s.getY();
			residual[ i ] = s.getReference( channel ) - fit.apply( s.getTarget( channel ) );
			weight[ i ] = s.getWeight();
		}

		switch ( axis )
		{
		case X:
			return GradientSurface.of( curve( 0, x, residual, weight ) );
		case Y:
			return GradientSurface.of( curve( 1, y, residual, weight ) );
		case AUTO:
		{
			final int d = GradientAxis.joinDimension( overlap );
			return GradientSurface.of( curve( d, d == 0 ? x : y, residual, weight ) );
		}
		case XY:
		default:
		{
			final int d = GradientAxis.joinDimension( overlap );
			final double[] along = d == 0 ? x : y;
			final double[] across = d == 0 ? y : x;
			final GradientCurve first = curve( d, along, residual, weight );

			final double[] remainder = new double[ n ];
			for ( int i = 0; i < n; ++i )
				remainder[ i ] = residual[ i ] - first.evaluate( along[ i ] );

			final GradientCurve second = curve( 1 - d, across, remainder, weight );
			return GradientSurface.separable( first, second );
		}
		}
	}

	/**
	 * Fit an Akima curve through residuals projected onto dimension {@code d}.
	 */
	public GradientCurve curve( final int d, final double[] positions, final double[] values, final double[] weights ) throws InsufficientDataException, DegenerateIntervalException
	{
		double[][] knots = mergeEqualPositions( positions, values, weights );
		if ( sections > 0 )
			knots = sections( knots, sections );

		LOG.debug( "{} residuals -> {} knots along {}", positions.length, knots[ 0 ].length, d == 0 ? "x" : "y" );

		if ( knots[ 0 ].length < AkimaInterpolation.MIN_NUM_KNOTS )
			throw new InsufficientDataException( "only " + knots[ 0 ].length + " distinct sample positions along " + ( d == 0 ? "x" : "y" ) +
					", at least " + AkimaInterpolation.MIN_NUM_KNOTS + " required for the gradient curve" );

		return new GradientCurve( d, knots[ 0 ], knots[ 1 ] );
	}

	/**
	 * Sort by position and replace samples with equal position by their weighted mean.
	 *
	 * @return {positions, values, weights}
	 */
	static double[][] mergeEqualPositions( final double[] positions, final double[] values, final double[] weights )
	{
		final Integer[] order = new Integer[ positions.length ];
		Arrays.setAll( order, i -> i );
		Arrays.sort( order, Comparator.comparingDouble( i -> positions[ i ] ) );

		final List< double[] > merged = new ArrayList<>();
		double position = Double.NaN;
		double sum = 0;
		double weight = 0;
		for ( final int i : order )
		{
			if ( positions[ i ] != position && weight > 0 )
			{
				merged.add( new double[] { position, sum / weight, weight } );
				sum = 0;
				weight = 0;
			}
			position = positions[ i ];
			sum += weights[ i ] * values[ i ];
			weight += weights[ i ];
		}
		if ( weight > 0 )
			merged.add( new double[] { position, sum / weight, weight } );

		return transpose( merged );
	}

	/**
	 * Average sorted knots into {@code n} equal-width sections between the first
	 * and last position. Empty sections are skipped.
	 *
	 * @return {positions, values, weights}
	 */
	static double[][] sections( final double[][] knots, final int n )
	{
		final double[] p = knots[ 0 ];
		final double[] v = knots[ 1 ];
		final double[] w = knots[ 2 ];
		if ( p.length == 0 )
			return knots;

		final double min = p[ 0 ];
		final double width = ( p[ p.length - 1 ] - min ) / n;
		if ( !( width > 0 ) )
			return knots;

		final double[] sumP = new double[ n ];
		final double[] sumV = new double[ n ];
		final double[] sumW = new double[ n ];
		for ( int i = 0; i < p.length; ++i )
		{
			final int s = Math.min( n - 1, ( int ) ( ( p[ i ] - min ) / width ) );
			sumP[ s ] += w[ i ] * p[ i ];
			sumV[ s ] += w[ i ] * v[ i ];
			sumW[ s ] += w[ i ];
		}

		final List< double[] > averaged = new ArrayList<>();
		for ( int s = 0; s < n; ++s )
			if ( sumW[ s ] > 0 )
				averaged.add( new double[] { sumP[ s ] / sumW[ s ], sumV[ s ] / sumW[ s ], sumW[ s ] } );

		return transpose( averaged );
	}

	private static double[][] transpose( final List< double[] > rows )
	{
		final double[][] t = new double[ 3 ][ rows.size() ];
		for ( int i = 0; i < rows.size(); ++i )
			for ( int j = 0; j < 3; ++j )
				t[ j ][ i ] = rows.get( i )[ j ];
		return t;
	}
}
