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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import net.imglib2.FinalInterval;
import net.imglib2.util.Intervals;
import net.preibisch.mosaic.exception.InsufficientDataException;
import net.preibisch.mosaic.exception.MosaicException;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.sampling.SamplePair;

public class GradientModelerTest
{
	private interface Residual
	{
		double at( double x, double y );
	}

	/**
	 * Samples on a grid of 10x10 cells, target 0.2, reference 0.2 + residual.
	 */
	private static List< SamplePair > samples( final int columns, final int rows, final Residual residual )
	{
		final List< SamplePair > samples = new ArrayList<>();
		for ( int r = 0; r < rows; ++r )
			for ( int c = 0; c < columns; ++c )
			{
				final double x = c * 10 + 4.5;
				final double y = r * 10 + 4.5;
				samples.add( new SamplePair(
						Intervals.createMinMax( c * 10, r * 10, c * 10 + 9, r * 10 + 9 ),
						x, y,
						new double[] { 0.2 + residual.at( x, y ) },
						new double[] { 0.2 },
						new int[] { 100 },
						new boolean[] { true },
						1 ) );
			}
		return samples;
	}

	private static LinearFit identity( final int n )
	{
		return LinearFit.offsetOnly( 0, 0, n, "test" );
	}

	@Test
	public void noneIsZero() throws MosaicException
	{
		final List< SamplePair > samples = samples( 10, 1, ( x, y ) -> 0.01 * x );
		final GradientSurface surface = new GradientModeler( GradientAxis.NONE, 0 ).model( samples, 0, identity( 10 ), Intervals.createMinMax( 0, 0, 99, 9 ) );
		assertTrue( surface.isZero() );
		assertEquals( 0, surface.evaluate( 50, 5 ), 0 );
	}

	@Test
	public void linearRampAlongTheJoin() throws MosaicException
	{
		final List< SamplePair > samples = samples( 10, 2, ( x, y ) -> 0.001 * x );
		final FinalInterval overlap = Intervals.createMinMax( 0, 0, 99, 19 );

		final GradientSurface surface = new GradientModeler( GradientAxis.AUTO, 0 ).model( samples, 0, identity( 20 ), overlap );

		assertNotNull( surface.getCurve( 0 ) );
		assertNull( surface.getCurve( 1 ) );
		assertEquals( 10, surface.getCurve( 0 ).numKnots() );
		assertEquals( 0.05, surface.evaluate( 50, 0 ), 1e-6 );
		// extrapolated over the whole tile
		assertEquals( 0.3, surface.evaluate( 300, 500 ), 1e-6 );
		assertEquals( -0.1, surface.evaluate( -100, 0 ), 1e-6 );
	}

	@Test
	public void autoFollowsTheLongerSide() throws MosaicException
	{
		final List< SamplePair > samples = samples( 2, 10, ( x, y ) -> 0.001 * y );
		final GradientSurface surface = new GradientModeler( GradientAxis.AUTO, 0 ).model( samples, 0, identity( 20 ), Intervals.createMinMax( 0, 0, 19, 99 ) );

		assertNull( surface.getCurve( 0 ) );
		assertEquals( 0.05, surface.evaluate( 0, 50 ), 1e-6 );
	}

	@Test
	public void separableSurface() throws MosaicException
	{
		final List< SamplePair > samples = samples( 10, 6, ( x, y ) -> 0.001 * x + 0.002 * y );
		final GradientSurface surface = new GradientModeler( GradientAxis.XY, 0 ).model( samples, 0, identity( 60 ), Intervals.createMinMax( 0, 0, 99, 59 ) );

		assertNotNull( surface.getCurve( 0 ) );
		assertNotNull( surface.getCurve( 1 ) );
		assertEquals( 0.001 * 33 + 0.002 * 21, surface.evaluate( 33, 21 ), 1e-6 );
		assertEquals( 0.001 * 150 + 0.002 * 80, surface.evaluate( 150, 80 ), 1e-6 );
	}

	@Test
	public void onlyInliersContribute() throws MosaicException
	{
		final List< SamplePair > samples = samples( 10, 1, ( x, y ) -> x == 44.5 ? 5 : 0.001 * x );
		final int[] inliers = { 0, 1, 2, 3, 5, 6, 7, 8, 9 };
		final LinearFit fit = LinearFit.valid( 1, 0, 0, inliers, new int[] { 4 } );

		final GradientSurface surface = new GradientModeler( GradientAxis.X, 0 ).model( samples, 0, fit, Intervals.createMinMax( 0, 0, 99, 9 ) );

		assertEquals( 9, surface.getCurve( 0 ).numKnots() );
		assertEquals( 0.0445, surface.evaluate( 44.5, 0 ), 1e-6 );
	}

	@Test( expected = InsufficientDataException.class )
	public void tooFewDistinctPositions() throws MosaicException
	{
		final List< SamplePair > samples = samples( 4, 3, ( x, y ) -> 0.001 * x );
		new GradientModeler( GradientAxis.X, 0 ).model( samples, 0, identity( 12 ), Intervals.createMinMax( 0, 0, 39, 29 ) );
	}

	@Test
	public void equalPositionsAreMerged()
	{
		final double[][] knots = GradientModeler.mergeEqualPositions(
				new double[] { 3, 1, 3, 2 },
				new double[] { 1, 5, 4, 7 },
				new double[] { 1, 1, 2, 1 } );

		assertArrayEquals( new double[] { 1, 2, 3 }, knots[ 0 ], 0 );
		assertArrayEquals( new double[] { 5, 7, 3 }, knots[ 1 ], 1e-12 );
		assertArrayEquals( new double[] { 1, 1, 3 }, knots[ 2 ], 0 );
	}

	@Test
	public void sectionsAverageTheKnots() throws MosaicException
	{
		final double[] positions = new double[ 21 ];
		final double[] values = new double[ 21 ];
		final double[] weights = new double[ 21 ];
		for ( int i = 0; i < 21; ++i )
		{
			positions[ i ] = i;
			values[ i ] = i % 2 == 0 ? 1 : -1;
			weights[ i ] = 1;
		}

		final GradientCurve raw = new GradientModeler( GradientAxis.X, 0 ).curve( 0, positions, values, weights );
		final GradientCurve smooth = new GradientModeler( GradientAxis.X, 5 ).curve( 0, positions, values, weights );

		assertEquals( 21, raw.numKnots() );
		assertEquals( 5, smooth.numKnots() );
		for ( final double v : smooth.getValues() )
			assertTrue( Math.abs( v ) < 0.5 );
	}
}
