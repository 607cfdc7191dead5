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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.preibisch.mosaic.exception.DegenerateIntervalException;
import net.preibisch.mosaic.exception.InsufficientDataException;
import net.preibisch.mosaic.exception.MosaicException;

public class AkimaInterpolationTest
{
	@Test
	public void colinearKnotsHaveNoCurvature() throws MosaicException
	{
		final double[] x = { 0, 1, 2, 3, 4 };
		final double[] y = { 1, 4, 7, 10, 13 };
		final AkimaInterpolation akima = new AkimaInterpolation( x, y );

		for ( int i = 0; i < 4; ++i )
		{
			final double[] coefficients = akima.coefficients( i );
			assertEquals( 3, coefficients[ 1 ], 1e-12 );
			assertEquals( 0, coefficients[ 2 ], 1e-12 );
			assertEquals( 0, coefficients[ 3 ], 1e-12 );
		}

		// extrapolation continues the line
		assertEquals( -14, akima.evaluate( -5 ), 1e-9 );
		assertEquals( 31, akima.evaluate( 10 ), 1e-9 );
		assertEquals( 8.5, akima.evaluate( 2.5 ), 1e-12 );
	}

	@Test
	public void passesThroughTheKnots() throws MosaicException
	{
		final double[] x = { 0, 2, 3, 7, 8, 11, 15 };
		final double[] y = { 0.1, 0.4, -0.2, 0.0, 0.3, 0.3, -0.1 };
		final AkimaInterpolation akima = new AkimaInterpolation( x, y );

		for ( int i = 0; i < x.length; ++i )
			assertEquals( y[ i ], akima.evaluate( x[ i ] ), 1e-12 );
	}

	@Test
	public void continuousAtTheKnots() throws MosaicException
	{
		final double[] x = { 0, 2, 3, 7, 8, 11, 15 };
		final double[] y = { 0.1, 0.4, -0.2, 0.0, 0.3, 0.3, -0.1 };
		final AkimaInterpolation akima = new AkimaInterpolation( x, y );

		for ( int i = 1; i < x.length - 1; ++i )
			assertEquals( akima.polynomial( i - 1, x[ i ] ), akima.polynomial( i, x[ i ] ), 1e-12 );
	}

	@Test
	public void extrapolationUsesTheBoundaryCubic() throws MosaicException
	{
		final double[] x = { 0, 2, 3, 7, 8, 11, 15 };
		final double[] y = { 0.1, 0.4, -0.2, 0.0, 0.3, 0.3, -0.1 };
		final AkimaInterpolation akima = new AkimaInterpolation( x, y );

		assertEquals( 0, akima.interval( -3 ) );
		assertEquals( 5, akima.interval( 20 ) );
		assertEquals( akima.polynomial( 0, -3 ), akima.evaluate( -3 ), 0 );
		assertEquals( akima.polynomial( 5, 20 ), akima.evaluate( 20 ), 0 );
	}

	@Test
	public void binarySearch() throws MosaicException
	{
		final AkimaInterpolation akima = new AkimaInterpolation( new double[] { 0, 1, 2, 3, 4, 5 }, new double[ 6 ] );
		assertEquals( 0, akima.interval( 0 ) );
		assertEquals( 0, akima.interval( 0.5 ) );
		assertEquals( 2, akima.interval( 2 ) );
		assertEquals( 3, akima.interval( 3.999 ) );
		assertEquals( 4, akima.interval( 5 ) );
	}

	@Test( expected = InsufficientDataException.class )
	public void fourKnotsAreNotEnough() throws MosaicException
	{
		new AkimaInterpolation( new double[] { 0, 1, 2, 3 }, new double[] { 0, 1, 0, 1 } );
	}

	@Test
	public void coincidingKnots() throws MosaicException
	{
		try
		{
			new AkimaInterpolation( new double[] { 0, 1, 1, 2, 3 }, new double[] { 0, 1, 2, 3, 4 } );
			fail( "coinciding knots must be rejected" );
		}
		catch ( final DegenerateIntervalException e )
		{
			// expected
		}

		try
		{
			new AkimaInterpolation( new double[] { 0, 1, 0.5, 2, 3 }, new double[] { 0, 1, 2, 3, 4 } );
			fail( "knots out of order must be rejected" );
		}
		catch ( final DegenerateIntervalException e )
		{
			// expected
		}
	}

	@Test
	public void underflowingKnotSpan() throws MosaicException
	{
		// 1e-200 > 0, but its square underflows
		try
		{
			new AkimaInterpolation( new double[] { 0, 1e-200, 1, 2, 3 }, new double[] { 0, 1, 2, 3, 4 } );
			fail( "underflowing knot spans must be rejected" );
		}
		catch ( final DegenerateIntervalException e )
		{
			assertTrue( e.getMessage(), e.getMessage().contains( "knots 0 and 1" ) );
		}

		// still representable
		new AkimaInterpolation( new double[] { 0, 1e-6, 1, 2, 3 }, new double[] { 0, 1, 2, 3, 4 } );
	}

	@Test
	public void cornerBetweenTwoLines() throws MosaicException
	{
		// flat up to x = 2, slope 1 afterwards: equal neighbouring slopes on both sides of the corner
		final double[] x = { 0, 1, 2, 3, 4, 5, 6 };
		final double[] y = { 0, 0, 0, 1, 2, 3, 4 };
		final AkimaInterpolation akima = new AkimaInterpolation( x, y );

		for ( int i = 0; i < 6; ++i )
		{
			final double[] coefficients = akima.coefficients( i );
			assertEquals( i < 2 ? 0 : 1, coefficients[ 1 ], 1e-12 );
			assertEquals( 0, coefficients[ 2 ], 1e-12 );
			assertEquals( 0, coefficients[ 3 ], 1e-12 );
		}

		assertEquals( 0, akima.evaluate( 1.5 ), 1e-12 );
		assertEquals( 0.5, akima.evaluate( 2.5 ), 1e-12 );
		assertEquals( 0, akima.evaluate( -1 ), 1e-12 );
		assertEquals( 6, akima.evaluate( 8 ), 1e-12 );
	}
}
