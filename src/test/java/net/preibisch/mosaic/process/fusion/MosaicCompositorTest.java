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
package net.preibisch.mosaic.process.fusion;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.mosaic.exception.MosaicException;
import net.preibisch.mosaic.process.SyntheticTiles;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.gradient.GradientCurve;
import net.preibisch.mosaic.process.gradient.GradientSurface;

public class MosaicCompositorTest
{
	private static LinearFit linear( final double scale, final double offset )
	{
		return LinearFit.valid( scale, offset, 0, new int[ 0 ], new int[ 0 ] );
	}

	private static List< GradientSurface > zero( final int channels )
	{
		return Collections.nCopies( channels, GradientSurface.zero() );
	}

	/**
	 * Reference has data in rows 0..19, target in rows 10..29, overlap rows 10..19.
	 */
	private static final Img< FloatType > reference = SyntheticTiles.image( 40, 30, 1, ( x, y, c ) -> y < 20 ? 0.6 : 0 );

	private static final Img< FloatType > target = SyntheticTiles.image( 40, 30, 1, ( x, y, c ) -> y >= 10 ? 0.2 : 0 );

	private static final Img< UnsignedByteType > mask = SyntheticTiles.mask( 40, 30, 0, 10, 39, 19 );

	private static Img< FloatType > composite( final BlendMode mode, final double probability, final long seed ) throws MosaicException
	{
		// corrected target 2 * 0.2 + 0 = 0.4
		return new MosaicCompositor( mode, probability, seed, false )
				.composite( reference, target, mask, Arrays.asList( linear( 2, 0 ) ), zero( 1 ) )
				.getImage();
	}

	@Test
	public void identityCorrectionReproducesTheTarget() throws MosaicException
	{
		final Img< FloatType > tgt = SyntheticTiles.image( 30, 20, 3, ( x, y, c ) -> 0.01 + ( x * 7 + y * 13 + c * 3 ) % 97 / 100.0 );
		final Img< FloatType > ref = SyntheticTiles.constant( 30, 20, 3, 0.5 );

		final Img< FloatType > out = new MosaicCompositor( BlendMode.TARGET_PRIORITY, 0.5, 1, false )
				.composite( ref, tgt, SyntheticTiles.mask( 30, 20, 10, 0, 29, 19 ), Collections.nCopies( 3, LinearFit.identity() ), zero( 3 ) )
				.getImage();

		final Cursor< FloatType > a = out.cursor();
		final Cursor< FloatType > b = tgt.cursor();
		while ( a.hasNext() )
			assertEquals( b.next().get(), a.next().get(), 0 );
	}

	@Test
	public void referencePriority() throws MosaicException
	{
		final Img< FloatType > out = composite( BlendMode.REFERENCE_PRIORITY, 0.5, 1 );
		assertEquals( 0.6, SyntheticTiles.get( out, 5, 5, 0 ), 1e-6 );
		assertEquals( 0.6, SyntheticTiles.get( out, 5, 15, 0 ), 1e-6 );
		assertEquals( 0.4, SyntheticTiles.get( out, 5, 25, 0 ), 1e-6 );
	}

	@Test
	public void targetPriority() throws MosaicException
	{
		final Img< FloatType > out = composite( BlendMode.TARGET_PRIORITY, 0.5, 1 );
		assertEquals( 0.6, SyntheticTiles.get( out, 5, 5, 0 ), 1e-6 );
		assertEquals( 0.4, SyntheticTiles.get( out, 5, 15, 0 ), 1e-6 );
		assertEquals( 0.4, SyntheticTiles.get( out, 5, 25, 0 ), 1e-6 );
	}

	@Test
	public void weightedAverageTapersFromReferenceToTarget() throws MosaicException
	{
		final Img< FloatType > out = composite( BlendMode.WEIGHTED_AVERAGE, 0.5, 1 );

		assertEquals( 0.6, SyntheticTiles.get( out, 5, 10, 0 ), 1e-6 );
		assertEquals( 0.4, SyntheticTiles.get( out, 5, 19, 0 ), 1e-6 );

		double last = Double.POSITIVE_INFINITY;
		for ( int y = 10; y <= 19; ++y )
		{
			final double v = SyntheticTiles.get( out, 17, y, 0 );
			assertTrue( v <= last );
			assertTrue( v >= 0.4 - 1e-6 && v <= 0.6 + 1e-6 );
			// constant along the join
			assertEquals( v, SyntheticTiles.get( out, 0, y, 0 ), 0 );
			last = v;
		}
	}

	@Test
	public void weightedAverageFollowsTheTileOrder() throws MosaicException
	{
		// swap the tiles: the reference is now below the target
		final Img< FloatType > ref = SyntheticTiles.image( 40, 30, 1, ( x, y, c ) -> y >= 10 ? 0.6 : 0 );
		final Img< FloatType > tgt = SyntheticTiles.image( 40, 30, 1, ( x, y, c ) -> y < 20 ? 0.2 : 0 );

		final Img< FloatType > out = new MosaicCompositor( BlendMode.WEIGHTED_AVERAGE, 0.5, 1, false )
				.composite( ref, tgt, mask, Arrays.asList( linear( 2, 0 ) ), zero( 1 ) )
				.getImage();

		assertEquals( 0.4, SyntheticTiles.get( out, 5, 10, 0 ), 1e-6 );
		assertEquals( 0.6, SyntheticTiles.get( out, 5, 19, 0 ), 1e-6 );
	}

	@Test
	public void randomDitherIsReproducible() throws MosaicException
	{
		final Img< FloatType > a = composite( BlendMode.RANDOM_DITHER, 0.5, 99 );
		final Img< FloatType > b = composite( BlendMode.RANDOM_DITHER, 0.5, 99 );

		int fromReference = 0, fromTarget = 0;
		final Cursor< FloatType > ca = a.localizingCursor();
		final Cursor< FloatType > cb = b.cursor();
		while ( ca.hasNext() )
		{
			final float v = ca.next().get();
			assertEquals( v, cb.next().get(), 0 );

			final int y = ca.getIntPosition( 1 );
			if ( y >= 10 && y <= 19 )
			{
				if ( Math.abs( v - 0.6 ) < 1e-6 )
					++fromReference;
				else if ( Math.abs( v - 0.4 ) < 1e-6 )
					++fromTarget;
				else
					fail( "dithered pixel " + v + " is from neither tile" );
			}
		}
		assertEquals( 400, fromReference + fromTarget );
		assertTrue( fromReference > 100 );
		assertTrue( fromTarget > 100 );
	}

	@Test
	public void ditherProbabilityExtremes() throws MosaicException
	{
		assertEquals( 0.6, SyntheticTiles.get( composite( BlendMode.RANDOM_DITHER, 0, 1 ), 3, 12, 0 ), 1e-6 );
		assertEquals( 0.4, SyntheticTiles.get( composite( BlendMode.RANDOM_DITHER, 1, 1 ), 3, 12, 0 ), 1e-6 );
	}

	@Test
	public void gradientIsApplied() throws Exception
	{
		final GradientCurve curve = new GradientCurve(
				1, new double[] { 0, 10, 20, 30, 40 }, new double[] { 0, 0.01, 0.02, 0.03, 0.04 } );

		final Img< FloatType > out = new MosaicCompositor( BlendMode.TARGET_PRIORITY, 0.5, 1, false )
				.composite( reference, target, mask, Arrays.asList( linear( 2, 0 ) ), Arrays.asList( GradientSurface.of( curve ) ) )
				.getImage();

		assertEquals( 0.4 + 0.025, SyntheticTiles.get( out, 3, 25, 0 ), 1e-6 );
		// no target data: reference unchanged
		assertEquals( 0.6, SyntheticTiles.get( out, 3, 5, 0 ), 1e-6 );
	}

	@Test
	public void inputsAreNotModified() throws MosaicException
	{
		composite( BlendMode.WEIGHTED_AVERAGE, 0.5, 1 );
		assertEquals( 0.2, SyntheticTiles.get( target, 5, 15, 0 ), 1e-6 );
		assertEquals( 0.6, SyntheticTiles.get( reference, 5, 15, 0 ), 1e-6 );
	}

	@Test
	public void invalidFitIsRefused()
	{
		final Img< FloatType > tile = SyntheticTiles.constant( 10, 10, 2, 0.5 );
		try
		{
			new MosaicCompositor( BlendMode.WEIGHTED_AVERAGE, 0.5, 1, false ).composite(
					tile, tile, SyntheticTiles.full( 10, 10 ),
					Arrays.asList( linear( 1, 0 ), LinearFit.invalid( "no samples" ) ), zero( 2 ) );
			fail( "an invalid fit must not be applied" );
		}
		catch ( final MosaicException e )
		{
			assertEquals( 1, e.getChannel() );
			assertEquals( "composite", e.getStage() );
		}
	}

	@Test
	public void truncation() throws MosaicException
	{
		final Img< FloatType > tile = SyntheticTiles.constant( 10, 10, 1, 0.9 );

		final MosaicCompositor.Composite clamped = new MosaicCompositor( BlendMode.TARGET_PRIORITY, 0.5, 1, true )
				.composite( tile, tile, SyntheticTiles.full( 10, 10 ), Arrays.asList( linear( 2, 0 ) ), zero( 1 ) );

		assertTrue( clamped.isTruncated() );
		assertEquals( 1.0, SyntheticTiles.get( clamped.getImage(), 4, 4, 0 ), 0 );
		assertEquals( 1.8, clamped.getMax( 0 ), 1e-6 );

		final MosaicCompositor.Composite raw = new MosaicCompositor( BlendMode.TARGET_PRIORITY, 0.5, 1, false )
				.composite( tile, tile, SyntheticTiles.full( 10, 10 ), Arrays.asList( linear( 2, 0 ) ), zero( 1 ) );

		assertFalse( raw.isTruncated() );
		assertEquals( 1.8, SyntheticTiles.get( raw.getImage(), 4, 4, 0 ), 1e-6 );
	}
}
