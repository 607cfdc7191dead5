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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import net.imglib2.FinalInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.util.Intervals;
import net.preibisch.mosaic.process.SyntheticTiles;
import net.preibisch.mosaic.process.stars.Star;

public class SampleGridTest
{
	@Test
	public void boundingBoxOfMask()
	{
		final FinalInterval box = SampleGrid.boundingBox( SyntheticTiles.mask( 30, 20, 4, 7, 12, 15 ) );
		assertTrue( Intervals.equals( Intervals.createMinMax( 4, 7, 12, 15 ), box ) );
		assertNull( SampleGrid.boundingBox( ArrayImgs.unsignedBytes( 5, 5 ) ) );
	}

	@Test
	public void gridCoversTheBox()
	{
		final SampleGrid grid = new SampleGrid( Intervals.createMinMax( 10, 20, 34, 29 ), 10 );
		assertEquals( 3, grid.numColumns() );
		assertEquals( 1, grid.numRows() );
		assertEquals( 0, grid.xKey( 10 ) );
		assertEquals( 2, grid.xKey( 34 ) );
		assertTrue( Intervals.equals( Intervals.createMinMax( 30, 20, 34, 29 ), grid.cell( 2, 0 ) ) );
	}

	@Test
	public void starRemovesItsRowAndColumnWithinTheRadius()
	{
		final SampleGrid grid = new SampleGrid( Intervals.createMinMax( 0, 0, 49, 49 ), 10 );

		// radius sqrt(144)/2 = 6 around the center of cell (2, 2)
		final int removed = grid.removeCellsWithStars( Arrays.asList( new Star( 25, 25, 1, 144 ) ), 1.0 );

		assertEquals( 5, removed );
		assertTrue( grid.isRemoved( 2, 2 ) );
		assertTrue( grid.isRemoved( 1, 2 ) );
		assertTrue( grid.isRemoved( 3, 2 ) );
		assertTrue( grid.isRemoved( 2, 1 ) );
		assertTrue( grid.isRemoved( 2, 3 ) );
		// diagonal neighbours are 14.1 away, further than 6 + 5
		assertFalse( grid.isRemoved( 1, 1 ) );
		assertFalse( grid.isRemoved( 3, 3 ) );
	}

	@Test
	public void growthEnlargesTheStar()
	{
		final SampleGrid grid = new SampleGrid( Intervals.createMinMax( 0, 0, 49, 49 ), 10 );
		grid.removeCellsWithStars( Arrays.asList( new Star( 25, 25, 1, 144 ) ), 2.0 );

		// radius 12: diagonal neighbours at 14.1 < 12 + 5
		assertTrue( grid.isRemoved( 1, 1 ) );
		assertTrue( grid.isRemoved( 3, 3 ) );
		assertFalse( grid.isRemoved( 0, 0 ) );
	}
}
