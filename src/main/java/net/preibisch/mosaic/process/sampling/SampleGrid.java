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

import java.util.List;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.mosaic.process.stars.Star;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regular grid of square cells laid over the bounding box of the overlap.
 * <p>
 * Cells are addressed by their column ({@code xKey}) and row ({@code yKey}),
 * counted from the top left cell. Cells at the right and bottom edge are
 * clipped to the bounding box. Cells can be removed, for example because a
 * star covers them.
 */
public class SampleGrid
{
	private static final Logger LOG = LoggerFactory.getLogger( SampleGrid.class );

	private final FinalInterval box;

	private final int cellSize;

	private final int numColumns;

	private final int numRows;

	private final boolean[] removed;

	public SampleGrid( final Interval box, final int cellSize )
	{
		if ( cellSize <= 0 )
			throw new IllegalArgumentException( "cellSize must be > 0" );

		this.box = new FinalInterval( new long[] { box.min( 0 ), box.min( 1 ) }, new long[] { box.max( 0 ), box.max( 1 ) } );
		this.cellSize = cellSize;
		this.numColumns = ( int ) ( ( box.dimension( 0 ) + cellSize - 1 ) / cellSize );
		this.numRows = ( int ) ( ( box.dimension( 1 ) + cellSize - 1 ) / cellSize );
		this.removed = new boolean[ numColumns * numRows ];
	}

	/**
	 * @return the bounding box of all non-zero mask pixels, or {@code null} if there are none
	 */
	public static FinalInterval boundingBox( final RandomAccessibleInterval< UnsignedByteType > mask )
	{
		final long[] min = new long[] { Long.MAX_VALUE, Long.MAX_VALUE };
		final long[] max = new long[] { Long.MIN_VALUE, Long.MIN_VALUE };
		boolean any = false;

		final Cursor< UnsignedByteType > c = Views.flatIterable( mask ).localizingCursor();
		while ( c.hasNext() )
		{
			if ( c.next().get() == 0 )
				continue;

			any = true;
			for ( int d = 0; d < 2; ++d )
			{
				final long p = c.getLongPosition( d );
				if ( p < min[ d ] )
					min[ d ] = p;
				if ( p > max[ d ] )
					max[ d ] = p;
			}
		}

		return any ? new FinalInterval( min, max ) : null;
	}

	public Interval getBox() { return box; }

	public int getCellSize() { return cellSize; }

	public int numColumns() { return numColumns; }

	public int numRows() { return numRows; }

	public int numCells() { return numColumns * numRows; }

	/**
	 * @param x any x coordinate within a cell, including its left edge
	 * @return column of the cell (may be outside the grid)
	 */
	public int xKey( final double x )
	{
		return ( int ) Math.floor( ( x - box.min( 0 ) ) / cellSize );
	}

	/**
	 * @param y any y coordinate within a cell, including its top edge
	 * @return row of the cell (may be outside the grid)
	 */
	public int yKey( final double y )
	{
		return ( int ) Math.floor( ( y - box.min( 1 ) ) / cellSize );
	}

	public boolean contains( final int xKey, final int yKey )
	{
		return xKey >= 0 && xKey < numColumns && yKey >= 0 && yKey < numRows;
	}

	/**
	 * @return the pixel bounds of a cell, clipped to the bounding box
	 */
	public FinalInterval cell( final int xKey, final int yKey )
	{
		final long x0 = box.min( 0 ) + ( long ) xKey * cellSize;
		final long y0 = box.min( 1 ) + ( long ) yKey * cellSize;
		return Intervals.createMinMax(
				x0, y0,
				Math.min( box.max( 0 ), x0 + cellSize - 1 ),
				Math.min( box.max( 1 ), y0 + cellSize - 1 ) );
	}

	/**
	 * @return center of the unclipped cell
	 */
	public double[] center( final int xKey, final int yKey )
	{
		return new double[] {
				box.min( 0 ) + ( double ) xKey * cellSize + cellSize / 2.0,
				box.min( 1 ) + ( double ) yKey * cellSize + cellSize / 2.0 };
	}

	public boolean isRemoved( final int xKey, final int yKey )
	{
		return removed[ yKey * numColumns + xKey ];
	}

	public void remove( final int xKey, final int yKey )
	{
		if ( contains( xKey, yKey ) )
			removed[ yKey * numColumns + xKey ] = true;
	}

	/**
	 * Remove all cells fully or partially covered by a star. A cell is removed if
	 * it is in the star's row or column within the star radius, or if the
	 * distance from star center to cell center is less than
	 * {@code radius + cellSize/2}. This lets a star clip a cell corner, which
	 * does not significantly affect the cell's median.
	 *
	 * @param stars stars to exclude
	 * @param radiusGrowth multiplier applied to each star's radius
	 * @return number of cells removed
	 */
	public int removeCellsWithStars( final List< Star > stars, final double radiusGrowth )
	{
		int numRemoved = 0;
		for ( final Star star : stars )
		{
			final double radius = star.radius() * radiusGrowth;
			final double starToCenter = radius + cellSize / 2.0;
			final int starXKey = xKey( star.getX() );
			final int starYKey = yKey( star.getY() );
			final int minXKey = Math.max( 0, xKey( star.getX() - radius ) );
			final int maxXKey = Math.min( numColumns - 1, xKey( star.getX() + radius ) );
			final int minYKey = Math.max( 0, yKey( star.getY() - radius ) );
			final int maxYKey = Math.min( numRows - 1, yKey( star.getY() + radius ) );

			for ( int yk = minYKey; yk <= maxYKey; ++yk )
			{
				for ( int xk = minXKey; xk <= maxXKey; ++xk )
				{
					if ( isRemoved( xk, yk ) )
						continue;

					boolean remove = xk == starXKey || yk == starYKey;
					if ( !remove )
					{
						final double[] c = center( xk, yk );
						final double dx = c[ 0 ] - star.getX();
						final double dy = c[ 1 ] - star.getY();
						remove = Math.sqrt( dx * dx + dy * dy ) < starToCenter;
					}

					if ( remove )
					{
						remove( xk, yk );
						++numRemoved;
					}
				}
			}
		}

		LOG.debug( "{} stars removed {} of {} cells", stars.size(), numRemoved, numCells() );
		return numRemoved;
	}
}
