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
package net.preibisch.mosaic.process.stars;

import java.util.Objects;

/**
 * A star as reported by an external star detector: centroid, flux and the
 * number of pixels it covers.
 */
public class Star
{
	private final double x;

	private final double y;

	private final double flux;

	private final double size;

	public Star( final double x, final double y, final double flux, final double size )
	{
		this.x = x;
		this.y = y;
		this.flux = flux;
		this.size = size;
	}

	public double getX() { return x; }

	public double getY() { return y; }

	public double getFlux() { return flux; }

	public double getSize() { return size; }

	/**
	 * Radius of the disc covered by the star, {@code sqrt(size)/2}.
	 */
	public double radius()
	{
		return Math.sqrt( Math.max( 0, size ) ) / 2;
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;
		if ( !( o instanceof Star ) )
			return false;
		final Star star = ( Star ) o;
		return Double.compare( star.x, x ) == 0 &&
				Double.compare( star.y, y ) == 0 &&
				Double.compare( star.flux, flux ) == 0 &&
				Double.compare( star.size, size ) == 0;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash( x, y, flux, size );
	}

	@Override
	public String toString()
	{
		return "Star{x=" + x + ", y=" + y + ", flux=" + flux + ", size=" + size + '}';
	}
}
