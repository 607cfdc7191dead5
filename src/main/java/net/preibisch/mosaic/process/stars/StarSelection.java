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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class StarSelection
{
	private StarSelection() {}

	/**
	 * @param stars detected stars, any order
	 * @param percent how many of the brightest stars to keep, 0..100
	 * @return the brightest {@code floor(n * percent / 100)} stars, brightest first
	 */
	public static List< Star > brightest( final List< Star > stars, final double percent )
	{
		final List< Star > sorted = new ArrayList<>( stars );
		sorted.sort( Comparator.comparingDouble( Star::getFlux ).reversed() );

		if ( percent >= 100 )
			return sorted;

		final int n = ( int ) Math.floor( sorted.size() * percent / 100 );
		return new ArrayList<>( sorted.subList( 0, n ) );
	}
}
