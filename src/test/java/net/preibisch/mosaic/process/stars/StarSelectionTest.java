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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class StarSelectionTest
{
	private static final List< Star > stars = Arrays.asList(
			new Star( 0, 0, 5, 4 ),
			new Star( 1, 1, 50, 4 ),
			new Star( 2, 2, 20, 4 ),
			new Star( 3, 3, 1, 4 ) );

	@Test
	public void brightestFirst()
	{
		final List< Star > all = StarSelection.brightest( stars, 100 );
		assertEquals( 4, all.size() );
		assertEquals( 50, all.get( 0 ).getFlux(), 0 );
		assertEquals( 1, all.get( 3 ).getFlux(), 0 );
	}

	@Test
	public void percentRoundsDown()
	{
		assertEquals( 2, StarSelection.brightest( stars, 50 ).size() );
		assertEquals( 2, StarSelection.brightest( stars, 74 ).size() );
		assertEquals( 0, StarSelection.brightest( stars, 0 ).size() );
		assertEquals( 20, StarSelection.brightest( stars, 50 ).get( 1 ).getFlux(), 0 );
	}

	@Test
	public void radius()
	{
		assertEquals( 1.0, new Star( 0, 0, 1, 4 ).radius(), 1e-12 );
		assertEquals( 5.0, new Star( 0, 0, 1, 100 ).radius(), 1e-12 );
	}
}
