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
package net.preibisch.mosaic.process.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

public class FingerprintTest
{
	@Test
	public void equalComponents()
	{
		final Fingerprint a = Fingerprint.of( "samples", "ref", 20, 3.0, new long[] { 0, 0, 0 }, new double[] { 1, 2 } );
		final Fingerprint b = Fingerprint.of( "samples", "ref", 20, 3.0, new long[] { 0, 0, 0 }, new double[] { 1, 2 } );

		assertEquals( a, b );
		assertEquals( a.hashCode(), b.hashCode() );
	}

	@Test
	public void anyComponentChangesTheFingerprint()
	{
		final Fingerprint a = Fingerprint.of( "samples", "ref", 20, 3.0 );
		assertNotEquals( a, Fingerprint.of( "samples", "ref", 21, 3.0 ) );
		assertNotEquals( a, Fingerprint.of( "samples", "ref", 20, 3.5 ) );
		assertNotEquals( a, Fingerprint.of( "samples", "tgt", 20, 3.0 ) );
		assertNotEquals( a, a.with( "fit", 0 ) );
		assertNotEquals( a.with( "fit", 0 ), a.with( "fit", 1 ) );
		assertEquals( a.with( "fit", 1 ), a.with( "fit", 1 ) );
	}

	@Test
	public void nanIsEqualToItself()
	{
		assertEquals( Fingerprint.of( Double.NaN ), Fingerprint.of( Double.NaN ) );
	}
}
