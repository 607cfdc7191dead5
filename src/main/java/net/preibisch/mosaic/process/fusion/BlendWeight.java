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

/**
 * Lookup table for the blending weight function
 * {@code fn(x) = (Math.cos((1 - x) * Math.PI) + 1) / 2}, monotonic from
 * {@code fn(0)=0} to {@code fn(1)=1}.
 */
final class BlendWeight
{
	private static final int n = 30;

	// size of the array is n + 2
	private static final float[] lookUp = createLookup( n );

	private BlendWeight() {}

	private static float[] createLookup( final int n )
	{
		final float[] lookup = new float[ n + 2 ];
		for ( int i = 0; i <= n; i++ )
		{
			final double d = ( double ) i / n;
			lookup[ i ] = ( float ) ( ( Math.cos( ( 1 - d ) * Math.PI ) + 1 ) / 2 );
		}
		lookup[ n + 1 ] = lookup[ n ];
		return lookup;
	}

	/**
	 * @param d position in [0, 1], clamped
	 */
	static float get( final double d )
	{
		if ( !( d > 0 ) )
			return 0;
		if ( d >= 1 )
			return 1;

		final int i = ( int ) ( d * n );
		final float s = ( float ) ( d * n ) - i;
		return lookUp[ i ] * ( 1.0f - s ) + lookUp[ i + 1 ] * s;
	}
}
