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
package net.preibisch.mosaic.process.fit;

import java.util.Arrays;

/**
 * Indices of the samples currently accepted by a fit.
 */
public class SampleIndices
{
	private final int[] indices;

	private int size;

	public SampleIndices( final int capacity )
	{
		indices = new int[ capacity ];
		size = 0;
	}

	/**
	 * @return indices {@code 0 ... n-1}
	 */
	public static SampleIndices all( final int n )
	{
		final SampleIndices all = new SampleIndices( n );
		for ( int i = 0; i < n; ++i )
			all.indices[ i ] = i;
		all.size = n;
		return all;
	}

	public int capacity()
	{
		return indices.length;
	}

	public int size()
	{
		return size;
	}

	/**
	 * Get the internal index array.
	 * <p>
	 * Note that the length of the returned array may be larger than the current {@code size()}.
	 *
	 * @return index array
	 */
	public int[] indices()
	{
		return indices;
	}

	public void setSize( final int size )
	{
		if ( size > capacity() )
			throw new IllegalArgumentException( "Given size exceeds the capacity" );
		this.size = size;
	}

	public void set( final SampleIndices other )
	{
		if ( other.size() > capacity() )
			throw new IllegalArgumentException( "Given indices exceed the capacity" );
		System.arraycopy( other.indices, 0, this.indices, 0, other.size );
		this.size = other.size;
	}

	public int[] toArray()
	{
		return Arrays.copyOf( indices, size );
	}

	/**
	 * @param n total number of samples
	 * @return sorted indices in {@code 0 ... n-1} that are not in this
	 */
	public int[] complement( final int n )
	{
		final boolean[] in = new boolean[ n ];
		for ( int i = 0; i < size; ++i )
			in[ indices[ i ] ] = true;

		final int[] out = new int[ n - size ];
		int j = 0;
		for ( int i = 0; i < n; ++i )
			if ( !in[ i ] )
				out[ j++ ] = i;
		return out;
	}
}
