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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Cache key made of everything a cached result depends on. Two fingerprints
 * are equal if all their components are equal, arrays compared by content.
 */
public final class Fingerprint
{
	private final List< Object > components;

	private final int hashCode;

	private Fingerprint( final List< Object > components )
	{
		this.components = Collections.unmodifiableList( components );
		this.hashCode = components.hashCode();
	}

	public static Fingerprint of( final Object... components )
	{
		final ArrayList< Object > list = new ArrayList<>( components.length );
		for ( final Object o : components )
			list.add( normalize( o ) );
		return new Fingerprint( list );
	}

	/**
	 * @return a new fingerprint with the additional components appended
	 */
	public Fingerprint with( final Object... more )
	{
		final ArrayList< Object > list = new ArrayList<>( components );
		for ( final Object o : more )
			list.add( normalize( o ) );
		return new Fingerprint( list );
	}

	private static Object normalize( final Object o )
	{
		if ( o instanceof double[] )
			return new DoubleArray( ( double[] ) o );
		if ( o instanceof long[] )
			return Arrays.toString( ( long[] ) o );
		if ( o instanceof int[] )
			return Arrays.toString( ( int[] ) o );
		return o;
	}

	public List< Object > getComponents()
	{
		return components;
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;
		if ( !( o instanceof Fingerprint ) )
			return false;
		return components.equals( ( ( Fingerprint ) o ).components );
	}

	@Override
	public int hashCode()
	{
		return hashCode;
	}

	@Override
	public String toString()
	{
		return "Fingerprint" + components;
	}

	private static final class DoubleArray
	{
		final double[] values;

		DoubleArray( final double[] values )
		{
			this.values = values.clone();
		}

		@Override
		public boolean equals( final Object o )
		{
			return o instanceof DoubleArray && Arrays.equals( values, ( ( DoubleArray ) o ).values );
		}

		@Override
		public int hashCode()
		{
			return Arrays.hashCode( values );
		}

		@Override
		public String toString()
		{
			return Arrays.toString( values );
		}
	}
}
