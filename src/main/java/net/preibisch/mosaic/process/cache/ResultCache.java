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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-recently-used cache of intermediate results. Entries never
 * expire on their own, they are evicted when the capacity is exceeded or
 * invalidated by the caller.
 * <p>
 * Lookup, computation and insertion of one key happen under a single lock, so
 * a value is computed at most once while it stays cached.
 *
 * @param <K> key type, usually a {@link Fingerprint}
 * @param <V> value type
 */
public class ResultCache< K, V >
{
	private static final Logger LOG = LoggerFactory.getLogger( ResultCache.class );

	private final int capacity;

	private final Object lock = new Object();

	// access order: the eldest entry is the least recently used one
	private final LinkedHashMap< K, V > entries;

	private long hits = 0, misses = 0;

	public ResultCache( final int capacity )
	{
		if ( capacity < 1 )
			throw new IllegalArgumentException( "cache capacity must be >= 1, got " + capacity );

		this.capacity = capacity;
		this.entries = new LinkedHashMap<>( 16, 0.75f, true );
	}

	/**
	 * Returns the cached value for {@code key}, or computes it with
	 * {@code loader}, stores and returns it. If the loader throws, nothing is
	 * stored.
	 */
	public < E extends Exception > V getOrCompute( final K key, final CacheLoader< V, E > loader ) throws E
	{
		synchronized ( lock )
		{
			final V cached = entries.get( key );
			if ( cached != null )
			{
				++hits;
				LOG.debug( "cache hit for {}", key );
				return cached;
			}

			++misses;
			final V value = loader.load();
			if ( value == null )
				throw new IllegalStateException( "loader returned null for " + key );

			entries.put( key, value );
			evictIfNeeded();
			return value;
		}
	}

	private void evictIfNeeded()
	{
		while ( entries.size() > capacity )
		{
			final Map.Entry< K, V > eldest = entries.entrySet().iterator().next();
			LOG.debug( "evicting {}", eldest.getKey() );
			entries.remove( eldest.getKey() );
		}
	}

	/**
	 * @return the cached value without touching the access order, or null
	 */
	public V peek( final K key )
	{
		synchronized ( lock )
		{
			for ( final Map.Entry< K, V > e : entries.entrySet() )
				if ( e.getKey().equals( key ) )
					return e.getValue();
			return null;
		}
	}

	public boolean contains( final K key )
	{
		synchronized ( lock )
		{
			return entries.containsKey( key );
		}
	}

	public void invalidate( final K key )
	{
		synchronized ( lock )
		{
			entries.remove( key );
		}
	}

	public void invalidateAll()
	{
		synchronized ( lock )
		{
			entries.clear();
		}
	}

	public int size()
	{
		synchronized ( lock )
		{
			return entries.size();
		}
	}

	public int capacity() { return capacity; }

	/**
	 * @return keys from least to most recently used
	 */
	public List< K > keys()
	{
		synchronized ( lock )
		{
			return new ArrayList<>( entries.keySet() );
		}
	}

	public long hits()
	{
		synchronized ( lock )
		{
			return hits;
		}
	}

	public long misses()
	{
		synchronized ( lock )
		{
			return misses;
		}
	}
}
