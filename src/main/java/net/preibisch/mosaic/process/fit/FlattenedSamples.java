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

import java.util.List;

import net.preibisch.mosaic.process.sampling.SamplePair;

/**
 * One channel's sample values in flat arrays: {@code p} target, {@code q}
 * reference, {@code w} weight.
 */
public class FlattenedSamples
{
	private final int capacity;

	private final double[] p;

	private final double[] q;

	private final double[] w;

	private int position;

	private int limit;

	private boolean weighted = true;

	public FlattenedSamples( final int capacity )
	{
		this.capacity = capacity;
		p = new double[ capacity ];
		q = new double[ capacity ];
		w = new double[ capacity ];
		position = 0;
		limit = capacity;
	}

	/**
	 * @param samples samples that are valid for {@code channel}
	 */
	public static FlattenedSamples of( final List< SamplePair > samples, final int channel )
	{
		final FlattenedSamples flat = new FlattenedSamples( samples.size() );
		boolean weighted = false;
		for ( final SamplePair s : samples )
		{
			if ( !s.isValid( channel ) )
				throw new IllegalArgumentException( "sample " + s + " is not valid for channel " + channel );
			flat.put( s.getTarget( channel ), s.getReference( channel ), s.getWeight() );
			weighted |= s.getWeight() != 1;
		}
		flat.flip();
		flat.setWeighted( weighted );
		return flat;
	}

	/**
	 * Unweighted samples from parallel arrays.
	 */
	public static FlattenedSamples of( final double[] target, final double[] reference )
	{
		if ( target.length != reference.length )
			throw new IllegalArgumentException( "target and reference differ in length" );

		final FlattenedSamples flat = new FlattenedSamples( target.length );
		for ( int i = 0; i < target.length; ++i )
			flat.put( target[ i ], reference[ i ], 1 );
		flat.flip();
		flat.setWeighted( false );
		return flat;
	}

	public int size()
	{
		return limit;
	}

	public int capacity()
	{
		return capacity;
	}

	public double[] p()
	{
		return p;
	}

	public double[] q()
	{
		return q;
	}

	public double[] w()
	{
		return w;
	}

	/**
	 * @return whether weights should be considered for fitting, all weights are
	 *         assumed {@code =1} otherwise
	 */
	public boolean weighted()
	{
		return weighted;
	}

	public void setWeighted( final boolean weighted )
	{
		this.weighted = weighted;
	}

	// --- java.nio.Buffer-like API ---

	public void put( final double p, final double q, final double w )
	{
		this.p[ position ] = p;
		this.q[ position ] = q;
		this.w[ position ] = w;
		position++;
	}

	public void flip()
	{
		limit = position;
		position = 0;
	}
}
