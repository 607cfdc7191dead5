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

public class ResidualStatistic
{
	/**
	 * Scales the median absolute deviation to the standard deviation of a
	 * normal distribution.
	 */
	public static final double MAD_TO_SIGMA = 1.4826;

	private final double[] values;

	private final double[] sorted;

	private int size = 0;

	private double mean = 0;

	private double sumOfSquares = 0;

	public ResidualStatistic( final int capacity )
	{
		values = new double[ capacity ];
		sorted = new double[ capacity ];
	}

	final public void add( final double new_value )
	{
		int i = size++;
		values[ i ] = new_value;

		final double delta = new_value - mean;
		mean += delta / size;
		sumOfSquares += new_value * new_value;
	}

	public double get( final int i )
	{
		return values[ i ];
	}

	public double getMedian()
	{
		System.arraycopy( values, 0, sorted, 0, size );
		return median( sorted, size );
	}

	/**
	 * @return median absolute deviation from the median
	 */
	public double getMAD()
	{
		final double median = getMedian();
		for ( int i = 0; i < size; ++i )
			sorted[ i ] = Math.abs( values[ i ] - median );
		return median( sorted, size );
	}

	/**
	 * @return {@link #MAD_TO_SIGMA} * MAD
	 */
	public double getSpread()
	{
		return MAD_TO_SIGMA * getMAD();
	}

	public double getRMS()
	{
		return size == 0 ? 0 : Math.sqrt( sumOfSquares / size );
	}

	public int n()
	{
		return size;
	}

	public double mean()
	{
		return mean;
	}

	public void clear()
	{
		size = 0;
		mean = 0;
		sumOfSquares = 0;
	}

	private static double median( final double[] a, final int size )
	{
		if ( size == 0 )
			return Double.NaN;

		Arrays.sort( a, 0, size );
		final int m = size / 2;
		if ( size % 2 == 0 )
			return ( a[ m - 1 ] + a[ m ] ) / 2.0;
		else
			return a[ m ];
	}
}
