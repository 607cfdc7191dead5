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
package net.preibisch.mosaic.process.sampling;

import java.util.Arrays;

/**
 * Robust central value of the pixels of one grid cell.
 */
public enum SampleStatistic
{
	MEDIAN
	{
		@Override
		public double reduce( final double[] values, final int size, final double clipSigma, final int clipIterations )
		{
			return median( values, size );
		}
	},

	/**
	 * Mean of the values within {@code clipSigma} standard deviations of the
	 * median, re-estimated until nothing more is clipped or
	 * {@code clipIterations} is reached.
	 */
	SIGMA_CLIPPED_MEAN
	{
		@Override
		public double reduce( final double[] values, final int size, final double clipSigma, final int clipIterations )
		{
			int n = size;
			double mean = mean( values, n );
			for ( int iteration = 0; iteration < clipIterations && n > 2; ++iteration )
			{
				final double center = median( values, n );
				final double std = std( values, n, mean );
				if ( std <= 0 )
					break;

				final double t = clipSigma * std;
				int j = 0;
				for ( int i = 0; i < n; ++i )
					if ( Math.abs( values[ i ] - center ) <= t )
						values[ j++ ] = values[ i ];

				if ( j == n || j == 0 )
					break;

				n = j;
				mean = mean( values, n );
			}
			return mean;
		}
	};

	/**
	 * Reduce the first {@code size} entries of {@code values}. The array is
	 * reordered in place.
	 */
	public abstract double reduce( double[] values, int size, double clipSigma, int clipIterations );

	/**
	 * Median of the first {@code size} entries, sorts them in place.
	 */
	public static double median( final double[] values, final int size )
	{
		if ( size == 0 )
			return Double.NaN;

		Arrays.sort( values, 0, size );
		final int m = size / 2;
		if ( size % 2 == 0 )
			return ( values[ m - 1 ] + values[ m ] ) / 2.0;
		else
			return values[ m ];
	}

	static double mean( final double[] values, final int size )
	{
		double sum = 0;
		for ( int i = 0; i < size; ++i )
			sum += values[ i ];
		return sum / size;
	}

	static double std( final double[] values, final int size, final double mean )
	{
		double sum = 0;
		for ( int i = 0; i < size; ++i )
		{
			final double d = values[ i ] - mean;
			sum += d * d;
		}
		return Math.sqrt( sum / size );
	}
}
