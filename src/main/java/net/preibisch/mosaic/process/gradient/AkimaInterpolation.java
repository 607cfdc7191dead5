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
package net.preibisch.mosaic.process.gradient;

import net.preibisch.mosaic.exception.DegenerateIntervalException;
import net.preibisch.mosaic.exception.InsufficientDataException;

/**
 * Akima subspline interpolation.
 * <p>
 * H. Akima, A new method of interpolation and smooth curve fitting based on
 * local procedures, Journal of the ACM 17(4), 1970, 589-602. Follows section
 * 13.1 of G. Engeln-Müllges and F. Uhlig, Numerical Algorithms with C
 * (Springer, 1996).
 * <p>
 * Corners are represented where a knot lies between two straight lines of
 * different slope, i.e. continuous differentiability is not imposed.
 * <p>
 * Outside {@code [x[0], x[n-1]]} the cubic of the first or last sub-interval is
 * extrapolated.
 */
public class AkimaInterpolation
{
	public static final int MIN_NUM_KNOTS = 5;

	/**
	 * chordal slope differences below this are treated as equal
	 */
	static final double WEIGHT_EPSILON = Math.ulp( 1.0 );

	private final double[] x;

	private final double[] y;

	private final double[] b;

	private final double[] c;

	private final double[] d;

	/**
	 * @param x strictly increasing knot positions
	 * @param y knot values, same length as {@code x}, at least {@link #MIN_NUM_KNOTS}
	 * @throws InsufficientDataException if fewer than {@link #MIN_NUM_KNOTS} knots are given
	 * @throws DegenerateIntervalException if two knots coincide, are out of order, or their distance underflows
	 */
	public AkimaInterpolation( final double[] x, final double[] y ) throws InsufficientDataException, DegenerateIntervalException
	{
		if ( x.length != y.length )
			throw new IllegalArgumentException( "x and y differ in length: " + x.length + " != " + y.length );
		if ( y.length < MIN_NUM_KNOTS )
			throw new InsufficientDataException( y.length + " knots are not enough for Akima interpolation, at least " + MIN_NUM_KNOTS + " required" );

		this.x = x.clone();
		this.y = y.clone();

		final int n = y.length;
		final int N = n - 1; // number of sub-intervals

		b = new double[ N ];
		c = new double[ N ];
		d = new double[ N ];

		// chordal slopes, with room for 4 prescribed slopes at the ends
		final double[] m = new double[ N + 4 ];

		// left-hand slopes, to support corners
		final double[] tL = new double[ n ];

		for ( int i = 0; i < N; ++i )
		{
			final double h = span( i );
			m[ i + 2 ] = ( this.y[ i + 1 ] - this.y[ i ] ) / h;
		}

		m[ 0 ] = 3 * m[ 2 ] - 2 * m[ 3 ];
		m[ 1 ] = 2 * m[ 2 ] - m[ 3 ];
		m[ N + 2 ] = 2 * m[ N + 1 ] - m[ N ];
		m[ N + 3 ] = 3 * m[ N + 1 ] - 2 * m[ N ];

		// right-hand slopes are the coefficients b[i]
		for ( int i = 0; i < n; ++i )
		{
			final double f = Math.abs( m[ i + 1 ] - m[ i ] );
			final double e = Math.abs( m[ i + 3 ] - m[ i + 2 ] ) + f;
			if ( e > WEIGHT_EPSILON )
			{
				tL[ i ] = m[ i + 1 ] + f * ( m[ i + 2 ] - m[ i + 1 ] ) / e;
				if ( i < N )
					b[ i ] = tL[ i ];
			}
			else
			{
				tL[ i ] = m[ i + 1 ];
				if ( i < N )
					b[ i ] = m[ i + 2 ];
			}
		}

		for ( int i = 0; i < N; ++i )
		{
			final double h = this.x[ i + 1 ] - this.x[ i ];
			c[ i ] = ( 3 * m[ i + 2 ] - 2 * b[ i ] - tL[ i + 1 ] ) / h;
			d[ i ] = ( b[ i ] + tL[ i + 1 ] - 2 * m[ i + 2 ] ) / ( h * h );
		}
	}

	private double span( final int i ) throws DegenerateIntervalException
	{
		final double h = x[ i + 1 ] - x[ i ];
		if ( !( h > 0 ) )
			throw new DegenerateIntervalException( "knots " + i + " and " + ( i + 1 ) + " are not strictly increasing: " + x[ i ] + ", " + x[ i + 1 ] );
		if ( 1 + h * h == 1 )
			throw new DegenerateIntervalException( "empty interpolation sub-interval between knots " + i + " and " + ( i + 1 ) + " (h=" + h + ")" );
		return h;
	}

	public int numKnots()
	{
		return x.length;
	}

	/**
	 * @return index {@code i} of the sub-interval used to evaluate at {@code position}:
	 *         {@code x[i] <= position < x[i+1]}, 0 before the first knot, {@code n-2} after the last
	 */
	public int interval( final double position )
	{
		int i0 = 0;
		int i1 = x.length - 1;
		while ( i1 - i0 > 1 )
		{
			final int im = ( i0 + i1 ) >>> 1;
			if ( position < x[ im ] )
				i1 = im;
			else
				i0 = im;
		}
		return i0;
	}

	public double evaluate( final double position )
	{
		final int i = interval( position );
		return polynomial( i, position );
	}

	/**
	 * Evaluate the cubic of sub-interval {@code i} at {@code position}, also outside the sub-interval.
	 */
	public double polynomial( final int i, final double position )
	{
		final double dx = position - x[ i ];
		return y[ i ] + dx * ( b[ i ] + dx * ( c[ i ] + dx * d[ i ] ) );
	}

	/**
	 * @return {a, b, c, d} of sub-interval {@code i}: {@code a + b dx + c dx^2 + d dx^3}, {@code dx = position - x[i]}
	 */
	public double[] coefficients( final int i )
	{
		return new double[] { y[ i ], b[ i ], c[ i ], d[ i ] };
	}

	public double[] getPositions()
	{
		return x.clone();
	}

	public double[] getValues()
	{
		return y.clone();
	}
}
