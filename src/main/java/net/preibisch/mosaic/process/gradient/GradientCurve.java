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
 * Residual gradient along one image dimension, an Akima curve through knots
 * {@code (position, value)}. Defined for any position.
 */
public class GradientCurve
{
	private final int dimension;

	private final AkimaInterpolation interpolation;

	/**
	 * @param dimension 0 for x, 1 for y
	 * @param positions strictly increasing
	 * @param values one per position
	 */
	public GradientCurve( final int dimension, final double[] positions, final double[] values ) throws InsufficientDataException, DegenerateIntervalException
	{
		if ( dimension != 0 && dimension != 1 )
			throw new IllegalArgumentException( "dimension must be 0 or 1, was " + dimension );

		this.dimension = dimension;
		this.interpolation = new AkimaInterpolation( positions, values );
	}

	public int getDimension()
	{
		return dimension;
	}

	public AkimaInterpolation getInterpolation()
	{
		return interpolation;
	}

	public int numKnots()
	{
		return interpolation.numKnots();
	}

	public double[] getPositions()
	{
		return interpolation.getPositions();
	}

	public double[] getValues()
	{
		return interpolation.getValues();
	}

	public double evaluate( final double position )
	{
		return interpolation.evaluate( position );
	}

	/**
	 * @return values at {@code min, min+1, ..., min+n-1}
	 */
	public double[] evaluate( final long min, final int n )
	{
		final double[] values = new double[ n ];
		for ( int i = 0; i < n; ++i )
			values[ i ] = interpolation.evaluate( min + i );
		return values;
	}

	@Override
	public String toString()
	{
		final double[] p = interpolation.getPositions();
		return "GradientCurve{" + ( dimension == 0 ? "x" : "y" ) + ", " + p.length + " knots in [" + p[ 0 ] + ", " + p[ p.length - 1 ] + "]}";
	}
}
