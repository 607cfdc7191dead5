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

/**
 * Additive correction {@code g(x, y) = gx(x) + gy(y)} of one channel; either
 * curve may be absent.
 */
public class GradientSurface
{
	private static final GradientSurface ZERO = new GradientSurface( null, null );

	private final GradientCurve xCurve;

	private final GradientCurve yCurve;

	private GradientSurface( final GradientCurve xCurve, final GradientCurve yCurve )
	{
		this.xCurve = xCurve;
		this.yCurve = yCurve;
	}

	public static GradientSurface zero()
	{
		return ZERO;
	}

	public static GradientSurface of( final GradientCurve curve )
	{
		return curve.getDimension() == 0 ? new GradientSurface( curve, null ) : new GradientSurface( null, curve );
	}

	public static GradientSurface separable( final GradientCurve first, final GradientCurve second )
	{
		if ( first.getDimension() == second.getDimension() )
			throw new IllegalArgumentException( "separable curves must run along different dimensions" );
		return first.getDimension() == 0 ? new GradientSurface( first, second ) : new GradientSurface( second, first );
	}

	public boolean isZero()
	{
		return xCurve == null && yCurve == null;
	}

	/**
	 * @return curve along {@code d}, or {@code null}
	 */
	public GradientCurve getCurve( final int d )
	{
		return d == 0 ? xCurve : yCurve;
	}

	public double evaluate( final double x, final double y )
	{
		double v = 0;
		if ( xCurve != null )
			v += xCurve.evaluate( x );
		if ( yCurve != null )
			v += yCurve.evaluate( y );
		return v;
	}

	/**
	 * @return the contribution of dimension {@code d} at positions {@code min ... min+n-1}
	 */
	public double[] evaluate( final int d, final long min, final int n )
	{
		final GradientCurve curve = getCurve( d );
		return curve == null ? new double[ n ] : curve.evaluate( min, n );
	}

	@Override
	public String toString()
	{
		return isZero() ? "GradientSurface{zero}" : "GradientSurface{x=" + xCurve + ", y=" + yCurve + "}";
	}
}
