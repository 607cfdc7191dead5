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

/**
 * Decides whether a pixel must not be used for sampling. A cell containing a
 * rejected pixel is invalid for that channel.
 */
@FunctionalInterface
public interface PixelRejection
{
	boolean reject( double reference, double target );

	PixelRejection NONE = ( r, t ) -> false;

	/**
	 * Reject pixels {@code <= minIntensity} (no data) and {@code >= maxIntensity}
	 * (saturated) in either tile. A {@link Double#NaN} threshold is ignored.
	 */
	static PixelRejection intensityRange( final double minIntensity, final double maxIntensity )
	{
		final boolean hasMinIntensity = Double.isFinite( minIntensity );
		final boolean hasMaxIntensity = Double.isFinite( maxIntensity );

		if ( !hasMinIntensity && !hasMaxIntensity )
			return NONE;

		return ( r, t ) ->
				( hasMinIntensity && ( r <= minIntensity || t <= minIntensity ) ) ||
				( hasMaxIntensity && ( r >= maxIntensity || t >= maxIntensity ) );
	}

	default PixelRejection or( final PixelRejection other )
	{
		return ( r, t ) -> reject( r, t ) || other.reject( r, t );
	}
}
