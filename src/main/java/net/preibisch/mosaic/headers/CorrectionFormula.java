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
package net.preibisch.mosaic.headers;

import java.util.Locale;

import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.fusion.BlendMode;

/**
 * Renders the photometric correction and the tile combination as pixel-math
 * style expressions for an external evaluator. The gradient is not part of
 * the expression, it is applied as an image.
 */
public class CorrectionFormula
{
	private CorrectionFormula() {}

	/**
	 * @return {@code iif(T != 0, scale * T + offset, 0)}, pixels without data stay black
	 */
	public static String correction( final String targetId, final LinearFit fit )
	{
		if ( !fit.isValid() )
			throw new IllegalArgumentException( "no formula for an invalid fit: " + fit );

		final String linear;
		if ( fit.getScale() == 1.0 )
			linear = targetId + " " + signed( fit.getOffset() );
		else
			linear = number( fit.getScale() ) + " * " + targetId + " " + signed( fit.getOffset() );

		return "iif(" + targetId + " != 0, " + linear + ", 0)";
	}

	/**
	 * @return expression that combines the reference with the corrected target
	 */
	public static String combination( final String referenceId, final String correctedId, final BlendMode mode )
	{
		final String a = referenceId, b = correctedId;
		switch ( mode )
		{
		case REFERENCE_PRIORITY:
			return "iif(" + a + " != 0, " + a + ", " + b + ")";
		case TARGET_PRIORITY:
			return "iif(" + b + " != 0, " + b + ", " + a + ")";
		case RANDOM_DITHER:
			return "iif(" + a + " && " + b + ", rndselect(" + a + ", " + b + "), " + a + " + " + b + ")";
		case WEIGHTED_AVERAGE:
		default:
			// the cosine taper needs the overlap geometry, the evaluator gets the plain mean
			return "iif(" + a + " && " + b + ", (" + a + " + " + b + ")/2, " + a + " + " + b + ")";
		}
	}

	static String number( final double value )
	{
		return String.format( Locale.ROOT, "%.8g", value );
	}

	static String signed( final double value )
	{
		return value < 0 ? "- " + number( -value ) : "+ " + number( value );
	}
}
