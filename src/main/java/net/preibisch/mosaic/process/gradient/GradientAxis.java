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

import net.imglib2.Interval;

/**
 * Spatial axes the residual gradient is modelled along.
 */
public enum GradientAxis
{
	/** no gradient correction, offset only */
	NONE,

	/** one curve along x, constant in y */
	X,

	/** one curve along y, constant in x */
	Y,

	/** one curve along the longer side of the overlap */
	AUTO,

	/** separable: a curve along the longer side of the overlap plus a curve across it */
	XY;

	/**
	 * @param overlap bounding box of the overlap (at least 2 dimensions)
	 * @return the dimension (0 or 1) the join runs along
	 */
	public static int joinDimension( final Interval overlap )
	{
		return overlap.dimension( 0 ) >= overlap.dimension( 1 ) ? 0 : 1;
	}
}
