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
package net.preibisch.mosaic.process.fusion;

/**
 * How reference and corrected target pixels are combined inside the overlap.
 */
public enum BlendMode
{
	/** keep the reference pixel */
	REFERENCE_PRIORITY,

	/** keep the corrected target pixel */
	TARGET_PRIORITY,

	/** cosine weight of the distance across the overlap, reference side to target side */
	WEIGHTED_AVERAGE,

	/** pick one source per pixel at random, turning a hard seam into noise */
	RANDOM_DITHER
}
