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
package net.preibisch.mosaic.exception;

/**
 * Two interpolation knots coincide, are out of order, or are so close that the
 * span between them underflows.
 */
public class DegenerateIntervalException extends MosaicException
{
	private static final long serialVersionUID = 1L;

	public DegenerateIntervalException( final String message )
	{
		super( message );
	}

	public DegenerateIntervalException( final String stage, final int channel, final String message, final Throwable cause )
	{
		super( stage, channel, message, cause );
	}
}
