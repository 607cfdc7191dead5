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
 * Base class of the errors a stage of the mosaic pipeline reports instead of
 * producing NaN, infinite or silently wrong values.
 * <p>
 * Carries the stage ("samples", "fit", "gradient", "composite") and the
 * channel that failed, if known, so that a caller can tell the user which
 * setting to adjust.
 */
public class MosaicException extends Exception
{
	private static final long serialVersionUID = 1L;

	public static final int UNKNOWN_CHANNEL = -1;

	private final String stage;

	private final int channel;

	public MosaicException( final String message )
	{
		this( null, UNKNOWN_CHANNEL, message, null );
	}

	public MosaicException( final String stage, final int channel, final String message )
	{
		this( stage, channel, message, null );
	}

	public MosaicException( final String stage, final int channel, final String message, final Throwable cause )
	{
		super( message, cause );
		this.stage = stage;
		this.channel = channel;
	}

	/**
	 * @return the pipeline stage that failed, or {@code null} if it is not known
	 */
	public String getStage()
	{
		return stage;
	}

	/**
	 * @return the failing channel, or {@link #UNKNOWN_CHANNEL}
	 */
	public int getChannel()
	{
		return channel;
	}

	@Override
	public String getMessage()
	{
		final String message = super.getMessage();
		if ( stage == null && channel == UNKNOWN_CHANNEL )
			return message;

		final StringBuilder sb = new StringBuilder();
		if ( stage != null )
			sb.append( stage );
		if ( channel != UNKNOWN_CHANNEL )
			sb.append( sb.length() > 0 ? " " : "" ).append( "channel[" ).append( channel ).append( "]" );
		return sb.append( ": " ).append( message ).toString();
	}
}
