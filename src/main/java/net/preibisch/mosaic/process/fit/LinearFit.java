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
package net.preibisch.mosaic.process.fit;

import java.util.Arrays;

/**
 * {@code reference = scale * target + offset} for one channel.
 * <p>
 * {@link Status#OFFSET_ONLY} is the fallback when the scale cannot be
 * determined (zero target variance): scale is fixed to 1. An
 * {@link Status#INVALID} fit must not be applied.
 */
public class LinearFit
{
	public enum Status
	{
		VALID,
		OFFSET_ONLY,
		INVALID
	}

	private final Status status;

	private final double scale;

	private final double offset;

	private final double error;

	private final int[] inliers;

	private final int[] rejected;

	private final String reason;

	private LinearFit(
			final Status status,
			final double scale,
			final double offset,
			final double error,
			final int[] inliers,
			final int[] rejected,
			final String reason )
	{
		this.status = status;
		this.scale = scale;
		this.offset = offset;
		this.error = error;
		this.inliers = inliers;
		this.rejected = rejected;
		this.reason = reason;
	}

	/**
	 * @param inliers indices of the samples the fit was computed from
	 * @param rejected indices of the samples rejected as outliers
	 */
	public static LinearFit valid( final double scale, final double offset, final double error, final int[] inliers, final int[] rejected )
	{
		if ( !( scale > 0 ) || !Double.isFinite( scale ) || !Double.isFinite( offset ) )
			throw new IllegalArgumentException( "scale must be finite and > 0, offset finite: scale=" + scale + ", offset=" + offset );
		return new LinearFit( Status.VALID, scale, offset, error, inliers.clone(), rejected.clone(), null );
	}

	public static LinearFit offsetOnly( final double offset, final double error, final int numSamples, final String reason )
	{
		if ( !Double.isFinite( offset ) )
			throw new IllegalArgumentException( "offset must be finite, was " + offset );
		final int[] all = new int[ numSamples ];
		Arrays.setAll( all, i -> i );
		return new LinearFit( Status.OFFSET_ONLY, 1, offset, error, all, new int[ 0 ], reason );
	}

	public static LinearFit invalid( final String reason )
	{
		return new LinearFit( Status.INVALID, Double.NaN, Double.NaN, Double.NaN, new int[ 0 ], new int[ 0 ], reason );
	}

	/**
	 * Identity, {@code scale=1, offset=0}.
	 */
	public static LinearFit identity()
	{
		return new LinearFit( Status.VALID, 1, 0, 0, new int[ 0 ], new int[ 0 ], null );
	}

	public Status getStatus() { return status; }

	public boolean isValid() { return status != Status.INVALID; }

	public boolean isOffsetOnly() { return status == Status.OFFSET_ONLY; }

	public double getScale() { return scale; }

	public double getOffset() { return offset; }

	/**
	 * @return RMS of the residuals of the accepted samples
	 */
	public double getError() { return error; }

	public int[] getInliers() { return inliers.clone(); }

	public int[] getRejected() { return rejected.clone(); }

	public int numInliers() { return inliers.length; }

	public int numRejected() { return rejected.length; }

	/**
	 * @return why the fit is offset-only or invalid, {@code null} for a valid fit
	 */
	public String getReason() { return reason; }

	public double apply( final double target )
	{
		return target * scale + offset;
	}

	@Override
	public String toString()
	{
		switch ( status )
		{
		case INVALID:
			return "LinearFit{INVALID, " + reason + "}";
		case OFFSET_ONLY:
			return String.format( "LinearFit{OFFSET_ONLY, offset=%.6g, error=%.4g, %s}", offset, error, reason );
		default:
			return String.format( "LinearFit{scale=%.6g, offset=%.6g, error=%.4g, inliers=%d, rejected=%d}",
					scale, offset, error, inliers.length, rejected.length );
		}
	}
}
