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
package net.preibisch.mosaic.process;

import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.gradient.GradientSurface;

/**
 * What happened to one channel: the fit, the gradient and how many samples
 * were used. The output range is filled in after compositing, NaN before.
 */
public class ChannelDiagnostics
{
	private final int channel;

	private final LinearFit fit;

	private final GradientSurface surface;

	private final int numSamples;

	private final double min, max;

	public ChannelDiagnostics( final int channel, final LinearFit fit, final GradientSurface surface, final int numSamples )
	{
		this( channel, fit, surface, numSamples, Double.NaN, Double.NaN );
	}

	private ChannelDiagnostics( final int channel, final LinearFit fit, final GradientSurface surface, final int numSamples, final double min, final double max )
	{
		this.channel = channel;
		this.fit = fit;
		this.surface = surface;
		this.numSamples = numSamples;
		this.min = min;
		this.max = max;
	}

	public ChannelDiagnostics withOutputRange( final double min, final double max )
	{
		return new ChannelDiagnostics( channel, fit, surface, numSamples, min, max );
	}

	public int getChannel() { return channel; }

	public LinearFit getFit() { return fit; }

	public GradientSurface getSurface() { return surface; }

	/**
	 * @return number of samples valid for this channel
	 */
	public int getNumSamples() { return numSamples; }

	public int getNumRejected() { return fit.numRejected(); }

	/**
	 * @return minimum output value before truncation
	 */
	public double getMin() { return min; }

	/**
	 * @return maximum output value before truncation
	 */
	public double getMax() { return max; }

	@Override
	public String toString()
	{
		return "channel " + channel + ": " + fit + ", " + numSamples + " samples, " + fit.numRejected() + " rejected, gradient " + surface;
	}
}
