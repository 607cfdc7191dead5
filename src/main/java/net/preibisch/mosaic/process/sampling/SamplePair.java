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

import java.util.Arrays;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * Robust reference and target value of one grid cell of the overlap, per
 * channel. Immutable.
 * <p>
 * A channel is valid only if at least the minimum number of pixels contributed
 * and none of the cell's pixels was rejected (no-data, saturated).
 */
public class SamplePair
{
	private final FinalInterval bounds;

	private final double x;

	private final double y;

	private final double[] reference;

	private final double[] target;

	private final int[] count;

	private final boolean[] valid;

	private final int weight;

	/**
	 * @param bounds 2d pixel bounds of the cell (inclusive)
	 * @param x center x
	 * @param y center y
	 * @param reference per channel reference value
	 * @param target per channel target value
	 * @param count per channel number of contributing pixels
	 * @param valid per channel validity
	 * @param weight number of grid cells this sample summarizes (1 unless binned)
	 */
	public SamplePair(
			final Interval bounds,
			final double x,
			final double y,
			final double[] reference,
			final double[] target,
			final int[] count,
			final boolean[] valid,
			final int weight )
	{
		if ( reference.length != target.length || reference.length != count.length || reference.length != valid.length )
			throw new IllegalArgumentException( "per channel arrays differ in length" );

		this.bounds = new FinalInterval( bounds );
		this.x = x;
		this.y = y;
		this.reference = reference.clone();
		this.target = target.clone();
		this.count = count.clone();
		this.valid = valid.clone();
		this.weight = weight;
	}

	public Interval getBounds() { return bounds; }

	public double getX() { return x; }

	public double getY() { return y; }

	/**
	 * @param d 0 for x, 1 for y
	 */
	public double getPosition( final int d )
	{
		return d == 0 ? x : y;
	}

	public int numChannels() { return reference.length; }

	public double getReference( final int channel ) { return reference[ channel ]; }

	public double getTarget( final int channel ) { return target[ channel ]; }

	public int getCount( final int channel ) { return count[ channel ]; }

	public boolean isValid( final int channel ) { return valid[ channel ]; }

	public int getWeight() { return weight; }

	/**
	 * @return true if at least one channel is valid
	 */
	public boolean isValid()
	{
		for ( final boolean v : valid )
			if ( v )
				return true;
		return false;
	}

	@Override
	public String toString()
	{
		return "SamplePair{" +
				"x=" + x +
				", y=" + y +
				", reference=" + Arrays.toString( reference ) +
				", target=" + Arrays.toString( target ) +
				", count=" + Arrays.toString( count ) +
				", valid=" + Arrays.toString( valid ) +
				", weight=" + weight +
				'}';
	}
}
