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

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.preibisch.mosaic.exception.MosaicException;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.gradient.GradientAxis;
import net.preibisch.mosaic.process.gradient.GradientSurface;
import net.preibisch.mosaic.process.sampling.SampleGrid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code scale * target + offset + gradient(x, y)} to the target tile
 * and merges it with the reference tile.
 * <p>
 * Outside the overlap the corrected target replaces the target wherever the
 * target has data (non-zero), the reference is used elsewhere. Inside the
 * overlap the {@link BlendMode} decides. The inputs are not modified.
 */
public class MosaicCompositor
{
	private static final Logger LOG = LoggerFactory.getLogger( MosaicCompositor.class );

	private final BlendMode blendMode;

	private final double ditherProbability;

	private final long ditherSeed;

	private final boolean truncate;

	/**
	 * @param blendMode how to merge inside the overlap
	 * @param ditherProbability probability of taking the corrected target pixel for {@link BlendMode#RANDOM_DITHER}
	 * @param ditherSeed seed for {@link BlendMode#RANDOM_DITHER}, the same seed gives the same mosaic
	 * @param truncate clamp the output to [0, 1]
	 */
	public MosaicCompositor( final BlendMode blendMode, final double ditherProbability, final long ditherSeed, final boolean truncate )
	{
		this.blendMode = blendMode;
		this.ditherProbability = ditherProbability;
		this.ditherSeed = ditherSeed;
		this.truncate = truncate;
	}

	public static class Composite
	{
		private final Img< FloatType > image;

		private final double[] min;

		private final double[] max;

		private final boolean truncated;

		Composite( final Img< FloatType > image, final double[] min, final double[] max, final boolean truncated )
		{
			this.image = image;
			this.min = min;
			this.max = max;
			this.truncated = truncated;
		}

		public Img< FloatType > getImage() { return image; }

		/**
		 * @return per channel minimum before truncation
		 */
		public double getMin( final int channel ) { return min[ channel ]; }

		/**
		 * @return per channel maximum before truncation
		 */
		public double getMax( final int channel ) { return max[ channel ]; }

		/**
		 * @return true if any value was clamped to [0, 1]
		 */
		public boolean isTruncated() { return truncated; }
	}

	/**
	 * @param reference reference tile (x, y, channel)
	 * @param target target tile, same dimensions
	 * @param mask overlap (x, y), non-zero inside
	 * @param fits per channel linear fit
	 * @param surfaces per channel gradient
	 * @throws MosaicException naming the channel, if a fit is invalid or a surface is missing
	 */
	public < T extends RealType< T > > Composite composite(
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask,
			final List< LinearFit > fits,
			final List< GradientSurface > surfaces ) throws MosaicException
	{
		if ( !Intervals.equals( reference, target ) )
			throw new IllegalArgumentException( "reference and target differ in size" );

		final int numChannels = ( int ) reference.dimension( 2 );
		if ( fits.size() != numChannels || surfaces.size() != numChannels )
			throw new IllegalArgumentException( "expected " + numChannels + " fits and surfaces, got " + fits.size() + " and " + surfaces.size() );

		for ( int c = 0; c < numChannels; ++c )
		{
			if ( fits.get( c ) == null || !fits.get( c ).isValid() )
				throw new MosaicException( "composite", c, "linear fit is invalid: " + fits.get( c ) );
			if ( surfaces.get( c ) == null )
				throw new MosaicException( "composite", c, "no gradient surface" );
		}

		final long minX = reference.min( 0 );
		final long minY = reference.min( 1 );
		final int width = ( int ) reference.dimension( 0 );
		final int height = ( int ) reference.dimension( 1 );

		final double[][] gx = new double[ numChannels ][];
		final double[][] gy = new double[ numChannels ][];
		final double[] scale = new double[ numChannels ];
		final double[] offset = new double[ numChannels ];
		for ( int c = 0; c < numChannels; ++c )
		{
			gx[ c ] = surfaces.get( c ).evaluate( 0, minX, width );
			gy[ c ] = surfaces.get( c ).evaluate( 1, minY, height );
			scale[ c ] = fits.get( c ).getScale();
			offset[ c ] = fits.get( c ).getOffset();
		}

		final Interval box = overlapBox( mask );
		final int normalDim = 1 - GradientAxis.joinDimension( box );
		final double[] referenceWeight = blendMode == BlendMode.WEIGHTED_AVERAGE ? referenceWeights( reference, target, mask, box ) : null;
		final Random random = new Random( ditherSeed );

		final Img< FloatType > out = ArrayImgs.floats( reference.dimension( 0 ), reference.dimension( 1 ), numChannels );
		final RandomAccess< T > raRef = reference.randomAccess();
		final RandomAccess< T > raTgt = target.randomAccess();
		final RandomAccess< UnsignedByteType > raMask = mask.randomAccess();
		final RandomAccess< FloatType > raOut = out.randomAccess();

		final double[] min = new double[ numChannels ];
		final double[] max = new double[ numChannels ];
		Arrays.fill( min, Double.POSITIVE_INFINITY );
		Arrays.fill( max, Double.NEGATIVE_INFINITY );
		boolean truncated = false;

		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				raMask.setPosition( minX + x, 0 );
				raMask.setPosition( minY + y, 1 );
				final boolean inOverlap = raMask.get().get() != 0;

				final boolean useTarget;
				final double wRef;
				if ( !inOverlap )
				{
					useTarget = true; // decided per channel below
					wRef = 0;
				}
				else
				{
					switch ( blendMode )
					{
					case REFERENCE_PRIORITY:
						useTarget = false;
						wRef = 1;
						break;
					case TARGET_PRIORITY:
						useTarget = true;
						wRef = 0;
						break;
					case RANDOM_DITHER:
						useTarget = random.nextDouble() < ditherProbability;
						wRef = useTarget ? 0 : 1;
						break;
					case WEIGHTED_AVERAGE:
					default:
						useTarget = true;
						wRef = referenceWeight[ normalDim == 0 ? x : y ];
					}
				}

				raRef.setPosition( minX + x, 0 );
				raRef.setPosition( minY + y, 1 );
				raTgt.setPosition( minX + x, 0 );
				raTgt.setPosition( minY + y, 1 );
				raOut.setPosition( x, 0 );
				raOut.setPosition( y, 1 );
				for ( int c = 0; c < numChannels; ++c )
				{
					raRef.setPosition( c, 2 );
					raTgt.setPosition( c, 2 );
					raOut.setPosition( c, 2 );

					final double r = raRef.get().getRealDouble();
					final double t = raTgt.get().getRealDouble();

					double v;
					if ( !inOverlap )
						v = t != 0 ? scale[ c ] * t + offset[ c ] + gx[ c ][ x ] + gy[ c ][ y ] : r;
					else if ( !useTarget )
						v = r;
					else
					{
						final double corrected = scale[ c ] * t + offset[ c ] + gx[ c ][ x ] + gy[ c ][ y ];
						v = wRef == 0 ? corrected : wRef * r + ( 1 - wRef ) * corrected;
					}

					if ( v < min[ c ] )
						min[ c ] = v;
					if ( v > max[ c ] )
						max[ c ] = v;

					if ( truncate && ( v < 0 || v > 1 ) )
					{
						v = Math.max( 0, Math.min( 1, v ) );
						truncated = true;
					}
					raOut.get().setReal( v );
				}
			}
		}

		if ( truncated )
			LOG.warn( "truncated mosaic to [0, 1] (min = {}, max = {})", Arrays.toString( min ), Arrays.toString( max ) );

		return new Composite( out, min, max, truncated );
	}

	/**
	 * Reference weight for every position across the join, 1 at the reference
	 * side of the overlap and 0 at the target side.
	 */
	< T extends RealType< T > > double[] referenceWeights(
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask,
			final Interval box )
	{
		final int normalDim = 1 - GradientAxis.joinDimension( box );
		final boolean referenceFirst = referenceFirst( reference, target, mask, box, normalDim );

		final long min = reference.min( normalDim );
		final int n = ( int ) reference.dimension( normalDim );
		final double span = box.max( normalDim ) - box.min( normalDim );
		final double[] w = new double[ n ];
		for ( int i = 0; i < n; ++i )
		{
			final double t = span > 0 ? ( min + i - box.min( normalDim ) ) / span : 0.5;
			w[ i ] = referenceFirst ? BlendWeight.get( 1 - t ) : BlendWeight.get( t );
		}
		LOG.debug( "weighted average across {}, reference {} the target", normalDim == 0 ? "x" : "y", referenceFirst ? "before" : "after" );
		return w;
	}

	private static Interval overlapBox( final RandomAccessibleInterval< UnsignedByteType > mask )
	{
		final Interval box = SampleGrid.boundingBox( mask );
		return box == null ? mask : box;
	}

	/**
	 * Does the reference tile lie before the target tile across the join?
	 * Compares the mean position of the pixels only one of the tiles has data
	 * for. Ties (for example a full overlap) count as reference first.
	 */
	static < T extends RealType< T > > boolean referenceFirst(
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask,
			final Interval box,
			final int normalDim )
	{
		final RandomAccess< T > raRef = reference.randomAccess();
		final RandomAccess< T > raTgt = target.randomAccess();
		final RandomAccess< UnsignedByteType > raMask = mask.randomAccess();
		raRef.setPosition( 0, 2 );
		raTgt.setPosition( 0, 2 );

		double sumRef = 0, sumTgt = 0;
		long nRef = 0, nTgt = 0;
		for ( long y = reference.min( 1 ); y <= reference.max( 1 ); ++y )
		{
			for ( long x = reference.min( 0 ); x <= reference.max( 0 ); ++x )
			{
				raMask.setPosition( x, 0 );
				raMask.setPosition( y, 1 );
				if ( raMask.get().get() != 0 )
					continue;

				raRef.setPosition( x, 0 );
				raRef.setPosition( y, 1 );
				raTgt.setPosition( x, 0 );
				raTgt.setPosition( y, 1 );
				final long p = normalDim == 0 ? x : y;
				if ( raRef.get().getRealDouble() != 0 )
				{
					sumRef += p;
					++nRef;
				}
				if ( raTgt.get().getRealDouble() != 0 )
				{
					sumTgt += p;
					++nTgt;
				}
			}
		}

		final double center = ( box.min( normalDim ) + box.max( normalDim ) ) / 2.0;
		if ( nRef > 0 && nTgt > 0 )
			return sumRef / nRef <= sumTgt / nTgt;
		if ( nRef > 0 )
			return sumRef / nRef <= center;
		if ( nTgt > 0 )
			return sumTgt / nTgt >= center;
		return true;
	}
}
