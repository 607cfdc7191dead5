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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.FinalInterval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.preibisch.mosaic.exception.InsufficientDataException;
import net.preibisch.mosaic.process.MosaicParameters;
import net.preibisch.mosaic.process.stars.Star;
import net.preibisch.mosaic.process.stars.StarSelection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the overlap of two tiles to one {@link SamplePair} per grid cell.
 * <p>
 * Only one cell's pixel values are held in memory at a time.
 */
public class SampleGridBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger( SampleGridBuilder.class );

	private final MosaicParameters params;

	private final PixelRejection rejection;

	public SampleGridBuilder( final MosaicParameters params )
	{
		this( params, PixelRejection.intensityRange( params.minIntensity, params.maxIntensity ) );
	}

	public SampleGridBuilder( final MosaicParameters params, final PixelRejection rejection )
	{
		this.params = params;
		this.rejection = rejection;
	}

	/**
	 * @param reference reference tile (x, y, channel)
	 * @param target target tile, same dimensions as reference
	 * @param mask overlap mask (x, y), non-zero inside the overlap
	 * @param stars detected stars to keep out of the samples, may be empty
	 * @return unmodifiable samples in row-major cell order, binned if there are more than {@code maxSamples}
	 * @throws InsufficientDataException if the mask is empty
	 */
	public < T extends RealType< T > > List< SamplePair > build(
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask,
			final List< Star > stars ) throws InsufficientDataException
	{
		final FinalInterval box = SampleGrid.boundingBox( mask );
		if ( box == null )
			throw new InsufficientDataException( "samples", -1, "overlap mask is empty", null );

		final SampleGrid grid = new SampleGrid( box, params.cellSize );
		if ( !stars.isEmpty() )
			grid.removeCellsWithStars( StarSelection.brightest( stars, params.limitSampleStarsPercent ), params.starRadiusGrowth );

		final List< SamplePair > samples = sample( grid, reference, target, mask );
		LOG.debug( "{} samples from {}x{} grid over {}", samples.size(), grid.numColumns(), grid.numRows(), box );

		if ( params.maxSamples > 0 && samples.size() > params.maxSamples )
		{
			final List< SamplePair > binned = SampleBinning.limit( samples, box, params.cellSize, params.maxSamples, params.minJoinThickness );
			LOG.debug( "binned {} samples into {}", samples.size(), binned.size() );
			return Collections.unmodifiableList( binned );
		}
		return Collections.unmodifiableList( samples );
	}

	public < T extends RealType< T > > List< SamplePair > sample(
			final SampleGrid grid,
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask )
	{
		final int numChannels = ( int ) reference.dimension( 2 );
		final int cellSize = grid.getCellSize();

		// one cell at a time
		final double[] refValues = new double[ cellSize * cellSize ];
		final double[] tgtValues = new double[ cellSize * cellSize ];

		final RandomAccess< T > raRef = reference.randomAccess();
		final RandomAccess< T > raTgt = target.randomAccess();
		final RandomAccess< UnsignedByteType > raMask = mask.randomAccess();

		final List< SamplePair > samples = new ArrayList<>();
		for ( int yKey = 0; yKey < grid.numRows(); ++yKey )
		{
			for ( int xKey = 0; xKey < grid.numColumns(); ++xKey )
			{
				if ( grid.isRemoved( xKey, yKey ) )
					continue;

				final FinalInterval cell = grid.cell( xKey, yKey );
				final double[] refMedian = new double[ numChannels ];
				final double[] tgtMedian = new double[ numChannels ];
				final int[] count = new int[ numChannels ];
				final boolean[] valid = new boolean[ numChannels ];
				boolean inMask = false;

				for ( int c = 0; c < numChannels; ++c )
				{
					raRef.setPosition( c, 2 );
					raTgt.setPosition( c, 2 );

					int n = 0;
					boolean rejected = false;

					A:
					for ( long y = cell.min( 1 ); y <= cell.max( 1 ); ++y )
					{
						for ( long x = cell.min( 0 ); x <= cell.max( 0 ); ++x )
						{
							raMask.setPosition( x, 0 );
							raMask.setPosition( y, 1 );
							if ( raMask.get().get() == 0 )
								continue;

							inMask = true;
							raRef.setPosition( x, 0 );
							raRef.setPosition( y, 1 );
							raTgt.setPosition( x, 0 );
							raTgt.setPosition( y, 1 );
							final double r = raRef.get().getRealDouble();
							final double t = raTgt.get().getRealDouble();
							if ( rejection.reject( r, t ) )
							{
								rejected = true;
								break A;
							}
							refValues[ n ] = r;
							tgtValues[ n ] = t;
							++n;
						}
					}

					count[ c ] = n;
					if ( rejected || n < params.minPixelsPerCell )
					{
						refMedian[ c ] = Double.NaN;
						tgtMedian[ c ] = Double.NaN;
						continue;
					}

					valid[ c ] = true;
					refMedian[ c ] = params.sampleStatistic.reduce( refValues, n, params.clipSigma, params.clipIterations );
					tgtMedian[ c ] = params.sampleStatistic.reduce( tgtValues, n, params.clipSigma, params.clipIterations );
				}

				if ( !inMask )
					continue;

				final SamplePair pair = new SamplePair(
						cell,
						( cell.min( 0 ) + cell.max( 0 ) ) / 2.0,
						( cell.min( 1 ) + cell.max( 1 ) ) / 2.0,
						refMedian, tgtMedian, count, valid, 1 );
				if ( pair.isValid() )
					samples.add( pair );
			}
		}
		return samples;
	}

	/**
	 * @return the samples that are valid for {@code channel}, in their original order
	 */
	public static List< SamplePair > valid( final List< SamplePair > samples, final int channel )
	{
		final List< SamplePair > valid = new ArrayList<>( samples.size() );
		for ( final SamplePair sample : samples )
			if ( sample.isValid( channel ) )
				valid.add( sample );
		return Collections.unmodifiableList( valid );
	}
}
