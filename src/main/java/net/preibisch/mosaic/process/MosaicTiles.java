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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import net.preibisch.mosaic.headers.HeaderLookup;
import net.preibisch.mosaic.process.stars.Star;

/**
 * The two registered tiles of a mosaic, their overlap mask and the stars
 * detected in the overlap.
 * <p>
 * Tiles are (x, y, channel); a 2-D (mono) tile gets a channel dimension of
 * size one. Both tiles must have the same dimensions and the mask must match
 * them in x and y. The ids identify the tiles in the cache and the headers.
 *
 * @param <T> pixel type
 */
public class MosaicTiles< T extends RealType< T > >
{
	private final String referenceId, targetId;

	private final RandomAccessibleInterval< T > reference, target;

	private final RandomAccessibleInterval< UnsignedByteType > mask;

	private final List< Star > stars;

	private HeaderLookup referenceHeader = HeaderLookup.empty();

	private HeaderLookup targetHeader = HeaderLookup.empty();

	private Long maskDigest;

	public MosaicTiles(
			final String referenceId,
			final RandomAccessibleInterval< T > reference,
			final String targetId,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask,
			final List< Star > stars )
	{
		if ( referenceId == null || targetId == null )
			throw new IllegalArgumentException( "tile ids must not be null" );

		this.referenceId = referenceId;
		this.targetId = targetId;
		this.reference = withChannels( reference, "reference" );
		this.target = withChannels( target, "target" );
		this.mask = mask;
		this.stars = stars == null ? Collections.emptyList() : Collections.unmodifiableList( new ArrayList<>( stars ) );

		for ( int d = 0; d < 3; ++d )
			if ( this.reference.min( d ) != this.target.min( d ) || this.reference.max( d ) != this.target.max( d ) )
				throw new IllegalArgumentException( "reference and target differ in dimension " + d );

		if ( mask.numDimensions() != 2 )
			throw new IllegalArgumentException( "mask must be 2-D, has " + mask.numDimensions() + " dimensions" );

		for ( int d = 0; d < 2; ++d )
			if ( mask.min( d ) != this.reference.min( d ) || mask.max( d ) != this.reference.max( d ) )
				throw new IllegalArgumentException( "mask does not match the tiles in dimension " + d );
	}

	public MosaicTiles(
			final String referenceId,
			final RandomAccessibleInterval< T > reference,
			final String targetId,
			final RandomAccessibleInterval< T > target,
			final RandomAccessibleInterval< UnsignedByteType > mask )
	{
		this( referenceId, reference, targetId, target, mask, null );
	}

	private static < T extends RealType< T > > RandomAccessibleInterval< T > withChannels( final RandomAccessibleInterval< T > img, final String name )
	{
		if ( img.numDimensions() == 2 )
			return Views.addDimension( img, 0, 0 );
		if ( img.numDimensions() == 3 )
			return img;
		throw new IllegalArgumentException( name + " must be (x, y) or (x, y, channel), has " + img.numDimensions() + " dimensions" );
	}

	public MosaicTiles< T > setHeaders( final HeaderLookup reference, final HeaderLookup target )
	{
		this.referenceHeader = reference == null ? HeaderLookup.empty() : reference;
		this.targetHeader = target == null ? HeaderLookup.empty() : target;
		return this;
	}

	public String getReferenceId() { return referenceId; }

	public String getTargetId() { return targetId; }

	public RandomAccessibleInterval< T > getReference() { return reference; }

	public RandomAccessibleInterval< T > getTarget() { return target; }

	public RandomAccessibleInterval< UnsignedByteType > getMask() { return mask; }

	public List< Star > getStars() { return stars; }

	public HeaderLookup getReferenceHeader() { return referenceHeader; }

	public HeaderLookup getTargetHeader() { return targetHeader; }

	public int numChannels() { return ( int ) reference.dimension( 2 ); }

	/**
	 * Hash of which pixels of the mask are set, computed on first use. The
	 * mask must not change afterwards.
	 */
	public synchronized long getMaskDigest()
	{
		if ( maskDigest == null )
			maskDigest = digest( mask );
		return maskDigest;
	}

	static long digest( final RandomAccessibleInterval< UnsignedByteType > mask )
	{
		// FNV-1a over the overlap flags
		long hash = 0xcbf29ce484222325L;
		for ( final UnsignedByteType t : Views.flatIterable( mask ) )
		{
			hash ^= t.get() == 0 ? 0 : 1;
			hash *= 0x100000001b3L;
		}
		return hash;
	}
}
