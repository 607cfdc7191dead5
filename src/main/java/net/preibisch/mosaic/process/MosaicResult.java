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

import java.util.Collections;
import java.util.List;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.mosaic.headers.HeaderKeyword;
import net.preibisch.mosaic.process.fusion.BlendMode;

/**
 * The mosaic (x, y, channel) and how it was made. Owned by the caller.
 */
public class MosaicResult
{
	private final Img< FloatType > image;

	private final BlendMode blendMode;

	private final List< ChannelDiagnostics > channels;

	private final List< HeaderKeyword > keywords;

	private final List< String > warnings;

	private final boolean truncated;

	public MosaicResult(
			final Img< FloatType > image,
			final BlendMode blendMode,
			final List< ChannelDiagnostics > channels,
			final List< HeaderKeyword > keywords,
			final List< String > warnings,
			final boolean truncated )
	{
		this.image = image;
		this.blendMode = blendMode;
		this.channels = Collections.unmodifiableList( channels );
		this.keywords = Collections.unmodifiableList( keywords );
		this.warnings = Collections.unmodifiableList( warnings );
		this.truncated = truncated;
	}

	public Img< FloatType > getImage() { return image; }

	public BlendMode getBlendMode() { return blendMode; }

	public List< ChannelDiagnostics > getChannels() { return channels; }

	public ChannelDiagnostics getChannel( final int c ) { return channels.get( c ); }

	public List< HeaderKeyword > getKeywords() { return keywords; }

	/**
	 * @return header inconsistencies between the tiles, e.g. different filters
	 */
	public List< String > getWarnings() { return warnings; }

	public boolean isTruncated() { return truncated; }
}
