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
package net.preibisch.mosaic.headers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import net.preibisch.mosaic.process.MosaicParameters;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.gradient.GradientSurface;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the header records describing how a mosaic was made.
 */
public class MosaicHeaders
{
	private static final Logger LOG = LoggerFactory.getLogger( MosaicHeaders.class );

	public static final String NAME = "PhotometricMosaic";

	/**
	 * Observation keywords copied from the reference header. RA and DEC are
	 * left out since they do not describe the mosaic.
	 */
	public static final List< String > OBSERVATION_KEYWORDS = Collections.unmodifiableList( Arrays.asList(
			"OBSERVER", "INSTRUME", "IMAGETYP", "FILTER", "XPIXSZ", "YPIXSZ", "XBINNING", "YBINNING",
			"TELESCOP", "FOCALLEN", "OBJECT", "DATE-OBS", "DATE-END", "OBSGEO-H", "ALT-OBS" ) );

	/**
	 * Keywords that should agree between the tiles of a mosaic.
	 */
	public static final List< String > CONSISTENCY_KEYWORDS = Collections.unmodifiableList( Arrays.asList( "FILTER", "EXPTIME", "XBINNING", "YBINNING" ) );

	private MosaicHeaders() {}

	public static List< HeaderKeyword > observation( final HeaderLookup reference )
	{
		final ArrayList< HeaderKeyword > keywords = new ArrayList<>();
		for ( final String key : OBSERVATION_KEYWORDS )
			reference.value( key ).ifPresent( v -> keywords.add( new HeaderKeyword( key, v, "" ) ) );
		return keywords;
	}

	/**
	 * @return one message per keyword present in both headers with different values
	 */
	public static List< String > inconsistencies( final HeaderLookup reference, final HeaderLookup target )
	{
		final ArrayList< String > messages = new ArrayList<>();
		for ( final String key : CONSISTENCY_KEYWORDS )
		{
			final Optional< String > r = reference.value( key );
			final Optional< String > t = target.value( key );
			if ( r.isPresent() && t.isPresent() && !r.get().trim().equals( t.get().trim() ) )
			{
				final String message = key + " differs: reference '" + r.get().trim() + "', target '" + t.get().trim() + "'";
				LOG.warn( message );
				messages.add( message );
			}
		}
		return messages;
	}

	public static List< HeaderKeyword > history(
			final String referenceId,
			final String targetId,
			final MosaicParameters params,
			final List< LinearFit > fits,
			final List< GradientSurface > surfaces )
	{
		final ArrayList< HeaderKeyword > keywords = new ArrayList<>();
		keywords.add( HeaderKeyword.history( NAME + " " + Version.getVersion() ) );
		keywords.add( record( "ref", referenceId ) );
		keywords.add( record( "tgt", targetId ) );
		keywords.add( record( "sampleSize", params.cellSize ) );
		keywords.add( record( "sampleStatistic", params.sampleStatistic ) );
		keywords.add( record( "limitSampleStarsPercent", params.limitSampleStarsPercent ) );
		if ( params.hasMaxIntensity() )
			keywords.add( record( "maxIntensity", params.maxIntensity ) );
		if ( params.maxSamples > 0 )
			keywords.add( record( "maxSamples", params.maxSamples ) );
		keywords.add( record( "rejectionSigma", params.rejectionSigma ) );
		keywords.add( record( "gradientAxis", params.gradientAxis ) );
		if ( params.gradientSections > 0 )
			keywords.add( record( "gradientSections", params.gradientSections ) );
		keywords.add( record( "combinationMode", params.blendMode ) );
		if ( params.truncate )
			keywords.add( record( "truncate", true ) );

		for ( int c = 0; c < fits.size(); ++c )
		{
			final LinearFit fit = fits.get( c );
			keywords.add( record( "scale[" + c + "]", precision( fit.getScale() ) ) );
			keywords.add( record( "offset[" + c + "]", precision( fit.getOffset() ) ) );
			if ( fit.isOffsetOnly() )
				keywords.add( record( "offsetOnly[" + c + "]", fit.getReason() ) );
			if ( surfaces != null && c < surfaces.size() && !surfaces.get( c ).isZero() )
				keywords.add( record( "gradient[" + c + "]", surfaces.get( c ) ) );
		}
		return keywords;
	}

	static HeaderKeyword record( final String key, final Object value )
	{
		return HeaderKeyword.history( NAME + "." + key + ": " + value );
	}

	static String precision( final double value )
	{
		return String.format( Locale.ROOT, "%.5g", value );
	}
}
