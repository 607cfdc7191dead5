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
import java.util.List;

import net.imglib2.FinalInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.preibisch.mosaic.exception.DegenerateFitException;
import net.preibisch.mosaic.exception.DegenerateIntervalException;
import net.preibisch.mosaic.exception.InsufficientDataException;
import net.preibisch.mosaic.exception.MosaicException;
import net.preibisch.mosaic.headers.HeaderKeyword;
import net.preibisch.mosaic.headers.MosaicHeaders;
import net.preibisch.mosaic.process.cache.Fingerprint;
import net.preibisch.mosaic.process.cache.ResultCache;
import net.preibisch.mosaic.process.fit.FlattenedSamples;
import net.preibisch.mosaic.process.fit.LinearFit;
import net.preibisch.mosaic.process.fit.RobustLinearFit;
import net.preibisch.mosaic.process.fusion.MosaicCompositor;
import net.preibisch.mosaic.process.gradient.GradientModeler;
import net.preibisch.mosaic.process.gradient.GradientSurface;
import net.preibisch.mosaic.process.sampling.SampleGrid;
import net.preibisch.mosaic.process.sampling.SampleGridBuilder;
import net.preibisch.mosaic.process.sampling.SamplePair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Photometric correction and blending of a target tile onto a reference tile.
 * <p>
 * For every channel: sample the overlap, fit {@code reference = scale * target + offset},
 * model the remaining gradient, then composite all channels. Samples and fits
 * are cached, so re-running with changed blending or gradient options reuses
 * them. Apart from the caches an instance holds no state, channels may be
 * computed one at a time with {@link #computeChannel}.
 */
public class PhotometricMosaic
{
	private static final Logger LOG = LoggerFactory.getLogger( PhotometricMosaic.class );

	private final ResultCache< Fingerprint, List< SamplePair > > sampleCache;

	private final ResultCache< Fingerprint, LinearFit > fitCache;

	public PhotometricMosaic()
	{
		this( new MosaicParameters() );
	}

	/**
	 * @param params only {@code cacheCapacity} is used, the options of a
	 *        computation are passed to each call
	 */
	public PhotometricMosaic( final MosaicParameters params )
	{
		this( params.validate().cacheCapacity );
	}

	/**
	 * @param cacheCapacity number of sample sets, and of fits, kept in memory
	 */
	public PhotometricMosaic( final int cacheCapacity )
	{
		this.sampleCache = new ResultCache<>( cacheCapacity );
		this.fitCache = new ResultCache<>( cacheCapacity );
	}

	/**
	 * @return samples of all channels, cached
	 */
	public < T extends RealType< T > > List< SamplePair > samples( final MosaicTiles< T > tiles, final MosaicParameters params ) throws InsufficientDataException
	{
		params.validate();
		return sampleCache.getOrCompute( sampleFingerprint( tiles, params ), () ->
		{
			final List< SamplePair > samples = new SampleGridBuilder( params ).build(
					tiles.getReference(), tiles.getTarget(), tiles.getMask(), tiles.getStars() );
			LOG.info( "{} samples in the overlap of {} and {}", samples.size(), tiles.getReferenceId(), tiles.getTargetId() );
			return samples;
		} );
	}

	/**
	 * Robust fit of one channel, cached. Falls back to an offset only fit if
	 * the samples cannot determine a scale.
	 */
	public < T extends RealType< T > > LinearFit fit( final MosaicTiles< T > tiles, final MosaicParameters params, final int channel ) throws MosaicException
	{
		final List< SamplePair > samples = samples( tiles, params );
		final Fingerprint key = sampleFingerprint( tiles, params ).with( "fit", channel, params.rejectionSigma, params.maxRejectionIterations, params.minFitSamples );
		return fitCache.getOrCompute( key, () -> fit( samples, params, channel ) );
	}

	static LinearFit fit( final List< SamplePair > samples, final MosaicParameters params, final int channel ) throws MosaicException
	{
		final List< SamplePair > valid = SampleGridBuilder.valid( samples, channel );
		if ( valid.isEmpty() )
			throw new InsufficientDataException( "fit", channel, "no valid samples in the overlap", null );

		final FlattenedSamples flat = FlattenedSamples.of( valid, channel );
		final RobustLinearFit engine = new RobustLinearFit( params.rejectionSigma, params.maxRejectionIterations, params.minFitSamples );
		try
		{
			final LinearFit fit = engine.fit( flat );
			LOG.info( "channel {}: {}", channel, fit );
			return fit;
		}
		catch ( final DegenerateFitException e )
		{
			LOG.warn( "channel {}: {}, using an offset only", channel, e.getMessage() );
			return RobustLinearFit.offsetOnly( flat, e.getMessage() );
		}
		catch ( final InsufficientDataException e )
		{
			throw new InsufficientDataException( "fit", channel, e.getMessage(), e );
		}
	}

	/**
	 * Samples, fit and gradient of one channel.
	 */
	public < T extends RealType< T > > ChannelDiagnostics computeChannel( final MosaicTiles< T > tiles, final MosaicParameters params, final int channel ) throws MosaicException
	{
		if ( channel < 0 || channel >= tiles.numChannels() )
			throw new IllegalArgumentException( "channel " + channel + " out of range [0, " + tiles.numChannels() + ")" );

		final LinearFit fit = fit( tiles, params, channel );
		final List< SamplePair > valid = SampleGridBuilder.valid( samples( tiles, params ), channel );

		final FinalInterval overlap = SampleGrid.boundingBox( tiles.getMask() );
		final GradientSurface surface;
		try
		{
			surface = new GradientModeler( params.gradientAxis, params.gradientSections ).model( valid, channel, fit, overlap );
		}
		catch ( final InsufficientDataException e )
		{
			throw new InsufficientDataException( "gradient", channel, e.getMessage(), e );
		}
		catch ( final DegenerateIntervalException e )
		{
			throw new DegenerateIntervalException( "gradient", channel, e.getMessage(), e );
		}

		LOG.debug( "channel {}: gradient {}", channel, surface );
		return new ChannelDiagnostics( channel, fit, surface, valid.size() );
	}

	/**
	 * All channels and the composite.
	 */
	public < T extends RealType< T > > MosaicResult compute( final MosaicTiles< T > tiles, final MosaicParameters params ) throws MosaicException
	{
		params.validate();

		final List< String > warnings = MosaicHeaders.inconsistencies( tiles.getReferenceHeader(), tiles.getTargetHeader() );

		final int numChannels = tiles.numChannels();
		final List< ChannelDiagnostics > channels = new ArrayList<>( numChannels );
		final List< LinearFit > fits = new ArrayList<>( numChannels );
		final List< GradientSurface > surfaces = new ArrayList<>( numChannels );
		for ( int c = 0; c < numChannels; ++c )
		{
			final ChannelDiagnostics diagnostics = computeChannel( tiles, params, c );
			channels.add( diagnostics );
			fits.add( diagnostics.getFit() );
			surfaces.add( diagnostics.getSurface() );
		}

		final MosaicCompositor.Composite composite = new MosaicCompositor( params.blendMode, params.ditherProbability, params.ditherSeed, params.truncate )
				.composite( tiles.getReference(), tiles.getTarget(), tiles.getMask(), fits, surfaces );

		for ( int c = 0; c < numChannels; ++c )
			channels.set( c, channels.get( c ).withOutputRange( composite.getMin( c ), composite.getMax( c ) ) );

		final List< HeaderKeyword > keywords = new ArrayList<>( MosaicHeaders.observation( tiles.getReferenceHeader() ) );
		keywords.addAll( MosaicHeaders.history( tiles.getReferenceId(), tiles.getTargetId(), params, fits, surfaces ) );

		LOG.info( "mosaic of {} and {} using {}", tiles.getReferenceId(), tiles.getTargetId(), params.blendMode );
		return new MosaicResult( composite.getImage(), params.blendMode, channels, keywords, warnings, composite.isTruncated() );
	}

	/**
	 * Drops all cached samples and fits, e.g. after the tiles changed on disk.
	 */
	public void invalidate()
	{
		sampleCache.invalidateAll();
		fitCache.invalidateAll();
	}

	ResultCache< Fingerprint, List< SamplePair > > getSampleCache() { return sampleCache; }

	ResultCache< Fingerprint, LinearFit > getFitCache() { return fitCache; }

	static < T extends RealType< T > > Fingerprint sampleFingerprint( final MosaicTiles< T > tiles, final MosaicParameters params )
	{
		return Fingerprint.of(
				"samples",
				tiles.getReferenceId(),
				tiles.getTargetId(),
				Intervals.minAsLongArray( tiles.getReference() ),
				Intervals.maxAsLongArray( tiles.getReference() ),
				tiles.getMaskDigest(),
				tiles.getStars(),
				params.cellSize,
				params.sampleStatistic,
				params.clipSigma,
				params.clipIterations,
				params.minPixelsPerCell,
				params.minIntensity,
				params.maxIntensity,
				params.limitSampleStarsPercent,
				params.starRadiusGrowth,
				params.maxSamples,
				params.minJoinThickness );
	}
}
