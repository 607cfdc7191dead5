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

import net.preibisch.mosaic.exception.DegenerateFitException;
import net.preibisch.mosaic.exception.InsufficientDataException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least squares fit of {@code reference = scale * target + offset} with
 * iterative sigma rejection of outliers.
 * <p>
 * After each fit the spread of the residuals is estimated as
 * {@link ResidualStatistic#MAD_TO_SIGMA} times their median absolute
 * deviation, and samples whose residual deviates from the median residual by
 * more than {@code rejectionSigma} times the spread are rejected. Stops when
 * nothing is rejected, when the fit is exact, after
 * {@code maxIterations}, or when fewer than {@code minSamples} would remain
 * (the last fit is kept then).
 */
public class RobustLinearFit
{
	private static final Logger LOG = LoggerFactory.getLogger( RobustLinearFit.class );

	/**
	 * relative threshold below which the target variance counts as zero
	 */
	static final double VARIANCE_EPSILON = 1e-12;

	/**
	 * relative threshold below which the normal equations count as singular
	 */
	static final double SINGULAR_EPSILON = 1e-14;

	/**
	 * relative threshold below which the residual spread counts as zero (exact fit)
	 */
	static final double SPREAD_EPSILON = 1e-12;

	private final double rejectionSigma;

	private final int maxIterations;

	private final int minSamples;

	/**
	 * @param rejectionSigma reject samples farther than this many spreads from the median residual
	 * @param maxIterations maximal number of reject-and-refit rounds
	 * @param minSamples minimal number of samples to fit (and to keep when rejecting), at least 3
	 */
	public RobustLinearFit( final double rejectionSigma, final int maxIterations, final int minSamples )
	{
		if ( !( rejectionSigma > 0 ) )
			throw new IllegalArgumentException( "rejectionSigma must be > 0" );
		if ( maxIterations < 0 )
			throw new IllegalArgumentException( "maxIterations must be >= 0" );
		if ( minSamples < 3 )
			throw new IllegalArgumentException( "minSamples must be >= 3" );

		this.rejectionSigma = rejectionSigma;
		this.maxIterations = maxIterations;
		this.minSamples = minSamples;
	}

	public LinearFit fit( final FlattenedSamples samples ) throws InsufficientDataException, DegenerateFitException
	{
		final int n = samples.size();
		if ( n == 0 )
			throw new InsufficientDataException( "no samples to fit" );

		checkVariance( samples );

		if ( n < minSamples )
			throw new InsufficientDataException( n + " samples are not enough to fit, at least " + minSamples + " required" );

		final SampleIndices inliers = SampleIndices.all( n );
		final SampleIndices candidates = new SampleIndices( n );
		final ResidualStatistic residuals = new ResidualStatistic( n );

		double[] model = fit( samples, inliers );

		for ( int iteration = 0; iteration < maxIterations; ++iteration )
		{
			residuals( samples, inliers, model, residuals );
			final double spread = residuals.getSpread();
			if ( spread <= SPREAD_EPSILON * Math.max( meanAbsReference( samples, inliers ), Double.MIN_NORMAL ) )
			{
				LOG.debug( "exact fit after {} iterations", iteration );
				break;
			}

			final double median = residuals.getMedian();
			final double t = rejectionSigma * spread;
			final int[] in = inliers.indices();
			final int[] out = candidates.indices();
			int j = 0;
			for ( int i = 0; i < inliers.size(); ++i )
				if ( Math.abs( residuals.get( i ) - median ) <= t )
					out[ j++ ] = in[ i ];
			candidates.setSize( j );

			if ( j == inliers.size() )
				break;

			if ( j < minSamples )
			{
				LOG.debug( "rejection would leave {} < {} samples, keeping last fit", j, minSamples );
				break;
			}

			final double[] refit;
			try
			{
				refit = fit( samples, candidates );
			}
			catch ( final DegenerateFitException e )
			{
				LOG.debug( "refit without {} outliers is degenerate, keeping last fit", inliers.size() - j );
				break;
			}

			LOG.debug( "iteration {}: rejected {} samples, scale {} -> {}", iteration, inliers.size() - j, model[ 0 ], refit[ 0 ] );
			inliers.set( candidates );
			model = refit;
		}

		if ( !( model[ 0 ] > 0 ) )
			throw new DegenerateFitException( "fitted scale " + model[ 0 ] + " is not positive" );

		residuals( samples, inliers, model, residuals );
		return LinearFit.valid( model[ 0 ], model[ 1 ], residuals.getRMS(), inliers.toArray(), inliers.complement( n ) );
	}

	/**
	 * {@code scale = 1}, {@code offset = median( reference - target )}.
	 */
	public static LinearFit offsetOnly( final FlattenedSamples samples, final String reason ) throws InsufficientDataException
	{
		final int n = samples.size();
		if ( n == 0 )
			throw new InsufficientDataException( "no samples to determine an offset" );

		final ResidualStatistic difference = new ResidualStatistic( n );
		for ( int i = 0; i < n; ++i )
			difference.add( samples.q()[ i ] - samples.p()[ i ] );

		final double offset = difference.getMedian();
		final ResidualStatistic residuals = new ResidualStatistic( n );
		for ( int i = 0; i < n; ++i )
			residuals.add( difference.get( i ) - offset );

		return LinearFit.offsetOnly( offset, residuals.getRMS(), n, reason );
	}

	/**
	 * @throws DegenerateFitException if the target values have (numerically) zero variance
	 */
	static void checkVariance( final FlattenedSamples samples ) throws DegenerateFitException
	{
		final int n = samples.size();
		final double[] p = samples.p();
		final double[] w = samples.w();
		final boolean weighted = samples.weighted();

		double W = 0;
		double mean = 0;
		for ( int i = 0; i < n; ++i )
		{
			final double w_i = weighted ? w[ i ] : 1;
			W += w_i;
			mean += w_i * p[ i ];
		}
		mean /= W;

		double var = 0;
		for ( int i = 0; i < n; ++i )
		{
			final double d = p[ i ] - mean;
			var += ( weighted ? w[ i ] : 1 ) * d * d;
		}
		var /= W;

		if ( var <= VARIANCE_EPSILON * Math.max( mean * mean, Double.MIN_NORMAL ) )
			throw new DegenerateFitException( "target values have zero variance (mean " + mean + "), cannot determine scale" );
	}

	/**
	 * @return {scale, offset}
	 */
	static double[] fit( final FlattenedSamples samples, final SampleIndices indices ) throws DegenerateFitException
	{
		final double[] p = samples.p();
		final double[] q = samples.q();
		final double[] w = samples.w();

		final int size = indices.size();
		final int[] idx = indices.indices();

		double W = 0;
		double S_p = 0;
		double S_q = 0;
		double S_pp = 0;
		double S_pq = 0;

		for ( int i = 0; i < size; i++ )
		{
			final int k = idx[ i ];
			final double p_i = p[ k ];
			final double q_i = q[ k ];
			final double w_i = samples.weighted() ? w[ k ] : 1;
			W += w_i;
			S_p += w_i * p_i;
			S_q += w_i * q_i;
			S_pp += w_i * p_i * p_i;
			S_pq += w_i * p_i * q_i;
		}

		return solve( W, S_p, S_q, S_pp, S_pq );
	}

	/**
	 * Solve the normal equations of the weighted least squares line.
	 *
	 * @throws DegenerateFitException if {@code W * S_pp - S_p^2} is within
	 *         {@link #SINGULAR_EPSILON} of zero relative to {@code W * S_pp}
	 */
	static double[] solve( final double W, final double S_p, final double S_q, final double S_pp, final double S_pq ) throws DegenerateFitException
	{
		final double a = W * S_pp - S_p * S_p;
		if ( !( W > 0 ) || a <= SINGULAR_EPSILON * Math.max( Math.abs( W * S_pp ), Double.MIN_NORMAL ) )
			throw new DegenerateFitException( "normal equations are singular (denominator " + a + ")" );

		final double scale = ( W * S_pq - S_p * S_q ) / a;
		final double offset = ( S_q - scale * S_p ) / W;
		return new double[] { scale, offset };
	}

	private static void residuals( final FlattenedSamples samples, final SampleIndices indices, final double[] model, final ResidualStatistic residuals )
	{
		residuals.clear();
		final double[] p = samples.p();
		final double[] q = samples.q();
		final int[] idx = indices.indices();
		for ( int i = 0; i < indices.size(); ++i )
		{
			final int k = idx[ i ];
			residuals.add( q[ k ] - ( model[ 0 ] * p[ k ] + model[ 1 ] ) );
		}
	}

	private static double meanAbsReference( final FlattenedSamples samples, final SampleIndices indices )
	{
		final double[] q = samples.q();
		final int[] idx = indices.indices();
		double sum = 0;
		for ( int i = 0; i < indices.size(); ++i )
			sum += Math.abs( q[ idx[ i ] ] );
		return indices.size() == 0 ? 0 : sum / indices.size();
	}
}
