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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.function.Consumer;

import org.junit.Test;

import net.preibisch.mosaic.exception.InvalidConfigurationException;
import net.preibisch.mosaic.process.fusion.BlendMode;

public class MosaicParametersTest
{
	@Test
	public void defaultsAreValid()
	{
		final MosaicParameters params = new MosaicParameters();
		assertSame( params, params.validate() );
	}

	private static void assertInvalid( final String option, final Consumer< MosaicParameters > change )
	{
		final MosaicParameters params = new MosaicParameters();
		change.accept( params );
		try
		{
			params.validate();
			fail( option + " should be rejected" );
		}
		catch ( final InvalidConfigurationException e )
		{
			assertEquals( option, e.getOption() );
		}
	}

	@Test
	public void outOfRangeOptions()
	{
		assertInvalid( "cellSize", p -> p.cellSize = 0 );
		assertInvalid( "clipSigma", p -> p.clipSigma = Double.NaN );
		assertInvalid( "minPixelsPerCell", p -> p.minPixelsPerCell = 0 );
		assertInvalid( "maxIntensity", p -> p.maxIntensity = -1 );
		assertInvalid( "limitSampleStarsPercent", p -> p.limitSampleStarsPercent = 101 );
		assertInvalid( "maxSamples", p -> p.maxSamples = -1 );
		assertInvalid( "rejectionSigma", p -> p.rejectionSigma = 0 );
		assertInvalid( "minFitSamples", p -> p.minFitSamples = 2 );
		assertInvalid( "gradientSections", p -> p.gradientSections = 3 );
		assertInvalid( "blendMode", p -> p.blendMode = null );
		assertInvalid( "ditherProbability", p -> p.ditherProbability = 1.5 );
		assertInvalid( "cacheCapacity", p -> p.cacheCapacity = 0 );
	}

	@Test
	public void copyIsIndependent()
	{
		final MosaicParameters params = new MosaicParameters();
		params.blendMode = BlendMode.RANDOM_DITHER;
		params.maxIntensity = 0.9;

		final MosaicParameters copy = params.copy();
		assertNotSame( params, copy );
		assertEquals( BlendMode.RANDOM_DITHER, copy.blendMode );
		assertEquals( 0.9, copy.maxIntensity, 0 );

		copy.cellSize = 7;
		assertEquals( 20, params.cellSize );
	}

	@Test
	public void toStringListsEveryOption() throws IllegalAccessException
	{
		final MosaicParameters params = new MosaicParameters();
		params.ditherSeed = 4711;
		params.truncate = true;
		final String s = params.toString();

		for ( final Field field : MosaicParameters.class.getFields() )
			if ( !Modifier.isStatic( field.getModifiers() ) )
				assertTrue( s + " lacks " + field.getName(), s.contains( field.getName() + "=" + field.get( params ) ) );
	}
}
