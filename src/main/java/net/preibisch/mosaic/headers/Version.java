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

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Version
{
	private static final Logger LOG = LoggerFactory.getLogger( Version.class );

	final static String notFound = "unknown";

	private Version() {}

	public static String getJARFile()
	{
		final CodeSource source = Version.class.getProtectionDomain().getCodeSource();
		if ( source == null || source.getLocation() == null )
			return "";

		try
		{
			return new File( source.getLocation().toURI().getPath() ).getName().trim();
		}
		catch ( URISyntaxException e )
		{
			LOG.debug( "cannot locate the jar file", e );
			return "";
		}
	}

	/**
	 * @return implementation version from the manifest, else parsed from the
	 *         jar name (e.g. photometric-mosaic-1.0.0.jar), else "unknown"
	 */
	public static String getVersion()
	{
		final String implementation = Version.class.getPackage() == null ? null : Version.class.getPackage().getImplementationVersion();
		if ( implementation != null )
			return implementation;

		final String name = getJARFile();

		if ( name.length() == 0 || !name.endsWith( ".jar" ) )
			return notFound;

		// the version starts after the last dash followed by a digit
		int start = -1;
		for ( int i = 0; i < name.length() - 1; ++i )
			if ( name.charAt( i ) == '-' && Character.isDigit( name.charAt( i + 1 ) ) )
				start = i + 1;
		final int end = name.length() - 4;

		if ( start < 0 || end <= start )
			return notFound;
		else
			return name.substring( start, end );
	}
}
