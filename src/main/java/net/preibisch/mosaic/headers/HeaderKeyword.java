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

import java.util.Objects;

/**
 * A header record: name, value and comment. HISTORY records carry their text
 * in the comment and have an empty value.
 */
public final class HeaderKeyword
{
	public static final String HISTORY = "HISTORY";

	private final String name, value, comment;

	public HeaderKeyword( final String name, final String value, final String comment )
	{
		this.name = Objects.requireNonNull( name );
		this.value = value == null ? "" : value;
		this.comment = comment == null ? "" : comment;
	}

	public static HeaderKeyword history( final String text )
	{
		return new HeaderKeyword( HISTORY, "", text );
	}

	public String getName() { return name; }

	public String getValue() { return value; }

	public String getComment() { return comment; }

	public boolean isHistory() { return HISTORY.equals( name ); }

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;
		if ( !( o instanceof HeaderKeyword ) )
			return false;
		final HeaderKeyword k = ( HeaderKeyword ) o;
		return name.equals( k.name ) && value.equals( k.value ) && comment.equals( k.comment );
	}

	@Override
	public int hashCode()
	{
		return Objects.hash( name, value, comment );
	}

	@Override
	public String toString()
	{
		return isHistory() ? name + " " + comment : name + " = " + value + ( comment.isEmpty() ? "" : " / " + comment );
	}
}
