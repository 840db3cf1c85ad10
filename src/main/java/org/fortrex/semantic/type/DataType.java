package org.fortrex.semantic.type;

import java.util.Locale;

/**
 * The intrinsic data kinds a Fortran symbol can have, plus the placeholder used for names
 * that were referenced before their declaration was processed.
 */
public enum DataType
{
	INTEGER("integer"),
	REAL("real"),
	LOGICAL("logical"),
	CHARACTER("character"),
	DERIVED_TYPE("type"),
	DEFERRED("deferred");

	private final String keyword;

	DataType(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public boolean isNumeric()
	{
		return this == INTEGER || this == REAL;
	}

	/**
	 * Maps a Fortran type keyword (or the enum name itself) to its data type.
	 *
	 * @param name e.g. {@code "INTEGER"}, {@code "real"}, {@code "type"}
	 * @return the matching data type
	 * @throws IllegalArgumentException if the name is not a known type keyword
	 */
	public static DataType fromString(String name)
	{
		if (name == null)
		{
			throw new IllegalArgumentException("Type keyword must not be null.");
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (DataType type : values())
		{
			if (type.keyword.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized))
			{
				return type;
			}
		}
		if (normalized.equals("derived"))
		{
			return DERIVED_TYPE;
		}
		throw new IllegalArgumentException("Unknown type keyword: '" + name + "'.");
	}
}
