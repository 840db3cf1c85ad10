package org.fortrex.util;

import org.fortrex.expression.Expression;
import org.fortrex.expression.RangeIndex;
import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A symbol declared on the command line as {@code NAME=TYPE[:KIND][(rank)]}, e.g.
 * {@code ZA=real:JPRB(2)} for an assumed-shape rank-2 real array. For {@code type} the
 * part after the colon is the derived type name.
 */
public record SymbolDeclaration(
		String name,
		DataType dataType,
		String kind, // Null when no kind was given
		int rank // 0 for scalars
)
{
	private static final Pattern FORMAT = Pattern.compile("(\\w+)=(\\w+)(?::(\\w+))?(?:\\((\\d+)\\))?");

	public static SymbolDeclaration parse(String text)
	{
		Matcher m = FORMAT.matcher(text.trim());
		if (!m.matches())
		{
			throw new IllegalArgumentException("Invalid declaration '" + text + "', expected NAME=TYPE[:KIND][(rank)]");
		}
		DataType dataType = DataType.fromString(m.group(2));
		int rank = m.group(4) == null ? 0 : Integer.parseInt(m.group(4));
		return new SymbolDeclaration(m.group(1), dataType, m.group(3), rank);
	}

	public SymbolType toSymbolType()
	{
		SymbolType type;
		if (dataType == DataType.DERIVED_TYPE)
		{
			type = SymbolType.derived(kind, Map.of());
		}
		else
		{
			type = SymbolType.of(dataType, kind);
		}
		if (rank == 0)
		{
			return type;
		}
		List<Expression> shape = new ArrayList<>();
		for (int i = 0; i < rank; i++)
		{
			shape.add(RangeIndex.all());
		}
		return type.withShape(shape);
	}
}
