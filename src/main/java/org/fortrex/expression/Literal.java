package org.fortrex.expression;

import org.fortrex.parser.ExpressionParser;
import org.fortrex.parser.ExpressionSyntaxException;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.DataType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Factory that turns raw constant values into the matching literal node.
 * <p>
 * The result is an {@link IntLiteral}, {@link FloatLiteral}, {@link LogicLiteral} or
 * {@link StringLiteral}. Text that is none of these is handed to the {@link ExpressionParser};
 * if that yields an elementary literal it is re-tagged with the requested kind, a compound
 * expression is returned as parsed.
 */
public final class Literal
{
	private static final Pattern INTEGER = Pattern.compile("([+-]?\\d+)(?:_(\\w+))?");
	private static final Pattern REAL = Pattern.compile(
			"([+-]?(?:\\d+\\.\\d*(?:[ed][+-]?\\d+)?|\\.\\d+(?:[ed][+-]?\\d+)?|\\d+[ed][+-]?\\d+))(?:_(\\w+))?",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern LOGICAL = Pattern.compile("(\\.true\\.|true|\\.false\\.|false)(?:_(\\w+))?",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern PREFIXED_STRING = Pattern.compile("(\\w+)_(['\"].*)", Pattern.DOTALL);

	private Literal()
	{
	}

	public static Expression of(Object value)
	{
		return of(value, null, null);
	}

	public static Expression of(Object value, String kind)
	{
		return of(value, null, kind);
	}

	/**
	 * Classifies a raw value.
	 *
	 * @param value the raw value: a number, a boolean, a string holding literal text, or an expression
	 * @param type  explicit data type to build, or null to infer it from the value
	 * @param kind  kind tag to attach, or null to keep a kind suffix found in the text
	 * @return the literal (or parsed expression)
	 * @throws UnclassifiableLiteralException if the value cannot be classified nor parsed
	 */
	public static Expression of(Object value, DataType type, String kind)
	{
		if (value == null)
		{
			throw new UnclassifiableLiteralException(null);
		}
		if (type != null)
		{
			return ofType(value, type, kind);
		}
		if (value instanceof Expression expression)
		{
			return kind == null ? expression : retag(expression, kind);
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
		{
			return new IntLiteral(((Number) value).longValue(), kind);
		}
		if (value instanceof BigInteger big)
		{
			return ofType(big.toString(), DataType.INTEGER, kind);
		}
		if (value instanceof Double || value instanceof Float)
		{
			return new FloatLiteral(value.toString(), kind);
		}
		if (value instanceof BigDecimal decimal)
		{
			return ofType(decimal.toString(), DataType.REAL, kind);
		}
		if (value instanceof Boolean bool)
		{
			return new LogicLiteral(bool, kind);
		}
		if (value instanceof Character)
		{
			return new StringLiteral(value.toString(), kind);
		}
		if (value instanceof String text)
		{
			return fromText(text.trim(), kind);
		}
		throw new UnclassifiableLiteralException(value);
	}

	private static Expression fromText(String text, String kind)
	{
		Matcher m;
		if ((m = INTEGER.matcher(text)).matches())
		{
			return new IntLiteral(parseInteger(m.group(1), text), kindOf(kind, m));
		}
		if ((m = REAL.matcher(text)).matches())
		{
			return new FloatLiteral(m.group(1), kindOf(kind, m));
		}
		if ((m = LOGICAL.matcher(text)).matches())
		{
			return new LogicLiteral(m.group(1), kindOf(kind, m));
		}
		if (StringLiteral.isQuoted(text))
		{
			return new StringLiteral(text, kind);
		}
		if ((m = PREFIXED_STRING.matcher(text)).matches() && StringLiteral.isQuoted(m.group(2)))
		{
			return new StringLiteral(m.group(2), kind == null ? m.group(1) : kind);
		}
		return parse(text, kind);
	}

	private static Expression ofType(Object value, DataType type, String kind)
	{
		String text = value.toString().trim();
		Matcher m;
		switch (type)
		{
			case INTEGER:
				if ((m = INTEGER.matcher(text)).matches())
				{
					return new IntLiteral(parseInteger(m.group(1), value), kindOf(kind, m));
				}
				break;
			case REAL:
				if ((m = REAL.matcher(text)).matches())
				{
					return new FloatLiteral(m.group(1), kindOf(kind, m));
				}
				if ((m = INTEGER.matcher(text)).matches())
				{
					return new FloatLiteral(m.group(1) + ".", kindOf(kind, m));
				}
				break;
			case LOGICAL:
				if ((m = LOGICAL.matcher(text)).matches())
				{
					return new LogicLiteral(m.group(1), kindOf(kind, m));
				}
				break;
			case CHARACTER:
				return new StringLiteral(text, kind);
			default:
				break;
		}
		throw new UnclassifiableLiteralException(value);
	}

	private static Expression parse(String text, String kind)
	{
		Expression parsed;
		try
		{
			// names in the text are bound to a scratch table
			parsed = ExpressionParser.parse(text, new Scope("literal"));
		}
		catch (ExpressionSyntaxException | InvalidConstructionException e)
		{
			throw new UnclassifiableLiteralException(text, e);
		}
		return kind == null ? parsed : retag(parsed, kind);
	}

	private static Expression retag(Expression expression, String kind)
	{
		if (expression instanceof IntLiteral literal)
		{
			return literal.withKind(kind);
		}
		if (expression instanceof FloatLiteral literal)
		{
			return literal.withKind(kind);
		}
		if (expression instanceof LogicLiteral literal)
		{
			return literal.withKind(kind);
		}
		if (expression instanceof StringLiteral literal)
		{
			return new StringLiteral("'" + literal.getValue().replace("'", "''") + "'", kind);
		}
		return expression;
	}

	private static long parseInteger(String digits, Object original)
	{
		try
		{
			return Long.parseLong(digits);
		}
		catch (NumberFormatException e)
		{
			throw new UnclassifiableLiteralException(original, e);
		}
	}

	private static String kindOf(String explicitKind, Matcher m)
	{
		return explicitKind != null ? explicitKind : m.group(2);
	}
}
