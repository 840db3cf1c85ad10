package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * A character constant. One matching pair of surrounding quotes is stripped from the given
 * value, and quotes doubled inside it are collapsed.
 */
public final class StringLiteral extends AbstractExpression
{
	private final String value;
	private final String kind;

	public StringLiteral(String value)
	{
		this(value, null);
	}

	public StringLiteral(String value, String kind)
	{
		require(value, "A character literal requires a value.");
		this.value = unquote(value);
		this.kind = kind;
	}

	static boolean isQuoted(String value)
	{
		if (value.length() < 2)
		{
			return false;
		}
		char first = value.charAt(0);
		return (first == '\'' || first == '"') && value.charAt(value.length() - 1) == first;
	}

	private static String unquote(String value)
	{
		if (!isQuoted(value))
		{
			return value;
		}
		String quote = value.substring(0, 1);
		return value.substring(1, value.length() - 1).replace(quote + quote, quote);
	}

	public String getValue()
	{
		return value;
	}

	public String getKind()
	{
		return kind;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitStringLiteral(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(value, kind);
	}

	@Override
	public StringLiteral clone()
	{
		// value is already unquoted; constructing from it again must not strip a second pair
		StringLiteral copy = new StringLiteral("'" + value.replace("'", "''") + "'", kind);
		return copySourceTo(copy);
	}
}
