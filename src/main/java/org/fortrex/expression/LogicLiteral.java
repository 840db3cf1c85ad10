package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A boolean constant.
 */
public final class LogicLiteral extends AbstractExpression
{
	private final boolean value;
	private final String kind;

	public LogicLiteral(boolean value)
	{
		this(value, null);
	}

	public LogicLiteral(boolean value, String kind)
	{
		this.value = value;
		this.kind = kind;
	}

	/**
	 * Creates the literal from its text; {@code .true.} and {@code true} in any case are true,
	 * everything else is false.
	 */
	public LogicLiteral(String value, String kind)
	{
		this(isTrue(value), kind);
	}

	private static boolean isTrue(String value)
	{
		String lower = value.trim().toLowerCase(Locale.ROOT);
		return lower.equals("true") || lower.equals(".true.");
	}

	public boolean getValue()
	{
		return value;
	}

	public String getKind()
	{
		return kind;
	}

	public LogicLiteral withKind(String kind)
	{
		return copySourceTo(new LogicLiteral(value, kind));
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLogicLiteral(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(value, kind);
	}

	@Override
	public LogicLiteral clone()
	{
		return copySourceTo(new LogicLiteral(value, kind));
	}
}
