package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * An integer constant, optionally with a kind tag ({@code 4_JPIM}).
 */
public final class IntLiteral extends AbstractExpression
{
	private final long value;
	private final String kind;

	public IntLiteral(long value)
	{
		this(value, null);
	}

	public IntLiteral(long value, String kind)
	{
		this.value = value;
		this.kind = kind;
	}

	public long getValue()
	{
		return value;
	}

	public String getKind()
	{
		return kind;
	}

	public IntLiteral withKind(String kind)
	{
		return copySourceTo(new IntLiteral(value, kind));
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitIntLiteral(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(value, kind);
	}

	@Override
	public IntLiteral clone()
	{
		return copySourceTo(new IntLiteral(value, kind));
	}
}
