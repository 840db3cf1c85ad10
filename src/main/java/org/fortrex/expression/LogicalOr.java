package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

public final class LogicalOr extends AbstractExpression
{
	private final List<Expression> children;

	public LogicalOr(List<? extends Expression> children)
	{
		this.children = requireChildren("LogicalOr", children, 2);
	}

	public LogicalOr(Expression... children)
	{
		this(Arrays.asList(children));
	}

	public List<Expression> getChildren()
	{
		return children;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLogicalOr(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(children);
	}

	@Override
	public LogicalOr clone()
	{
		return copySourceTo(new LogicalOr(cloneAll(children)));
	}
}
