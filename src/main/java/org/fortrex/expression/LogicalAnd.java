package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

public final class LogicalAnd extends AbstractExpression
{
	private final List<Expression> children;

	public LogicalAnd(List<? extends Expression> children)
	{
		this.children = requireChildren("LogicalAnd", children, 2);
	}

	public LogicalAnd(Expression... children)
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
		return visitor.visitLogicalAnd(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(children);
	}

	@Override
	public LogicalAnd clone()
	{
		return copySourceTo(new LogicalAnd(cloneAll(children)));
	}
}
