package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * An n-ary sum. A difference is a sum with a negated term, {@code Product(-1, b)}.
 */
public final class Sum extends AbstractExpression
{
	private final List<Expression> children;

	public Sum(List<? extends Expression> children)
	{
		this.children = requireChildren("Sum", children, 1);
	}

	public Sum(Expression... children)
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
		return visitor.visitSum(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(children);
	}

	@Override
	public Sum clone()
	{
		return copySourceTo(new Sum(cloneAll(children)));
	}
}
