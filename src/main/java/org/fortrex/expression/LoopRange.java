package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

/**
 * The iteration space of a {@code DO} loop.
 */
public final class LoopRange extends Range
{
	public LoopRange(Expression lower, Expression upper)
	{
		super(lower, upper);
	}

	public LoopRange(Expression lower, Expression upper, Expression step)
	{
		super(lower, upper, step);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLoopRange(this);
	}

	@Override
	public LoopRange clone()
	{
		return copySourceTo(new LoopRange(cloneOrNull(getLower()), cloneOrNull(getUpper()), cloneOrNull(getStep())));
	}
}
