package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * A {@code lower:upper:step} triplet. Any bound may be absent.
 */
public class Range extends AbstractExpression
{
	private final Expression lower;
	private final Expression upper;
	private final Expression step;

	public Range(Expression lower, Expression upper)
	{
		this(lower, upper, null);
	}

	public Range(Expression lower, Expression upper, Expression step)
	{
		this.lower = lower;
		this.upper = upper;
		this.step = step;
	}

	public Expression getLower()
	{
		return lower;
	}

	public Expression getUpper()
	{
		return upper;
	}

	public Expression getStep()
	{
		return step;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitRange(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(lower, upper, step);
	}

	@Override
	public Range clone()
	{
		return copySourceTo(new Range(cloneOrNull(lower), cloneOrNull(upper), cloneOrNull(step)));
	}
}
