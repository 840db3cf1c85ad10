package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

/**
 * A subscript triplet inside an array reference.
 * <p>
 * Instances are created through {@link #of(Expression, Expression, Expression)}, which
 * normalises a triplet holding only an upper bound to that bound itself: such an index is a
 * direct element access, so {@code RangeIndex.of(5)} is the integer literal {@code 5}.
 */
public final class RangeIndex extends Range
{
	private RangeIndex(Expression lower, Expression upper, Expression step)
	{
		super(lower, upper, step);
	}

	public static Expression of(Expression lower, Expression upper, Expression step)
	{
		if (upper != null && lower == null && step == null)
		{
			return upper;
		}
		return new RangeIndex(lower, upper, step);
	}

	public static Expression of(Expression lower, Expression upper)
	{
		return of(lower, upper, null);
	}

	public static Expression of(long upper)
	{
		return new IntLiteral(upper);
	}

	/**
	 * The full-extent subscript {@code :}.
	 */
	public static RangeIndex all()
	{
		return new RangeIndex(null, null, null);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitRangeIndex(this);
	}

	@Override
	public RangeIndex clone()
	{
		return copySourceTo(new RangeIndex(cloneOrNull(getLower()), cloneOrNull(getUpper()), cloneOrNull(getStep())));
	}
}
