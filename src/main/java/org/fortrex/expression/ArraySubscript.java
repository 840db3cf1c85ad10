package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

/**
 * The index list of an array reference, e.g. the {@code (I,1:N)} of {@code A(I,1:N)}.
 */
public final class ArraySubscript extends AbstractExpression
{
	private final List<Expression> index;

	public ArraySubscript(List<? extends Expression> index)
	{
		this.index = requireChildren("Array subscript", index, 0);
	}

	public List<Expression> getIndex()
	{
		return index;
	}

	public int size()
	{
		return index.size();
	}

	public boolean isEmpty()
	{
		return index.isEmpty();
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitArraySubscript(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(index);
	}

	@Override
	public ArraySubscript clone()
	{
		return copySourceTo(new ArraySubscript(cloneAll(index)));
	}
}
