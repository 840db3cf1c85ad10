package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

/**
 * An array constructor, e.g. the initialisation list {@code [1,2,3]}.
 */
public final class LiteralList extends AbstractExpression
{
	private final List<Expression> elements;

	public LiteralList(List<? extends Expression> elements)
	{
		this.elements = requireChildren("Literal list", elements, 0);
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLiteralList(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(elements);
	}

	@Override
	public LiteralList clone()
	{
		return copySourceTo(new LiteralList(cloneAll(elements)));
	}
}
