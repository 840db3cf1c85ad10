package org.fortrex.expression;

import org.fortrex.expression.visitor.Stringifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public abstract class AbstractExpression implements Expression
{
	private Source source;

	@Override
	public Source getSource()
	{
		return source;
	}

	@Override
	public void setSource(Source source)
	{
		this.source = source;
	}

	@Override
	public abstract Expression clone();

	protected <T extends Expression> T copySourceTo(T copy)
	{
		copy.setSource(source);
		return copy;
	}

	protected static <T> T require(T value, String message)
	{
		if (value == null)
		{
			throw new InvalidConstructionException(message);
		}
		return value;
	}

	protected static List<Expression> requireChildren(String node, List<? extends Expression> children, int minimum)
	{
		if (children == null || children.size() < minimum)
		{
			throw new InvalidConstructionException(node + " requires at least " + minimum + " operand(s).");
		}
		List<Expression> copy = new ArrayList<>(children.size());
		for (Expression child : children)
		{
			copy.add(require(child, node + " operands must not be null."));
		}
		return List.copyOf(copy);
	}

	protected static List<Expression> cloneAll(List<Expression> expressions)
	{
		return expressions.stream().map(Expression::clone).collect(Collectors.toList());
	}

	protected static Expression cloneOrNull(Expression expression)
	{
		return expression == null ? null : expression.clone();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return getReconstructionArgs().equals(((Expression) o).getReconstructionArgs());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), getReconstructionArgs());
	}

	@Override
	public String toString()
	{
		return Stringifier.render(this);
	}
}
