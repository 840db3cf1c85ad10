package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * A type conversion through an intrinsic such as {@code REAL(x, kind=JPRB)}.
 */
public final class Cast extends AbstractExpression
{
	private final String name;
	private final Expression expression;
	private final Expression kind;

	public Cast(String name, Expression expression)
	{
		this(name, expression, null);
	}

	public Cast(String name, Expression expression, Expression kind)
	{
		if (name == null || name.isBlank())
		{
			throw new InvalidConstructionException("A cast requires the name of the conversion intrinsic.");
		}
		this.name = name;
		this.expression = require(expression, "Cast to " + name + " requires an operand.");
		this.kind = kind;
	}

	public String getName()
	{
		return name;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public Expression getKind()
	{
		return kind;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitCast(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(name, expression, kind);
	}

	@Override
	public Cast clone()
	{
		return copySourceTo(new Cast(name, expression.clone(), cloneOrNull(kind)));
	}
}
