package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;
import org.fortrex.semantic.symbol.Scope;

/**
 * A scalar variable, or any other bound leaf without subscripts.
 */
public final class Scalar extends Variable
{
	Scalar(String name, Scope scope, Expression initial, Variable parent)
	{
		super(name, scope, initial, parent);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitScalar(this);
	}

	@Override
	public Builder toBuilder()
	{
		return builder(getName(), scopeReference())
				.type(getType())
				.initial(getInitial())
				.parent(getParent())
				.source(getSource());
	}
}
