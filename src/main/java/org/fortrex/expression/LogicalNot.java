package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

public final class LogicalNot extends AbstractExpression
{
	private final Expression child;

	public LogicalNot(Expression child)
	{
		this.child = require(child, "Logical negation requires an operand.");
	}

	public Expression getChild()
	{
		return child;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitLogicalNot(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(child);
	}

	@Override
	public LogicalNot clone()
	{
		return copySourceTo(new LogicalNot(child.clone()));
	}
}
