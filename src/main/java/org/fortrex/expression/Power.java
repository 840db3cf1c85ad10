package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

public final class Power extends AbstractExpression
{
	private final Expression base;
	private final Expression exponent;

	public Power(Expression base, Expression exponent)
	{
		this.base = require(base, "Power requires a base.");
		this.exponent = require(exponent, "Power requires an exponent.");
	}

	public Expression getBase()
	{
		return base;
	}

	public Expression getExponent()
	{
		return exponent;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitPower(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(base, exponent);
	}

	@Override
	public Power clone()
	{
		return copySourceTo(new Power(base.clone(), exponent.clone()));
	}
}
