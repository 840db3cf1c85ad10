package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

public final class Quotient extends AbstractExpression
{
	private final Expression numerator;
	private final Expression denominator;

	public Quotient(Expression numerator, Expression denominator)
	{
		this.numerator = require(numerator, "Quotient requires a numerator.");
		this.denominator = require(denominator, "Quotient requires a denominator.");
	}

	public Expression getNumerator()
	{
		return numerator;
	}

	public Expression getDenominator()
	{
		return denominator;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitQuotient(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(numerator, denominator);
	}

	@Override
	public Quotient clone()
	{
		return copySourceTo(new Quotient(numerator.clone(), denominator.clone()));
	}
}
