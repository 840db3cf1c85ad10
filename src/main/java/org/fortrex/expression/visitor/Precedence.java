package org.fortrex.expression.visitor;

import org.fortrex.expression.*;

/**
 * Binding strength of each operator, loosest first. A sub-expression is parenthesised when its
 * own precedence is lower than the one its context requires.
 */
public final class Precedence
{
	public static final int NONE = 0;
	public static final int LOGICAL_OR = 4;
	public static final int LOGICAL_AND = 5;
	public static final int LOGICAL_NOT = 6;
	public static final int COMPARISON = 7;
	public static final int SUM = 11;
	public static final int PRODUCT = 12;
	public static final int UNARY = 13;
	public static final int POWER = 14;
	public static final int CALL = 15;
	public static final int ATOM = 100;

	private Precedence()
	{
	}

	/**
	 * The precedence an expression renders with. Negations and negative constants bind like a
	 * sum, as the unary minus does in Fortran.
	 */
	public static int of(Expression expression)
	{
		if (expression instanceof Sum)
		{
			return SUM;
		}
		if (expression instanceof Product product)
		{
			return product.isNegation() ? SUM : PRODUCT;
		}
		if (expression instanceof Quotient)
		{
			return PRODUCT;
		}
		if (expression instanceof Power)
		{
			return POWER;
		}
		if (expression instanceof Comparison)
		{
			return COMPARISON;
		}
		if (expression instanceof LogicalNot)
		{
			return LOGICAL_NOT;
		}
		if (expression instanceof LogicalAnd)
		{
			return LOGICAL_AND;
		}
		if (expression instanceof LogicalOr)
		{
			return LOGICAL_OR;
		}
		if (expression instanceof IntLiteral literal)
		{
			return literal.getValue() < 0 ? SUM : ATOM;
		}
		if (expression instanceof FloatLiteral literal)
		{
			return literal.isNegative() ? SUM : ATOM;
		}
		if (expression instanceof InlineCall || expression instanceof Cast)
		{
			return CALL;
		}
		return ATOM;
	}
}
