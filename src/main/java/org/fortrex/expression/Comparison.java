package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;
import java.util.Locale;

/**
 * A relational expression. The operator is stored independently of the spelling it was written
 * with; it is always rendered in its Fortran 90 form.
 */
public final class Comparison extends AbstractExpression
{
	public enum Operator
	{
		EQ("==", ".eq."),
		NE("/=", ".ne."),
		LT("<", ".lt."),
		LE("<=", ".le."),
		GT(">", ".gt."),
		GE(">=", ".ge.");

		private final String symbol;
		private final String legacySymbol;

		Operator(String symbol, String legacySymbol)
		{
			this.symbol = symbol;
			this.legacySymbol = legacySymbol;
		}

		/**
		 * The Fortran 90 spelling, e.g. {@code /=}.
		 */
		public String getSymbol()
		{
			return symbol;
		}

		/**
		 * The FORTRAN 77 spelling, e.g. {@code .ne.}.
		 */
		public String getLegacySymbol()
		{
			return legacySymbol;
		}

		public static Operator fromSymbol(String text)
		{
			String lower = text.trim().toLowerCase(Locale.ROOT);
			if (lower.equals("!="))
			{
				return NE;
			}
			for (Operator op : values())
			{
				if (op.symbol.equals(lower) || op.legacySymbol.equals(lower))
				{
					return op;
				}
			}
			throw new IllegalArgumentException("Unknown comparison operator: '" + text + "'.");
		}
	}

	private final Expression left;
	private final Operator operator;
	private final Expression right;

	public Comparison(Expression left, Operator operator, Expression right)
	{
		this.left = require(left, "Comparison requires a left operand.");
		this.operator = require(operator, "Comparison requires an operator.");
		this.right = require(right, "Comparison requires a right operand.");
	}

	public Expression getLeft()
	{
		return left;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitComparison(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(left, operator, right);
	}

	@Override
	public Comparison clone()
	{
		return copySourceTo(new Comparison(left.clone(), operator, right.clone()));
	}
}
