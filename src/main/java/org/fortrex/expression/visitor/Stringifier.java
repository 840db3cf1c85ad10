package org.fortrex.expression.visitor;

import org.fortrex.expression.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expression trees as Fortran source text.
 * <p>
 * Parentheses are derived from the {@link Precedence} table only: every operand is rendered with
 * the precedence its position requires, and wrapped when its own precedence is lower. Operands
 * to the right of a left-associative operator require one level more, so that regrouping
 * written by the user is kept.
 * <p>
 * With {@code preserveSource} set, a node that still carries its original {@link Source} text
 * is emitted verbatim. Invalidating the source of a node makes it render from the tree again.
 */
public class Stringifier implements ExpressionVisitor<String>
{
	private final boolean preserveSource;
	private int enclosing = Precedence.NONE;

	public Stringifier()
	{
		this(false);
	}

	public Stringifier(boolean preserveSource)
	{
		this.preserveSource = preserveSource;
	}

	public static String render(Expression expression)
	{
		return new Stringifier().stringify(expression);
	}

	public String stringify(Expression expression)
	{
		return rec(expression, Precedence.NONE);
	}

	private String rec(Expression expression, int enclosingPrecedence)
	{
		if (preserveSource && expression.getSource() != null && expression.getSource().getString() != null)
		{
			return parenthesize(Precedence.of(expression), enclosingPrecedence, expression.getSource().getString());
		}
		int saved = enclosing;
		enclosing = enclosingPrecedence;
		try
		{
			return expression.accept(this);
		}
		finally
		{
			enclosing = saved;
		}
	}

	private static String parenthesize(int precedence, int enclosingPrecedence, String text)
	{
		return enclosingPrecedence > precedence ? "(" + text + ")" : text;
	}

	private String join(List<Expression> expressions, String separator, int first, int rest)
	{
		List<String> parts = new ArrayList<>(expressions.size());
		for (int i = 0; i < expressions.size(); i++)
		{
			parts.add(rec(expressions.get(i), i == 0 ? first : rest));
		}
		return String.join(separator, parts);
	}

	private static String withKind(String text, String kind)
	{
		return kind == null ? text : text + "_" + kind;
	}

	// --- Leaves ---

	@Override
	public String visitScalar(Scalar scalar)
	{
		return scalar.getName();
	}

	@Override
	public String visitArray(Array array)
	{
		StringBuilder sb = new StringBuilder(array.getName());
		if (array.hasDimensions())
		{
			sb.append(rec(array.getDimensions(), Precedence.NONE));
		}
		if (array.getInitial() != null)
		{
			sb.append(" = ").append(rec(array.getInitial(), Precedence.NONE));
		}
		return sb.toString();
	}

	@Override
	public String visitIntLiteral(IntLiteral literal)
	{
		String text = withKind(Long.toString(literal.getValue()), literal.getKind());
		return parenthesize(Precedence.of(literal), enclosing, text);
	}

	@Override
	public String visitFloatLiteral(FloatLiteral literal)
	{
		String text = withKind(literal.getValue(), literal.getKind());
		return parenthesize(Precedence.of(literal), enclosing, text);
	}

	@Override
	public String visitLogicLiteral(LogicLiteral literal)
	{
		return withKind(literal.getValue() ? ".true." : ".false.", literal.getKind());
	}

	@Override
	public String visitStringLiteral(StringLiteral literal)
	{
		String quoted = "'" + literal.getValue().replace("'", "''") + "'";
		// character kinds are a prefix: JPCH_'abc'
		return literal.getKind() == null ? quoted : literal.getKind() + "_" + quoted;
	}

	@Override
	public String visitLiteralList(LiteralList list)
	{
		return "[" + join(list.getElements(), ",", Precedence.NONE, Precedence.NONE) + "]";
	}

	// --- Operators ---

	@Override
	public String visitSum(Sum sum)
	{
		int outer = enclosing;
		List<Expression> terms = sum.getChildren();
		StringBuilder sb = new StringBuilder(rec(terms.get(0), Precedence.SUM));
		for (Expression term : terms.subList(1, terms.size()))
		{
			Expression negated = negatedTerm(term);
			if (negated != null)
			{
				sb.append(" - ").append(rec(negated, Precedence.PRODUCT));
			}
			else
			{
				sb.append(" + ").append(rec(term, Precedence.SUM + 1));
			}
		}
		return parenthesize(Precedence.SUM, outer, sb.toString());
	}

	/**
	 * For a term that reads as a subtraction, the subtrahend; otherwise null.
	 */
	private static Expression negatedTerm(Expression term)
	{
		if (term instanceof Product product && product.isNegation())
		{
			return product.getNegatedOperand();
		}
		if (term instanceof IntLiteral literal && literal.getValue() < 0)
		{
			return new IntLiteral(-literal.getValue(), literal.getKind());
		}
		if (term instanceof FloatLiteral literal && literal.isNegative())
		{
			return new FloatLiteral(literal.getValue().substring(1), literal.getKind());
		}
		return null;
	}

	@Override
	public String visitProduct(Product product)
	{
		int outer = enclosing;
		if (product.isNegation())
		{
			String text = "-" + rec(product.getNegatedOperand(), Precedence.PRODUCT);
			return parenthesize(Precedence.SUM, outer, text);
		}
		String text = join(product.getChildren(), "*", Precedence.PRODUCT, Precedence.PRODUCT + 1);
		return parenthesize(Precedence.PRODUCT, outer, text);
	}

	@Override
	public String visitQuotient(Quotient quotient)
	{
		int outer = enclosing;
		String text = rec(quotient.getNumerator(), Precedence.PRODUCT) + "/"
				+ rec(quotient.getDenominator(), Precedence.PRODUCT + 1);
		return parenthesize(Precedence.PRODUCT, outer, text);
	}

	@Override
	public String visitPower(Power power)
	{
		int outer = enclosing;
		// right-associative: the base needs grouping, the exponent does not
		String text = rec(power.getBase(), Precedence.POWER + 1) + "**" + rec(power.getExponent(), Precedence.POWER);
		return parenthesize(Precedence.POWER, outer, text);
	}

	@Override
	public String visitComparison(Comparison comparison)
	{
		int outer = enclosing;
		String text = rec(comparison.getLeft(), Precedence.COMPARISON + 1)
				+ " " + comparison.getOperator().getSymbol() + " "
				+ rec(comparison.getRight(), Precedence.COMPARISON + 1);
		return parenthesize(Precedence.COMPARISON, outer, text);
	}

	@Override
	public String visitLogicalAnd(LogicalAnd and)
	{
		int outer = enclosing;
		String text = join(and.getChildren(), " .and. ", Precedence.LOGICAL_AND, Precedence.LOGICAL_AND + 1);
		return parenthesize(Precedence.LOGICAL_AND, outer, text);
	}

	@Override
	public String visitLogicalOr(LogicalOr or)
	{
		int outer = enclosing;
		String text = join(or.getChildren(), " .or. ", Precedence.LOGICAL_OR, Precedence.LOGICAL_OR + 1);
		return parenthesize(Precedence.LOGICAL_OR, outer, text);
	}

	@Override
	public String visitLogicalNot(LogicalNot not)
	{
		int outer = enclosing;
		String text = ".not. " + rec(not.getChild(), Precedence.LOGICAL_NOT);
		return parenthesize(Precedence.LOGICAL_NOT, outer, text);
	}

	// --- Calls, ranges and subscripts ---

	@Override
	public String visitInlineCall(InlineCall call)
	{
		List<String> arguments = new ArrayList<>();
		call.getParameters().forEach(p -> arguments.add(rec(p, Precedence.NONE)));
		call.getKeywordParameters().forEach((k, v) -> arguments.add(k + "=" + rec(v, Precedence.NONE)));
		return call.getName() + "(" + String.join(", ", arguments) + ")";
	}

	@Override
	public String visitCast(Cast cast)
	{
		String kind = cast.getKind() == null ? "" : ", kind=" + rec(cast.getKind(), Precedence.NONE);
		return cast.getName() + "(" + rec(cast.getExpression(), Precedence.NONE) + kind + ")";
	}

	@Override
	public String visitRange(Range range)
	{
		String lower = range.getLower() == null ? "" : rec(range.getLower(), Precedence.NONE);
		String upper = range.getUpper() == null ? "" : rec(range.getUpper(), Precedence.NONE);
		if (range.getStep() != null)
		{
			return lower + ":" + upper + ":" + rec(range.getStep(), Precedence.NONE);
		}
		return lower + ":" + upper;
	}

	@Override
	public String visitLoopRange(LoopRange range)
	{
		return visitRange(range);
	}

	@Override
	public String visitRangeIndex(RangeIndex range)
	{
		return visitRange(range);
	}

	@Override
	public String visitArraySubscript(ArraySubscript subscript)
	{
		return subscript.getIndex().stream()
				.map(e -> rec(e, Precedence.NONE))
				.collect(Collectors.joining(",", "(", ")"));
	}
}
