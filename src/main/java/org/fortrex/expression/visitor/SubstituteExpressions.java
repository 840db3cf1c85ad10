package org.fortrex.expression.visitor;

import org.fortrex.expression.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces sub-expressions of a tree according to a substitution map.
 * <p>
 * Keys are matched by structural equality, so a freshly built {@code Scalar.of("I", scope)}
 * replaces every reference to {@code I} in that scope. Nodes on the path to a replacement are
 * rebuilt without source text; untouched subtrees are returned as the same instances.
 */
public class SubstituteExpressions implements ExpressionVisitor<Expression>
{
	private final Map<Expression, Expression> substitutions;

	public SubstituteExpressions(Map<? extends Expression, ? extends Expression> substitutions)
	{
		this.substitutions = new LinkedHashMap<>(substitutions);
	}

	public Expression substitute(Expression expression)
	{
		if (expression == null)
		{
			return null;
		}
		Expression replacement = substitutions.get(expression);
		if (replacement != null)
		{
			return replacement;
		}
		return expression.accept(this);
	}

	private List<Expression> substituteAll(List<Expression> expressions)
	{
		List<Expression> result = new ArrayList<>(expressions.size());
		boolean changed = false;
		for (Expression e : expressions)
		{
			Expression s = substitute(e);
			changed |= s != e;
			result.add(s);
		}
		return changed ? result : expressions;
	}

	private static boolean same(Object[] before, Object[] after)
	{
		for (int i = 0; i < before.length; i++)
		{
			if (before[i] != after[i])
			{
				return false;
			}
		}
		return true;
	}

	// --- Variables ---

	@Override
	public Expression visitScalar(Scalar scalar)
	{
		Expression initial = substitute(scalar.getInitial());
		if (initial == scalar.getInitial())
		{
			return scalar;
		}
		return scalar.toBuilder().initial(initial).source(null).build();
	}

	@Override
	public Expression visitArray(Array array)
	{
		Expression dimensions = substitute(array.getDimensions());
		Expression initial = substitute(array.getInitial());
		if (dimensions == array.getDimensions() && initial == array.getInitial())
		{
			return array;
		}
		if (dimensions != null && !(dimensions instanceof ArraySubscript))
		{
			throw new InvalidConstructionException("The subscript of '" + array.getName() + "' can only be replaced by a subscript, got " + dimensions);
		}
		return array.toBuilder()
				.dimensions((ArraySubscript) dimensions)
				.initial(initial)
				.source(null)
				.build();
	}

	// --- Literals ---

	@Override
	public Expression visitIntLiteral(IntLiteral literal)
	{
		return literal;
	}

	@Override
	public Expression visitFloatLiteral(FloatLiteral literal)
	{
		return literal;
	}

	@Override
	public Expression visitLogicLiteral(LogicLiteral literal)
	{
		return literal;
	}

	@Override
	public Expression visitStringLiteral(StringLiteral literal)
	{
		return literal;
	}

	@Override
	public Expression visitLiteralList(LiteralList list)
	{
		List<Expression> elements = substituteAll(list.getElements());
		return elements == list.getElements() ? list : new LiteralList(elements);
	}

	// --- Operators ---

	@Override
	public Expression visitSum(Sum sum)
	{
		List<Expression> children = substituteAll(sum.getChildren());
		return children == sum.getChildren() ? sum : new Sum(children);
	}

	@Override
	public Expression visitProduct(Product product)
	{
		List<Expression> children = substituteAll(product.getChildren());
		return children == product.getChildren() ? product : new Product(children);
	}

	@Override
	public Expression visitQuotient(Quotient quotient)
	{
		Expression numerator = substitute(quotient.getNumerator());
		Expression denominator = substitute(quotient.getDenominator());
		if (numerator == quotient.getNumerator() && denominator == quotient.getDenominator())
		{
			return quotient;
		}
		return new Quotient(numerator, denominator);
	}

	@Override
	public Expression visitPower(Power power)
	{
		Expression base = substitute(power.getBase());
		Expression exponent = substitute(power.getExponent());
		if (base == power.getBase() && exponent == power.getExponent())
		{
			return power;
		}
		return new Power(base, exponent);
	}

	@Override
	public Expression visitComparison(Comparison comparison)
	{
		Expression left = substitute(comparison.getLeft());
		Expression right = substitute(comparison.getRight());
		if (left == comparison.getLeft() && right == comparison.getRight())
		{
			return comparison;
		}
		return new Comparison(left, comparison.getOperator(), right);
	}

	@Override
	public Expression visitLogicalAnd(LogicalAnd and)
	{
		List<Expression> children = substituteAll(and.getChildren());
		return children == and.getChildren() ? and : new LogicalAnd(children);
	}

	@Override
	public Expression visitLogicalOr(LogicalOr or)
	{
		List<Expression> children = substituteAll(or.getChildren());
		return children == or.getChildren() ? or : new LogicalOr(children);
	}

	@Override
	public Expression visitLogicalNot(LogicalNot not)
	{
		Expression child = substitute(not.getChild());
		return child == not.getChild() ? not : new LogicalNot(child);
	}

	// --- Calls, ranges and subscripts ---

	@Override
	public Expression visitInlineCall(InlineCall call)
	{
		List<Expression> parameters = substituteAll(call.getParameters());
		Map<String, Expression> keywords = new LinkedHashMap<>();
		boolean keywordsChanged = false;
		for (Map.Entry<String, Expression> entry : call.getKeywordParameters().entrySet())
		{
			Expression value = substitute(entry.getValue());
			keywordsChanged |= value != entry.getValue();
			keywords.put(entry.getKey(), value);
		}
		if (parameters == call.getParameters() && !keywordsChanged)
		{
			return call;
		}
		return new InlineCall(call.getName(), parameters, keywords);
	}

	@Override
	public Expression visitCast(Cast cast)
	{
		Expression expression = substitute(cast.getExpression());
		Expression kind = substitute(cast.getKind());
		if (expression == cast.getExpression() && kind == cast.getKind())
		{
			return cast;
		}
		return new Cast(cast.getName(), expression, kind);
	}

	@Override
	public Expression visitRange(Range range)
	{
		Object[] before = {range.getLower(), range.getUpper(), range.getStep()};
		Expression[] after = {substitute(range.getLower()), substitute(range.getUpper()), substitute(range.getStep())};
		return same(before, after) ? range : new Range(after[0], after[1], after[2]);
	}

	@Override
	public Expression visitLoopRange(LoopRange range)
	{
		Object[] before = {range.getLower(), range.getUpper(), range.getStep()};
		Expression[] after = {substitute(range.getLower()), substitute(range.getUpper()), substitute(range.getStep())};
		return same(before, after) ? range : new LoopRange(after[0], after[1], after[2]);
	}

	@Override
	public Expression visitRangeIndex(RangeIndex range)
	{
		Object[] before = {range.getLower(), range.getUpper(), range.getStep()};
		Expression[] after = {substitute(range.getLower()), substitute(range.getUpper()), substitute(range.getStep())};
		return same(before, after) ? range : RangeIndex.of(after[0], after[1], after[2]);
	}

	@Override
	public Expression visitArraySubscript(ArraySubscript subscript)
	{
		List<Expression> index = substituteAll(subscript.getIndex());
		return index == subscript.getIndex() ? subscript : new ArraySubscript(index);
	}
}
