package org.fortrex.expression.visitor;

import org.fortrex.expression.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collects every node of a tree that matches a query, in pre-order.
 * <p>
 * The optional {@code recurseQuery} decides whether the children of a node are visited at all;
 * returning false for a node keeps its subtree out of the result (the node itself is still
 * tested against the query).
 */
public class ExpressionRetriever implements ExpressionVisitor<Void>
{
	private final Predicate<Expression> query;
	private final Predicate<Expression> recurseQuery;
	private final List<Expression> found = new ArrayList<>();

	public ExpressionRetriever(Predicate<Expression> query)
	{
		this(query, e -> true);
	}

	public ExpressionRetriever(Predicate<Expression> query, Predicate<Expression> recurseQuery)
	{
		this.query = query;
		this.recurseQuery = recurseQuery;
	}

	public List<Expression> retrieve(Expression root)
	{
		found.clear();
		visit(root);
		return new ArrayList<>(found);
	}

	/**
	 * All variables referenced in the tree, each structurally distinct variable once.
	 */
	public static List<Variable> findVariables(Expression root)
	{
		LinkedHashSet<Variable> variables = new LinkedHashSet<>();
		for (Expression e : new ExpressionRetriever(Variable.class::isInstance).retrieve(root))
		{
			variables.add((Variable) e);
		}
		return new ArrayList<>(variables);
	}

	/**
	 * All literal leaves of the tree, in order of appearance.
	 */
	public static List<Expression> findLiterals(Expression root)
	{
		return new ExpressionRetriever(ExpressionRetriever::isLiteral).retrieve(root);
	}

	private static boolean isLiteral(Expression e)
	{
		return e instanceof IntLiteral || e instanceof FloatLiteral || e instanceof LogicLiteral
				|| e instanceof StringLiteral || e instanceof LiteralList;
	}

	private void visit(Expression expression)
	{
		if (expression == null)
		{
			return;
		}
		if (query.test(expression))
		{
			found.add(expression);
		}
		if (recurseQuery.test(expression))
		{
			expression.accept(this);
		}
	}

	private Void visitAll(List<Expression> expressions)
	{
		expressions.forEach(this::visit);
		return null;
	}

	@Override
	public Void visitScalar(Scalar scalar)
	{
		visit(scalar.getInitial());
		return null;
	}

	@Override
	public Void visitArray(Array array)
	{
		visit(array.getDimensions());
		visit(array.getInitial());
		return null;
	}

	@Override
	public Void visitIntLiteral(IntLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitFloatLiteral(FloatLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitLogicLiteral(LogicLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral literal)
	{
		return null;
	}

	@Override
	public Void visitLiteralList(LiteralList list)
	{
		return visitAll(list.getElements());
	}

	@Override
	public Void visitSum(Sum sum)
	{
		return visitAll(sum.getChildren());
	}

	@Override
	public Void visitProduct(Product product)
	{
		return visitAll(product.getChildren());
	}

	@Override
	public Void visitQuotient(Quotient quotient)
	{
		visit(quotient.getNumerator());
		visit(quotient.getDenominator());
		return null;
	}

	@Override
	public Void visitPower(Power power)
	{
		visit(power.getBase());
		visit(power.getExponent());
		return null;
	}

	@Override
	public Void visitComparison(Comparison comparison)
	{
		visit(comparison.getLeft());
		visit(comparison.getRight());
		return null;
	}

	@Override
	public Void visitLogicalAnd(LogicalAnd and)
	{
		return visitAll(and.getChildren());
	}

	@Override
	public Void visitLogicalOr(LogicalOr or)
	{
		return visitAll(or.getChildren());
	}

	@Override
	public Void visitLogicalNot(LogicalNot not)
	{
		visit(not.getChild());
		return null;
	}

	@Override
	public Void visitInlineCall(InlineCall call)
	{
		visitAll(call.getParameters());
		call.getKeywordParameters().values().forEach(this::visit);
		return null;
	}

	@Override
	public Void visitCast(Cast cast)
	{
		visit(cast.getExpression());
		visit(cast.getKind());
		return null;
	}

	@Override
	public Void visitRange(Range range)
	{
		visit(range.getLower());
		visit(range.getUpper());
		visit(range.getStep());
		return null;
	}

	@Override
	public Void visitLoopRange(LoopRange range)
	{
		return visitRange(range);
	}

	@Override
	public Void visitRangeIndex(RangeIndex range)
	{
		return visitRange(range);
	}

	@Override
	public Void visitArraySubscript(ArraySubscript subscript)
	{
		return visitAll(subscript.getIndex());
	}
}
