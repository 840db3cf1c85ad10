package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * An n-ary product. A product whose first factor is the integer {@code -1} is a negation.
 */
public final class Product extends AbstractExpression
{
	private final List<Expression> children;

	public Product(List<? extends Expression> children)
	{
		this.children = requireChildren("Product", children, 1);
	}

	public Product(Expression... children)
	{
		this(Arrays.asList(children));
	}

	public List<Expression> getChildren()
	{
		return children;
	}

	/**
	 * Builds {@code -expression}.
	 */
	public static Product negate(Expression expression)
	{
		return new Product(new IntLiteral(-1), expression);
	}

	/**
	 * Whether this product is a plain negation, i.e. its first factor is {@code -1} without kind.
	 */
	public boolean isNegation()
	{
		return children.size() > 1 && children.get(0).equals(new IntLiteral(-1));
	}

	/**
	 * The negated operand of a {@link #isNegation() negation}.
	 */
	public Expression getNegatedOperand()
	{
		List<Expression> rest = children.subList(1, children.size());
		return rest.size() == 1 ? rest.get(0) : new Product(rest);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitProduct(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(children);
	}

	@Override
	public Product clone()
	{
		return copySourceTo(new Product(cloneAll(children)));
	}
}
