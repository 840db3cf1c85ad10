package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.List;

/**
 * A node of an expression tree.
 * <p>
 * Nodes are compared structurally: two nodes are equal when they are the same variant and
 * their {@link #getReconstructionArgs() reconstruction arguments} are equal. Source provenance
 * takes no part in equality.
 */
public interface Expression
{
	<R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * The ordered fields needed to rebuild an equal node of the same variant.
	 */
	List<Object> getReconstructionArgs();

	/**
	 * Creates a structurally equal copy of this node.
	 */
	Expression clone();

	Source getSource();

	void setSource(Source source);

	/**
	 * Drops the cached source so that backends regenerate the text from the tree.
	 */
	default void invalidateSource()
	{
		setSource(null);
	}
}
