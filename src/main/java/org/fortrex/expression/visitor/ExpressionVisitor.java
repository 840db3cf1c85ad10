package org.fortrex.expression.visitor;

import org.fortrex.expression.*;

/**
 * Double-dispatch visitor over all expression node variants.
 * <p>
 * Every concern that walks trees (rendering, retrieval, substitution) implements this interface
 * in full, so adding a node variant is a compile-time checked change to each of them.
 *
 * @param <R> the result type of a visit
 */
public interface ExpressionVisitor<R>
{
	// --- Leaves ---
	R visitScalar(Scalar scalar);

	R visitArray(Array array);

	R visitIntLiteral(IntLiteral literal);

	R visitFloatLiteral(FloatLiteral literal);

	R visitLogicLiteral(LogicLiteral literal);

	R visitStringLiteral(StringLiteral literal);

	R visitLiteralList(LiteralList list);

	// --- Operators ---
	R visitSum(Sum sum);

	R visitProduct(Product product);

	R visitQuotient(Quotient quotient);

	R visitPower(Power power);

	R visitComparison(Comparison comparison);

	R visitLogicalAnd(LogicalAnd and);

	R visitLogicalOr(LogicalOr or);

	R visitLogicalNot(LogicalNot not);

	// --- Calls, ranges and subscripts ---
	R visitInlineCall(InlineCall call);

	R visitCast(Cast cast);

	R visitRange(Range range);

	R visitLoopRange(LoopRange range);

	R visitRangeIndex(RangeIndex range);

	R visitArraySubscript(ArraySubscript subscript);
}
