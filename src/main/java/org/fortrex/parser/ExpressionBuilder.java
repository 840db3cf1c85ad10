package org.fortrex.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.fortrex.expression.*;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.SymbolType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a parse tree into expression nodes bound to a scope.
 * <p>
 * Every node built here records the line range and text it was parsed from.
 */
public class ExpressionBuilder extends FortranExpressionParserBaseVisitor<Expression>
{
	private static final Set<String> CONVERSION_INTRINSICS = Set.of("real", "int", "dble", "logical", "cmplx");

	private final Scope scope;

	public ExpressionBuilder(Scope scope)
	{
		this.scope = scope;
	}

	@Override
	public Expression visitParse(FortranExpressionParser.ParseContext ctx)
	{
		return visit(ctx.expression());
	}

	// --- Operators ---

	@Override
	public Expression visitPowerExpression(FortranExpressionParser.PowerExpressionContext ctx)
	{
		return withSource(new Power(visit(ctx.expression(0)), visit(ctx.expression(1))), ctx);
	}

	@Override
	public Expression visitMultiplicativeExpression(FortranExpressionParser.MultiplicativeExpressionContext ctx)
	{
		Expression left = visit(ctx.expression(0));
		Expression right = visit(ctx.expression(1));
		if (ctx.op.getType() == FortranExpressionLexer.STAR)
		{
			return withSource(new Product(left, right), ctx);
		}
		return withSource(new Quotient(left, right), ctx);
	}

	@Override
	public Expression visitUnaryExpression(FortranExpressionParser.UnaryExpressionContext ctx)
	{
		Expression operand = visit(ctx.expression());
		if (ctx.op.getType() == FortranExpressionLexer.PLUS)
		{
			return withSource(operand, ctx);
		}
		if (operand instanceof IntLiteral literal)
		{
			return withSource(new IntLiteral(-literal.getValue(), literal.getKind()), ctx);
		}
		if (operand instanceof FloatLiteral literal)
		{
			String value = literal.isNegative() ? literal.getValue().substring(1) : "-" + literal.getValue();
			return withSource(new FloatLiteral(value, literal.getKind()), ctx);
		}
		return withSource(Product.negate(operand), ctx);
	}

	@Override
	public Expression visitAdditiveExpression(FortranExpressionParser.AdditiveExpressionContext ctx)
	{
		Expression left = visit(ctx.expression(0));
		Expression right = visit(ctx.expression(1));
		if (ctx.op.getType() == FortranExpressionLexer.MINUS)
		{
			right = Product.negate(right);
		}
		return withSource(new Sum(left, right), ctx);
	}

	@Override
	public Expression visitComparisonExpression(FortranExpressionParser.ComparisonExpressionContext ctx)
	{
		Comparison.Operator operator = Comparison.Operator.fromSymbol(ctx.op.getText());
		return withSource(new Comparison(visit(ctx.expression(0)), operator, visit(ctx.expression(1))), ctx);
	}

	@Override
	public Expression visitNotExpression(FortranExpressionParser.NotExpressionContext ctx)
	{
		return withSource(new LogicalNot(visit(ctx.expression())), ctx);
	}

	@Override
	public Expression visitAndExpression(FortranExpressionParser.AndExpressionContext ctx)
	{
		return withSource(new LogicalAnd(visit(ctx.expression(0)), visit(ctx.expression(1))), ctx);
	}

	@Override
	public Expression visitOrExpression(FortranExpressionParser.OrExpressionContext ctx)
	{
		return withSource(new LogicalOr(visit(ctx.expression(0)), visit(ctx.expression(1))), ctx);
	}

	@Override
	public Expression visitPrimaryExpression(FortranExpressionParser.PrimaryExpressionContext ctx)
	{
		return visit(ctx.primary());
	}

	// --- Primaries ---

	@Override
	public Expression visitLiteralPrimary(FortranExpressionParser.LiteralPrimaryContext ctx)
	{
		String text = ctx.literal().getText();
		try
		{
			return withSource(Literal.of(text), ctx);
		}
		catch (UnclassifiableLiteralException e)
		{
			throw new ExpressionSyntaxException(text, e.getMessage());
		}
	}

	@Override
	public Expression visitParenthesisPrimary(FortranExpressionParser.ParenthesisPrimaryContext ctx)
	{
		return visit(ctx.expression());
	}

	@Override
	public Expression visitArrayConstructorPrimary(FortranExpressionParser.ArrayConstructorPrimaryContext ctx)
	{
		boolean bracket = ctx.open.getType() == FortranExpressionLexer.LBRACK;
		if (bracket != (ctx.close.getType() == FortranExpressionLexer.RBRACK))
		{
			throw new ExpressionSyntaxException(textOf(ctx), "array constructor opened with '" + ctx.open.getText()
					+ "' is closed with '" + ctx.close.getText() + "'");
		}
		List<Expression> elements = new ArrayList<>();
		ctx.expression().forEach(e -> elements.add(visit(e)));
		return withSource(new LiteralList(elements), ctx);
	}

	@Override
	public Expression visitDesignatorPrimary(FortranExpressionParser.DesignatorPrimaryContext ctx)
	{
		return visit(ctx.designator());
	}

	/**
	 * Builds {@code a%b%c(...)}: every part before the last becomes the parent of the next one.
	 */
	@Override
	public Expression visitDesignator(FortranExpressionParser.DesignatorContext ctx)
	{
		List<FortranExpressionParser.PartReferenceContext> parts = ctx.partReference();
		Variable parent = null;
		String qualifiedName = null;
		for (int i = 0; i < parts.size() - 1; i++)
		{
			FortranExpressionParser.PartReferenceContext part = parts.get(i);
			if (part.LPAREN() != null)
			{
				throw new ExpressionSyntaxException(textOf(ctx),
						"subscripted component '" + textOf(part) + "' cannot be followed by '%'");
			}
			qualifiedName = qualify(qualifiedName, part.NAME().getText());
			parent = Variable.builder(qualifiedName, scope)
					.parent(parent)
					.source(sourceOf(ctx.start, part.stop))
					.build();
		}

		FortranExpressionParser.PartReferenceContext last = parts.get(parts.size() - 1);
		String name = qualify(qualifiedName, last.NAME().getText());
		Source source = sourceOf(ctx.start, ctx.stop);
		if (last.LPAREN() == null)
		{
			return Variable.builder(name, scope).parent(parent).source(source).build();
		}
		return buildReference(name, parent, last, source);
	}

	private Expression buildReference(String name, Variable parent, FortranExpressionParser.PartReferenceContext part, Source source)
	{
		List<FortranExpressionParser.ArgumentContext> arguments = part.argumentList() == null
				? List.of()
				: part.argumentList().argument();

		List<Expression> positional = new ArrayList<>();
		Map<String, Expression> keywords = new LinkedHashMap<>();
		boolean hasRange = false;
		for (FortranExpressionParser.ArgumentContext argument : arguments)
		{
			if (argument instanceof FortranExpressionParser.KeywordArgumentContext keyword)
			{
				keywords.put(keyword.NAME().getText(), visit(keyword.expression()));
			}
			else if (argument instanceof FortranExpressionParser.RangeArgumentContext range)
			{
				positional.add(buildRange(range));
				hasRange = true;
			}
			else
			{
				positional.add(visit(((FortranExpressionParser.PositionalArgumentContext) argument).expression()));
			}
		}

		if (keywords.isEmpty() && (hasRange || parent != null || isDeclared(name)))
		{
			return Variable.builder(name, scope).dimensions(positional).parent(parent).source(source).build();
		}
		if (hasRange)
		{
			throw new ExpressionSyntaxException(source.getString(), "a range is only valid as an array subscript");
		}
		if (isConversion(name, positional, keywords))
		{
			Cast cast = new Cast(name, positional.get(0), keywords.values().stream().findFirst().orElse(null));
			cast.setSource(source);
			return cast;
		}
		InlineCall call = new InlineCall(name, positional, keywords);
		call.setSource(source);
		return call;
	}

	private Expression buildRange(FortranExpressionParser.RangeArgumentContext ctx)
	{
		Expression lower = ctx.lower == null ? null : visit(ctx.lower);
		Expression upper = ctx.upper == null ? null : visit(ctx.upper);
		Expression step = ctx.step == null ? null : visit(ctx.step);
		Expression range;
		if (lower == null && step == null && upper != null)
		{
			// ':N' must stay a slice, a collapsed RangeIndex would read as element N
			range = new Range(null, upper, null);
		}
		else
		{
			range = RangeIndex.of(lower, upper, step);
		}
		return withSource(range, ctx);
	}

	private boolean isDeclared(String name)
	{
		if (scope == null)
		{
			return false;
		}
		Optional<SymbolType> type = scope.lookup(name, true);
		return type.isPresent() && !type.get().isDeferred();
	}

	private static boolean isConversion(String name, List<Expression> positional, Map<String, Expression> keywords)
	{
		if (!CONVERSION_INTRINSICS.contains(name.toLowerCase(Locale.ROOT)) || positional.size() != 1)
		{
			return false;
		}
		return keywords.isEmpty() || (keywords.size() == 1 && keywords.keySet().iterator().next().equalsIgnoreCase("kind"));
	}

	private static String qualify(String parentName, String name)
	{
		return parentName == null ? name : parentName + "%" + name;
	}

	// --- Source tracking ---

	private static Expression withSource(Expression expression, ParserRuleContext ctx)
	{
		expression.setSource(sourceOf(ctx.start, ctx.stop));
		return expression;
	}

	private static Source sourceOf(Token start, Token stop)
	{
		String text = start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
		return new Source(start.getLine(), stop.getLine(), text);
	}

	private static String textOf(ParserRuleContext ctx)
	{
		return sourceOf(ctx.start, ctx.stop).getString();
	}
}
