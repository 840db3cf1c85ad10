package org.fortrex.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.fortrex.expression.Expression;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.util.Debug;
import org.fortrex.util.SyntaxErrorListener;

/**
 * Parses Fortran expression text into expression trees whose variables are bound to a scope.
 */
public class ExpressionParser
{
	private final Scope scope;

	/**
	 * @param scope the scope names are resolved and registered in, or null for constant expressions
	 */
	public ExpressionParser(Scope scope)
	{
		this.scope = scope;
	}

	public static Expression parse(String text, Scope scope)
	{
		return new ExpressionParser(scope).parse(text);
	}

	public Expression parse(String text)
	{
		return parse(text, 1);
	}

	/**
	 * Parses an expression that starts on the given line of its file, so that the
	 * {@link org.fortrex.expression.Source} of every node carries file line numbers.
	 *
	 * @throws ExpressionSyntaxException if the text is not a single valid expression
	 */
	public Expression parse(String text, int firstLine)
	{
		if (text == null || text.isBlank())
		{
			throw new ExpressionSyntaxException(String.valueOf(text), "empty expression");
		}

		CharStream input = CharStreams.fromString(text);
		FortranExpressionLexer lexer = new FortranExpressionLexer(input);
		lexer.setLine(firstLine);
		CommonTokenStream tokens = new CommonTokenStream(lexer);
		FortranExpressionParser parser = new FortranExpressionParser(tokens);

		// Remove default error listeners to use our own
		SyntaxErrorListener errorListener = new SyntaxErrorListener();
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);

		FortranExpressionParser.ParseContext tree;
		try
		{
			tree = parser.parse();
		}
		catch (ParseCancellationException e)
		{
			throw new ExpressionSyntaxException(text, e.getMessage());
		}
		if (errorListener.hasErrors())
		{
			throw new ExpressionSyntaxException(text, errorListener.getErrors());
		}

		Expression expression = new ExpressionBuilder(scope).visit(tree);
		Debug.logDebug("Parsed '" + text + "' -> " + expression);
		return expression;
	}

	public Scope getScope()
	{
		return scope;
	}
}
