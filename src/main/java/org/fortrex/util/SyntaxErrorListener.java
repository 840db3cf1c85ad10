package org.fortrex.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A custom error listener for the ANTLR lexer and parser. Syntax errors are kept for the
 * caller to report and routed through Debug.logDebug, since a failed parse is often expected
 * (the literal factory hands unclassified text to the parser).
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final List<String> errors = new ArrayList<>();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg);
		Debug.logDebug(err);
		errors.add(err);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}
}
