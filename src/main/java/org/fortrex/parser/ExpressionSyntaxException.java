package org.fortrex.parser;

import java.util.List;

/**
 * Raised when text cannot be parsed as a Fortran expression.
 */
public class ExpressionSyntaxException extends IllegalArgumentException
{
	private final String text;
	private final List<String> errors;

	public ExpressionSyntaxException(String text, List<String> errors)
	{
		super("Invalid expression '" + text + "': " + String.join("; ", errors));
		this.text = text;
		this.errors = List.copyOf(errors);
	}

	public ExpressionSyntaxException(String text, String error)
	{
		this(text, List.of(error));
	}

	public String getText()
	{
		return text;
	}

	public List<String> getErrors()
	{
		return errors;
	}
}
