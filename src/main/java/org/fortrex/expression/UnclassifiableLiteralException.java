package org.fortrex.expression;

/**
 * Raised by the literal factory when a raw value is neither a literal nor a parsable expression.
 */
public class UnclassifiableLiteralException extends IllegalArgumentException
{
	private final transient Object value;

	public UnclassifiableLiteralException(Object value)
	{
		super("Unknown literal: " + value);
		this.value = value;
	}

	public UnclassifiableLiteralException(Object value, Throwable cause)
	{
		super("Unknown literal: " + value, cause);
		this.value = value;
	}

	public Object getValue()
	{
		return value;
	}
}
