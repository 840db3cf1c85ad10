package org.fortrex.expression;

/**
 * Raised when a node is built without the fields it cannot exist without, such as a bound
 * symbol missing its name or scope. No partially built node is ever returned.
 */
public class InvalidConstructionException extends IllegalArgumentException
{
	public InvalidConstructionException(String message)
	{
		super(message);
	}
}
