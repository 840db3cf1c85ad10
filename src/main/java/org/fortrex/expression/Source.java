package org.fortrex.expression;

/**
 * Where a node came from: the line range and the original text of the construct.
 */
public final class Source
{
	private final int startLine;
	private final int endLine;
	private final String string;

	public Source(int startLine, int endLine, String string)
	{
		this.startLine = startLine;
		this.endLine = endLine;
		this.string = string;
	}

	public Source(int line, String string)
	{
		this(line, line, string);
	}

	public int getStartLine()
	{
		return startLine;
	}

	public int getEndLine()
	{
		return endLine;
	}

	public String getString()
	{
		return string;
	}

	@Override
	public String toString()
	{
		return startLine == endLine
				? "line " + startLine + ": " + string
				: "lines " + startLine + "-" + endLine + ": " + string;
	}
}
