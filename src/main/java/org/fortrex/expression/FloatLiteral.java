package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * A real constant.
 * <p>
 * The value is kept as the text it was written with ({@code 1.0}, {@code 2.5D-3}) so that
 * rendering and re-parsing never drifts through a binary floating point representation.
 */
public final class FloatLiteral extends AbstractExpression
{
	private final String value;
	private final String kind;

	public FloatLiteral(String value)
	{
		this(value, null);
	}

	public FloatLiteral(String value, String kind)
	{
		if (value == null || value.isBlank())
		{
			throw new InvalidConstructionException("A real literal requires a value.");
		}
		this.value = value;
		this.kind = kind;
	}

	/**
	 * The original textual representation.
	 */
	public String getValue()
	{
		return value;
	}

	public String getKind()
	{
		return kind;
	}

	public boolean isNegative()
	{
		return value.startsWith("-");
	}

	/**
	 * Numeric value for consumers that need one; Fortran's {@code D} exponent is accepted.
	 */
	public double doubleValue()
	{
		return Double.parseDouble(value.replace('d', 'e').replace('D', 'E'));
	}

	public FloatLiteral withKind(String kind)
	{
		return copySourceTo(new FloatLiteral(value, kind));
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitFloatLiteral(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return Arrays.asList(value, kind);
	}

	@Override
	public FloatLiteral clone()
	{
		return copySourceTo(new FloatLiteral(value, kind));
	}
}
