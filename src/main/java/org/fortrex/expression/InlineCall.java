package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A function reference inside an expression, with positional and keyword arguments.
 */
public final class InlineCall extends AbstractExpression
{
	private final String function;
	private final List<Expression> parameters;
	private final Map<String, Expression> keywordParameters;

	public InlineCall(String function, List<? extends Expression> parameters)
	{
		this(function, parameters, Map.of());
	}

	public InlineCall(String function, List<? extends Expression> parameters, Map<String, ? extends Expression> keywordParameters)
	{
		if (function == null || function.isBlank())
		{
			throw new InvalidConstructionException("An inline call requires a function name.");
		}
		this.function = function;
		this.parameters = requireChildren("Call to " + function, parameters == null ? List.of() : parameters, 0);
		Map<String, Expression> keywords = new LinkedHashMap<>();
		if (keywordParameters != null)
		{
			keywordParameters.forEach((k, v) -> keywords.put(k, require(v, "Keyword argument '" + k + "' must not be null.")));
		}
		this.keywordParameters = Collections.unmodifiableMap(keywords);
	}

	public String getName()
	{
		return function;
	}

	public List<Expression> getParameters()
	{
		return parameters;
	}

	/**
	 * Keyword arguments in the order they were given.
	 */
	public Map<String, Expression> getKeywordParameters()
	{
		return keywordParameters;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitInlineCall(this);
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		return List.of(function, parameters, keywordParameters);
	}

	@Override
	public InlineCall clone()
	{
		Map<String, Expression> keywords = new LinkedHashMap<>();
		keywordParameters.forEach((k, v) -> keywords.put(k, v.clone()));
		return copySourceTo(new InlineCall(function, cloneAll(parameters), keywords));
	}
}
