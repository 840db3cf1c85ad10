package org.fortrex.semantic.type;

import org.fortrex.expression.Expression;
import org.fortrex.expression.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Type descriptor of a symbol: data kind, kind tag, declared shape and, for derived types,
 * the member layout.
 * <p>
 * Descriptors are immutable. Every {@code with...} method returns a modified copy and leaves
 * the receiver untouched, which is what allows the member template of a derived type to be
 * shared by all of its instances. Equality is identity: two separately created descriptors are
 * never considered the same declaration.
 */
public final class SymbolType
{
	private final DataType dtype;
	private final String kind;
	private final List<Expression> shape;
	private final Variable parent;
	private final String typeName;
	private final Expression initial;
	private final Map<String, SymbolType> variables;
	private final Map<String, Variable> members;

	private SymbolType(DataType dtype, String kind, List<Expression> shape, Variable parent, String typeName,
					   Expression initial, Map<String, SymbolType> variables, Map<String, Variable> members)
	{
		if (dtype == null)
		{
			throw new IllegalArgumentException("A symbol type requires a data type.");
		}
		this.dtype = dtype;
		this.kind = kind;
		this.shape = shape == null ? List.of() : List.copyOf(shape);
		this.parent = parent;
		this.typeName = typeName;
		this.initial = initial;
		this.variables = variables;
		this.members = members;
	}

	// --- Factories ---

	public static SymbolType of(DataType dtype)
	{
		return new SymbolType(dtype, null, null, null, null, null, Map.of(), Map.of());
	}

	public static SymbolType of(DataType dtype, String kind)
	{
		return new SymbolType(dtype, kind, null, null, null, null, Map.of(), Map.of());
	}

	public static SymbolType array(DataType dtype, String kind, List<? extends Expression> shape)
	{
		return new SymbolType(dtype, kind, List.copyOf(shape), null, null, null, Map.of(), Map.of());
	}

	/**
	 * Creates the descriptor of a derived type definition. The given member declarations become
	 * the template that every instance clones on expansion.
	 *
	 * @param typeName  name of the derived type, e.g. {@code my_struct}
	 * @param variables member name to member type, in declaration order
	 */
	public static SymbolType derived(String typeName, Map<String, SymbolType> variables)
	{
		Map<String, SymbolType> template = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
		return new SymbolType(DataType.DERIVED_TYPE, null, null, null, typeName, null, template, Map.of());
	}

	/**
	 * Placeholder for a name that is used before its declaration has been seen.
	 */
	public static SymbolType deferred()
	{
		return of(DataType.DEFERRED);
	}

	// --- Clone with overrides ---

	public SymbolType withKind(String kind)
	{
		return new SymbolType(dtype, kind, shape, parent, typeName, initial, variables, members);
	}

	public SymbolType withShape(List<? extends Expression> shape)
	{
		return new SymbolType(dtype, kind, List.copyOf(shape), parent, typeName, initial, variables, members);
	}

	public SymbolType withParent(Variable parent)
	{
		return new SymbolType(dtype, kind, shape, parent, typeName, initial, variables, members);
	}

	public SymbolType withInitial(Expression initial)
	{
		return new SymbolType(dtype, kind, shape, parent, typeName, initial, variables, members);
	}

	/**
	 * Returns a copy bound to the given per-instance member variables. The template stays shared.
	 */
	public SymbolType withMembers(Map<String, Variable> members)
	{
		Map<String, Variable> bound = Collections.unmodifiableMap(new LinkedHashMap<>(members));
		return new SymbolType(dtype, kind, shape, parent, typeName, initial, variables, bound);
	}

	// --- Accessors ---

	public DataType getDtype()
	{
		return dtype;
	}

	public String getKind()
	{
		return kind;
	}

	public List<Expression> getShape()
	{
		return shape;
	}

	public boolean hasShape()
	{
		return !shape.isEmpty();
	}

	public Variable getParent()
	{
		return parent;
	}

	public String getTypeName()
	{
		return typeName;
	}

	public Expression getInitial()
	{
		return initial;
	}

	/**
	 * The member template of a derived type, in declaration order. Empty for intrinsic types.
	 */
	public Map<String, SymbolType> getVariables()
	{
		return variables;
	}

	/**
	 * Member variables bound to one instance, empty until the instance has been expanded.
	 */
	public Map<String, Variable> getMembers()
	{
		return members;
	}

	public boolean isDerived()
	{
		return dtype == DataType.DERIVED_TYPE;
	}

	public boolean isDeferred()
	{
		return dtype == DataType.DEFERRED;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (isDerived())
		{
			sb.append("type(").append(typeName == null ? "" : typeName).append(')');
		}
		else
		{
			sb.append(dtype.getKeyword());
			if (kind != null)
			{
				sb.append("(kind=").append(kind).append(')');
			}
		}
		if (hasShape())
		{
			sb.append(", dimension(")
					.append(shape.stream().map(Expression::toString).collect(Collectors.joining(",")))
					.append(')');
		}
		return sb.toString();
	}
}
