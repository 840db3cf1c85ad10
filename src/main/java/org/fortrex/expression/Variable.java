package org.fortrex.expression;

import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.SymbolType;
import org.fortrex.util.Debug;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol bound to the symbol table of its scope: either a {@link Scalar} or an {@link Array}.
 * <p>
 * A variable never stores its own type. {@link #getType()} reads the scope's table entry for
 * {@link #getName()} on every call and {@link #setType(SymbolType)} writes through to it, so all
 * nodes naming the same symbol in the same scope observe the same type.
 * <p>
 * The static factories are the only way to create variables. They pick the variant from the
 * resolved shape and expand the members of derived-type instances.
 * <p>
 * Warning: providing a type that is not the very instance already held by the table overwrites
 * the entry. A name may be used before its declaration has been processed, so the latest type
 * information is taken as the most up to date.
 */
public abstract class Variable extends AbstractExpression
{
	private final String name;
	private final Scope scope;
	private final Expression initial;
	private final Variable parent;

	Variable(String name, Scope scope, Expression initial, Variable parent)
	{
		this.name = name;
		this.scope = scope;
		this.initial = initial;
		this.parent = parent;
	}

	// --- Factory ---

	public static Variable of(String name, Scope scope)
	{
		return builder(name, scope).build();
	}

	public static Variable of(String name, Scope scope, SymbolType type)
	{
		return builder(name, scope).type(type).build();
	}

	public static Variable of(String name, Scope scope, SymbolType type, List<? extends Expression> dimensions)
	{
		return builder(name, scope).type(type).dimensions(dimensions).build();
	}

	public static Builder builder(String name, Scope scope)
	{
		return new Builder(name, scope);
	}

	private static Variable create(Builder b)
	{
		if (b.name == null || b.name.isBlank())
		{
			throw new InvalidConstructionException("A variable requires a name.");
		}
		if (b.scope == null)
		{
			throw new InvalidConstructionException("Variable '" + b.name + "' requires a scope.");
		}
		if (!b.scope.isAlive())
		{
			throw new InvalidConstructionException("Variable '" + b.name + "' refers to a discarded scope.");
		}

		Optional<SymbolType> existing = b.scope.resolveLocally(b.name);
		SymbolType type = b.type;
		if (type == null)
		{
			type = existing.orElseGet(() -> b.scope.setDefault(b.name, SymbolType.deferred()));
		}
		else if (existing.isEmpty() || existing.get() != type)
		{
			if (existing.isPresent())
			{
				Debug.logDebug("Overwriting type of '" + b.name + "' in " + b.scope + ": " + existing.get() + " -> " + type);
			}
			b.scope.assign(b.name, type);
		}

		Variable parent = b.parent != null ? b.parent : type.getParent();
		Variable obj;
		if (b.dimensions == null && !type.hasShape())
		{
			obj = new Scalar(b.name, b.scope, b.initial, parent);
		}
		else
		{
			obj = new Array(b.name, b.scope, b.dimensions, b.initial, parent);
		}
		obj.setSource(b.source);
		return instantiateDerivedTypeVariables(obj);
	}

	/**
	 * Binds the members of a derived-type instance.
	 * <p>
	 * The type definition only carries a member template. The first time an instance is created
	 * in a scope, the descriptor is cloned with a fresh member map holding one variable per
	 * template entry, named {@code <instance>%<member>} and parented to the instance. Once the
	 * members are bound to the instance's scope this is a no-op.
	 */
	static Variable instantiateDerivedTypeVariables(Variable obj)
	{
		SymbolType type = obj.getType();
		if (type == null || !type.isDerived() || type.getVariables().isEmpty())
		{
			return obj;
		}
		if (!type.getMembers().isEmpty())
		{
			Variable first = type.getMembers().values().iterator().next();
			if (first.scope == obj.scope)
			{
				return obj;
			}
		}

		Map<String, Variable> members = new LinkedHashMap<>();
		type.getVariables().forEach((vname, vtype) ->
		{
			Variable member = builder(obj.name + "%" + vname, obj.scope)
					.type(vtype.withParent(obj))
					.parent(obj)
					.build();
			members.put(vname, member);
		});
		obj.setType(type.withMembers(members));
		Debug.logDebug("Expanded " + members.size() + " member(s) of derived-type variable '" + obj.name + "'.");
		return obj;
	}

	// --- Accessors ---

	public String getName()
	{
		return name;
	}

	/**
	 * The name without the qualifiers of its parents, i.e. the part after the last {@code %}.
	 */
	public String getBasename()
	{
		return name.substring(name.lastIndexOf('%') + 1);
	}

	/**
	 * The scope this variable is bound to, or empty once that scope has been discarded.
	 */
	public Optional<Scope> getScope()
	{
		return scope.isAlive() ? Optional.of(scope) : Optional.empty();
	}

	/**
	 * The type currently recorded for this name in the scope's table, or null if the scope is gone.
	 */
	public SymbolType getType()
	{
		return scope.resolveLocally(name).orElse(null);
	}

	public void setType(SymbolType type)
	{
		if (!scope.isAlive())
		{
			throw new IllegalStateException("Cannot set the type of '" + name + "': its scope has been discarded.");
		}
		scope.assign(name, type);
	}

	public Expression getInitial()
	{
		return initial;
	}

	/**
	 * The derived-type instance this variable is a member of, or null for top-level symbols.
	 */
	public Variable getParent()
	{
		return parent;
	}

	/**
	 * Member variables of a derived-type instance, keyed by member basename.
	 */
	public Map<String, Variable> getMembers()
	{
		SymbolType type = getType();
		return type == null ? Map.of() : type.getMembers();
	}

	Scope scopeReference()
	{
		return scope;
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		// names compare the way the scope keys them
		return Arrays.asList(name.toLowerCase(Locale.ROOT), scope);
	}

	/**
	 * A builder pre-filled with this variable's fields. Set any field to override it; the
	 * variant is derived again on {@link Builder#build()}.
	 */
	public abstract Builder toBuilder();

	@Override
	public Variable clone()
	{
		return toBuilder().build();
	}

	public static final class Builder
	{
		private String name;
		private Scope scope;
		private SymbolType type;
		private ArraySubscript dimensions;
		private Expression initial;
		private Variable parent;
		private Source source;

		private Builder(String name, Scope scope)
		{
			this.name = name;
			this.scope = scope;
		}

		public Builder name(String name)
		{
			this.name = name;
			return this;
		}

		public Builder scope(Scope scope)
		{
			this.scope = scope;
			return this;
		}

		public Builder type(SymbolType type)
		{
			this.type = type;
			return this;
		}

		public Builder dimensions(ArraySubscript dimensions)
		{
			this.dimensions = dimensions;
			return this;
		}

		public Builder dimensions(List<? extends Expression> dimensions)
		{
			this.dimensions = dimensions == null ? null : new ArraySubscript(dimensions);
			return this;
		}

		public Builder dimensions(Expression... dimensions)
		{
			return dimensions(Arrays.asList(dimensions));
		}

		public Builder noDimensions()
		{
			this.dimensions = null;
			return this;
		}

		public Builder initial(Expression initial)
		{
			this.initial = initial;
			return this;
		}

		public Builder parent(Variable parent)
		{
			this.parent = parent;
			return this;
		}

		public Builder source(Source source)
		{
			this.source = source;
			return this;
		}

		public Variable build()
		{
			return create(this);
		}
	}
}
