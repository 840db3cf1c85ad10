package org.fortrex.semantic.symbol;

import org.fortrex.semantic.type.SymbolType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * The symbol table of one program unit (subroutine, function or module).
 * <p>
 * Maps names to {@link SymbolType}s in declaration order. Fortran names are case-insensitive,
 * so entries are keyed by the lower-cased name while the spelling seen first is kept for output.
 * A scope may have an enclosing scope that recursive lookups fall back to.
 * <p>
 * Expression nodes only hold a back-pointer to their scope. Once the owning program unit is done
 * with it, {@link #discard()} releases the table and every node referencing it observes an
 * absent scope from then on.
 */
public class Scope
{
	private final String name;
	private final Scope enclosingScope;
	private final Map<String, Entry> symbols = new LinkedHashMap<>();
	private boolean alive = true;

	public Scope(String name)
	{
		this(name, null);
	}

	public Scope(String name, Scope enclosingScope)
	{
		this.name = name;
		this.enclosingScope = enclosingScope;
	}

	/**
	 * Looks up the type of a name.
	 *
	 * @param name      the (possibly {@code %}-qualified) name
	 * @param recursive whether enclosing scopes are searched when this table has no entry
	 * @return the type, or empty for undeclared names and discarded scopes
	 */
	public Optional<SymbolType> lookup(String name, boolean recursive)
	{
		Optional<SymbolType> local = resolveLocally(name);
		if (local.isPresent() || !recursive)
		{
			return local;
		}
		if (enclosingScope != null)
		{
			return enclosingScope.lookup(name, true);
		}
		return Optional.empty();
	}

	public Optional<SymbolType> resolve(String name)
	{
		return lookup(name, true);
	}

	public Optional<SymbolType> resolveLocally(String name)
	{
		if (!alive || name == null)
		{
			return Optional.empty();
		}
		Entry entry = symbols.get(key(name));
		return entry == null ? Optional.empty() : Optional.of(entry.type);
	}

	/**
	 * Inserts the type only if this table has no entry for the name yet.
	 *
	 * @return the entry in effect after the call
	 */
	public SymbolType setDefault(String name, SymbolType type)
	{
		checkAlive();
		Entry existing = symbols.get(key(name));
		if (existing != null)
		{
			return existing.type;
		}
		symbols.put(key(name), new Entry(name, type));
		return type;
	}

	/**
	 * Inserts or overwrites the entry for a name. The original spelling of an existing entry is kept.
	 */
	public void assign(String name, SymbolType type)
	{
		checkAlive();
		Entry existing = symbols.get(key(name));
		symbols.put(key(name), new Entry(existing != null ? existing.name : name, type));
	}

	public boolean contains(String name)
	{
		return resolveLocally(name).isPresent();
	}

	public int size()
	{
		return symbols.size();
	}

	/**
	 * Ordered view of the table, keyed by declared spelling.
	 */
	public Map<String, SymbolType> getSymbols()
	{
		Map<String, SymbolType> view = new LinkedHashMap<>();
		symbols.values().forEach(e -> view.put(e.name, e.type));
		return Collections.unmodifiableMap(view);
	}

	public void forEachSymbol(BiConsumer<String, SymbolType> visitor)
	{
		symbols.values().forEach(e -> visitor.accept(e.name, e.type));
	}

	/**
	 * Releases this scope. The table is cleared and further writes are rejected.
	 */
	public void discard()
	{
		symbols.clear();
		alive = false;
	}

	public boolean isAlive()
	{
		return alive;
	}

	public String getName()
	{
		return name;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	@Override
	public String toString()
	{
		return "Scope<" + name + ">";
	}

	private void checkAlive()
	{
		if (!alive)
		{
			throw new IllegalStateException("Scope '" + name + "' has been discarded.");
		}
	}

	private static String key(String name)
	{
		if (name == null)
		{
			throw new IllegalArgumentException("Symbol name must not be null.");
		}
		return name.toLowerCase(Locale.ROOT);
	}

	private static final class Entry
	{
		private final String name;
		private final SymbolType type;

		private Entry(String name, SymbolType type)
		{
			this.name = name;
			this.type = type;
		}
	}
}
