package org.fortrex.semantic.symbol;

import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Scope")
class ScopeTest
{
	@Test
	void lookupIsCaseInsensitiveAndKeepsFirstSpelling()
	{
		Scope scope = new Scope("routine");
		SymbolType real = SymbolType.of(DataType.REAL, "JPRB");
		scope.assign("ZA", real);

		assertThat(scope.lookup("za", false)).containsSame(real);
		assertThat(scope.contains("Za")).isTrue();

		SymbolType integer = SymbolType.of(DataType.INTEGER);
		scope.assign("za", integer);
		assertThat(scope.getSymbols()).containsOnlyKeys("ZA");
		assertThat(scope.resolveLocally("ZA")).containsSame(integer);
	}

	@Test
	void recursiveLookupFallsBackToEnclosingScope()
	{
		Scope module = new Scope("module");
		Scope routine = new Scope("routine", module);
		SymbolType type = SymbolType.of(DataType.LOGICAL);
		module.assign("LFLAG", type);

		assertThat(routine.lookup("LFLAG", false)).isEmpty();
		assertThat(routine.lookup("LFLAG", true)).containsSame(type);
		assertThat(routine.resolve("lflag")).containsSame(type);
		assertThat(routine.resolve("UNKNOWN")).isEmpty();
	}

	@Test
	void setDefaultOnlyInsertsMissingEntries()
	{
		Scope scope = new Scope("routine");
		SymbolType first = SymbolType.of(DataType.INTEGER);
		SymbolType second = SymbolType.of(DataType.REAL);

		assertThat(scope.setDefault("I", first)).isSameAs(first);
		assertThat(scope.setDefault("i", second)).isSameAs(first);
		assertThat(scope.size()).isEqualTo(1);
	}

	@Test
	void symbolsKeepDeclarationOrder()
	{
		Scope scope = new Scope("routine");
		scope.assign("C", SymbolType.of(DataType.INTEGER));
		scope.assign("A", SymbolType.of(DataType.INTEGER));
		scope.assign("B", SymbolType.of(DataType.INTEGER));

		StringBuilder visited = new StringBuilder();
		scope.forEachSymbol((name, type) -> visited.append(name));
		assertThat(visited.toString()).isEqualTo("CAB");
		assertThat(scope.getSymbols().keySet()).containsExactly("C", "A", "B");
	}

	@Test
	void discardedScopeResolvesNothingAndRejectsWrites()
	{
		Scope scope = new Scope("routine");
		scope.assign("X", SymbolType.of(DataType.REAL));
		scope.discard();

		assertThat(scope.isAlive()).isFalse();
		assertThat(scope.resolveLocally("X")).isEmpty();
		assertThat(scope.lookup("X", true)).isEmpty();
		assertThatThrownBy(() -> scope.assign("X", SymbolType.of(DataType.REAL)))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> scope.setDefault("Y", SymbolType.deferred()))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void nullNameResolvesToEmpty()
	{
		assertThat(new Scope("routine").resolveLocally(null)).isEmpty();
	}
}
