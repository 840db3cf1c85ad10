package org.fortrex.expression;

import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Variable factory")
class VariableTest
{
	private Scope scope;

	@BeforeEach
	void setUp()
	{
		scope = new Scope("routine");
	}

	@Nested
	@DisplayName("type resolution")
	class TypeResolution
	{
		@Test
		void variablesOfTheSameNameShareTheTableEntry()
		{
			SymbolType real = SymbolType.of(DataType.REAL, "JPRB");
			Variable first = Variable.of("ZX", scope, real);
			Variable second = Variable.of("zx", scope);

			assertThat(second.getType()).isSameAs(real);

			SymbolType integer = SymbolType.of(DataType.INTEGER);
			second.setType(integer);
			assertThat(first.getType()).isSameAs(integer);
			assertThat(scope.resolveLocally("ZX")).containsSame(integer);
		}

		@Test
		void undeclaredNameGetsADeferredPlaceholder()
		{
			Variable variable = Variable.of("I", scope);

			assertThat(variable.getType().isDeferred()).isTrue();
			assertThat(scope.contains("I")).isTrue();
		}

		@Test
		void placeholderIsLocalEvenWhenAnEnclosingScopeDeclaresTheName()
		{
			Scope module = new Scope("module");
			module.assign("N", SymbolType.of(DataType.INTEGER));
			Scope routine = new Scope("routine", module);

			Variable n = Variable.of("N", routine);

			assertThat(n.getType().isDeferred()).isTrue();
			assertThat(module.resolveLocally("N").get().getDtype()).isEqualTo(DataType.INTEGER);
		}

		@Test
		void explicitTypeOverwritesTheExistingEntry()
		{
			Variable.of("X", scope, SymbolType.of(DataType.INTEGER));
			SymbolType real = SymbolType.of(DataType.REAL);
			Variable.of("X", scope, real);

			assertThat(scope.resolveLocally("X")).containsSame(real);
		}

		@Test
		void arrayShapeIsStoredInTheType()
		{
			Array array = (Array) Variable.of("A", scope, SymbolType.array(DataType.REAL, null, List.of(new IntLiteral(4))));
			array.setShape(List.of(new IntLiteral(8)));

			Array other = (Array) Variable.of("A", scope);
			assertThat(other.getShape()).containsExactly(new IntLiteral(8));
		}
	}

	@Nested
	@DisplayName("variant selection")
	class VariantSelection
	{
		@Test
		void scalarWithoutShapeOrSubscript()
		{
			assertThat(Variable.of("X", scope, SymbolType.of(DataType.REAL))).isInstanceOf(Scalar.class);
		}

		@Test
		void arrayWhenTheTypeHasAShape()
		{
			Variable variable = Variable.of("A", scope, SymbolType.array(DataType.REAL, null, List.of(new IntLiteral(3))));

			assertThat(variable).isInstanceOf(Array.class);
			assertThat(((Array) variable).hasDimensions()).isFalse();
		}

		@Test
		void arrayWhenSubscripted()
		{
			Variable i = Variable.of("I", scope);
			Variable variable = Variable.of("A", scope, SymbolType.of(DataType.REAL), List.of(i));

			assertThat(variable).isInstanceOf(Array.class);
			assertThat(((Array) variable).getDimensions().getIndex()).containsExactly(i);
		}

		@Test
		void invalidArgumentsAreRejected()
		{
			assertThatThrownBy(() -> Variable.of(null, scope)).isInstanceOf(InvalidConstructionException.class);
			assertThatThrownBy(() -> Variable.of("  ", scope)).isInstanceOf(InvalidConstructionException.class);
			assertThatThrownBy(() -> Variable.of("X", null)).isInstanceOf(InvalidConstructionException.class);
		}
	}

	@Nested
	@DisplayName("derived types")
	class DerivedTypes
	{
		private SymbolType structType()
		{
			Map<String, SymbolType> components = new LinkedHashMap<>();
			components.put("a", SymbolType.of(DataType.REAL, "JPRB"));
			components.put("b", SymbolType.array(DataType.INTEGER, null, List.of(new IntLiteral(3))));
			return SymbolType.derived("my_struct", components);
		}

		@Test
		void membersAreExpandedAndParented()
		{
			SymbolType struct = structType();
			Variable obj = Variable.of("obj", scope, struct);

			assertThat(obj.getMembers()).containsOnlyKeys("a", "b");
			Variable a = obj.getMembers().get("a");
			assertThat(a).isInstanceOf(Scalar.class);
			assertThat(a.getName()).isEqualTo("obj%a");
			assertThat(a.getBasename()).isEqualTo("a");
			assertThat(a.getParent()).isSameAs(obj);
			assertThat(a.getType().getParent()).isSameAs(obj);
			assertThat(obj.getMembers().get("b")).isInstanceOf(Array.class);
			assertThat(scope.contains("obj%a")).isTrue();

			assertThat(struct.getMembers()).isEmpty();
		}

		@Test
		void expansionIsIdempotent()
		{
			Variable first = Variable.of("obj", scope, structType());
			Map<String, Variable> members = first.getMembers();
			SymbolType expanded = first.getType();

			Variable second = Variable.of("obj", scope);

			assertThat(second.getType()).isSameAs(expanded);
			assertThat(second.getMembers()).isSameAs(members);
			assertThat(Variable.instantiateDerivedTypeVariables(second).getType()).isSameAs(expanded);
		}

		@Test
		void instancesInOtherScopesGetTheirOwnMembers()
		{
			SymbolType struct = structType();
			Variable here = Variable.of("obj", scope, struct);
			Scope other = new Scope("other");
			Variable there = Variable.of("obj", other, here.getType());

			assertThat(there.getMembers().get("a").getScope()).contains(other);
			assertThat(here.getMembers().get("a").getScope()).contains(scope);
		}
	}

	@Nested
	@DisplayName("copies with overrides")
	class Overrides
	{
		@Test
		void droppingTheSubscriptOfAShapelessArrayYieldsAScalar()
		{
			SymbolType real = SymbolType.of(DataType.REAL);
			Variable subscripted = Variable.of("A", scope, real, List.of(new IntLiteral(1)));

			Variable copy = subscripted.toBuilder().noDimensions().build();

			assertThat(subscripted).isInstanceOf(Array.class);
			assertThat(copy).isInstanceOf(Scalar.class);
			assertThat(copy.getName()).isEqualTo("A");
			assertThat(copy.getType()).isSameAs(real);
		}

		@Test
		void droppingTheSubscriptOfAShapedArrayKeepsAnArray()
		{
			Variable subscripted = Variable.of("A", scope, SymbolType.array(DataType.REAL, null, List.of(new IntLiteral(3))),
					List.of(new IntLiteral(1)));

			Variable copy = subscripted.toBuilder().noDimensions().build();

			assertThat(copy).isInstanceOf(Array.class);
			assertThat(((Array) copy).hasDimensions()).isFalse();
		}

		@Test
		void addingASubscriptToAScalarYieldsAnArray()
		{
			Variable x = Variable.of("X", scope, SymbolType.of(DataType.REAL));

			Variable copy = x.toBuilder().dimensions(new IntLiteral(2)).build();

			assertThat(copy).isInstanceOf(Array.class);
			assertThat(((Array) copy).getDimensions().getIndex()).containsExactly(new IntLiteral(2));
		}

		@Test
		void renamedCopyDeclaresTheNewNameWithTheSameType()
		{
			SymbolType real = SymbolType.of(DataType.REAL, "JPRB");
			Variable x = Variable.of("X", scope, real);

			Variable y = x.toBuilder().name("Y").build();

			assertThat(y.getName()).isEqualTo("Y");
			assertThat(y).isNotEqualTo(x);
			assertThat(scope.resolveLocally("Y")).containsSame(real);
			assertThat(x.getType()).isSameAs(real);
		}

		@Test
		void typeOverrideIsWrittenToTheTable()
		{
			Variable x = Variable.of("X", scope, SymbolType.of(DataType.REAL));
			SymbolType integer = SymbolType.of(DataType.INTEGER);

			Variable copy = x.toBuilder().type(integer).build();

			assertThat(copy).isEqualTo(x);
			assertThat(x.getType()).isSameAs(integer);
			assertThat(scope.resolveLocally("X")).containsSame(integer);
		}
	}

	@Nested
	@DisplayName("lifecycle")
	class Lifecycle
	{
		@Test
		void cloneIsEqualButDistinct()
		{
			Variable i = Variable.of("I", scope);
			Variable original = Variable.of("A", scope, SymbolType.of(DataType.REAL), List.of(i, new IntLiteral(2)));
			Variable copy = original.clone();

			assertThat(copy).isNotSameAs(original).isEqualTo(original);
			assertThat(copy.getType()).isSameAs(original.getType());
			assertThat(copy).hasSameHashCodeAs(original);
		}

		@Test
		void namesDifferingOnlyInCaseAreTheSameVariable()
		{
			Variable upper = Variable.of("I", scope);
			Variable lower = Variable.of("i", scope);

			assertThat(lower).isEqualTo(upper).hasSameHashCodeAs(upper);
		}

		@Test
		void variablesInDifferentScopesAreNotEqual()
		{
			assertThat(Variable.of("X", scope)).isNotEqualTo(Variable.of("X", new Scope("other")));
		}

		@Test
		void discardedScopeLeavesADanglingVariable()
		{
			Variable x = Variable.of("X", scope, SymbolType.of(DataType.REAL));
			scope.discard();

			assertThat(x.getScope()).isEmpty();
			assertThat(x.getType()).isNull();
			assertThat(x.getMembers()).isEmpty();
			assertThatThrownBy(() -> x.setType(SymbolType.of(DataType.REAL))).isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> Variable.of("Y", scope)).isInstanceOf(InvalidConstructionException.class);
		}
	}
}
