package org.fortrex.semantic.type;

import org.fortrex.expression.IntLiteral;
import org.fortrex.expression.RangeIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SymbolTypeTest
{
	@Test
	void withersReturnCopiesAndLeaveTheReceiverUntouched()
	{
		SymbolType scalar = SymbolType.of(DataType.REAL, "JPRB");
		SymbolType array = scalar.withShape(List.of(new IntLiteral(10)));

		assertThat(array).isNotSameAs(scalar);
		assertThat(scalar.hasShape()).isFalse();
		assertThat(array.getShape()).containsExactly(new IntLiteral(10));
		assertThat(array.getKind()).isEqualTo("JPRB");
		assertThat(scalar.withKind("JPRD").getKind()).isEqualTo("JPRD");
		assertThat(scalar.getKind()).isEqualTo("JPRB");
	}

	@Test
	void equalityIsIdentity()
	{
		assertThat(SymbolType.of(DataType.INTEGER)).isNotEqualTo(SymbolType.of(DataType.INTEGER));
	}

	@Test
	void derivedTemplateIsImmutableAndSharedByCopies()
	{
		Map<String, SymbolType> components = new LinkedHashMap<>();
		components.put("a", SymbolType.of(DataType.REAL));
		SymbolType derived = SymbolType.derived("my_struct", components);
		components.put("b", SymbolType.of(DataType.INTEGER));

		assertThat(derived.getVariables()).containsOnlyKeys("a");
		assertThatThrownBy(() -> derived.getVariables().put("c", SymbolType.deferred()))
				.isInstanceOf(UnsupportedOperationException.class);
		assertThat(derived.withMembers(Map.of()).getVariables()).isSameAs(derived.getVariables());
		assertThat(derived.isDerived()).isTrue();
	}

	@Test
	void rendersDeclarationText()
	{
		SymbolType type = SymbolType.array(DataType.REAL, "JPRB", List.of(RangeIndex.all(), new IntLiteral(3)));
		assertThat(type).hasToString("real(kind=JPRB), dimension(:,3)");
		assertThat(SymbolType.derived("my_struct", Map.of())).hasToString("type(my_struct)");
	}

	@ParameterizedTest
	@CsvSource({
			"integer, INTEGER",
			"REAL, REAL",
			"Logical, LOGICAL",
			"character, CHARACTER",
			"type, DERIVED_TYPE",
			"derived_type, DERIVED_TYPE",
			"deferred, DEFERRED"
	})
	void dataTypeFromString(String text, DataType expected)
	{
		assertThat(DataType.fromString(text)).isEqualTo(expected);
	}

	@Test
	void unknownDataTypeIsRejected()
	{
		assertThatThrownBy(() -> DataType.fromString("complex")).isInstanceOf(IllegalArgumentException.class);
	}
}
