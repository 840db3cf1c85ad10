package org.fortrex.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.fortrex.dto.ScopeDTO;
import org.fortrex.dto.SymbolDTO;
import org.fortrex.expression.IntLiteral;
import org.fortrex.expression.Variable;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SymbolTableDTOConverterTest
{
	@Test
	void convertsEntriesInDeclarationOrder()
	{
		Scope module = new Scope("module");
		Scope scope = new Scope("routine", module);
		scope.assign("ZA", SymbolType.array(DataType.REAL, "JPRB", List.of(new IntLiteral(10))));
		Map<String, SymbolType> components = new LinkedHashMap<>();
		components.put("n", SymbolType.of(DataType.INTEGER));
		Variable.of("obj", scope, SymbolType.derived("my_struct", components));

		ScopeDTO dto = SymbolTableDTOConverter.toDTO(scope);

		assertThat(dto.name).isEqualTo("routine");
		assertThat(dto.enclosingScope).isEqualTo("module");
		assertThat(dto.symbols).extracting(s -> s.name).containsExactly("ZA", "obj", "obj%n");

		SymbolDTO za = dto.symbols.get(0);
		assertThat(za.type).isEqualTo("real");
		assertThat(za.kind).isEqualTo("JPRB");
		assertThat(za.shape).containsExactly("10");

		SymbolDTO obj = dto.symbols.get(1);
		assertThat(obj.typeName).isEqualTo("my_struct");
		assertThat(obj.components).extracting(s -> s.name).containsExactly("n");
		assertThat(dto.symbols.get(2).parent).isEqualTo("obj");
	}

	@Test
	void serializesWithGson()
	{
		Scope scope = new Scope("routine");
		scope.assign("LFLAG", SymbolType.of(DataType.LOGICAL));

		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		String json = gson.toJson(SymbolTableDTOConverter.toDTO(scope));
		ScopeDTO back = gson.fromJson(json, ScopeDTO.class);

		assertThat(json).contains("\"LFLAG\"").contains("\"logical\"");
		assertThat(back.symbols).singleElement().satisfies(s -> assertThat(s.type).isEqualTo("logical"));
	}
}
