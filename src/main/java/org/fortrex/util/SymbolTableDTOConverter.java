package org.fortrex.util;

import org.fortrex.dto.ScopeDTO;
import org.fortrex.dto.SymbolDTO;
import org.fortrex.expression.Expression;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.SymbolType;

public class SymbolTableDTOConverter
{
	public static ScopeDTO toDTO(Scope scope)
	{
		ScopeDTO dto = new ScopeDTO();
		dto.name = scope.getName();
		dto.enclosingScope = scope.getEnclosingScope() != null ? scope.getEnclosingScope().getName() : null;
		scope.forEachSymbol((name, type) -> dto.symbols.add(symbolToDTO(name, type)));
		return dto;
	}

	private static SymbolDTO symbolToDTO(String name, SymbolType type)
	{
		SymbolDTO dto = new SymbolDTO();
		dto.name = name;
		dto.type = type.getDtype().getKeyword();
		dto.kind = type.getKind();
		dto.typeName = type.getTypeName();
		dto.parent = type.getParent() != null ? type.getParent().getName() : null;
		dto.initial = type.getInitial() != null ? type.getInitial().toString() : null;
		for (Expression extent : type.getShape())
		{
			dto.shape.add(extent.toString());
		}

		// The template of a derived type, not the expanded instance members: those are
		// table entries of their own.
		type.getVariables().forEach((component, componentType) -> dto.components.add(symbolToDTO(component, componentType)));
		return dto;
	}
}
