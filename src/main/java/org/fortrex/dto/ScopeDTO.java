package org.fortrex.dto;

import java.util.ArrayList;
import java.util.List;

public class ScopeDTO
{
	public String name;
	public String enclosingScope;
	public List<SymbolDTO> symbols = new ArrayList<>();
}
