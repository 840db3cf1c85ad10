package org.fortrex.dto;

import java.util.ArrayList;
import java.util.List;

public class SymbolDTO
{
	public String name;
	public String type;
	public String kind;
	public String typeName;
	public String parent;
	public String initial;
	public List<String> shape = new ArrayList<>();
	public List<SymbolDTO> components = new ArrayList<>();
}
