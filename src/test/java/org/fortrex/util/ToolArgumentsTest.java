package org.fortrex.util;

import org.fortrex.expression.RangeIndex;
import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

class ToolArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void parsesFlagsAndInputs()
	{
		ToolArguments args = ToolArguments.parse(new String[]{
				"-v", "--keep-source", "-o", "out.txt", "--dump-symbols", "symbols.json", "a.f90", "b.f90"});

		assertThat(args.isHelpFlag()).isFalse();
		assertThat(args.isVerboseFlag()).isTrue();
		assertThat(Debug.ENABLE_DEBUG).isTrue();
		assertThat(args.isKeepSource()).isTrue();
		assertThat(args.getOutputPath()).isEqualTo(Paths.get("out.txt"));
		assertThat(args.getSymbolDumpPath()).isEqualTo(Paths.get("symbols.json"));
		assertThat(args.getInputFiles()).containsExactly(Paths.get("a.f90"), Paths.get("b.f90"));
	}

	@Test
	void parsesDeclarations()
	{
		ToolArguments args = ToolArguments.parse(new String[]{"-D", "ZA=real:JPRB(2)", "-DN=integer", "x.f90"});

		assertThat(args.getDeclarations()).containsExactly(
				new SymbolDeclaration("ZA", DataType.REAL, "JPRB", 2),
				new SymbolDeclaration("N", DataType.INTEGER, null, 0));

		SymbolType za = args.getDeclarations().get(0).toSymbolType();
		assertThat(za.getKind()).isEqualTo("JPRB");
		assertThat(za.getShape()).containsExactly(RangeIndex.all(), RangeIndex.all());
		assertThat(args.getDeclarations().get(1).toSymbolType().hasShape()).isFalse();
	}

	@Test
	void helpAndVersionShortCircuit()
	{
		assertThat(ToolArguments.parse(new String[]{}).isHelpFlag()).isTrue();
		assertThat(ToolArguments.parse(new String[]{"--help", "x.f90"}).isHelpFlag()).isTrue();
		assertThat(ToolArguments.parse(new String[]{"--version"}).isVersionFlag()).isTrue();
	}

	@Test
	void invalidArgumentsFallBackToHelp()
	{
		assertThat(ToolArguments.parse(new String[]{"--unknown"}).isHelpFlag()).isTrue();
		assertThat(ToolArguments.parse(new String[]{"-o"}).isHelpFlag()).isTrue();
		assertThat(ToolArguments.parse(new String[]{"-D", "ZA=complex"}).isHelpFlag()).isTrue();
		assertThat(ToolArguments.parse(new String[]{"-D", "not a declaration"}).isHelpFlag()).isTrue();
	}
}
