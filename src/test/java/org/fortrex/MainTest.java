package org.fortrex;

import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.DataType;
import org.fortrex.util.ErrorHandler;
import org.fortrex.util.SymbolDeclaration;
import org.fortrex.util.ToolArguments;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MainTest
{
	@Test
	void rendersEachExpressionLineAndReportsFailures()
	{
		Scope scope = new Scope("test");
		ErrorHandler errors = new ErrorHandler();
		List<String> lines = List.of(
				"! a comment",
				"ia .ge. 3",
				"",
				"a +",
				"X%Y * 2");

		List<String> rendered = Main.processLines(Paths.get("test.f90"), lines, scope, false, errors);

		assertThat(rendered).containsExactly("ia >= 3", "X%Y*2");
		assertThat(errors.getErrorCount()).isEqualTo(1);
		assertThat(errors.getErrors().get(0)).contains("line 4");
	}

	@Test
	void keepSourceEchoesOriginalText()
	{
		List<String> rendered = Main.processLines(Paths.get("test.f90"), List.of("ia .ge. 3"), new Scope("test"), true, new ErrorHandler());

		assertThat(rendered).containsExactly("ia .ge. 3");
	}

	@Test
	void declarationsSeedTheScope()
	{
		Scope scope = Main.newScope(Paths.get("dir/routine.f90"),
				List.of(new SymbolDeclaration("ZA", DataType.REAL, "JPRB", 1)));

		assertThat(scope.getName()).isEqualTo("routine");
		List<String> rendered = Main.processLines(Paths.get("routine.f90"), List.of("ZA(I)"), scope, false, new ErrorHandler());
		assertThat(rendered).containsExactly("ZA(I)");
	}

	@Test
	void writesOutputAndSymbolDump(@TempDir Path dir) throws IOException
	{
		Path input = Files.writeString(dir.resolve("calc.f90"), "x + y\nFOO(1)\n");
		Path output = dir.resolve("out/calc.txt");
		Path dump = dir.resolve("symbols.json");
		ToolArguments args = ToolArguments.parse(new String[]{
				"-o", output.toString(), "--dump-symbols", dump.toString(), input.toString()});

		Main.run(args, new ErrorHandler());

		assertThat(Files.readAllLines(output)).containsExactly("x + y", "FOO(1)");
		assertThat(Files.readString(dump)).contains("\"calc\"").contains("\"x\"").contains("\"deferred\"");
	}
}
