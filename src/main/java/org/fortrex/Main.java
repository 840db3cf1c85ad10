package org.fortrex;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.fortrex.dto.ScopeDTO;
import org.fortrex.expression.Expression;
import org.fortrex.expression.InvalidConstructionException;
import org.fortrex.expression.visitor.Stringifier;
import org.fortrex.parser.ExpressionParser;
import org.fortrex.parser.ExpressionSyntaxException;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.util.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver: reads files of Fortran expressions, one per line, and prints each in
 * canonical form. Every file is parsed into a scope of its own.
 */
public class Main
{

	public static void main(String[] args)
	{
		try
		{
			ToolArguments arguments = ToolArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				ToolArguments.printUsage();
				return;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("fortrex version " + ToolArguments.VERSION);
				return;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			ErrorHandler errorHandler = new ErrorHandler();
			run(arguments, errorHandler);

			if (errorHandler.hasErrors())
			{
				Debug.logWarning(errorHandler.getErrorCount() + " expression(s) could not be processed.");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
	}

	/**
	 * Processes all input files and writes the rendered expressions and the optional symbol dump.
	 */
	static void run(ToolArguments args, ErrorHandler errorHandler) throws IOException
	{
		List<String> output = new ArrayList<>();
		List<ScopeDTO> scopes = new ArrayList<>();

		for (Path file : args.getInputFiles())
		{
			if (!Files.exists(file))
			{
				Debug.logError("Input file not found: " + file);
				continue;
			}
			Scope scope = newScope(file, args.getDeclarations());
			output.addAll(processLines(file, Files.readAllLines(file), scope, args.isKeepSource(), errorHandler));
			scopes.add(SymbolTableDTOConverter.toDTO(scope));
			scope.discard();
		}

		if (args.getOutputPath() != null)
		{
			writeFile(args.getOutputPath(), String.join(System.lineSeparator(), output) + System.lineSeparator());
			Debug.logInfo("Wrote " + output.size() + " expression(s) to: " + args.getOutputPath());
		}
		else
		{
			output.forEach(Debug::log);
		}

		if (args.getSymbolDumpPath() != null)
		{
			Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
			writeFile(args.getSymbolDumpPath(), gson.toJson(scopes));
			Debug.logInfo("Wrote symbol tables to: " + args.getSymbolDumpPath());
		}
	}

	static Scope newScope(Path file, List<SymbolDeclaration> declarations)
	{
		String name = file.getFileName().toString().replaceFirst("[.][^.]+$", "");
		Scope scope = new Scope(name);
		for (SymbolDeclaration declaration : declarations)
		{
			scope.assign(declaration.name(), declaration.toSymbolType());
		}
		return scope;
	}

	/**
	 * Renders every expression line. Blank lines and comment lines are skipped, and a line that
	 * fails is reported and left out of the result.
	 */
	static List<String> processLines(Path file, List<String> lines, Scope scope, boolean keepSource, ErrorHandler errorHandler)
	{
		ExpressionParser parser = new ExpressionParser(scope);
		Stringifier stringifier = new Stringifier(keepSource);
		List<String> rendered = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++)
		{
			String line = lines.get(i).trim();
			if (line.isEmpty() || line.startsWith("!"))
			{
				continue;
			}
			try
			{
				Expression expression = parser.parse(line, i + 1);
				rendered.add(stringifier.stringify(expression));
			}
			catch (ExpressionSyntaxException | InvalidConstructionException e)
			{
				errorHandler.logError(file, i + 1, e.getMessage());
			}
		}
		return rendered;
	}

	private static void writeFile(Path outPath, String content) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
	}
}
