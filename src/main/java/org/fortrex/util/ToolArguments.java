package org.fortrex.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments of the fortrex expression normaliser.
 */
public class ToolArguments
{
	public static final String VERSION = "0.1.0-alpha";

	private final List<Path> inputFiles = new ArrayList<>();
	private final List<SymbolDeclaration> declarations = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean keepSource = false;
	private Path outputPath = null; // Default: null (stdout)
	private Path symbolDumpPath = null;

	// Private constructor, use parse()
	private ToolArguments()
	{
	}

	public static ToolArguments parse(String[] args)
	{
		ToolArguments parsedArgs = new ToolArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("--keep-source"))
				{
					parsedArgs.keepSource = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--dump-symbols"))
				{
					parsedArgs.symbolDumpPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-D"))
				{
					parsedArgs.declarations.add(SymbolDeclaration.parse(getNextArg(args, ++i, arg)));
					continue;
				}
				if (arg.startsWith("-D") && arg.length() > 2)
				{
					parsedArgs.declarations.add(SymbolDeclaration.parse(arg.substring(2)));
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Normalises Fortran expressions and reports the symbols they use.");
		System.out.println("\nUSAGE: fortrex [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                   Show this help message and exit.");
		System.out.println("  --version                    Show the version and exit.");
		System.out.println("  -v, --verbose                Enable verbose debug logging.");
		System.out.println("  -o, --output <file>          Write the rendered expressions to <file> instead of stdout.");
		System.out.println("  --dump-symbols <file>        Write the symbol table of every input as JSON.");
		System.out.println("  --keep-source                Echo the original text of each expression.");
		System.out.println("  -D NAME=TYPE[:KIND][(rank)]  Declare a symbol before parsing, e.g. -D ZA=real:JPRB(2).");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public List<SymbolDeclaration> getDeclarations()
	{
		return declarations;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isKeepSource()
	{
		return keepSource;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getSymbolDumpPath()
	{
		return symbolDumpPath;
	}
}
