package org.lokray.toybeam;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.util.CompileOptions;
import org.lokray.toybeam.util.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Entry point for the toybeam compiler.
 * Reads one source file and writes the Core Erlang module next to it, or where {@code -o} says.
 */
public class Main
{
	private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

	static final String CONFIG_FILE = "toybeam.properties";
	static final String USAGE = "Usage: toybeamc [--test] [--feature <name>]... [-o <out.core>] <source>";

	static final int EXIT_OK = 0;
	static final int EXIT_COMPILE_ERROR = 1;
	static final int EXIT_USAGE = 2;

	public static void main(String[] args)
	{
		System.exit(run(args, new ErrorReporter()));
	}

	/**
	 * Runs the compiler and returns the process exit code.
	 */
	static int run(String[] args, ErrorReporter errorReporter)
	{
		// 1. Load configuration
		CompileOptions options = loadConfiguration(Paths.get(CONFIG_FILE), errorReporter);
		if (options == null)
		{
			return EXIT_USAGE;
		}

		// 2. Flags
		Path output = null;
		List<String> sources = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			if (arg.equals("--test"))
			{
				options = options.withTestMode(true);
			}
			else if (arg.equals("--feature") || arg.equals("-o"))
			{
				if (i + 1 == args.length)
				{
					errorReporter.report("Missing value after " + arg + ".\n" + USAGE);
					return EXIT_USAGE;
				}
				String value = args[++i];
				if (arg.equals("-o"))
				{
					output = Paths.get(value);
				}
				else
				{
					options = options.withFeatures(value);
				}
			}
			else if (arg.startsWith("-"))
			{
				errorReporter.report("Unknown option " + arg + ".\n" + USAGE);
				return EXIT_USAGE;
			}
			else
			{
				sources.add(arg);
			}
		}
		if (sources.size() != 1)
		{
			errorReporter.report(USAGE);
			return EXIT_USAGE;
		}

		// 3. Compile
		Path source = Paths.get(sources.get(0));
		if (output == null)
		{
			output = defaultOutput(source);
		}
		String text;
		try
		{
			text = Files.readString(source, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			errorReporter.report("Could not read " + source + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		LOGGER.info("Compiling {} with {}", source, options);
		String coreErlang;
		try
		{
			coreErlang = ToyBeamCompiler.compile(text, options);
		}
		catch (CompileException e)
		{
			errorReporter.report(source.toString(), e);
			return EXIT_COMPILE_ERROR;
		}

		// 4. Write output only after a successful compile
		try
		{
			Files.writeString(output, coreErlang, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			errorReporter.report("Could not write " + output + ": " + e.getMessage());
			return EXIT_USAGE;
		}
		LOGGER.info("Wrote {}", output);
		return EXIT_OK;
	}

	/**
	 * The source path with its extension replaced by {@code .core}.
	 */
	static Path defaultOutput(Path source)
	{
		String name = source.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String base = dot > 0 ? name.substring(0, dot) : name;
		return source.resolveSibling(base + ".core");
	}

	/**
	 * Reads the options file when present.
	 *
	 * @return The options, defaults when the file is absent, or null if it exists but cannot be read.
	 */
	static CompileOptions loadConfiguration(Path configPath, ErrorReporter errorReporter)
	{
		Properties props = new Properties();
		if (!Files.exists(configPath))
		{
			LOGGER.debug("No {} found, using default settings", configPath);
			return CompileOptions.defaults();
		}
		try (InputStream input = Files.newInputStream(configPath))
		{
			props.load(input);
			LOGGER.info("Loaded configuration from {}", configPath);
		}
		catch (IOException e)
		{
			errorReporter.report("Could not read config file " + configPath + ": " + e.getMessage());
			return null;
		}
		return new CompileOptions(props);
	}
}
