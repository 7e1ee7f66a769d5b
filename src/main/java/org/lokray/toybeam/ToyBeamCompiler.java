package org.lokray.toybeam;

import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.codegen.CoreErlangGenerator;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Lexer;
import org.lokray.toybeam.lexer.Token;
import org.lokray.toybeam.parser.ToyBeamParser;
import org.lokray.toybeam.semantics.CfgEvaluator;
import org.lokray.toybeam.semantics.ModuleSymbols;
import org.lokray.toybeam.semantics.SemanticAnalyzer;
import org.lokray.toybeam.util.CompileOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the whole pipeline on one module: lex, parse, conditional compilation, semantic
 * analysis, code generation. The first error aborts the run; nothing is returned unless
 * every stage succeeds.
 * <p>
 * Each call is independent and keeps no state, so one instance may be shared between threads.
 */
public class ToyBeamCompiler
{
	private static final Logger LOGGER = LoggerFactory.getLogger(ToyBeamCompiler.class);

	private final CompileOptions options;

	public ToyBeamCompiler()
	{
		this(CompileOptions.defaults());
	}

	public ToyBeamCompiler(CompileOptions options)
	{
		this.options = options;
	}

	public CompileOptions getOptions()
	{
		return options;
	}

	/**
	 * Compiles one module's source text to Core Erlang.
	 *
	 * @param source The complete source of a single module.
	 * @return The Core Erlang module text.
	 * @throws CompileException The first lexical, syntactic, semantic or code generation error.
	 */
	public String compile(String source) throws CompileException
	{
		List<Token> tokens = new Lexer(source).scanTokens();
		LOGGER.debug("Lexed {} token(s)", tokens.size());

		ModuleDeclaration parsed = new ToyBeamParser(tokens).parse();
		LOGGER.debug("Parsed module '{}' with {} item(s)", parsed.getName(), parsed.getItems().size());

		ModuleDeclaration module = new CfgEvaluator(options).filter(parsed);
		LOGGER.debug("{} item(s) remain after conditional compilation", module.getItems().size());

		ModuleSymbols symbols = new SemanticAnalyzer().analyze(module);
		LOGGER.debug("Resolved {} function(s), {} exported", symbols.getFunctions().size(), symbols.getExports().size());

		String output = new CoreErlangGenerator(symbols).generate(module);
		LOGGER.debug("Generated {} character(s) of Core Erlang", output.length());
		return output;
	}

	/**
	 * Compiles with the given options instead of this compiler's own.
	 */
	public static String compile(String source, CompileOptions options) throws CompileException
	{
		return new ToyBeamCompiler(options).compile(source);
	}
}
