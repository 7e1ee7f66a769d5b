package org.lokray.toybeam.patterns;

import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.ast.expressions.BitstringSegment;
import org.lokray.toybeam.ast.patterns.*;
import org.lokray.toybeam.codegen.BitstringSpecifiers;
import org.lokray.toybeam.codegen.CoreErlang;
import org.lokray.toybeam.codegen.HygieneContext;
import org.lokray.toybeam.exception.CodegenException;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.semantics.ModuleSymbols;
import org.lokray.toybeam.semantics.StructSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles ordered arms into one dispatch construct. Shared by {@code match}, {@code receive},
 * refutable {@code let} and function parameters; only the {@link DispatchStrategy} differs.
 * <p>
 * Arms keep their source order, and each arm gets its own hygiene scope, so a name bound
 * in one arm never leaks into another. Source patterns map onto target patterns:
 * <ul>
 *     <li>structs and variants with a payload become tagged tuples, fields in declaration order;</li>
 *     <li>variants without a payload become bare atoms;</li>
 *     <li>every variable is renamed through the {@link HygieneContext}, and every {@code _}
 *     gets its own fresh name.</li>
 * </ul>
 */
public class PatternCompiler implements PatternVisitor<String>
{
	private static final Logger LOGGER = LoggerFactory.getLogger(PatternCompiler.class);

	private final ModuleSymbols symbols;
	private final HygieneContext hygiene;
	private final ClauseLowering lowering;

	public PatternCompiler(ModuleSymbols symbols, HygieneContext hygiene, ClauseLowering lowering)
	{
		this.symbols = symbols;
		this.hygiene = hygiene;
		this.lowering = lowering;
	}

	/**
	 * Compiles the arms in order and hands the clauses to the strategy.
	 */
	public String compile(DispatchStrategy strategy, List<Arm> arms) throws CompileException
	{
		List<String> clauses = new ArrayList<>();
		for (Arm arm : arms)
		{
			if (arm.getPatterns().size() != strategy.width())
			{
				throw new IllegalStateException("Arm has " + arm.getPatterns().size()
						+ " patterns for a dispatch of width " + strategy.width());
			}
			hygiene.enterScope();
			List<String> patterns = new ArrayList<>();
			for (Pattern pattern : arm.getPatterns())
			{
				patterns.add(compilePattern(pattern));
			}
			String guard = arm.getGuard() != null ? lowering.lowerGuard(arm.getGuard()) : CoreErlang.TRUE;
			String body = arm.getBody().lower();
			hygiene.exitScope();
			clauses.add(CoreErlang.clause(join(patterns), guard, body));
		}
		LOGGER.trace("Compiled {} arm(s) with {}", clauses.size(), strategy.getClass().getSimpleName());
		return strategy.assemble(clauses, hygiene);
	}

	/**
	 * Lowers one pattern, binding its variables in the innermost hygiene scope.
	 */
	public String compilePattern(Pattern pattern) throws CompileException
	{
		return pattern.accept(this);
	}

	/**
	 * True for patterns that match every value: a plain variable or a wildcard.
	 */
	public static boolean isIrrefutable(Pattern pattern)
	{
		return pattern instanceof IdentifierPattern || pattern instanceof WildcardPattern;
	}

	/**
	 * Writes a single term as itself and several as a value list.
	 */
	static String join(List<String> terms)
	{
		return terms.size() == 1 ? terms.get(0) : CoreErlang.values(terms);
	}

	@Override
	public String visitIdentifierPattern(IdentifierPattern pattern)
	{
		return hygiene.bind(pattern.getName());
	}

	@Override
	public String visitWildcardPattern(WildcardPattern pattern)
	{
		return hygiene.wildcard();
	}

	@Override
	public String visitLiteralPattern(LiteralPattern pattern)
	{
		return CoreErlang.literal(pattern.getLiteral());
	}

	@Override
	public String visitTuplePattern(TuplePattern pattern) throws CompileException
	{
		return CoreErlang.tuple(compileAll(pattern.getElements()));
	}

	@Override
	public String visitListPattern(ListPattern pattern) throws CompileException
	{
		return CoreErlang.list(compileAll(pattern.getElements()));
	}

	@Override
	public String visitConsPattern(ConsPattern pattern) throws CompileException
	{
		List<String> heads = compileAll(pattern.getHeads());
		return CoreErlang.cons(heads, pattern.getTail().accept(this));
	}

	@Override
	public String visitStructPattern(StructPattern pattern) throws CompileException
	{
		StructSymbol struct = symbols.getStruct(pattern.getTypeName());
		if (struct == null)
		{
			throw new IllegalStateException("Unresolved struct '" + pattern.getTypeName() + "' reached code generation");
		}

		// Sub-patterns are bound in source order, then laid out in declaration order
		Map<String, String> byField = new HashMap<>();
		for (FieldPattern field : pattern.getFields())
		{
			byField.put(field.getName(), field.getPattern().accept(this));
		}
		List<String> elements = new ArrayList<>();
		elements.add(CoreErlang.atom(struct.getName()));
		for (String field : struct.getFieldNames())
		{
			String element = byField.get(field);
			elements.add(element != null ? element : hygiene.wildcard());
		}
		return CoreErlang.tuple(elements);
	}

	@Override
	public String visitEnumPattern(EnumPattern pattern) throws CompileException
	{
		String tag = CoreErlang.atom(pattern.getVariant());
		if (!pattern.isParenthesized())
		{
			return tag;
		}
		List<String> elements = new ArrayList<>();
		elements.add(tag);
		elements.addAll(compileAll(pattern.getArguments()));
		return CoreErlang.tuple(elements);
	}

	@Override
	public String visitBitstringPattern(BitstringPattern pattern) throws CompileException
	{
		List<String> segments = new ArrayList<>();
		List<BitstringSegment<Pattern>> source = pattern.getSegments();
		for (int i = 0; i < source.size(); i++)
		{
			BitstringSegment<Pattern> segment = source.get(i);
			BitstringSpecifiers specifiers = BitstringSpecifiers.resolve(segment.getSpecifiers(),
					segment.getSize() != null, segment.getFirstToken().getSpan());
			Pattern value = segment.getValue();

			if (value instanceof LiteralPattern
					&& ((LiteralPattern) value).getLiteral().getKind() == Literal.Kind.STRING)
			{
				segments.addAll(specifiers.stringSegments(segment,
						(String) ((LiteralPattern) value).getLiteral().getValue()));
				continue;
			}
			if (!isSegmentValue(value))
			{
				throw new CodegenException(ErrorKind.UNSUPPORTED_CONSTRUCT, value.getFirstToken().getSpan(),
						"A bitstring segment can only match a variable, '_' or a literal.");
			}
			if (specifiers.getType().equals("binary") && segment.getSize() == null && i != source.size() - 1)
			{
				throw new CodegenException(ErrorKind.UNSUPPORTED_CONSTRUCT, segment.getFirstToken().getSpan(),
						"A binary segment without a size must be the last segment of the pattern.");
			}

			String term = value.accept(this);
			String size = segment.getSize() != null ? lowering.lowerSegmentSize(segment.getSize()) : null;
			segments.add(specifiers.render(term, size));
		}
		return CoreErlang.binary(segments);
	}

	private static boolean isSegmentValue(Pattern value)
	{
		if (value instanceof LiteralPattern)
		{
			return ((LiteralPattern) value).getLiteral().getKind() == Literal.Kind.INTEGER;
		}
		return isIrrefutable(value);
	}

	private List<String> compileAll(List<Pattern> patterns) throws CompileException
	{
		List<String> compiled = new ArrayList<>();
		for (Pattern pattern : patterns)
		{
			compiled.add(pattern.accept(this));
		}
		return compiled;
	}
}
