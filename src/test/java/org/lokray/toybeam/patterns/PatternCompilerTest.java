package org.lokray.toybeam.patterns;

import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.expressions.MatchArm;
import org.lokray.toybeam.ast.expressions.MatchExpression;
import org.lokray.toybeam.ast.items.FunctionDeclaration;
import org.lokray.toybeam.ast.patterns.IdentifierPattern;
import org.lokray.toybeam.ast.patterns.LiteralPattern;
import org.lokray.toybeam.ast.patterns.Pattern;
import org.lokray.toybeam.ast.patterns.WildcardPattern;
import org.lokray.toybeam.codegen.CoreErlangGenerator;
import org.lokray.toybeam.codegen.HygieneContext;
import org.lokray.toybeam.exception.CodegenException;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.lexer.Lexer;
import org.lokray.toybeam.lexer.SourceSpan;
import org.lokray.toybeam.lexer.Token;
import org.lokray.toybeam.lexer.TokenType;
import org.lokray.toybeam.parser.ToyBeamParser;
import org.lokray.toybeam.semantics.ModuleSymbols;
import org.lokray.toybeam.semantics.SemanticAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTest
{
	private static final String DECLARATIONS = "struct Point { x: int, y: int } enum Shape { Circle(Point, int), Empty } ";

	private HygieneContext hygiene;
	private PatternCompiler compiler;

	@BeforeEach
	void setUp() throws CompileException
	{
		ModuleSymbols symbols = new SemanticAnalyzer().analyze(parse("mod m { " + DECLARATIONS + "}"));
		hygiene = new HygieneContext();
		compiler = new PatternCompiler(symbols, hygiene, new CoreErlangGenerator(symbols, hygiene));
	}

	private static ModuleDeclaration parse(String source) throws CompileException
	{
		return new ToyBeamParser(new Lexer(source).scanTokens()).parse();
	}

	/**
	 * Parses a pattern as the single arm of a match.
	 */
	private static Pattern pattern(String source) throws CompileException
	{
		return arm(source).getPattern();
	}

	/**
	 * Parses the single arm of a match; {@code source} is everything before the {@code =>}.
	 */
	private static MatchArm arm(String source) throws CompileException
	{
		ModuleDeclaration module = parse("mod m { " + DECLARATIONS + "fn f(v: int) { match v { " + source + " => 0 } } }");
		FunctionDeclaration f = (FunctionDeclaration) module.getItems().get(2);
		return ((MatchExpression) f.getBody().getTail()).getArms().get(0);
	}

	private static Token token(TokenType type, String lexeme)
	{
		return new Token(type, lexeme, null, SourceSpan.UNKNOWN);
	}

	private static Pattern integer(long value)
	{
		return new LiteralPattern(new Literal(Literal.Kind.INTEGER, BigInteger.valueOf(value),
				token(TokenType.INTEGER_LITERAL, String.valueOf(value))));
	}

	private static Pattern variable(String name)
	{
		return new IdentifierPattern(token(TokenType.IDENTIFIER, name));
	}

	@Test
	void compilesArmsInOrderWithCatchAll() throws CompileException
	{
		String code = compiler.compile(new ValueDispatch("V", ValueDispatch.CASE_CLAUSE), List.of(
				Arm.of(integer(0), null, () -> "'zero'"),
				Arm.of(variable("n"), null, () -> "'other'")));

		assertEquals("case V of\n"
				+ "  0 when 'true' ->\n"
				+ "      'zero'\n"
				+ "  N@1 when 'true' ->\n"
				+ "      'other'\n"
				+ "  _Other@2 when 'true' ->\n"
				+ "      primop 'match_fail'({'case_clause', _Other@2})\n"
				+ "end", code);
	}

	@Test
	void armBindingsAreScopedToTheirArm() throws CompileException
	{
		compiler.compile(new ValueDispatch("V", ValueDispatch.CASE_CLAUSE), List.of(
				Arm.of(variable("n"), null, () -> hygiene.resolve("n"))));
		assertFalse(hygiene.isBound("n"));
	}

	@Test
	void bodySeesTheArmBindings() throws CompileException
	{
		String code = compiler.compile(new ValueDispatch("V", ValueDispatch.CASE_CLAUSE), List.of(
				Arm.of(variable("n"), null, () -> hygiene.resolve("n"))));
		assertTrue(code.contains("N@1 when 'true' ->\n      N@1"), code);
	}

	@Test
	void dispatchesOnSeveralValues() throws CompileException
	{
		String code = compiler.compile(new ValueDispatch(List.of("_Arg@1", "_Arg@2"), ValueDispatch.FUNCTION_CLAUSE),
				List.of(new Arm(List.of(integer(0), variable("x")), null, () -> "'ok'")));

		assertTrue(code.startsWith("case <_Arg@1, _Arg@2> of\n"), code);
		assertTrue(code.contains("<0, X@1> when 'true' ->"), code);
		assertTrue(code.contains("<_Other@2, _Other@3> when 'true' ->\n"
				+ "      primop 'match_fail'({'function_clause', _Other@2, _Other@3})"), code);
	}

	@Test
	void rejectsArmOfTheWrongWidth()
	{
		assertThrows(IllegalStateException.class, () -> compiler.compile(
				new ValueDispatch(List.of("A", "B"), ValueDispatch.FUNCTION_CLAUSE),
				List.of(Arm.of(integer(1), null, () -> "1"))));
	}

	@Test
	void mailboxDispatchHasNoCatchAll() throws CompileException
	{
		String code = compiler.compile(MailboxDispatch.forever(), List.of(Arm.of(variable("msg"), null, () -> "'ok'")));

		assertEquals("receive\n"
				+ "  Msg@1 when 'true' ->\n"
				+ "      'ok'\n"
				+ "after 'infinity' ->\n"
				+ "    'true'", code);
	}

	@Test
	void mailboxDispatchWithTimeout() throws CompileException
	{
		String code = compiler.compile(new MailboxDispatch("500", () -> "'timeout'"),
				List.of(Arm.of(integer(1), null, () -> "'one'")));
		assertTrue(code.endsWith("after 500 ->\n    'timeout'"), code);
		assertFalse(code.contains("match_fail"));
	}

	@Test
	void lowersGuards() throws CompileException
	{
		MatchArm source = arm("n if n > 0 && is_integer(n)");
		String code = compiler.compile(new ValueDispatch("V", ValueDispatch.CASE_CLAUSE),
				List.of(Arm.of(source.getPattern(), source.getGuard(), () -> "1")));
		assertTrue(code.contains("N@1 when call 'erlang':'and'(call 'erlang':'>'(N@1, 0), call 'erlang':'is_integer'(N@1)) ->"),
				code);
	}

	@Test
	void rejectsCallsToModuleFunctionsInGuards() throws CompileException
	{
		MatchArm source = arm("n if f(n)");
		CodegenException e = assertThrows(CodegenException.class, () -> compiler.compile(
				new ValueDispatch("V", ValueDispatch.CASE_CLAUSE),
				List.of(Arm.of(source.getPattern(), source.getGuard(), () -> "1"))));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.getKind());
	}

	@Test
	void structFieldsFollowDeclarationOrder() throws CompileException
	{
		assertEquals("{'Point', A@2, B@1}", compiler.compilePattern(pattern("Point { y: b, x: a }")));
	}

	@Test
	void variantsWithoutPayloadAreAtoms() throws CompileException
	{
		assertEquals("'Empty'", compiler.compilePattern(pattern("Shape::Empty")));
		assertEquals("{'Circle', C@1, _@2}", compiler.compilePattern(pattern("Shape::Circle(c, _)")));
	}

	@Test
	void compilesCollections() throws CompileException
	{
		assertEquals("[H@1|T@2]", compiler.compilePattern(pattern("[h | t]")));
		assertEquals("[]", compiler.compilePattern(pattern("[]")));
		assertEquals("{'ok', X@3}", compiler.compilePattern(pattern("(:ok, x)")));
		assertEquals("-3", compiler.compilePattern(pattern("-3")));
		assertEquals("\"hi\"", compiler.compilePattern(pattern("\"hi\"")));
	}

	@Test
	void segmentSizeMayReferToEarlierSegment() throws CompileException
	{
		assertEquals("#{#<Len@1>(8,1,'integer',['unsigned','big']),#<Rest@2>(Len@1,8,'binary',['unsigned','big'])}#",
				compiler.compilePattern(pattern("<<len:8, rest:len/binary>>")));
	}

	@Test
	void stringSegmentsMatchBytes() throws CompileException
	{
		assertEquals("#{#<111>(8,1,'integer',['unsigned','big']),#<107>(8,1,'integer',['unsigned','big']),"
						+ "#<T@1>(8,1,'integer',['unsigned','big'])}#",
				compiler.compilePattern(pattern("<<\"ok\", t>>")));
	}

	@Test
	void unsizedBinaryMustBeLast()
	{
		CodegenException e = assertThrows(CodegenException.class,
				() -> compiler.compilePattern(pattern("<<rest/binary, x>>")));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.getKind());
	}

	@Test
	void segmentValueMustBeSimple()
	{
		CodegenException e = assertThrows(CodegenException.class,
				() -> compiler.compilePattern(pattern("<<(a, b)>>")));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.getKind());
	}

	@Test
	void conflictingSpecifiersAreRejected()
	{
		CodegenException e = assertThrows(CodegenException.class,
				() -> compiler.compilePattern(pattern("<<x/big-little>>")));
		assertEquals(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, e.getKind());
	}

	@Test
	void recognizesIrrefutablePatterns()
	{
		assertTrue(PatternCompiler.isIrrefutable(variable("x")));
		assertTrue(PatternCompiler.isIrrefutable(new WildcardPattern(token(TokenType.IDENTIFIER, "_"))));
		assertFalse(PatternCompiler.isIrrefutable(integer(1)));
	}
}
