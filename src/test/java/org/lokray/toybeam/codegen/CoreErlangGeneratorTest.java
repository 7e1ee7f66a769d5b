package org.lokray.toybeam.codegen;

import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.exception.CodegenException;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.lexer.Lexer;
import org.lokray.toybeam.parser.ToyBeamParser;
import org.lokray.toybeam.semantics.ModuleSymbols;
import org.lokray.toybeam.semantics.SemanticAnalyzer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoreErlangGeneratorTest
{
	private static String generate(String source) throws CompileException
	{
		ModuleDeclaration module = new ToyBeamParser(new Lexer(source).scanTokens()).parse();
		ModuleSymbols symbols = new SemanticAnalyzer().analyze(module);
		return new CoreErlangGenerator(symbols).generate(module);
	}

	/**
	 * Generates a module {@code m} holding the given items.
	 */
	private static String module(String items) throws CompileException
	{
		return generate("mod m { " + items + " }");
	}

	private static ErrorKind failure(String items)
	{
		return assertThrows(CodegenException.class, () -> module(items)).getKind();
	}

	/**
	 * The trimmed line following the first line that contains {@code marker}.
	 */
	private static String lineAfter(String output, String marker)
	{
		String[] lines = output.split("\n");
		for (int i = 0; i < lines.length - 1; i++)
		{
			if (lines[i].contains(marker))
			{
				return lines[i + 1].trim();
			}
		}
		fail("No line containing " + marker + " in\n" + output);
		return null;
	}

	private static void assertContains(String output, String... fragments)
	{
		for (String fragment : fragments)
		{
			assertTrue(output.contains(fragment), () -> "Expected '" + fragment + "' in\n" + output);
		}
	}

	@Test
	void generatesACompleteModule() throws CompileException
	{
		assertEquals("module 'math' ['add'/2]\n"
				+ "    attributes []\n"
				+ "\n"
				+ "'add'/2 =\n"
				+ "    fun (A@1, B@2) ->\n"
				+ "        call 'erlang':'+'(A@1, B@2)\n"
				+ "end\n", generate("mod math { pub fn add(a: int, b: int) -> int { a + b } }"));
	}

	@Test
	void exportsOnlyPublicFunctions() throws CompileException
	{
		String output = module("pub fn a() { 1 } fn b() { 2 } pub fn c(x: int) { x } struct S { f: int }");
		assertTrue(output.startsWith("module 'm' ['a'/0, 'c'/1]\n"), output);
		assertContains(output, "'b'/0 =\n    fun () ->\n        2");
	}

	@Test
	void lowersAProcessLoop() throws CompileException
	{
		String output = generate("mod counter {\n"
				+ "  pub fn start() -> pid { spawn || { run(0) } }\n"
				+ "  fn run(n: int) -> int {\n"
				+ "    receive {\n"
				+ "      (:inc, from) => { from ! n + 1; run(n + 1) }\n"
				+ "      :stop => n,\n"
				+ "    } after 1000 => n\n"
				+ "  }\n"
				+ "}");

		assertTrue(output.startsWith("module 'counter' ['start'/0]\n"), output);
		assertContains(output,
				"call 'erlang':'spawn'(fun () ->",
				"apply 'run'/1(0)",
				"{'inc', From@2} when 'true' ->",
				"let <_Msg@3> = call 'erlang':'+'(N@1, 1)",
				"call 'erlang':'!'(From@2, _Msg@3)",
				"'stop' when 'true' ->",
				"after 1000 ->");
		assertEquals("N@1", lineAfter(output, "after 1000 ->"));
		assertFalse(output.contains("match_fail"), output);
	}

	@Test
	void structsAreTaggedTuplesInDeclarationOrder() throws CompileException
	{
		String output = module("struct Point { x: int, y: int }\n"
				+ "fn make(a: int) -> Point { Point { y: a, x: 1 } }\n"
				+ "fn getx(p: Point) -> int { p.x }");

		assertContains(output,
				"{'Point', 1, A@1}",
				"case P@2 of",
				"{'Point', _X@3, _@4} when 'true' ->",
				"call 'erlang':'error'({'badfield', 'x', _Other@5})");
		assertEquals("_X@3", lineAfter(output, "{'Point', _X@3, _@4} when 'true' ->"));
	}

	@Test
	void structFieldValuesAreEvaluatedInSourceOrder() throws CompileException
	{
		String output = module("struct Pair { a: int, b: int } fn f() -> int { 1 }\n"
				+ "fn make() -> Pair { Pair { b: f(), a: f() } }");
		int first = output.indexOf("let <_B@1> = apply 'f'/0()");
		int second = output.indexOf("let <_A@2> = apply 'f'/0()");
		assertTrue(first >= 0 && second > first, output);
		assertContains(output, "{'Pair', _A@2, _B@1}");
	}

	@Test
	void shadowedBindingsGetFreshNames() throws CompileException
	{
		String output = module("fn f() -> int { let x = 1; let x = x + 1; x }");
		assertContains(output,
				"let <X@1> = 1",
				"let <X@2> = call 'erlang':'+'(X@1, 1)",
				"in X@2");
	}

	@Test
	void expressionStatementsAreSequenced() throws CompileException
	{
		String output = module("fn f(p: pid) -> int { p ! 1; 2 }");
		assertContains(output, "let <_@2> = call 'erlang':'!'(P@1, 1)", "in 2");
	}

	@Test
	void emptyBlockIsUnit() throws CompileException
	{
		assertContains(module("fn f() { }"), "fun () ->\n        {}");
	}

	@Test
	void lowersOperators() throws CompileException
	{
		String output = module("fn f(a: int, b: int) -> bool { a / b % 2 <= -3 }");
		assertContains(output,
				"call 'erlang':'div'(A@1, B@2)",
				"call 'erlang':'rem'(_Lhs@4, 2)",
				"call 'erlang':'=<'(_Lhs@3, -3)");

		assertContains(module("fn f(a: int, b: int) -> bool { a != b }"), "call 'erlang':'=/='(A@1, B@2)");
		assertContains(module("fn f(a: int, b: int) -> bool { a == b }"), "call 'erlang':'=:='(A@1, B@2)");
		assertContains(module("fn f(a: int) -> int { -a }"), "call 'erlang':'-'(A@1)");
		assertContains(module("fn f(a: bool) -> bool { !a }"), "call 'erlang':'not'(A@1)");
	}

	@Test
	void shortCircuitsLogicalOperators() throws CompileException
	{
		String and = module("fn f(a: bool, b: bool) -> bool { a && b }");
		assertContains(and, "case A@1 of", "call 'erlang':'error'({'badarg', _Other@3})");
		assertEquals("B@2", lineAfter(and, "'true' when 'true' ->"));
		assertEquals("'false'", lineAfter(and, "'false' when 'true' ->"));

		String or = module("fn f(a: bool, b: bool) -> bool { a || b }");
		assertEquals("'true'", lineAfter(or, "'true' when 'true' ->"));
		assertEquals("B@2", lineAfter(or, "'false' when 'true' ->"));
	}

	@Test
	void ifWithoutElseYieldsUnit() throws CompileException
	{
		String output = module("fn f(c: bool) { if c { 1 } }");
		assertContains(output, "case C@1 of", "primop 'match_fail'('if_clause')");
		assertEquals("1", lineAfter(output, "'true' when 'true' ->"));
		assertEquals("{}", lineAfter(output, "'false' when 'true' ->"));
	}

	@Test
	void lowersMatchWithGuardsAndCatchAll() throws CompileException
	{
		String output = module("fn sign(n: int) -> atom { match n { 0 => :zero, x if x > 0 => :pos, _ => :neg } }");
		assertContains(output,
				"case N@1 of",
				"0 when 'true' ->",
				"X@2 when call 'erlang':'>'(X@2, 0) ->",
				"_@3 when 'true' ->",
				"primop 'match_fail'({'case_clause', _Other@4})");
		assertEquals("'pos'", lineAfter(output, "X@2 when"));
	}

	@Test
	void refutableLetBecomesBadmatchCase() throws CompileException
	{
		String output = module("fn f(p: int) -> int { let (a, b) = p; a }");
		assertContains(output,
				"case P@1 of",
				"{A@2, B@3} when 'true' ->",
				"primop 'match_fail'({'badmatch', _Other@4})");
		assertEquals("A@2", lineAfter(output, "{A@2, B@3} when 'true' ->"));
	}

	@Test
	void refutableParametersDispatchOnArguments() throws CompileException
	{
		String output = module("fn first((a, _): (int, int)) -> int { a }");
		assertContains(output,
				"fun (_Arg@1) ->",
				"case _Arg@1 of",
				"{A@2, _@3} when 'true' ->",
				"primop 'match_fail'({'function_clause', _Other@4})");
	}

	@Test
	void lowersCalls() throws CompileException
	{
		assertContains(module("fn double(x: int) -> int { x * 2 } fn f(v: int) -> int { v.double() }"),
				"apply 'double'/1(V@2)");
		assertContains(module("fn f() { Io::format(\"hi\") }"), "call 'io':'format'(\"hi\")");
		assertContains(module("fn f() { HttpClient::get(\"/\") }"), "call 'http_client':'get'(\"/\")");
		assertContains(module("fn invoke(f: int) { f(1) }"), "apply F@1(1)");
		assertContains(module("fn worker() { () } fn go() { spawn(worker) }"), "call 'erlang':'spawn'('worker'/0)");
		assertContains(module("fn g(x: int) -> int { x } fn f() -> int { g(g(1)) }"),
				"let <_Arg@2> = apply 'g'/1(1)", "apply 'g'/1(_Arg@2)");
	}

	@Test
	void lowersBuiltins() throws CompileException
	{
		assertContains(module("fn f() -> pid { self() }"), "call 'erlang':'self'()");
		assertContains(module("fn f(p: pid) { monitor(p) }"), "call 'erlang':'monitor'('process', P@1)");
		assertContains(module("fn f() { print(1) }"), "call 'io':'format'(\"~p~n\", [1])");
		assertContains(module("fn f() { trap_exit(true) }"), "call 'erlang':'process_flag'('trap_exit', 'true')");
	}

	@Test
	void localFunctionShadowsBuiltin() throws CompileException
	{
		assertContains(module("fn self() -> int { 1 } fn f() -> int { self() }"), "apply 'self'/0()");
	}

	@Test
	void lowersVariants() throws CompileException
	{
		String output = module("enum Msg { Ping(int), Stop } fn f(n: int) { (Msg::Ping(n), Msg::Stop) }");
		assertContains(output, "let <_Elem@2> = {'Ping', N@1}", "in {_Elem@2, 'Stop'}");
	}

	@Test
	void indexesTuplesAndLists() throws CompileException
	{
		String constant = module("fn at(t: int) { t[0] }");
		assertContains(constant,
				"case T@1 of",
				"_Tuple@2 when call 'erlang':'is_tuple'(_Tuple@2) ->",
				"call 'erlang':'element'(1, _Tuple@2)",
				"_List@3 when call 'erlang':'is_list'(_List@3) ->",
				"call 'lists':'nth'(1, _List@3)",
				"call 'erlang':'error'({'badarg', _Other@4})");

		String computed = module("fn at(t: int, i: int) { t[i] }");
		assertContains(computed, "let <_Pos@3> = call 'erlang':'+'(I@2, 1)", "call 'erlang':'element'(_Pos@3, _Tuple@4)");
	}

	@Test
	void lowersBitstrings() throws CompileException
	{
		assertContains(module("fn b(x: int) { <<x, \"hi\", 7:16/little>> }"),
				"#{#<X@1>(8,1,'integer',['unsigned','big']),"
						+ "#<104>(8,1,'integer',['unsigned','big']),"
						+ "#<105>(8,1,'integer',['unsigned','big']),"
						+ "#<7>(16,1,'integer',['unsigned','little'])}#");
		assertContains(module("fn b(x: string) { <<x/binary>> }"), "#{#<X@1>('all',8,'binary',['unsigned','big'])}#");
		assertContains(module("fn b(x: int, n: int) { <<x:n/signed>> }"), "#{#<X@1>(N@2,1,'integer',['signed','big'])}#");
	}

	@Test
	void receiveWithoutAfterWaitsForever() throws CompileException
	{
		String output = module("fn f() { receive { x => x } }");
		assertContains(output, "receive\n", "X@1 when 'true' ->", "after 'infinity' ->");
		assertEquals("'true'", lineAfter(output, "after 'infinity' ->"));
	}

	@Test
	void computedTimeoutIsBoundBeforeReceive() throws CompileException
	{
		String output = module("fn f(t: int) { receive { x => x } after t * 2 => 0 }");
		assertContains(output, "let <_Timeout@2> = call 'erlang':'*'(T@1, 2)", "X@3 when 'true' ->", "after _Timeout@2 ->");
		assertTrue(output.indexOf("let <_Timeout@2>") < output.indexOf("receive"), output);

		assertContains(module("fn f(t: int) { receive { x => x } after t => 0 }"), "after T@1 ->");
	}

	@Test
	void matchesSignals() throws CompileException
	{
		assertContains(module("fn f() { receive { Signal::EXIT(pid, why) => why } }"),
				"{'EXIT', Pid@1, Why@2} when 'true' ->");
	}

	@Test
	void closuresCaptureEnclosingVariables() throws CompileException
	{
		assertContains(module("fn f(parent: pid) { spawn || { parent ! :hi } }"), "call 'erlang':'!'(Parent@1, 'hi')");
	}

	@Test
	void returnInTailPositionIsTheValue() throws CompileException
	{
		assertContains(module("fn f(x: int) -> int { return x + 1; }"), "fun (X@1) ->\n        call 'erlang':'+'(X@1, 1)");
		String branches = module("fn f(x: int) -> int { if x > 0 { return 1; } else { return 2; } }");
		assertEquals("1", lineAfter(branches, "'true' when 'true' ->"));
		assertEquals("2", lineAfter(branches, "'false' when 'true' ->"));
	}

	@Test
	void rejectsEarlyReturn()
	{
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure("fn f(x: int) -> int { if x > 0 { return 1; } x }"));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure("fn f(x: int) -> int { let y = return x; y }"));
	}

	@Test
	void rejectsSideEffectsInGuards()
	{
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT,
				failure("fn pos(x: int) -> bool { x > 0 } fn f(v: int) { match v { n if pos(n) => 1, _ => 0 } }"));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT,
				failure("fn f(v: pid) { match v { n if n == self() => 1, _ => 0 } }"));
	}

	@Test
	void rejectsBadBitstringSegments()
	{
		assertEquals(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, failure("fn f(x: int) { <<x/big-little>> }"));
		assertEquals(ErrorKind.CONFLICTING_BITSTRING_SPECIFIER, failure("fn f(x: int) { <<x:8/utf8>> }"));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure("fn f() { <<\"ab\":16>> }"));
	}

	@Test
	void rejectsNegativeTimeout()
	{
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure("fn f() { receive { x => x } after -1 => 0 }"));
	}

	@Test
	void countersRestartForEachGenerator() throws CompileException
	{
		String source = "mod m { fn f(a: int) -> int { a } }";
		assertEquals(generate(source), generate(source));
	}
}
