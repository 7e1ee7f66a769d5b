package org.lokray.toybeam.semantics;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.SemanticException;
import org.lokray.toybeam.lexer.Lexer;
import org.lokray.toybeam.parser.ToyBeamParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest
{
	private static ModuleSymbols analyze(String source) throws CompileException
	{
		return new SemanticAnalyzer().analyze(new ToyBeamParser(new Lexer(source).scanTokens()).parse());
	}

	private static SemanticException failure(String source)
	{
		return assertThrows(SemanticException.class, () -> analyze(source));
	}

	private static ErrorKind kindOf(String source)
	{
		return failure(source).getKind();
	}

	@Test
	void collectsSymbolsAndExports() throws CompileException
	{
		ModuleSymbols symbols = analyze("mod shapes {\n"
				+ "  struct Point { x: int, y: int }\n"
				+ "  enum Shape { Circle(Point, int), Empty }\n"
				+ "  pub fn area(s: Shape) -> int { 0 }\n"
				+ "  fn helper() { () }\n"
				+ "  pub fn origin() -> Point { Point { x: 0, y: 0 } }\n"
				+ "}");

		assertEquals("shapes", symbols.getModuleName());
		List<String> exports = symbols.getExports().stream().map(FunctionSymbol::getName).collect(Collectors.toList());
		assertEquals(List.of("area", "origin"), exports);
		assertEquals(List.of("x", "y"), symbols.getStruct("Point").getFieldNames());
		assertEquals(2, symbols.getEnum("Shape").getVariant("Circle").getArity());
		assertTrue(symbols.getEnum("Shape").getVariant("Empty").isBareAtom());
		assertEquals(1, symbols.structsWithField("x").size());
	}

	@Test
	void signalIsPredeclared() throws CompileException
	{
		ModuleSymbols symbols = analyze("mod m { fn f() { receive { Signal::EXIT(pid, why) => why } } }");
		assertTrue(symbols.isEnum(ModuleSymbols.SIGNAL_ENUM));
		assertEquals(4, symbols.getEnum("Signal").getVariant("DOWN").getArity());
	}

	@Test
	void signalCannotBeRedefined()
	{
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { enum Signal { Stop } }"));
	}

	@Test
	void reportsUndefinedVariableWithPosition()
	{
		SemanticException e = failure("mod m { fn f() { y } }");
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.getKind());
		assertEquals(1, e.getLine());
		assertEquals(18, e.getColumn());
	}

	@Test
	void letValueCannotSeeItsOwnBinding()
	{
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, kindOf("mod m { fn f() { let x = x; x } }"));
	}

	@Test
	void shadowingIsAllowed() throws CompileException
	{
		assertNotNull(analyze("mod m { fn f() { let x = 1; let x = x + 1; x } }"));
	}

	@Test
	void armBindingsDoNotLeak()
	{
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, kindOf("mod m { fn f(v: int) { match v { n => n }; n } }"));
	}

	@Test
	void builtinsAreNotValues()
	{
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, kindOf("mod m { fn f() { self } }"));
	}

	@Test
	void functionsAreValues() throws CompileException
	{
		assertNotNull(analyze("mod m { fn worker() { () } fn f() { spawn(worker) } }"));
	}

	@Test
	void reportsUndefinedFunction()
	{
		assertEquals(ErrorKind.UNDEFINED_FUNCTION_CALL, kindOf("mod m { fn f() { g(1) } }"));
	}

	@Test
	void checksCallArity()
	{
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { fn f() { g(1, 2) } fn g(a: int) { a } }"));
	}

	@Test
	void checksBuiltinArity() throws CompileException
	{
		assertNotNull(analyze("mod m { fn f(p: pid) { exit(p, :kill); exit(:normal) } }"));
		SemanticException e = failure("mod m { fn f() { exit(1, 2, 3) } }");
		assertEquals(ErrorKind.ARITY_MISMATCH, e.getKind());
		assertTrue(e.getMessage().contains("[1, 2]"), e.getMessage());
	}

	@Test
	void checksMethodCalls() throws CompileException
	{
		String double_ = "fn double(x: int) -> int { x * 2 } ";
		assertNotNull(analyze("mod m { " + double_ + "fn f(v: int) { v.double() } }"));
		assertEquals(ErrorKind.UNDEFINED_FUNCTION_CALL, kindOf("mod m { " + double_ + "fn f(v: int) { v.triple() } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { " + double_ + "fn f(v: int) { v.double(1) } }"));
	}

	@Test
	void rejectsDuplicateDefinitions()
	{
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { fn f() { 1 } fn f() { 2 } }"));
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { struct P { x: int } enum P { A } }"));
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { struct P { x: int, x: int } }"));
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { enum E { A, A } }"));
	}

	@Test
	void rejectsNamesBoundTwiceInOnePattern()
	{
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { fn f(x: int, x: int) { x } }"));
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { fn f(p: (int, int)) { let (a, a) = p; a } }"));
	}

	@Test
	void checksVariants() throws CompileException
	{
		String option = "enum Option { Some(int), None } ";
		assertNotNull(analyze("mod m { " + option + "fn f() { (Option::Some(1), Option::None) } }"));
		assertEquals(ErrorKind.UNDEFINED_VARIANT, kindOf("mod m { " + option + "fn f() { Option::Nope } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { " + option + "fn f() { Option::Some(1, 2) } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { " + option + "fn f() { Option::None(1) } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { " + option + "fn f() { Option::Some } }"));
	}

	@Test
	void checksVariantPatterns()
	{
		String option = "enum Option { Some(int), None } ";
		assertEquals(ErrorKind.ARITY_MISMATCH,
				kindOf("mod m { " + option + "fn f(o: Option) { match o { Option::None() => 0, _ => 1 } } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH,
				kindOf("mod m { " + option + "fn f(o: Option) { match o { Option::Some => 0, _ => 1 } } }"));
		assertEquals(ErrorKind.UNDEFINED_TYPE,
				kindOf("mod m { fn f(o: int) { match o { Maybe::Some(x) => x } } }"));
	}

	@Test
	void remoteCallsNeedNoDeclaration() throws CompileException
	{
		assertNotNull(analyze("mod m { fn f() { Io::format(\"hi\") } }"));
		assertEquals(ErrorKind.UNDEFINED_TYPE, kindOf("mod m { fn f() { Io::format } }"));
	}

	@Test
	void checksStructLiterals()
	{
		String point = "struct Point { x: int, y: int } ";
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { " + point + "fn f() { Point { x: 1 } } }"));
		assertEquals(ErrorKind.UNDEFINED_FIELD, kindOf("mod m { " + point + "fn f() { Point { x: 1, z: 2 } } }"));
		assertEquals(ErrorKind.DUPLICATE_BINDING, kindOf("mod m { " + point + "fn f() { Point { x: 1, x: 2 } } }"));
		assertEquals(ErrorKind.UNDEFINED_TYPE, kindOf("mod m { fn f() { Point { x: 1 } } }"));
	}

	@Test
	void checksFieldAccess() throws CompileException
	{
		String point = "struct Point { x: int, y: int } ";
		assertNotNull(analyze("mod m { " + point + "fn f(p: Point) { p.x } }"));
		assertEquals(ErrorKind.UNDEFINED_FIELD, kindOf("mod m { " + point + "fn f(p: Point) { p.z } }"));
	}

	@Test
	void tagMustKeepOneShape() throws CompileException
	{
		assertNotNull(analyze("mod m { enum A { Ok(int) } enum B { Ok(int) } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { struct Circle { r: int } enum Shape { Circle(int, int) } }"));
		assertEquals(ErrorKind.ARITY_MISMATCH, kindOf("mod m { enum A { Done } enum B { Done(int) } }"));
	}

	@Test
	void segmentSizeMayUseEarlierSegment() throws CompileException
	{
		assertNotNull(analyze("mod m { fn f(b: string) { match b { <<n:8, rest:n/binary>> => rest, _ => b } } }"));
		assertEquals(ErrorKind.UNDEFINED_VARIABLE,
				kindOf("mod m { fn f(b: string) { match b { <<rest:n/binary>> => rest, _ => b } } }"));
	}

	@Test
	void closuresSeeEnclosingVariables() throws CompileException
	{
		assertNotNull(analyze("mod m { fn f(parent: pid) { spawn || { parent ! :hello } } }"));
	}
}
