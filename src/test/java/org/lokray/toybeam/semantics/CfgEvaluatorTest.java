package org.lokray.toybeam.semantics;

import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.items.Item;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Lexer;
import org.lokray.toybeam.parser.ToyBeamParser;
import org.lokray.toybeam.util.CompileOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CfgEvaluatorTest
{
	private static final String SOURCE = "mod m {\n"
			+ "  fn always() { 1 }\n"
			+ "  #[test] fn only_tests() { 2 }\n"
			+ "  #[cfg(test)] fn cfg_test() { 3 }\n"
			+ "  #[cfg(not(test))] fn release() { 4 }\n"
			+ "  #[cfg(feature = \"net\")] fn net() { 5 }\n"
			+ "  #[cfg(all(feature = \"net\", feature = \"tls\"))] fn secure() { 6 }\n"
			+ "  #[cfg(any(feature = \"tls\", test))] fn either() { 7 }\n"
			+ "  #[cfg(unix)] fn unknown() { 8 }\n"
			+ "  #[cfg] fn bare() { 9 }\n"
			+ "  #[inline] fn other_attribute() { 10 }\n"
			+ "}";

	private static List<String> kept(CompileOptions options) throws CompileException
	{
		ModuleDeclaration module = new ToyBeamParser(new Lexer(SOURCE).scanTokens()).parse();
		return new CfgEvaluator(options).filter(module).getItems().stream()
				.map(Item::getName)
				.collect(Collectors.toList());
	}

	@Test
	void defaultsKeepOnlyUnconditionalItems() throws CompileException
	{
		assertEquals(List.of("always", "release", "bare", "other_attribute"), kept(CompileOptions.defaults()));
	}

	@Test
	void testModeKeepsTestItems() throws CompileException
	{
		assertEquals(List.of("always", "only_tests", "cfg_test", "either", "bare", "other_attribute"),
				kept(CompileOptions.forTesting()));
	}

	@Test
	void featuresEnableItems() throws CompileException
	{
		assertEquals(List.of("always", "release", "net", "bare", "other_attribute"),
				kept(CompileOptions.defaults().withFeatures("net")));
		assertEquals(List.of("always", "release", "net", "secure", "either", "bare", "other_attribute"),
				kept(CompileOptions.defaults().withFeatures("net", "tls")));
	}

	@Test
	void filteringKeepsTheModuleName() throws CompileException
	{
		ModuleDeclaration module = new ToyBeamParser(new Lexer(SOURCE).scanTokens()).parse();
		assertEquals("m", new CfgEvaluator(CompileOptions.defaults()).filter(module).getName());
	}
}
