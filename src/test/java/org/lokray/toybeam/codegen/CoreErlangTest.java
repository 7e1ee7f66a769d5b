package org.lokray.toybeam.codegen;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoreErlangTest
{
	@Test
	void quotesAtoms()
	{
		assertEquals("'ok'", CoreErlang.atom("ok"));
		assertEquals("'it\\'s'", CoreErlang.atom("it's"));
		assertEquals("'a\\\\b'", CoreErlang.atom("a\\b"));
	}

	@Test
	void escapesStringsPerByte()
	{
		assertEquals("\"hi\"", CoreErlang.string("hi"));
		assertEquals("\"say \\\"no\\\"\"", CoreErlang.string("say \"no\""));
		assertEquals("\"a\\012b\"", CoreErlang.string("a\nb"));
		assertEquals("\"\\303\\251\"", CoreErlang.string("é"));
	}

	@Test
	void buildsCompoundTerms()
	{
		assertEquals("{}", CoreErlang.tuple(List.of()));
		assertEquals("{'ok', X@1}", CoreErlang.tuple(List.of("'ok'", "X@1")));
		assertEquals("[1, 2]", CoreErlang.list(List.of("1", "2")));
		assertEquals("[H@1, H@2|T@3]", CoreErlang.cons(List.of("H@1", "H@2"), "T@3"));
		assertEquals("<A@1, B@2>", CoreErlang.values(List.of("A@1", "B@2")));
		assertEquals("'loop'/2", CoreErlang.functionName("loop", 2));
		assertEquals("-5", CoreErlang.integer(BigInteger.valueOf(-5)));
	}

	@Test
	void buildsCalls()
	{
		assertEquals("call 'erlang':'+'(A@1, 1)", CoreErlang.call("erlang", "+", List.of("A@1", "1")));
		assertEquals("apply 'f'/0()", CoreErlang.apply("'f'/0", List.of()));
		assertEquals("primop 'match_fail'('if_clause')", CoreErlang.matchFail("'if_clause'"));
	}

	@Test
	void letKeepsSingleLineValuesInline()
	{
		assertEquals("let <X@1> = 1\nin X@1", CoreErlang.let("X@1", "1", "X@1"));
	}

	@Test
	void letIndentsMultiLineValues()
	{
		String value = "case A@1 of\n  _ when 'true' ->\n      1\nend";
		assertEquals("let <X@2> =\n    case A@1 of\n      _ when 'true' ->\n          1\n    end\nin X@2",
				CoreErlang.let("X@2", value, "X@2"));
	}

	@Test
	void caseIndentsClauses()
	{
		String clause = CoreErlang.clause("'true'", "'true'", "1");
		assertEquals("'true' when 'true' ->\n    1", clause);
		assertEquals("case C@1 of\n  'true' when 'true' ->\n      1\nend", CoreErlang.caseOf("C@1", List.of(clause)));
	}

	@Test
	void receiveEndsWithItsAfterClause()
	{
		String clause = CoreErlang.clause("'ping'", "'true'", "'pong'");
		assertEquals("receive\n  'ping' when 'true' ->\n      'pong'\nafter 100 ->\n    'timeout'",
				CoreErlang.receive(List.of(clause), "100", "'timeout'"));
	}

	@Test
	void funIndentsItsBody()
	{
		assertEquals("fun (A@1) ->\n    A@1", CoreErlang.fun(List.of("A@1"), "A@1"));
		assertEquals("fun () ->\n    'ok'", CoreErlang.fun(List.of(), "'ok'"));
	}

	@Test
	void rendersBinaries()
	{
		String segment = CoreErlang.segment("X@1", "16", "1", "integer", List.of("'signed'", "'little'"));
		assertEquals("#<X@1>(16,1,'integer',['signed','little'])", segment);
		assertEquals("#{" + segment + "," + segment + "}#", CoreErlang.binary(List.of(segment, segment)));
		assertEquals("#{}#", CoreErlang.binary(List.of()));
	}

	@Test
	void snakeCasesTypeNames()
	{
		assertEquals("io", CoreErlang.snakeCase("Io"));
		assertEquals("http_client", CoreErlang.snakeCase("HttpClient"));
		assertEquals("lists", CoreErlang.snakeCase("Lists"));
	}

	@Test
	void indentSkipsBlankLines()
	{
		assertEquals("  a\n\n  b", CoreErlang.indent("a\n\nb", 2));
		assertTrue(CoreErlang.isSingleLine("a b"));
		assertFalse(CoreErlang.isSingleLine("a\nb"));
	}
}
