package org.lokray.toybeam.util;

import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.SemanticException;
import org.lokray.toybeam.lexer.SourceSpan;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	@Test
	void formatsPositionStageAndKind()
	{
		SemanticException e = new SemanticException(ErrorKind.UNDEFINED_VARIABLE, new SourceSpan(3, 7, 40),
				"Undefined variable 'y'.");
		assertEquals("app.tb: [Error] Line 3, Column 7: [SEMANTIC/UNDEFINED_VARIABLE] Undefined variable 'y'.",
				ErrorReporter.format("app.tb", e));
		assertTrue(ErrorReporter.format(null, e).startsWith("[Error] Line 3"));
	}

	@Test
	void tracksWhetherAnythingWasReported()
	{
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		ErrorReporter reporter = new ErrorReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
		assertFalse(reporter.hasErrors());

		reporter.report("Could not read x");
		assertTrue(reporter.hasErrors());
		assertEquals("[Error] Could not read x", buffer.toString(StandardCharsets.UTF_8).trim());
	}
}
