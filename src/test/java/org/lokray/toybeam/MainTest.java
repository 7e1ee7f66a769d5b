package org.lokray.toybeam;

import org.lokray.toybeam.util.CompileOptions;
import org.lokray.toybeam.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@TempDir
	Path dir;

	private ByteArrayOutputStream errors;
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		errors = new ByteArrayOutputStream();
		reporter = new ErrorReporter(new PrintStream(errors, true, StandardCharsets.UTF_8));
	}

	private String errorText()
	{
		return errors.toString(StandardCharsets.UTF_8);
	}

	private Path write(String name, String content) throws IOException
	{
		Path file = dir.resolve(name);
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	void defaultOutputReplacesTheExtension()
	{
		assertEquals(Paths.get("src", "app.core"), Main.defaultOutput(Paths.get("src", "app.tb")));
		assertEquals(Paths.get("noext.core"), Main.defaultOutput(Paths.get("noext")));
		assertEquals(Paths.get("a.b.core"), Main.defaultOutput(Paths.get("a.b.tb")));
	}

	@Test
	void compilesNextToTheSource() throws IOException
	{
		Path source = write("math.tb", "mod math { pub fn one() -> int { 1 } }");
		assertEquals(Main.EXIT_OK, Main.run(new String[]{source.toString()}, reporter));

		String output = Files.readString(dir.resolve("math.core"), StandardCharsets.UTF_8);
		assertTrue(output.startsWith("module 'math' ['one'/0]"), output);
		assertFalse(reporter.hasErrors());
	}

	@Test
	void honorsOutputAndFlags() throws IOException
	{
		Path source = write("app.tb", "mod app { #[test] pub fn t() -> int { 1 } #[cfg(feature = \"x\")] pub fn x() -> int { 2 } }");
		Path out = dir.resolve("out.core");

		int code = Main.run(new String[]{"--test", "--feature", "x", "-o", out.toString(), source.toString()}, reporter);
		assertEquals(Main.EXIT_OK, code, errorText());
		assertTrue(Files.readString(out, StandardCharsets.UTF_8).startsWith("module 'app' ['t'/0, 'x'/0]"));
	}

	@Test
	void compileErrorWritesNothing() throws IOException
	{
		Path source = write("bad.tb", "mod bad { fn f() { y } }");
		assertEquals(Main.EXIT_COMPILE_ERROR, Main.run(new String[]{source.toString()}, reporter));

		assertFalse(Files.exists(dir.resolve("bad.core")));
		assertTrue(errorText().contains("[SEMANTIC/UNDEFINED_VARIABLE]"), errorText());
		assertTrue(errorText().contains("Line 1, Column 20"), errorText());
	}

	@Test
	void usageErrors() throws IOException
	{
		Path source = write("ok.tb", "mod ok { }");
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{}, reporter));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"--bogus", source.toString()}, reporter));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{source.toString(), "-o"}, reporter));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{source.toString(), source.toString()}, reporter));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{dir.resolve("missing.tb").toString()}, reporter));
		assertTrue(errorText().contains(Main.USAGE));
	}

	@Test
	void loadsConfiguration() throws IOException
	{
		Path config = write(Main.CONFIG_FILE, "compile.test_mode=true\ncompile.features=net\n");
		CompileOptions options = Main.loadConfiguration(config, reporter);
		assertTrue(options.isTestMode());
		assertTrue(options.hasFeature("net"));
	}

	@Test
	void missingConfigurationMeansDefaults()
	{
		CompileOptions options = Main.loadConfiguration(dir.resolve("absent.properties"), reporter);
		assertFalse(options.isTestMode());
		assertFalse(reporter.hasErrors());
	}
}
