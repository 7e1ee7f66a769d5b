package org.lokray.toybeam.util;

import org.lokray.toybeam.exception.CompileException;

import java.io.PrintStream;

/**
 * Prints compile failures for people. Only the command-line front end uses this;
 * the compiler itself reports through exceptions.
 */
public class ErrorReporter
{
	private final PrintStream out;
	private boolean hasErrors = false; // Flag to indicate if any errors have been reported

	public ErrorReporter()
	{
		this(System.err);
	}

	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a compile failure, including its stage and kind.
	 *
	 * @param source The file the failure belongs to, may be null.
	 * @param e      The failure.
	 */
	public void report(String source, CompileException e)
	{
		out.println(format(source, e));
		hasErrors = true;
	}

	/**
	 * Reports a problem that has no source position, such as an unreadable file.
	 */
	public void report(String message)
	{
		out.println("[Error] " + message);
		hasErrors = true;
	}

	public static String format(String source, CompileException e)
	{
		String prefix = source != null ? source + ": " : "";
		return prefix + "[Error] Line " + e.getLine() + ", Column " + e.getColumn() + ": ["
				+ e.getKind().getStage() + "/" + e.getKind() + "] " + e.getMessage();
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}
}
