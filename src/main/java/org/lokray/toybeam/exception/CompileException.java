package org.lokray.toybeam.exception;

import org.lokray.toybeam.lexer.SourceSpan;

/**
 * Base class of every failure raised while compiling a module.
 * Compilation is fail-fast, so at most one of these is ever produced per run.
 */
public abstract class CompileException extends Exception
{
	private final ErrorKind kind;
	private final SourceSpan span;

	protected CompileException(ErrorKind kind, SourceSpan span, String message)
	{
		super(message);
		this.kind = kind;
		this.span = span != null ? span : SourceSpan.UNKNOWN;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	public int getLine()
	{
		return span.line();
	}

	public int getColumn()
	{
		return span.column();
	}

	@Override
	public String toString()
	{
		return kind.getStage() + "/" + kind + " at " + span + ": " + getMessage();
	}
}
