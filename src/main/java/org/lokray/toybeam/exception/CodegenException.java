package org.lokray.toybeam.exception;

import org.lokray.toybeam.lexer.SourceSpan;

/**
 * Raised when a resolved construct has no valid Core Erlang lowering.
 */
public class CodegenException extends CompileException
{
	public CodegenException(ErrorKind kind, SourceSpan span, String message)
	{
		super(kind, span, message);
	}
}
