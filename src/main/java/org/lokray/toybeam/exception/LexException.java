package org.lokray.toybeam.exception;

import org.lokray.toybeam.lexer.SourceSpan;

/**
 * Raised by the lexer on malformed source text.
 */
public class LexException extends CompileException
{
	public LexException(ErrorKind kind, SourceSpan span, String message)
	{
		super(kind, span, message);
	}
}
