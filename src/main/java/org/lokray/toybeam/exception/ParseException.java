package org.lokray.toybeam.exception;

import org.lokray.toybeam.lexer.SourceSpan;

/**
 * Raised by the parser on the first syntax error; there is no recovery.
 */
public class ParseException extends CompileException
{
	public ParseException(ErrorKind kind, SourceSpan span, String message)
	{
		super(kind, span, message);
	}
}
