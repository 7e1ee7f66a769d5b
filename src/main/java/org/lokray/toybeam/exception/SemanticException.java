package org.lokray.toybeam.exception;

import org.lokray.toybeam.lexer.SourceSpan;

/**
 * Raised when a module is syntactically valid but references unknown names or disagrees with a declaration.
 */
public class SemanticException extends CompileException
{
	public SemanticException(ErrorKind kind, SourceSpan span, String message)
	{
		super(kind, span, message);
	}
}
