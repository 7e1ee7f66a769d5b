package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * Base interface for pattern nodes. Patterns appear in match and receive arms,
 * let bindings and function parameters.
 */
public interface Pattern
{
	<R> R accept(PatternVisitor<R> visitor) throws CompileException;

	Token getFirstToken();
}
