package org.lokray.toybeam.patterns;

import org.lokray.toybeam.exception.CompileException;

/**
 * Lowers the body of one clause. Called after the clause's patterns are bound, so the
 * body sees the pattern variables.
 */
@FunctionalInterface
public interface ClauseBody
{
	String lower() throws CompileException;
}
