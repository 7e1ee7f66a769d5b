package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;

/**
 * Visitor over the pattern hierarchy.
 *
 * @param <R> The return type of the visit operations.
 */
public interface PatternVisitor<R>
{
	R visitIdentifierPattern(IdentifierPattern pattern) throws CompileException;

	R visitWildcardPattern(WildcardPattern pattern) throws CompileException;

	R visitLiteralPattern(LiteralPattern pattern) throws CompileException;

	R visitTuplePattern(TuplePattern pattern) throws CompileException;

	R visitListPattern(ListPattern pattern) throws CompileException;

	R visitConsPattern(ConsPattern pattern) throws CompileException;

	R visitStructPattern(StructPattern pattern) throws CompileException;

	R visitEnumPattern(EnumPattern pattern) throws CompileException;

	R visitBitstringPattern(BitstringPattern pattern) throws CompileException;
}
