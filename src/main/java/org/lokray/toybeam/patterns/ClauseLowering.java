package org.lokray.toybeam.patterns;

import org.lokray.toybeam.ast.expressions.Expression;
import org.lokray.toybeam.exception.CompileException;

/**
 * The expression lowering the pattern compiler needs from the code generator.
 */
public interface ClauseLowering
{
	/**
	 * Lowers an arm guard. Guards may only use side-effect-free operations.
	 */
	String lowerGuard(Expression guard) throws CompileException;

	/**
	 * Lowers the size of a bitstring pattern segment to a variable or an integer.
	 */
	String lowerSegmentSize(Expression size) throws CompileException;
}
