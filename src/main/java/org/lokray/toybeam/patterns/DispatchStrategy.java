package org.lokray.toybeam.patterns;

import org.lokray.toybeam.codegen.HygieneContext;
import org.lokray.toybeam.exception.CompileException;

import java.util.List;

/**
 * How the compiled clauses reach their subject: a value already in hand, or the
 * process mailbox.
 */
public interface DispatchStrategy
{
	/**
	 * The number of patterns each arm must supply.
	 */
	int width();

	/**
	 * Wraps the compiled clauses, in arm order, into the complete dispatch construct.
	 */
	String assemble(List<String> clauses, HygieneContext hygiene) throws CompileException;
}
