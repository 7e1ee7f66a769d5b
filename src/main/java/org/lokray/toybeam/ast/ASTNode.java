package org.lokray.toybeam.ast;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * Base interface for all item, statement and expression nodes in the Abstract Syntax Tree (AST).
 * Patterns and type annotations form their own hierarchies.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor) throws CompileException;

	/**
	 * Returns the first token that constitutes this node, used to position diagnostics.
	 */
	Token getFirstToken();
}
