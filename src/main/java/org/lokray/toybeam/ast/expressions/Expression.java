package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTNode;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value; in toybeam every
 * construct except items and let bindings is an expression.
 */
public interface Expression extends ASTNode
{
	/**
	 * True for constructs that end in a block ({@code if}, {@code match}, {@code receive}, blocks)
	 * and may therefore stand as a statement without a trailing semicolon.
	 */
	default boolean isBlockLike()
	{
		return false;
	}
}
