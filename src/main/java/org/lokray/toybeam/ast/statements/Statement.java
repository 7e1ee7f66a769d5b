package org.lokray.toybeam.ast.statements;

import org.lokray.toybeam.ast.ASTNode;

/**
 * Base interface for the statements of a block: {@code let} bindings and expression statements.
 */
public interface Statement extends ASTNode
{
}
