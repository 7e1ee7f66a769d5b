package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.statements.Statement;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a block: an ordered statement sequence and an optional trailing
 * expression that gives the block its value. Without one the block evaluates to unit.
 */
public class BlockExpression implements Expression
{
	private final Token leftBrace;
	private final List<Statement> statements;
	private final Expression tail; // null when the block ends in a statement

	public BlockExpression(Token leftBrace, List<Statement> statements, Expression tail)
	{
		this.leftBrace = leftBrace;
		this.statements = new ArrayList<>(statements);
		this.tail = tail;
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public Expression getTail()
	{
		return tail;
	}

	@Override
	public boolean isBlockLike()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitBlockExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{ ");
		for (Statement statement : statements)
		{
			sb.append(statement).append(" ");
		}
		if (tail != null)
		{
			sb.append(tail).append(" ");
		}
		return sb.append("}").toString();
	}
}
