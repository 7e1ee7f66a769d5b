package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing {@code if cond { ... } else ...}. The else branch is either a
 * block or another if expression, and may be absent, in which case the value is unit.
 */
public class IfExpression implements Expression
{
	private final Token ifKeyword;
	private final Expression condition;
	private final BlockExpression thenBranch;
	private final Expression elseBranch; // BlockExpression, IfExpression or null

	public IfExpression(Token ifKeyword, Expression condition, BlockExpression thenBranch, Expression elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockExpression getThenBranch()
	{
		return thenBranch;
	}

	public Expression getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public boolean isBlockLike()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitIfExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public String toString()
	{
		return "if " + condition + " " + thenBranch + (elseBranch != null ? " else " + elseBranch : "");
	}
}
