package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing a parenthesized single expression with no trailing comma.
 */
public class GroupingExpression implements Expression
{
	private final Token leftParen;
	private final Expression expression;

	public GroupingExpression(Token leftParen, Expression expression)
	{
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public String toString()
	{
		return "(" + expression + ")";
	}
}
