package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

public class ReturnExpression implements Expression
{
	private final Token returnKeyword;
	private final Expression value; // null returns unit

	public ReturnExpression(Token returnKeyword, Expression value)
	{
		this.returnKeyword = returnKeyword;
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitReturnExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return returnKeyword;
	}

	@Override
	public String toString()
	{
		return value != null ? "return " + value : "return";
	}
}
