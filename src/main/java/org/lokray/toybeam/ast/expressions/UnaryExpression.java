package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing a prefix negation ({@code -x}) or logical not ({@code !x}).
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operator;
	}

	@Override
	public String toString()
	{
		return "(" + operator.getLexeme() + operand + ")";
	}
}
