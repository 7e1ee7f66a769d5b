package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing {@code target ! message}. Its value is the message sent.
 */
public class SendExpression implements Expression
{
	private final Expression target;
	private final Token bang;
	private final Expression message;

	public SendExpression(Expression target, Token bang, Expression message)
	{
		this.target = target;
		this.bang = bang;
		this.message = message;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getBang()
	{
		return bang;
	}

	public Expression getMessage()
	{
		return message;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitSendExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}

	@Override
	public String toString()
	{
		return "(" + target + " ! " + message + ")";
	}
}
