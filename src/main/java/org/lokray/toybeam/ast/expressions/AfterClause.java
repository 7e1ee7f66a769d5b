package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.lexer.Token;

/**
 * The optional timeout clause of a receive: {@code after timeout => body}.
 */
public class AfterClause
{
	private final Token afterKeyword;
	private final Expression timeout;
	private final Expression body;

	public AfterClause(Token afterKeyword, Expression timeout, Expression body)
	{
		this.afterKeyword = afterKeyword;
		this.timeout = timeout;
		this.body = body;
	}

	public Token getAfterKeyword()
	{
		return afterKeyword;
	}

	public Expression getTimeout()
	{
		return timeout;
	}

	public Expression getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		return "after " + timeout + " => " + body;
	}
}
