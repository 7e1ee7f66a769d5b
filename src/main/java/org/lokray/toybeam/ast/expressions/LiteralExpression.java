package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing an integer, string, atom, boolean or unit literal.
 */
public class LiteralExpression implements Expression
{
	private final Literal literal;

	public LiteralExpression(Literal literal)
	{
		this.literal = literal;
	}

	public Literal getLiteral()
	{
		return literal;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return literal.getToken();
	}

	@Override
	public String toString()
	{
		return literal.toString();
	}
}
