package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * Matches a value equal to an integer, string, atom, boolean or unit literal.
 */
public class LiteralPattern implements Pattern
{
	private final Literal literal;

	public LiteralPattern(Literal literal)
	{
		this.literal = literal;
	}

	public Literal getLiteral()
	{
		return literal;
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitLiteralPattern(this);
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
