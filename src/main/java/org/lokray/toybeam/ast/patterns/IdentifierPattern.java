package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * Binds the matched value to a fresh variable.
 */
public class IdentifierPattern implements Pattern
{
	private final Token name;

	public IdentifierPattern(Token name)
	{
		this.name = name;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitIdentifierPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
