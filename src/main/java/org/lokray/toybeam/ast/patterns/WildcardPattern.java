package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

public class WildcardPattern implements Pattern
{
	private final Token underscore;

	public WildcardPattern(Token underscore)
	{
		this.underscore = underscore;
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitWildcardPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return underscore;
	}

	@Override
	public String toString()
	{
		return "_";
	}
}
