package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.lexer.Token;

/**
 * A {@code field: pattern} entry of a struct pattern. The shorthand {@code field}
 * is parsed as {@code field: field}.
 */
public class FieldPattern
{
	private final Token name;
	private final Pattern pattern;

	public FieldPattern(Token name, Pattern pattern)
	{
		this.name = name;
		this.pattern = pattern;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	@Override
	public String toString()
	{
		return getName() + ": " + pattern;
	}
}
