package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

/**
 * A reference to a user type or type parameter by name, e.g. {@code Point} or {@code T}.
 */
public class NamedType implements TypeAnnotation
{
	private final Token name;

	public NamedType(Token name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name.getLexeme();
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
