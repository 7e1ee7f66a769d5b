package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.lexer.Token;

/**
 * A {@code name: value} pair inside a struct construction. The shorthand {@code name}
 * is stored with an identifier expression of the same name as its value.
 */
public class FieldInitializer
{
	private final Token name;
	private final Expression value;

	public FieldInitializer(Token name, Expression value)
	{
		this.name = name;
		this.value = value;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return getName() + ": " + value;
	}
}
