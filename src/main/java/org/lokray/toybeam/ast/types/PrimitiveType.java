package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

import java.util.Set;

/**
 * One of the built-in type names: int, bool, string, atom, pid.
 */
public class PrimitiveType implements TypeAnnotation
{
	public static final Set<String> NAMES = Set.of("int", "bool", "string", "atom", "pid");

	private final Token name;

	public PrimitiveType(Token name)
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
