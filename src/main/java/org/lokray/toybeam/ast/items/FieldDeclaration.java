package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.types.TypeAnnotation;
import org.lokray.toybeam.lexer.Token;

/**
 * A named, typed field of a struct declaration.
 */
public class FieldDeclaration
{
	private final Token name;
	private final TypeAnnotation type;

	public FieldDeclaration(Token name, TypeAnnotation type)
	{
		this.name = name;
		this.type = type;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public TypeAnnotation getType()
	{
		return type;
	}

	@Override
	public String toString()
	{
		return getName() + ": " + type;
	}
}
