package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

/**
 * Abstract base class for all symbols in the symbol tables.
 * A symbol represents a declared entity in the program: a function, a struct, an enum,
 * an enum variant or a local variable.
 */
public abstract class Symbol
{
	private final String name;
	private final Token declarationToken; // The token where this symbol was declared, null for predeclared symbols

	protected Symbol(String name, Token declarationToken)
	{
		this.name = name;
		this.declarationToken = declarationToken;
	}

	public String getName()
	{
		return name;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "{name='" + name + "'"
				+ (declarationToken != null ? ", line=" + declarationToken.getLine() : "") + "}";
	}
}
