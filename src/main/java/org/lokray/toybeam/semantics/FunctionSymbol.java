package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

/**
 * A module-level function: its name, its declared arity and whether it is exported.
 */
public class FunctionSymbol extends Symbol
{
	private final int arity;
	private final boolean isPublic;

	public FunctionSymbol(String name, int arity, boolean isPublic, Token declarationToken)
	{
		super(name, declarationToken);
		this.arity = arity;
		this.isPublic = isPublic;
	}

	public int getArity()
	{
		return arity;
	}

	public boolean isPublic()
	{
		return isPublic;
	}

	@Override
	public String toString()
	{
		return (isPublic ? "pub " : "") + getName() + "/" + arity;
	}
}
