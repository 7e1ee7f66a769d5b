package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

/**
 * One variant of an enum. A zero-arity variant is the bare atom of its name; any other
 * variant is a tagged tuple of its name followed by the payload.
 */
public class VariantSymbol extends Symbol
{
	private final String enumName;
	private final int arity;

	public VariantSymbol(String enumName, String name, int arity, Token declarationToken)
	{
		super(name, declarationToken);
		this.enumName = enumName;
		this.arity = arity;
	}

	public String getEnumName()
	{
		return enumName;
	}

	public int getArity()
	{
		return arity;
	}

	public boolean isBareAtom()
	{
		return arity == 0;
	}

	@Override
	public String toString()
	{
		return enumName + "::" + getName() + "/" + arity;
	}
}
