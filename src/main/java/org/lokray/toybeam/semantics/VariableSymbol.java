package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

/**
 * A local binding introduced by a parameter, a let or a match/receive arm pattern.
 */
public class VariableSymbol extends Symbol
{
	private final boolean mutable;

	public VariableSymbol(String name, boolean mutable, Token declarationToken)
	{
		super(name, declarationToken);
		this.mutable = mutable;
	}

	public boolean isMutable()
	{
		return mutable;
	}
}
