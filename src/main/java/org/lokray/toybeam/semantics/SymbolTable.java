package org.lokray.toybeam.semantics;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents the local variables of one lexical scope.
 * Symbol tables form a chain through their enclosing scope; lookups walk outward.
 * Redefining a name in the same scope replaces it, which is how a later {@code let}
 * shadows an earlier one.
 */
public class SymbolTable
{
	private final Map<String, VariableSymbol> symbols;
	private final SymbolTable enclosingScope; // Reference to the parent scope
	private final String scopeName;           // For debugging (e.g. "fn:main", "arm", "spawn")

	public SymbolTable(SymbolTable enclosingScope, String scopeName)
	{
		this.symbols = new HashMap<>();
		this.enclosingScope = enclosingScope;
		this.scopeName = scopeName;
	}

	public void define(VariableSymbol symbol)
	{
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol, starting from the current scope and moving up to enclosing scopes.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found symbol, or null if not found in any enclosing scope.
	 */
	public VariableSymbol resolve(String name)
	{
		VariableSymbol symbol = symbols.get(name);
		if (symbol != null)
		{
			return symbol;
		}
		return enclosingScope != null ? enclosingScope.resolve(name) : null;
	}

	public VariableSymbol resolveCurrentScope(String name)
	{
		return symbols.get(name);
	}

	public SymbolTable getEnclosingScope()
	{
		return enclosingScope;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("':\n");
		for (Map.Entry<String, VariableSymbol> entry : symbols.entrySet())
		{
			sb.append("  ").append(entry.getValue()).append("\n");
		}
		return sb.toString();
	}
}
