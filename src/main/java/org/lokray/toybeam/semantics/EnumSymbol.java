package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An enum declaration and its variants in declaration order.
 */
public class EnumSymbol extends Symbol
{
	private final Map<String, VariantSymbol> variants = new LinkedHashMap<>();

	public EnumSymbol(String name, Token declarationToken)
	{
		super(name, declarationToken);
	}

	/**
	 * Adds a variant.
	 *
	 * @return false if a variant of that name was already present.
	 */
	boolean addVariant(VariantSymbol variant)
	{
		return variants.putIfAbsent(variant.getName(), variant) == null;
	}

	public VariantSymbol getVariant(String name)
	{
		return variants.get(name);
	}

	public Collection<VariantSymbol> getVariants()
	{
		return Collections.unmodifiableCollection(variants.values());
	}

	@Override
	public String toString()
	{
		return "enum " + getName() + variants.values();
	}
}
