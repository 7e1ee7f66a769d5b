package org.lokray.toybeam.semantics;

import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A struct declaration reduced to its ordered field names.
 * Values are tagged tuples {@code {'Name', f1, ..., fn}} in this order.
 */
public class StructSymbol extends Symbol
{
	private final List<String> fieldNames;

	public StructSymbol(String name, List<String> fieldNames, Token declarationToken)
	{
		super(name, declarationToken);
		this.fieldNames = new ArrayList<>(fieldNames);
	}

	public List<String> getFieldNames()
	{
		return Collections.unmodifiableList(fieldNames);
	}

	public int getArity()
	{
		return fieldNames.size();
	}

	public boolean hasField(String field)
	{
		return fieldNames.contains(field);
	}

	/**
	 * Returns the zero-based position of the field among the declared fields, or -1.
	 */
	public int indexOf(String field)
	{
		return fieldNames.indexOf(field);
	}

	@Override
	public String toString()
	{
		return "struct " + getName() + fieldNames;
	}
}
