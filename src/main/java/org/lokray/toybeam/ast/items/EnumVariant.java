package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.types.TypeAnnotation;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One variant of an enum. Its arity is the number of payload types; a 0-arity
 * variant is written without parentheses.
 */
public class EnumVariant
{
	private final Token name;
	private final List<TypeAnnotation> fieldTypes;

	public EnumVariant(Token name, List<TypeAnnotation> fieldTypes)
	{
		this.name = name;
		this.fieldTypes = new ArrayList<>(fieldTypes);
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public List<TypeAnnotation> getFieldTypes()
	{
		return Collections.unmodifiableList(fieldTypes);
	}

	public int getArity()
	{
		return fieldTypes.size();
	}

	@Override
	public String toString()
	{
		if (fieldTypes.isEmpty())
		{
			return getName();
		}
		return getName() + "(" + fieldTypes.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
