package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

public class ListType implements TypeAnnotation
{
	private final Token leftBracket;
	private final TypeAnnotation elementType;

	public ListType(Token leftBracket, TypeAnnotation elementType)
	{
		this.leftBracket = leftBracket;
		this.elementType = elementType;
	}

	public TypeAnnotation getElementType()
	{
		return elementType;
	}

	@Override
	public Token getFirstToken()
	{
		return leftBracket;
	}

	@Override
	public String toString()
	{
		return "[" + elementType + "]";
	}
}
