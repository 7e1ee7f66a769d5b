package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class TupleType implements TypeAnnotation
{
	private final Token leftParen;
	private final List<TypeAnnotation> elements;

	public TupleType(Token leftParen, List<TypeAnnotation> elements)
	{
		this.leftParen = leftParen;
		this.elements = new ArrayList<>(elements);
	}

	public List<TypeAnnotation> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public String toString()
	{
		return "(" + elements.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
