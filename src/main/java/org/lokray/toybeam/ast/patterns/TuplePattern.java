package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class TuplePattern implements Pattern
{
	private final Token leftParen;
	private final List<Pattern> elements;

	public TuplePattern(Token leftParen, List<Pattern> elements)
	{
		this.leftParen = leftParen;
		this.elements = new ArrayList<>(elements);
	}

	public List<Pattern> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitTuplePattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public String toString()
	{
		String inner = elements.stream().map(Object::toString).collect(Collectors.joining(", "));
		return "(" + inner + (elements.size() == 1 ? ",)" : ")");
	}
}
