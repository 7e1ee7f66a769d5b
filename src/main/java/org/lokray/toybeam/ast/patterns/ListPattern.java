package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches a proper list of exactly the given length.
 */
public class ListPattern implements Pattern
{
	private final Token leftBracket;
	private final List<Pattern> elements;

	public ListPattern(Token leftBracket, List<Pattern> elements)
	{
		this.leftBracket = leftBracket;
		this.elements = new ArrayList<>(elements);
	}

	public List<Pattern> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitListPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBracket;
	}

	@Override
	public String toString()
	{
		return "[" + elements.stream().map(Object::toString).collect(Collectors.joining(", ")) + "]";
	}
}
