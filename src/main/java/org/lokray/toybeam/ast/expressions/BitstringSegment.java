package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One segment of a bitstring: `VALUE ( : SIZE )? ( / SPECIFIER ( - SPECIFIER )* )?`.
 * The value is an {@link Expression} in construction and a
 * {@link org.lokray.toybeam.ast.patterns.Pattern} in matching.
 *
 * @param <T> the node type of the segment value.
 */
public class BitstringSegment<T>
{
	private final T value;
	private final Token firstToken;
	private final Expression size;        // null when omitted
	private final List<Token> specifiers; // empty when omitted

	public BitstringSegment(T value, Token firstToken, Expression size, List<Token> specifiers)
	{
		this.value = value;
		this.firstToken = firstToken;
		this.size = size;
		this.specifiers = new ArrayList<>(specifiers);
	}

	public T getValue()
	{
		return value;
	}

	public Token getFirstToken()
	{
		return firstToken;
	}

	public Expression getSize()
	{
		return size;
	}

	public List<Token> getSpecifiers()
	{
		return Collections.unmodifiableList(specifiers);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(String.valueOf(value));
		if (size != null)
		{
			sb.append(":").append(size);
		}
		if (!specifiers.isEmpty())
		{
			sb.append("/").append(specifiers.stream().map(Token::getLexeme).collect(Collectors.joining("-")));
		}
		return sb.toString();
	}
}
