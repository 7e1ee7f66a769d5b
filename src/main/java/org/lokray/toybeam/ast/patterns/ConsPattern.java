package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches a list with at least one element: {@code [h | t]} or {@code [a, b | t]}.
 */
public class ConsPattern implements Pattern
{
	private final Token leftBracket;
	private final List<Pattern> heads;
	private final Pattern tail;

	public ConsPattern(Token leftBracket, List<Pattern> heads, Pattern tail)
	{
		this.leftBracket = leftBracket;
		this.heads = new ArrayList<>(heads);
		this.tail = tail;
	}

	public List<Pattern> getHeads()
	{
		return Collections.unmodifiableList(heads);
	}

	public Pattern getTail()
	{
		return tail;
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitConsPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBracket;
	}

	@Override
	public String toString()
	{
		return "[" + heads.stream().map(Object::toString).collect(Collectors.joining(", ")) + " | " + tail + "]";
	}
}
