package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.ast.expressions.BitstringSegment;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class BitstringPattern implements Pattern
{
	private final Token open;
	private final List<BitstringSegment<Pattern>> segments;

	public BitstringPattern(Token open, List<BitstringSegment<Pattern>> segments)
	{
		this.open = open;
		this.segments = new ArrayList<>(segments);
	}

	public List<BitstringSegment<Pattern>> getSegments()
	{
		return Collections.unmodifiableList(segments);
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitBitstringPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return open;
	}

	@Override
	public String toString()
	{
		return "<<" + segments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ">>";
	}
}
