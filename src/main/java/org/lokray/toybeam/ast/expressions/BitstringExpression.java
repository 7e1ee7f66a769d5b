package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing bitstring construction, {@code <<seg, ...>>}.
 */
public class BitstringExpression implements Expression
{
	private final Token open;
	private final List<BitstringSegment<Expression>> segments;

	public BitstringExpression(Token open, List<BitstringSegment<Expression>> segments)
	{
		this.open = open;
		this.segments = new ArrayList<>(segments);
	}

	public List<BitstringSegment<Expression>> getSegments()
	{
		return Collections.unmodifiableList(segments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitBitstringExpression(this);
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
