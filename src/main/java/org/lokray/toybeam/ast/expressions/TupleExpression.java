package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a tuple of two or more elements, or one element with a trailing comma.
 */
public class TupleExpression implements Expression
{
	private final Token leftParen;
	private final List<Expression> elements;

	public TupleExpression(Token leftParen, List<Expression> elements)
	{
		this.leftParen = leftParen;
		this.elements = new ArrayList<>(elements);
	}

	public List<Expression> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitTupleExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public String toString()
	{
		return "(" + elements.stream().map(Object::toString).collect(Collectors.joining(", "))
				+ (elements.size() == 1 ? ",)" : ")");
	}
}
