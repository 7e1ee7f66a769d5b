package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class ListExpression implements Expression
{
	private final Token leftBracket;
	private final List<Expression> elements;

	public ListExpression(Token leftBracket, List<Expression> elements)
	{
		this.leftBracket = leftBracket;
		this.elements = new ArrayList<>(elements);
	}

	public List<Expression> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitListExpression(this);
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
