package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

public class FieldAccessExpression implements Expression
{
	private final Expression object;
	private final Token field;

	public FieldAccessExpression(Expression object, Token field)
	{
		this.object = object;
		this.field = field;
	}

	public Expression getObject()
	{
		return object;
	}

	public Token getFieldToken()
	{
		return field;
	}

	public String getFieldName()
	{
		return field.getLexeme();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitFieldAccessExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public String toString()
	{
		return object + "." + getFieldName();
	}
}
