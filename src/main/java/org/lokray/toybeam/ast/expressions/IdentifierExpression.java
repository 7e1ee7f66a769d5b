package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing a reference to a lowercase name: a local variable or a module function.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
