package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing zero-based indexing, {@code value[index]}.
 */
public class IndexExpression implements Expression
{
	private final Expression object;
	private final Token bracket;
	private final Expression index;

	public IndexExpression(Expression object, Token bracket, Expression index)
	{
		this.object = object;
		this.bracket = bracket;
		this.index = index;
	}

	public Expression getObject()
	{
		return object;
	}

	public Token getBracket()
	{
		return bracket;
	}

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitIndexExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public String toString()
	{
		return object + "[" + index + "]";
	}
}
