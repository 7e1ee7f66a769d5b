package org.lokray.toybeam.ast.statements;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.expressions.Expression;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * An expression evaluated for its effects; its value is discarded.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return expression.getFirstToken();
	}

	@Override
	public String toString()
	{
		return expression + ";";
	}
}
