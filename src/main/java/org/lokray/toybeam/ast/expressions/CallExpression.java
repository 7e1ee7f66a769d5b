package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a call. The callee is any expression; only a bare identifier
 * or a {@code Type::member} path is resolved statically.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final Token paren;
	private final List<Expression> arguments;

	public CallExpression(Expression callee, Token paren, List<Expression> arguments)
	{
		this.callee = callee;
		this.paren = paren;
		this.arguments = new ArrayList<>(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public Token getParen()
	{
		return paren;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return callee.getFirstToken();
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
