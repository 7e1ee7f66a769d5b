package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing {@code receiver.method(args)}: a call to the module function
 * {@code method} with the receiver prepended to the arguments.
 */
public class MethodCallExpression implements Expression
{
	private final Expression receiver;
	private final Token method;
	private final List<Expression> arguments;

	public MethodCallExpression(Expression receiver, Token method, List<Expression> arguments)
	{
		this.receiver = receiver;
		this.method = method;
		this.arguments = new ArrayList<>(arguments);
	}

	public Expression getReceiver()
	{
		return receiver;
	}

	public Token getMethodToken()
	{
		return method;
	}

	public String getMethodName()
	{
		return method.getLexeme();
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitMethodCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return receiver.getFirstToken();
	}

	@Override
	public String toString()
	{
		return receiver + "." + getMethodName() + "("
				+ arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
