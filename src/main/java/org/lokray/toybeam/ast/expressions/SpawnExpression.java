package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing process creation. Exactly one of the two forms is present:
 * {@code spawn || { body }} carries a closure body, {@code spawn(expr)} carries a
 * callable expression that must evaluate to a zero-argument function.
 */
public class SpawnExpression implements Expression
{
	private final Token spawnKeyword;
	private final BlockExpression closureBody;
	private final Expression callable;

	private SpawnExpression(Token spawnKeyword, BlockExpression closureBody, Expression callable)
	{
		this.spawnKeyword = spawnKeyword;
		this.closureBody = closureBody;
		this.callable = callable;
	}

	public static SpawnExpression ofClosure(Token spawnKeyword, BlockExpression body)
	{
		return new SpawnExpression(spawnKeyword, body, null);
	}

	public static SpawnExpression ofCallable(Token spawnKeyword, Expression callable)
	{
		return new SpawnExpression(spawnKeyword, null, callable);
	}

	public boolean isClosure()
	{
		return closureBody != null;
	}

	public BlockExpression getClosureBody()
	{
		return closureBody;
	}

	public Expression getCallable()
	{
		return callable;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitSpawnExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return spawnKeyword;
	}

	@Override
	public String toString()
	{
		return isClosure() ? "spawn || " + closureBody : "spawn(" + callable + ")";
	}
}
