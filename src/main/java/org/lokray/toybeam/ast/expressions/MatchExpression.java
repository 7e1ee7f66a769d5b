package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing {@code match scrutinee { arms }}. Arms are kept in source order.
 */
public class MatchExpression implements Expression
{
	private final Token matchKeyword;
	private final Expression scrutinee;
	private final List<MatchArm> arms;

	public MatchExpression(Token matchKeyword, Expression scrutinee, List<MatchArm> arms)
	{
		this.matchKeyword = matchKeyword;
		this.scrutinee = scrutinee;
		this.arms = new ArrayList<>(arms);
	}

	public Expression getScrutinee()
	{
		return scrutinee;
	}

	public List<MatchArm> getArms()
	{
		return Collections.unmodifiableList(arms);
	}

	@Override
	public boolean isBlockLike()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitMatchExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return matchKeyword;
	}

	@Override
	public String toString()
	{
		return "match " + scrutinee + " { " + arms.stream().map(MatchArm::toString).collect(Collectors.joining(", ")) + " }";
	}
}
