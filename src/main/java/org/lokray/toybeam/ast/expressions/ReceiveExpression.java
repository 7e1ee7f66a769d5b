package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a selective receive over the current process mailbox.
 * Without an after clause the receive waits indefinitely.
 */
public class ReceiveExpression implements Expression
{
	private final Token receiveKeyword;
	private final List<MatchArm> arms;
	private final AfterClause after; // null means wait forever

	public ReceiveExpression(Token receiveKeyword, List<MatchArm> arms, AfterClause after)
	{
		this.receiveKeyword = receiveKeyword;
		this.arms = new ArrayList<>(arms);
		this.after = after;
	}

	public List<MatchArm> getArms()
	{
		return Collections.unmodifiableList(arms);
	}

	public AfterClause getAfter()
	{
		return after;
	}

	@Override
	public boolean isBlockLike()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitReceiveExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return receiveKeyword;
	}

	@Override
	public String toString()
	{
		return "receive { " + arms.stream().map(MatchArm::toString).collect(Collectors.joining(", "))
				+ (after != null ? " " + after : "") + " }";
	}
}
