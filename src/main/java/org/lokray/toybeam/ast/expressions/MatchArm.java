package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.patterns.Pattern;

/**
 * One arm of a {@code match} or {@code receive}: `PATTERN ( IF GUARD )? => BODY`.
 */
public class MatchArm
{
	private final Pattern pattern;
	private final Expression guard; // null means the guard always holds
	private final Expression body;

	public MatchArm(Pattern pattern, Expression guard, Expression body)
	{
		this.pattern = pattern;
		this.guard = guard;
		this.body = body;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public Expression getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		return pattern + (guard != null ? " if " + guard : "") + " => " + body;
	}
}
