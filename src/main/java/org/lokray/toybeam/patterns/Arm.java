package org.lokray.toybeam.patterns;

import org.lokray.toybeam.ast.expressions.Expression;
import org.lokray.toybeam.ast.patterns.Pattern;

import java.util.Collections;
import java.util.List;

/**
 * One clause to compile: patterns for every scrutinee position, an optional guard and a body.
 */
public class Arm
{
	private final List<Pattern> patterns;
	private final Expression guard;
	private final ClauseBody body;

	public Arm(List<Pattern> patterns, Expression guard, ClauseBody body)
	{
		this.patterns = patterns;
		this.guard = guard;
		this.body = body;
	}

	public static Arm of(Pattern pattern, Expression guard, ClauseBody body)
	{
		return new Arm(Collections.singletonList(pattern), guard, body);
	}

	public List<Pattern> getPatterns()
	{
		return patterns;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public ClauseBody getBody()
	{
		return body;
	}
}
