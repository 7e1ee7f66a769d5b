package org.lokray.toybeam.patterns;

import org.lokray.toybeam.codegen.CoreErlang;
import org.lokray.toybeam.codegen.HygieneContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dispatch on values: a {@code case} whose last clause catches everything the arms do not
 * and raises a match failure tagged with the reason the runtime uses for that construct.
 */
public class ValueDispatch implements DispatchStrategy
{
	public static final String CASE_CLAUSE = "case_clause";
	public static final String BADMATCH = "badmatch";
	public static final String FUNCTION_CLAUSE = "function_clause";

	private final List<String> scrutinees;
	private final String failureReason;

	public ValueDispatch(List<String> scrutinees, String failureReason)
	{
		this.scrutinees = new ArrayList<>(scrutinees);
		this.failureReason = failureReason;
	}

	public ValueDispatch(String scrutinee, String failureReason)
	{
		this(Collections.singletonList(scrutinee), failureReason);
	}

	@Override
	public int width()
	{
		return scrutinees.size();
	}

	@Override
	public String assemble(List<String> clauses, HygieneContext hygiene)
	{
		List<String> others = new ArrayList<>();
		for (int i = 0; i < scrutinees.size(); i++)
		{
			others.add(hygiene.temporary("Other"));
		}
		List<String> reason = new ArrayList<>();
		reason.add(CoreErlang.atom(failureReason));
		reason.addAll(others);

		List<String> all = new ArrayList<>(clauses);
		all.add(CoreErlang.clause(PatternCompiler.join(others), CoreErlang.TRUE,
				CoreErlang.matchFail(CoreErlang.tuple(reason))));
		return CoreErlang.caseOf(PatternCompiler.join(scrutinees), all);
	}
}
