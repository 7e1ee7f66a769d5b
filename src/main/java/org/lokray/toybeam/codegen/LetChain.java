package org.lokray.toybeam.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Operands bound ahead of the expression that uses them. Wrapping nests the bindings
 * in the order they were added, which is the source evaluation order.
 */
final class LetChain
{
	private final List<String> variables = new ArrayList<>();
	private final List<String> values = new ArrayList<>();

	void add(String variable, String value)
	{
		variables.add(variable);
		values.add(value);
	}

	boolean isEmpty()
	{
		return variables.isEmpty();
	}

	String wrap(String body)
	{
		String result = body;
		for (int i = variables.size() - 1; i >= 0; i--)
		{
			result = CoreErlang.let(variables.get(i), values.get(i), result);
		}
		return result;
	}
}
