package org.lokray.toybeam.semantics;

import java.util.List;
import java.util.function.Function;

/**
 * A function every module can call without declaring it. Each one lowers to a call into the
 * runtime; {@link #render(List)} receives the already lowered arguments in source order.
 */
public class BuiltinFunction
{
	private final String name;
	private final int arity;
	private final boolean guardSafe;
	private final Function<List<String>, String> lowering;

	BuiltinFunction(String name, int arity, boolean guardSafe, Function<List<String>, String> lowering)
	{
		this.name = name;
		this.arity = arity;
		this.guardSafe = guardSafe;
		this.lowering = lowering;
	}

	public String getName()
	{
		return name;
	}

	public int getArity()
	{
		return arity;
	}

	/**
	 * True when the runtime permits the call inside a clause guard.
	 */
	public boolean isGuardSafe()
	{
		return guardSafe;
	}

	public String render(List<String> arguments)
	{
		return lowering.apply(arguments);
	}

	@Override
	public String toString()
	{
		return name + "/" + arity;
	}
}
