package org.lokray.toybeam.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * The table of built-in functions, keyed by name and arity.
 * A function declared in the module with the same name hides the built-in.
 */
public final class Builtins
{
	private static final Map<String, BuiltinFunction> TABLE = new LinkedHashMap<>();

	static
	{
		// Process primitives
		erlang("self", 0);
		erlang("link", 1);
		erlang("unlink", 1);
		define("monitor", 1, false, args -> call("erlang", "monitor", prepend("'process'", args)));
		erlang("demonitor", 1);
		erlang("register", 2);
		erlang("unregister", 1);
		erlang("whereis", 1);
		erlang("exit", 1);
		erlang("exit", 2);
		define("trap_exit", 1, false, args -> call("erlang", "process_flag", prepend("'trap_exit'", args)));
		erlang("spawn_link", 1);
		erlang("spawn_monitor", 1);
		erlang("make_ref", 0);
		erlang("is_process_alive", 1);
		erlang("node", 0);
		define("sleep", 1, false, args -> call("timer", "sleep", args));
		define("print", 1, false, args -> call("io", "format", List.of("\"~p~n\"", "[" + args.get(0) + "]")));

		// Type tests and accessors the runtime allows in guards
		for (String test : List.of("is_integer", "is_atom", "is_tuple", "is_list", "is_pid", "is_binary",
				"is_boolean", "length", "hd", "tl", "tuple_size", "abs"))
		{
			define(test, 1, true, args -> call("erlang", test, args));
		}
	}

	private Builtins()
	{
	}

	private static void erlang(String name, int arity)
	{
		define(name, arity, false, args -> call("erlang", name, args));
	}

	private static void define(String name, int arity, boolean guardSafe,
							   Function<List<String>, String> lowering)
	{
		TABLE.put(key(name, arity), new BuiltinFunction(name, arity, guardSafe, lowering));
	}

	private static String key(String name, int arity)
	{
		return name + "/" + arity;
	}

	private static List<String> prepend(String first, List<String> rest)
	{
		List<String> all = new ArrayList<>();
		all.add(first);
		all.addAll(rest);
		return all;
	}

	private static String call(String module, String function, List<String> args)
	{
		return "call '" + module + "':'" + function + "'(" + String.join(", ", args) + ")";
	}

	/**
	 * Looks up the built-in with exactly this name and arity.
	 *
	 * @return The built-in, or null.
	 */
	public static BuiltinFunction lookup(String name, int arity)
	{
		return TABLE.get(key(name, arity));
	}

	/**
	 * True if some built-in carries this name, whatever its arity.
	 */
	public static boolean isBuiltin(String name)
	{
		return !aritiesOf(name).isEmpty();
	}

	/**
	 * The arities under which a name is defined, in ascending order.
	 */
	public static Set<Integer> aritiesOf(String name)
	{
		Set<Integer> arities = new TreeSet<>();
		for (BuiltinFunction function : TABLE.values())
		{
			if (function.getName().equals(name))
			{
				arities.add(function.getArity());
			}
		}
		return Collections.unmodifiableSet(arities);
	}
}
