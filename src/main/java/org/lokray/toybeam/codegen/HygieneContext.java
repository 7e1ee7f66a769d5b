package org.lokray.toybeam.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates target variable names for one compilation. Every binding, temporary and
 * wildcard gets a suffix from a single counter, so no two target names ever collide and
 * a shadowing source binding never captures an outer one.
 * <ul>
 *     <li>source variable {@code count} becomes {@code Count@N};</li>
 *     <li>temporaries are {@code _Hint@N};</li>
 *     <li>each wildcard is a fresh {@code _@N}.</li>
 * </ul>
 * Scopes mirror the lexical scopes of the source: function, block, then arm.
 */
public class HygieneContext
{
	/**
	 * One source-to-target renaming, kept in the order the bindings were made.
	 */
	public static final class Binding
	{
		private final String sourceName;
		private final String targetName;
		private final int depth;

		Binding(String sourceName, String targetName, int depth)
		{
			this.sourceName = sourceName;
			this.targetName = targetName;
			this.depth = depth;
		}

		public String getSourceName()
		{
			return sourceName;
		}

		public String getTargetName()
		{
			return targetName;
		}

		public int getDepth()
		{
			return depth;
		}

		@Override
		public String toString()
		{
			return sourceName + " -> " + targetName;
		}
	}

	private final Deque<Map<String, String>> scopes = new ArrayDeque<>();
	private final List<Binding> bindings = new ArrayList<>();
	private int counter;

	public HygieneContext()
	{
		scopes.push(new HashMap<>());
	}

	public void enterScope()
	{
		scopes.push(new HashMap<>());
	}

	public void exitScope()
	{
		if (scopes.size() == 1)
		{
			throw new IllegalStateException("Cannot exit the outermost hygiene scope");
		}
		scopes.pop();
	}

	/**
	 * Binds a source variable in the innermost scope, shadowing any earlier binding of the
	 * same name, and returns its new target name.
	 */
	public String bind(String sourceName)
	{
		String target = capitalize(sourceName) + "@" + next();
		scopes.peek().put(sourceName, target);
		bindings.add(new Binding(sourceName, target, scopes.size()));
		return target;
	}

	/**
	 * Resolves a source variable through the enclosing scopes.
	 *
	 * @return The target name, or null if the variable is not bound.
	 */
	public String resolve(String sourceName)
	{
		for (Map<String, String> scope : scopes)
		{
			String target = scope.get(sourceName);
			if (target != null)
			{
				return target;
			}
		}
		return null;
	}

	public boolean isBound(String sourceName)
	{
		return resolve(sourceName) != null;
	}

	/**
	 * A compiler-introduced variable that no source name can reach.
	 */
	public String temporary(String hint)
	{
		return "_" + capitalize(hint) + "@" + next();
	}

	public String wildcard()
	{
		return "_@" + next();
	}

	public int getDepth()
	{
		return scopes.size();
	}

	/**
	 * Every source binding made so far, in order.
	 */
	public List<Binding> getBindings()
	{
		return Collections.unmodifiableList(bindings);
	}

	private int next()
	{
		return ++counter;
	}

	private static String capitalize(String name)
	{
		if (name.isEmpty())
		{
			return name;
		}
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}
}
