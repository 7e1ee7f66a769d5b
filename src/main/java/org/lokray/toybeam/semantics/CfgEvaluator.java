package org.lokray.toybeam.semantics;

import org.lokray.toybeam.ast.Attribute;
import org.lokray.toybeam.ast.AttributeArgument;
import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.items.Item;
import org.lokray.toybeam.util.CompileOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional compilation. Decides from an item's attributes whether it takes part in the
 * compilation, before any symbol is collected:
 * <ul>
 *     <li>every {@code #[cfg(...)]} on the item must hold;</li>
 *     <li>an item marked {@code #[test]} is only kept in test mode.</li>
 * </ul>
 * Predicates: {@code test}, {@code feature = "name"}, {@code not(p)}, {@code all(...)},
 * {@code any(...)}. Unknown names evaluate to false, malformed cfg attributes to true.
 */
public class CfgEvaluator
{
	private static final Logger LOGGER = LoggerFactory.getLogger(CfgEvaluator.class);

	private final CompileOptions options;

	public CfgEvaluator(CompileOptions options)
	{
		this.options = options;
	}

	/**
	 * Returns the module without the items excluded by their attributes.
	 */
	public ModuleDeclaration filter(ModuleDeclaration module)
	{
		List<Item> kept = new ArrayList<>();
		for (Item item : module.getItems())
		{
			if (shouldInclude(item.getAttributes()))
			{
				kept.add(item);
			}
			else
			{
				LOGGER.debug("Excluding '{}' from module '{}' under {}", item.getName(), module.getName(), options);
			}
		}
		return module.withItems(kept);
	}

	public boolean shouldInclude(List<Attribute> attributes)
	{
		for (Attribute attribute : attributes)
		{
			if (attribute.getName().equals("cfg") && !evaluate(attribute))
			{
				return false;
			}
			if (attribute.getName().equals("test") && !options.isTestMode())
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Evaluates one cfg attribute. Bare {@code #[cfg]}, {@code #[cfg = "..."]} and {@code #[cfg()]}
	 * hold; several top-level predicates must all hold.
	 */
	boolean evaluate(Attribute attribute)
	{
		if (!attribute.isParenthesized())
		{
			return true;
		}
		for (AttributeArgument argument : attribute.getArguments())
		{
			if (!evaluate(argument))
			{
				return false;
			}
		}
		return true;
	}

	private boolean evaluate(AttributeArgument argument)
	{
		switch (argument.getKind())
		{
			case IDENTIFIER:
				return argument.getName().equals("test") && options.isTestMode();
			case KEY_VALUE:
				return argument.getName().equals("feature") && options.hasFeature(argument.getValue());
			case NESTED:
				return evaluateNested(argument.getName(), argument.getNested());
			default:
				return false;
		}
	}

	private boolean evaluateNested(String function, List<AttributeArgument> arguments)
	{
		switch (function)
		{
			case "not":
				return arguments.size() == 1 && !evaluate(arguments.get(0));
			case "all":
				for (AttributeArgument argument : arguments)
				{
					if (!evaluate(argument))
					{
						return false;
					}
				}
				return true;
			case "any":
				for (AttributeArgument argument : arguments)
				{
					if (evaluate(argument))
					{
						return true;
					}
				}
				return false;
			default:
				return false;
		}
	}
}
