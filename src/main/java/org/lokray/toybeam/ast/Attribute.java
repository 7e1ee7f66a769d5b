package org.lokray.toybeam.ast;

import org.lokray.toybeam.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * An item attribute: {@code #[name]}, {@code #[name(args)]} or {@code #[name = "value"]}.
 */
public class Attribute
{
	private final Token name;
	private final List<AttributeArgument> arguments; // null when there were no parentheses
	private final String value;                      // null unless written as name = "value"

	public Attribute(Token name, List<AttributeArgument> arguments, String value)
	{
		this.name = name;
		this.arguments = arguments;
		this.value = value;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public boolean isParenthesized()
	{
		return arguments != null;
	}

	public List<AttributeArgument> getArguments()
	{
		return arguments != null ? Collections.unmodifiableList(arguments) : Collections.emptyList();
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		if (arguments != null)
		{
			return "#[" + getName() + "(" + AttributeArgument.join(arguments) + ")]";
		}
		if (value != null)
		{
			return "#[" + getName() + " = \"" + value + "\"]";
		}
		return "#[" + getName() + "]";
	}
}
