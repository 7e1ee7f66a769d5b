package org.lokray.toybeam.ast;

import org.lokray.toybeam.lexer.Token;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One argument inside an attribute's parentheses: an identifier ({@code test}),
 * a key/value pair ({@code feature = "json"}) or a nested call ({@code not(test)}).
 */
public class AttributeArgument
{
	public enum Kind
	{
		IDENTIFIER, KEY_VALUE, NESTED
	}

	private final Kind kind;
	private final Token name;
	private final String value;
	private final List<AttributeArgument> nested;

	private AttributeArgument(Kind kind, Token name, String value, List<AttributeArgument> nested)
	{
		this.kind = kind;
		this.name = name;
		this.value = value;
		this.nested = nested;
	}

	public static AttributeArgument identifier(Token name)
	{
		return new AttributeArgument(Kind.IDENTIFIER, name, null, Collections.emptyList());
	}

	public static AttributeArgument keyValue(Token key, String value)
	{
		return new AttributeArgument(Kind.KEY_VALUE, key, value, Collections.emptyList());
	}

	public static AttributeArgument nested(Token name, List<AttributeArgument> arguments)
	{
		return new AttributeArgument(Kind.NESTED, name, null, arguments);
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public String getValue()
	{
		return value;
	}

	public List<AttributeArgument> getNested()
	{
		return Collections.unmodifiableList(nested);
	}

	static String join(List<AttributeArgument> arguments)
	{
		return arguments.stream().map(AttributeArgument::toString).collect(Collectors.joining(", "));
	}

	@Override
	public String toString()
	{
		switch (kind)
		{
			case KEY_VALUE:
				return getName() + " = \"" + value + "\"";
			case NESTED:
				return getName() + "(" + join(nested) + ")";
			default:
				return getName();
		}
	}
}
