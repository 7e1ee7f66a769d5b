package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A generic application such as {@code Option<int>}.
 */
public class GenericType implements TypeAnnotation
{
	private final Token name;
	private final List<TypeAnnotation> arguments;

	public GenericType(Token name, List<TypeAnnotation> arguments)
	{
		this.name = name;
		this.arguments = new ArrayList<>(arguments);
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public List<TypeAnnotation> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return getName() + "<" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ">";
	}
}
