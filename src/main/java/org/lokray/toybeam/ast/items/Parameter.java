package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.patterns.Pattern;
import org.lokray.toybeam.ast.types.TypeAnnotation;

/**
 * A function parameter. The binding side is a pattern, so parameters may destructure.
 */
public class Parameter
{
	private final Pattern pattern;
	private final TypeAnnotation type;

	public Parameter(Pattern pattern, TypeAnnotation type)
	{
		this.pattern = pattern;
		this.type = type;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public TypeAnnotation getType()
	{
		return type;
	}

	@Override
	public String toString()
	{
		return pattern + ": " + type;
	}
}
