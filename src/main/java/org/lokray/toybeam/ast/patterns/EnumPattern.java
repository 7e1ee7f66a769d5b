package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches an enum variant: {@code Type::Variant} or {@code Type::Variant(p, ...)}.
 */
public class EnumPattern implements Pattern
{
	private final Token typeName;
	private final Token variant;
	private final List<Pattern> arguments;
	private final boolean parenthesized;

	public EnumPattern(Token typeName, Token variant, List<Pattern> arguments, boolean parenthesized)
	{
		this.typeName = typeName;
		this.variant = variant;
		this.arguments = new ArrayList<>(arguments);
		this.parenthesized = parenthesized;
	}

	public Token getTypeNameToken()
	{
		return typeName;
	}

	public String getTypeName()
	{
		return typeName.getLexeme();
	}

	public Token getVariantToken()
	{
		return variant;
	}

	public String getVariant()
	{
		return variant.getLexeme();
	}

	public List<Pattern> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public boolean isParenthesized()
	{
		return parenthesized;
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitEnumPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return typeName;
	}

	@Override
	public String toString()
	{
		String head = getTypeName() + "::" + getVariant();
		if (!parenthesized)
		{
			return head;
		}
		return head + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
