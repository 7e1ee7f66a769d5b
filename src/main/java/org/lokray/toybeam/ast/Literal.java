package org.lokray.toybeam.ast;

import org.lokray.toybeam.lexer.Token;

import java.math.BigInteger;

/**
 * A literal value shared by literal expressions and literal patterns.
 * Integers are held as {@link BigInteger}, strings as their decoded text,
 * atoms as their bare name and booleans as {@link Boolean}; unit has no value.
 */
public class Literal
{
	public enum Kind
	{
		INTEGER, STRING, ATOM, BOOLEAN, UNIT
	}

	private final Kind kind;
	private final Object value;
	private final Token token;

	public Literal(Kind kind, Object value, Token token)
	{
		this.kind = kind;
		this.value = value;
		this.token = token;
	}

	public Kind getKind()
	{
		return kind;
	}

	public Object getValue()
	{
		return value;
	}

	public Token getToken()
	{
		return token;
	}

	/**
	 * Returns the same literal with its integer value negated. Only meaningful for integers.
	 */
	public Literal negate(Token minus)
	{
		return new Literal(kind, ((BigInteger) value).negate(), minus);
	}

	@Override
	public String toString()
	{
		switch (kind)
		{
			case STRING:
				return "\"" + value + "\"";
			case ATOM:
				return ":" + value;
			case UNIT:
				return "()";
			default:
				return String.valueOf(value);
		}
	}
}
