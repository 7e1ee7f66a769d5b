package org.lokray.toybeam.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the toybeam Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INTEGER_LITERAL, PLUS)
	private final String lexeme;     // The actual text of the token (e.g., "counter", "123", "+")
	private final Object literal;    // BigInteger for integers, decoded String for strings, atom name for atoms
	private final SourceSpan span;   // Where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source code.
	 * @param literal The parsed literal value for literal tokens, null otherwise.
	 * @param span    The position where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, SourceSpan span)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.span = span;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	public int getLine()
	{
		return span.line();
	}

	public int getColumn()
	{
		return span.column();
	}

	/**
	 * Format: "TokenType 'lexeme' [literal] (Line:l, Col:c)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + span.line() + ", Col:" + span.column() + ")";
	}

	/**
	 * Compares type, lexeme, and literal. The position is not included, so tokens
	 * from different places are equal when they spell the same thing.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme) && Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
