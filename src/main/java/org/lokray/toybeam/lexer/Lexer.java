package org.lokray.toybeam.lexer;

import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.LexException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw toybeam source code and converts it into a stream of meaningful Tokens.
 * Whitespace and both comment forms are consumed here and never reach the parser.
 * Scanning stops at the first malformed input with a {@link LexException}.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("mod", TokenType.MOD);
		keywords.put("fn", TokenType.FN);
		keywords.put("pub", TokenType.PUB);
		keywords.put("let", TokenType.LET);
		keywords.put("mut", TokenType.MUT);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("match", TokenType.MATCH);
		keywords.put("struct", TokenType.STRUCT);
		keywords.put("enum", TokenType.ENUM);
		keywords.put("spawn", TokenType.SPAWN);
		keywords.put("receive", TokenType.RECEIVE);
		keywords.put("after", TokenType.AFTER);
		keywords.put("return", TokenType.RETURN);
		keywords.put("true", TokenType.TRUE);
		keywords.put("false", TokenType.FALSE);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	/**
	 * Scans the entire source code and returns a list of tokens, terminated by an EOF token.
	 *
	 * @throws LexException on the first unterminated string or comment, invalid escape, or stray character.
	 */
	public List<Token> scanTokens() throws LexException
	{
		while (!isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;
			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, new SourceSpan(line, column, current)));
		return tokens;
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken() throws LexException
	{
		char c = advance();

		switch (c)
		{
			// --- Single-character tokens ---
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case '[':
				addToken(TokenType.LEFT_BRACKET);
				break;
			case ']':
				addToken(TokenType.RIGHT_BRACKET);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '#':
				addToken(TokenType.HASH);
				break;
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '*':
				addToken(TokenType.STAR);
				break;
			case '%':
				addToken(TokenType.PERCENT);
				break;

			// --- Operators that can be single or double characters ---
			case ':':
				if (match(':'))
				{
					addToken(TokenType.DOUBLE_COLON);
				}
				else if (startsAtom())
				{
					scanAtom();
				}
				else
				{
					addToken(TokenType.COLON);
				}
				break;
			case '-':
				addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
				break;
			case '=':
				if (match('='))
				{
					addToken(TokenType.EQUAL_EQUAL);
				}
				else if (match('>'))
				{
					addToken(TokenType.FAT_ARROW);
				}
				else
				{
					addToken(TokenType.ASSIGN);
				}
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '<':
				if (match('<'))
				{
					addToken(TokenType.LESS_LESS);
				}
				else
				{
					addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
				}
				break;
			case '>':
				if (match('>'))
				{
					addToken(TokenType.GREATER_GREATER);
				}
				else
				{
					addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				}
				break;
			case '&':
				if (!match('&'))
				{
					throw error(ErrorKind.INVALID_CHARACTER, "Unexpected character '&'. Did you mean '&&'?");
				}
				addToken(TokenType.AMPERSAND_AMPERSAND);
				break;
			case '|':
				addToken(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE);
				break;
			case '/':
				if (match('/'))
				{
					// Line comment, consume until newline
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else if (match('*'))
				{
					blockComment();
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;

			// --- Literals and Identifiers ---
			case '"':
				scanStringLiteral();
				break;

			// --- Whitespace ---
			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				line++;
				column = 1;
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isLower(c) || c == '_')
				{
					scanIdentifier();
				}
				else if (isUpper(c))
				{
					scanTypeIdentifier();
				}
				else
				{
					throw error(ErrorKind.INVALID_CHARACTER, "Unexpected character '" + c + "'.");
				}
				break;
		}
	}

	/**
	 * Consumes the current character and returns it, also updates the column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, new SourceSpan(startLine, startColumn, start)));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Consumes the current character if it matches the expected one.
	 *
	 * @param expected The expected character.
	 * @return True if the character matched and was consumed, false otherwise.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}

		current++;
		column++;
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private LexException error(ErrorKind kind, String message)
	{
		return new LexException(kind, new SourceSpan(startLine, startColumn, start), message);
	}

	/**
	 * Consumes a block comment whose opening delimiter was already matched.
	 * Block comments nest: every inner opening delimiter needs its own closing one.
	 */
	private void blockComment() throws LexException
	{
		int depth = 1;
		while (depth > 0)
		{
			if (isAtEnd())
			{
				throw error(ErrorKind.UNTERMINATED_COMMENT, "Unterminated block comment.");
			}
			if (peek() == '/' && peekNext() == '*')
			{
				advance();
				advance();
				depth++;
			}
			else if (peek() == '*' && peekNext() == '/')
			{
				advance();
				advance();
				depth--;
			}
			else if (advance() == '\n')
			{
				line++;
				column = 1;
			}
		}
	}

	/**
	 * An atom is a colon directly followed by a lowercase identifier, unless the colon is glued
	 * to the end of an operand ({@code x:int}, {@code <<v:size>>}), where it is a plain colon.
	 */
	private boolean startsAtom()
	{
		char next = peek();
		if (!isLower(next) && next != '_')
		{
			return false;
		}
		if (start == 0)
		{
			return true;
		}
		char before = source.charAt(start - 1);
		return !(isLower(before) || isUpper(before) || isDigit(before) || before == '_'
				|| before == ')' || before == ']' || before == '"');
	}

	private void scanAtom()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}
		addToken(TokenType.ATOM_LITERAL, source.substring(start + 1, current));
	}

	/**
	 * Scans an arbitrary-precision integer literal.
	 */
	private void scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}
		addToken(TokenType.INTEGER_LITERAL, new BigInteger(source.substring(start, current)));
	}

	/**
	 * Scans a string literal enclosed in double quotes, decoding escape sequences.
	 */
	private void scanStringLiteral() throws LexException
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"')
		{
			if (isAtEnd())
			{
				throw error(ErrorKind.UNTERMINATED_STRING, "Unterminated string literal.");
			}
			char c = advance();
			if (c == '\\')
			{
				value.appendCodePoint(escapeSequence());
			}
			else if (c == '\n')
			{
				value.append('\n');
				line++;
				column = 1;
			}
			else
			{
				value.append(c);
			}
		}

		advance(); // Consume the closing '"'
		addToken(TokenType.STRING_LITERAL, value.toString());
	}

	/**
	 * Decodes the escape sequence following a backslash.
	 *
	 * @return The code point the escape stands for.
	 */
	private int escapeSequence() throws LexException
	{
		SourceSpan escapeSpan = new SourceSpan(line, column - 1, current - 1);
		if (isAtEnd())
		{
			throw error(ErrorKind.UNTERMINATED_STRING, "Unterminated string literal.");
		}
		char escapeChar = advance();
		switch (escapeChar)
		{
			case 'n':
				return '\n';
			case 't':
				return '\t';
			case 'r':
				return '\r';
			case '0':
				return 0;
			case '\\':
				return '\\';
			case '"':
				return '"';
			case '\'':
				return '\'';
			case 'x':
			{
				int high = Character.digit(peek(), 16);
				int low = Character.digit(peekNext(), 16);
				if (high < 0 || low < 0 || high > 7)
				{
					throw new LexException(ErrorKind.INVALID_ESCAPE, escapeSpan, "Invalid escape sequence: '\\x' needs two hex digits in the range 00-7F.");
				}
				advance();
				advance();
				return high * 16 + low;
			}
			case 'u':
				return unicodeEscape(escapeSpan);
			default:
				throw new LexException(ErrorKind.INVALID_ESCAPE, escapeSpan, "Invalid escape sequence '\\" + escapeChar + "' in string literal.");
		}
	}

	/**
	 * Decodes {@code \\u{XXXX}} with one to six hex digits.
	 */
	private int unicodeEscape(SourceSpan escapeSpan) throws LexException
	{
		if (!match('{'))
		{
			throw new LexException(ErrorKind.INVALID_ESCAPE, escapeSpan, "Invalid escape sequence: expected '{' after '\\u'.");
		}
		int codePoint = 0;
		int digits = 0;
		while (Character.digit(peek(), 16) >= 0)
		{
			codePoint = codePoint * 16 + Character.digit(advance(), 16);
			digits++;
		}
		if (!match('}') || digits == 0 || digits > 6 || !Character.isValidCodePoint(codePoint))
		{
			throw new LexException(ErrorKind.INVALID_ESCAPE, escapeSpan, "Invalid unicode escape sequence.");
		}
		return codePoint;
	}

	/**
	 * Scans an identifier or keyword.
	 */
	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.get(text);
		addToken(type != null ? type : TokenType.IDENTIFIER);
	}

	private void scanTypeIdentifier()
	{
		while (isLower(peek()) || isUpper(peek()) || isDigit(peek()) || peek() == '_')
		{
			advance();
		}
		addToken(TokenType.TYPE_IDENTIFIER);
	}

	private static boolean isIdentifierPart(char c)
	{
		return isLower(c) || isDigit(c) || c == '_';
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isLower(char c)
	{
		return c >= 'a' && c <= 'z';
	}

	private static boolean isUpper(char c)
	{
		return c >= 'A' && c <= 'Z';
	}
}
