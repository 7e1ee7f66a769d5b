package org.lokray.toybeam.lexer;

import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.LexException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private static List<Token> scan(String source) throws LexException
	{
		return new Lexer(source).scanTokens();
	}

	private static List<TokenType> types(String source) throws LexException
	{
		List<TokenType> types = new ArrayList<>();
		for (Token token : scan(source))
		{
			types.add(token.getType());
		}
		return types;
	}

	@Test
	void scansKeywordsIdentifiersAndTypeNames() throws LexException
	{
		assertEquals(List.of(TokenType.PUB, TokenType.FN, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
						TokenType.IDENTIFIER, TokenType.COLON, TokenType.TYPE_IDENTIFIER, TokenType.RIGHT_PAREN,
						TokenType.EOF),
				types("pub fn start(p: Point)"));
	}

	@Test
	void scansOperators() throws LexException
	{
		assertEquals(List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL,
						TokenType.GREATER_EQUAL, TokenType.AMPERSAND_AMPERSAND, TokenType.PIPE_PIPE, TokenType.PIPE,
						TokenType.FAT_ARROW, TokenType.ARROW, TokenType.DOUBLE_COLON, TokenType.LESS_LESS,
						TokenType.GREATER_GREATER, TokenType.BANG, TokenType.EOF),
				types("== != <= >= && || | => -> :: << >> !"));
	}

	@Test
	void distinguishesAtomsFromTypeColons() throws LexException
	{
		List<Token> tokens = scan("x:int :ok f(:stop)");
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals(TokenType.COLON, tokens.get(1).getType());
		assertEquals(TokenType.IDENTIFIER, tokens.get(2).getType());
		assertEquals(TokenType.ATOM_LITERAL, tokens.get(3).getType());
		assertEquals("ok", tokens.get(3).getLiteral());
		assertEquals(TokenType.ATOM_LITERAL, tokens.get(6).getType());
		assertEquals("stop", tokens.get(6).getLiteral());
	}

	@Test
	void keepsSegmentSizeColonsInsideBitstrings() throws LexException
	{
		assertEquals(List.of(TokenType.LESS_LESS, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
						TokenType.SLASH, TokenType.IDENTIFIER, TokenType.GREATER_GREATER, TokenType.EOF),
				types("<<data:len/binary>>"));
	}

	@Test
	void decodesIntegersAndStringEscapes() throws LexException
	{
		List<Token> tokens = scan("123456789012345678901234567890 \"a\\n\\\"b\\x41\\u{e9}\"");
		assertEquals(new BigInteger("123456789012345678901234567890"), tokens.get(0).getLiteral());
		assertEquals("a\n\"bA\u00e9", tokens.get(1).getLiteral());
	}

	@Test
	void skipsNestedBlockCommentsAndLineComments() throws LexException
	{
		assertEquals(List.of(TokenType.MOD, TokenType.IDENTIFIER, TokenType.EOF),
				types("/* outer /* inner */ still comment */ mod // trailing\n m"));
	}

	@Test
	void tracksLinesAndColumns() throws LexException
	{
		List<Token> tokens = scan("mod\n  counter");
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(1, tokens.get(0).getColumn());
		assertEquals(2, tokens.get(1).getLine());
		assertEquals(3, tokens.get(1).getColumn());
	}

	@Test
	void rejectsUnterminatedString()
	{
		LexException e = assertThrows(LexException.class, () -> scan("let s = \"open"));
		assertEquals(ErrorKind.UNTERMINATED_STRING, e.getKind());
		assertEquals(9, e.getColumn());
	}

	@Test
	void rejectsUnterminatedBlockComment()
	{
		LexException e = assertThrows(LexException.class, () -> scan("/* /* */"));
		assertEquals(ErrorKind.UNTERMINATED_COMMENT, e.getKind());
	}

	@Test
	void rejectsInvalidEscape()
	{
		LexException e = assertThrows(LexException.class, () -> scan("\"bad \\q\""));
		assertEquals(ErrorKind.INVALID_ESCAPE, e.getKind());
	}

	@Test
	void rejectsStrayCharacters()
	{
		assertEquals(ErrorKind.INVALID_CHARACTER, assertThrows(LexException.class, () -> scan("a @ b")).getKind());
		assertEquals(ErrorKind.INVALID_CHARACTER, assertThrows(LexException.class, () -> scan("a & b")).getKind());
	}
}
