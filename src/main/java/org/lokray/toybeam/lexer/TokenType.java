package org.lokray.toybeam.lexer;

/**
 * Defines the types of tokens recognized by the toybeam Lexer.
 * Comments are stripped by the lexer and therefore have no token type.
 */
public enum TokenType
{
	// --- Keywords ---
	MOD(Category.KEYWORD), FN(Category.KEYWORD), PUB(Category.KEYWORD), LET(Category.KEYWORD), MUT(Category.KEYWORD),
	IF(Category.KEYWORD), ELSE(Category.KEYWORD), MATCH(Category.KEYWORD),
	STRUCT(Category.KEYWORD), ENUM(Category.KEYWORD),
	SPAWN(Category.KEYWORD), RECEIVE(Category.KEYWORD), AFTER(Category.KEYWORD), RETURN(Category.KEYWORD),
	TRUE(Category.KEYWORD), FALSE(Category.KEYWORD),

	// --- Names and literals ---
	IDENTIFIER(Category.IDENTIFIER),           // [a-z_][a-z0-9_]*
	TYPE_IDENTIFIER(Category.TYPE_IDENTIFIER), // [A-Z][A-Za-z0-9_]*
	INTEGER_LITERAL(Category.INTEGER_LITERAL),
	STRING_LITERAL(Category.STRING_LITERAL),
	ATOM_LITERAL(Category.ATOM_LITERAL),       // :name

	// --- Punctuation & Delimiters ---
	LEFT_PAREN(Category.PUNCTUATION), RIGHT_PAREN(Category.PUNCTUATION),       // ( )
	LEFT_BRACE(Category.PUNCTUATION), RIGHT_BRACE(Category.PUNCTUATION),       // { }
	LEFT_BRACKET(Category.PUNCTUATION), RIGHT_BRACKET(Category.PUNCTUATION),   // [ ]
	COMMA(Category.PUNCTUATION), SEMICOLON(Category.PUNCTUATION), COLON(Category.PUNCTUATION),
	DOT(Category.PUNCTUATION), HASH(Category.PUNCTUATION),
	DOUBLE_COLON(Category.PUNCTUATION),  // ::
	ARROW(Category.PUNCTUATION),         // ->
	FAT_ARROW(Category.PUNCTUATION),     // =>

	// --- Operators ---
	PLUS(Category.OPERATOR), MINUS(Category.OPERATOR),
	STAR(Category.OPERATOR), SLASH(Category.OPERATOR), PERCENT(Category.OPERATOR),
	EQUAL_EQUAL(Category.OPERATOR), BANG_EQUAL(Category.OPERATOR),
	LESS(Category.OPERATOR), LESS_EQUAL(Category.OPERATOR),
	GREATER(Category.OPERATOR), GREATER_EQUAL(Category.OPERATOR),
	AMPERSAND_AMPERSAND(Category.OPERATOR), PIPE_PIPE(Category.OPERATOR),
	BANG(Category.OPERATOR),             // unary not, and binary send
	PIPE(Category.OPERATOR),             // list cons separator
	ASSIGN(Category.OPERATOR),           // =
	LESS_LESS(Category.OPERATOR),        // << opens a bitstring
	GREATER_GREATER(Category.OPERATOR),  // >> closes a bitstring

	// --- Special Tokens ---
	EOF(Category.END);

	/**
	 * Coarse token classes, independent of the concrete operator or keyword.
	 */
	public enum Category
	{
		KEYWORD, IDENTIFIER, TYPE_IDENTIFIER, INTEGER_LITERAL, STRING_LITERAL, ATOM_LITERAL,
		OPERATOR, PUNCTUATION, END
	}

	private final Category category;

	TokenType(Category category)
	{
		this.category = category;
	}

	public Category getCategory()
	{
		return category;
	}
}
