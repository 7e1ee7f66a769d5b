package org.lokray.toybeam.parser;

import org.lokray.toybeam.ast.Attribute;
import org.lokray.toybeam.ast.AttributeArgument;
import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.expressions.*;
import org.lokray.toybeam.ast.items.*;
import org.lokray.toybeam.ast.patterns.*;
import org.lokray.toybeam.ast.statements.ExpressionStatement;
import org.lokray.toybeam.ast.statements.LetStatement;
import org.lokray.toybeam.ast.statements.Statement;
import org.lokray.toybeam.ast.types.*;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.ParseException;
import org.lokray.toybeam.lexer.SourceSpan;
import org.lokray.toybeam.lexer.Token;
import org.lokray.toybeam.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The ToyBeamParser is responsible for performing syntactic analysis.
 * It takes the token list produced by the lexer and builds the Abstract Syntax Tree
 * for exactly one module. Statements and items are parsed by recursive descent,
 * binary operators by precedence climbing over {@link #BINARY_PRECEDENCE}.
 * <p>
 * Parsing stops at the first syntax error. Three ambiguities are resolved by lookahead
 * at a single parse point each:
 * <ul>
 *     <li>{@code ()} is unit, {@code (e)} is a grouping, {@code (e,)} and {@code (a, b)} are tuples.
 *     The same rule applies to patterns.</li>
 *     <li><code>Type { ... }</code> is a struct literal, except as the direct condition of {@code if} or the
 *     scrutinee of {@code match}, where it is rejected as ambiguous unless parenthesized.</li>
 *     <li>{@code Type::Variant} takes a parenthesized sub-pattern list only for non-zero arity
 *     variants; the arity itself is checked during semantic analysis.</li>
 * </ul>
 */
public class ToyBeamParser
{
	/**
	 * Binding power of each left-associative binary operator; higher binds tighter.
	 * Send ({@code !}) sits below all of them and associates to the right.
	 */
	private static final Map<TokenType, Integer> BINARY_PRECEDENCE = new EnumMap<>(TokenType.class);

	static
	{
		BINARY_PRECEDENCE.put(TokenType.PIPE_PIPE, 1);
		BINARY_PRECEDENCE.put(TokenType.AMPERSAND_AMPERSAND, 2);
		BINARY_PRECEDENCE.put(TokenType.EQUAL_EQUAL, 3);
		BINARY_PRECEDENCE.put(TokenType.BANG_EQUAL, 3);
		BINARY_PRECEDENCE.put(TokenType.LESS, 4);
		BINARY_PRECEDENCE.put(TokenType.LESS_EQUAL, 4);
		BINARY_PRECEDENCE.put(TokenType.GREATER, 4);
		BINARY_PRECEDENCE.put(TokenType.GREATER_EQUAL, 4);
		BINARY_PRECEDENCE.put(TokenType.PLUS, 5);
		BINARY_PRECEDENCE.put(TokenType.MINUS, 5);
		BINARY_PRECEDENCE.put(TokenType.STAR, 6);
		BINARY_PRECEDENCE.put(TokenType.SLASH, 6);
		BINARY_PRECEDENCE.put(TokenType.PERCENT, 6);
	}

	/**
	 * Words accepted after {@code /} in a bitstring segment.
	 */
	public static final Set<String> SEGMENT_SPECIFIERS = Set.of(
			"big", "little", "signed", "unsigned", "integer", "float", "binary", "bytes", "utf8");

	private final List<Token> tokens; // mutable copy, a '>>' may be split while parsing generics
	private int current = 0;          // Current position in the token list

	// Set while parsing an if condition or a match scrutinee, where '{' must open the block
	private boolean noStructLiteral = false;

	/**
	 * Constructs a ToyBeamParser.
	 *
	 * @param tokens The list of tokens produced by the lexer, terminated by EOF.
	 */
	public ToyBeamParser(List<Token> tokens)
	{
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parses a whole compilation unit: one {@code mod name { items }} and nothing after it.
	 *
	 * @return The root of the parsed AST.
	 * @throws ParseException on the first syntax error.
	 */
	public ModuleDeclaration parse() throws ParseException
	{
		Token modKeyword = consume(TokenType.MOD, "Expected 'mod' at the start of the source.");
		Token name = consume(TokenType.IDENTIFIER, "Expected a module name after 'mod'.");
		consume(TokenType.LEFT_BRACE, "Expected '{' after module name.");

		List<Item> items = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			items.add(item());
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' at the end of module '" + name.getLexeme() + "'.");

		if (!isAtEnd())
		{
			throw error(peek(), "Unexpected input after the end of the module.");
		}
		return new ModuleDeclaration(modKeyword, name, items);
	}

	// --- Items ---

	/**
	 * Parses one item with its leading attributes.
	 * Grammar: `ATTRIBUTE* PUB? ( FUNCTION | STRUCT | ENUM )`
	 */
	private Item item() throws ParseException
	{
		List<Attribute> attributes = new ArrayList<>();
		while (check(TokenType.HASH))
		{
			attributes.add(attribute());
		}

		boolean isPublic = match(TokenType.PUB);

		if (match(TokenType.FN))
		{
			return functionDeclaration(attributes, isPublic);
		}
		if (match(TokenType.STRUCT))
		{
			return structDeclaration(attributes, isPublic);
		}
		if (match(TokenType.ENUM))
		{
			return enumDeclaration(attributes, isPublic);
		}
		throw error(peek(), "Expected 'fn', 'struct' or 'enum'.");
	}

	/**
	 * Grammar: `# [ IDENTIFIER ( ( ARGS ) | = STRING )? ]`
	 */
	private Attribute attribute() throws ParseException
	{
		consume(TokenType.HASH, "Expected '#'.");
		consume(TokenType.LEFT_BRACKET, "Expected '[' after '#'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected an attribute name.");

		List<AttributeArgument> arguments = null;
		String value = null;
		if (match(TokenType.LEFT_PAREN))
		{
			arguments = attributeArguments();
		}
		else if (match(TokenType.ASSIGN))
		{
			value = (String) consume(TokenType.STRING_LITERAL, "Expected a string after '='.").getLiteral();
		}
		consume(TokenType.RIGHT_BRACKET, "Expected ']' to close the attribute.");
		return new Attribute(name, arguments, value);
	}

	/**
	 * Parses the arguments after an already consumed '(' up to and including the matching ')'.
	 */
	private List<AttributeArgument> attributeArguments() throws ParseException
	{
		List<AttributeArgument> arguments = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			Token name = consume(TokenType.IDENTIFIER, "Expected an identifier in attribute arguments.");
			if (match(TokenType.ASSIGN))
			{
				Token value = consume(TokenType.STRING_LITERAL, "Expected a string after '='.");
				arguments.add(AttributeArgument.keyValue(name, (String) value.getLiteral()));
			}
			else if (match(TokenType.LEFT_PAREN))
			{
				arguments.add(AttributeArgument.nested(name, attributeArguments()));
			}
			else
			{
				arguments.add(AttributeArgument.identifier(name));
			}
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after attribute arguments.");
		return arguments;
	}

	/**
	 * Grammar: `FN IDENTIFIER TYPE_PARAMETERS? ( PARAMETER,* ) ( -> TYPE )? BLOCK`
	 */
	private FunctionDeclaration functionDeclaration(List<Attribute> attributes, boolean isPublic) throws ParseException
	{
		Token fnKeyword = previous();
		Token name = consume(TokenType.IDENTIFIER, "Expected a function name after 'fn'.");
		List<Token> typeParameters = typeParameters();

		consume(TokenType.LEFT_PAREN, "Expected '(' after function name.");
		List<Parameter> parameters = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			Pattern pattern = pattern();
			consume(TokenType.COLON, "Expected ':' and a type after parameter pattern.");
			parameters.add(new Parameter(pattern, type()));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");

		TypeAnnotation returnType = null;
		if (match(TokenType.ARROW))
		{
			returnType = type();
		}

		BlockExpression body = block();
		return new FunctionDeclaration(attributes, isPublic, fnKeyword, name, typeParameters, parameters, returnType, body);
	}

	/**
	 * Grammar: `STRUCT TYPE_IDENTIFIER TYPE_PARAMETERS? { ( IDENTIFIER : TYPE ),* ,? }`
	 */
	private StructDeclaration structDeclaration(List<Attribute> attributes, boolean isPublic) throws ParseException
	{
		Token structKeyword = previous();
		Token name = consume(TokenType.TYPE_IDENTIFIER, "Expected a capitalized struct name after 'struct'.");
		List<Token> typeParameters = typeParameters();

		consume(TokenType.LEFT_BRACE, "Expected '{' after struct name.");
		List<FieldDeclaration> fields = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE))
		{
			Token fieldName = consume(TokenType.IDENTIFIER, "Expected a field name.");
			consume(TokenType.COLON, "Expected ':' after field name.");
			fields.add(new FieldDeclaration(fieldName, type()));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after struct fields.");
		return new StructDeclaration(attributes, isPublic, structKeyword, name, typeParameters, fields);
	}

	/**
	 * Grammar: `ENUM TYPE_IDENTIFIER TYPE_PARAMETERS? { ( TYPE_IDENTIFIER ( ( TYPE,* ) )? ),* ,? }`
	 */
	private EnumDeclaration enumDeclaration(List<Attribute> attributes, boolean isPublic) throws ParseException
	{
		Token enumKeyword = previous();
		Token name = consume(TokenType.TYPE_IDENTIFIER, "Expected a capitalized enum name after 'enum'.");
		List<Token> typeParameters = typeParameters();

		consume(TokenType.LEFT_BRACE, "Expected '{' after enum name.");
		List<EnumVariant> variants = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE))
		{
			Token variantName = consume(TokenType.TYPE_IDENTIFIER, "Expected a capitalized variant name.");
			List<TypeAnnotation> fieldTypes = new ArrayList<>();
			if (match(TokenType.LEFT_PAREN))
			{
				while (!check(TokenType.RIGHT_PAREN))
				{
					fieldTypes.add(type());
					if (!match(TokenType.COMMA))
					{
						break;
					}
				}
				consume(TokenType.RIGHT_PAREN, "Expected ')' after variant payload types.");
			}
			variants.add(new EnumVariant(variantName, fieldTypes));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after enum variants.");
		return new EnumDeclaration(attributes, isPublic, enumKeyword, name, typeParameters, variants);
	}

	/**
	 * Grammar: `( < TYPE_IDENTIFIER,+ > )?`
	 */
	private List<Token> typeParameters() throws ParseException
	{
		List<Token> parameters = new ArrayList<>();
		if (match(TokenType.LESS))
		{
			do
			{
				parameters.add(consume(TokenType.TYPE_IDENTIFIER, "Expected a type parameter name."));
			}
			while (match(TokenType.COMMA));
			closingAngle();
		}
		return parameters;
	}

	// --- Types ---

	/**
	 * Parses a type annotation.
	 * Grammar: `PRIMITIVE | TYPE_IDENTIFIER ( < TYPE,+ > )? | ( TYPE,* ) | [ TYPE ]`
	 */
	private TypeAnnotation type() throws ParseException
	{
		if (check(TokenType.IDENTIFIER) && PrimitiveType.NAMES.contains(peek().getLexeme()))
		{
			return new PrimitiveType(advance());
		}
		if (match(TokenType.TYPE_IDENTIFIER))
		{
			Token name = previous();
			if (match(TokenType.LESS))
			{
				List<TypeAnnotation> arguments = new ArrayList<>();
				do
				{
					arguments.add(type());
				}
				while (match(TokenType.COMMA));
				closingAngle();
				return new GenericType(name, arguments);
			}
			return new NamedType(name);
		}
		if (match(TokenType.LEFT_PAREN))
		{
			Token leftParen = previous();
			List<TypeAnnotation> elements = new ArrayList<>();
			while (!check(TokenType.RIGHT_PAREN))
			{
				elements.add(type());
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple type.");
			return new TupleType(leftParen, elements);
		}
		if (match(TokenType.LEFT_BRACKET))
		{
			Token leftBracket = previous();
			TypeAnnotation element = type();
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after list element type.");
			return new ListType(leftBracket, element);
		}
		throw error(peek(), "Expected a type.");
	}

	/**
	 * Consumes a '>' closing a type argument list. A '>>' token closes two nested lists, so it is
	 * split: the first half is consumed here and the second half stays in the stream.
	 */
	private Token closingAngle() throws ParseException
	{
		if (check(TokenType.GREATER_GREATER))
		{
			Token both = peek();
			SourceSpan span = both.getSpan();
			SourceSpan second = new SourceSpan(span.line(), span.column() + 1, span.offset() + 1);
			tokens.set(current, new Token(TokenType.GREATER, ">", null, second));
			return new Token(TokenType.GREATER, ">", null, span);
		}
		return consume(TokenType.GREATER, "Expected '>' to close type arguments.");
	}

	// --- Blocks and statements ---

	/**
	 * Parses a block.
	 * Grammar: `{ STATEMENT* EXPRESSION? }`
	 * <p>
	 * An expression that starts with 'if', 'match', 'receive' or '{' ends at its closing brace
	 * when it starts a statement, and needs no ';'. If such an expression is the last thing in
	 * the block it becomes the block's value.
	 */
	private BlockExpression block() throws ParseException
	{
		Token leftBrace = consume(TokenType.LEFT_BRACE, "Expected '{' to start a block.");
		boolean savedNoStruct = noStructLiteral;
		noStructLiteral = false;
		try
		{
			List<Statement> statements = new ArrayList<>();
			Expression tail = null;

			while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
			{
				if (match(TokenType.SEMICOLON))
				{
					continue; // empty statement
				}
				if (check(TokenType.LET))
				{
					statements.add(letStatement());
					continue;
				}

				Expression expression;
				if (startsBlockLike())
				{
					expression = blockLike();
					if (check(TokenType.RIGHT_BRACE))
					{
						tail = expression;
						break;
					}
					match(TokenType.SEMICOLON);
					statements.add(new ExpressionStatement(expression));
					continue;
				}

				expression = expression();
				if (match(TokenType.SEMICOLON))
				{
					statements.add(new ExpressionStatement(expression));
				}
				else if (check(TokenType.RIGHT_BRACE))
				{
					tail = expression;
				}
				else
				{
					throw error(peek(), "Expected ';' or '}' after expression.");
				}
			}

			consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
			return new BlockExpression(leftBrace, statements, tail);
		}
		finally
		{
			noStructLiteral = savedNoStruct;
		}
	}

	/**
	 * Grammar: `LET MUT? PATTERN ( : TYPE )? = EXPRESSION ;`
	 */
	private LetStatement letStatement() throws ParseException
	{
		Token letKeyword = consume(TokenType.LET, "Expected 'let'.");
		boolean mutable = match(TokenType.MUT);
		Pattern pattern = pattern();

		TypeAnnotation type = null;
		if (match(TokenType.COLON))
		{
			type = type();
		}
		consume(TokenType.ASSIGN, "Expected '=' in let binding.");
		Expression value = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after let binding.");
		return new LetStatement(letKeyword, mutable, pattern, type, value);
	}

	private boolean startsBlockLike()
	{
		return check(TokenType.IF, TokenType.MATCH, TokenType.RECEIVE, TokenType.LEFT_BRACE);
	}

	private Expression blockLike() throws ParseException
	{
		if (match(TokenType.IF))
		{
			return ifExpression();
		}
		if (match(TokenType.MATCH))
		{
			return matchExpression();
		}
		if (match(TokenType.RECEIVE))
		{
			return receiveExpression();
		}
		return block();
	}

	// --- Expressions ---

	/**
	 * Entry point for expressions. The lowest tier is send, which is right-associative.
	 * Grammar: `BINARY ( ! EXPRESSION )?`
	 */
	private Expression expression() throws ParseException
	{
		Expression target = binary(1);
		if (match(TokenType.BANG))
		{
			Token bang = previous();
			Expression message = expression();
			return new SendExpression(target, bang, message);
		}
		return target;
	}

	/**
	 * Parses an expression in which struct literals are allowed again, regardless of the
	 * surrounding condition context.
	 */
	private Expression nestedExpression() throws ParseException
	{
		boolean saved = noStructLiteral;
		noStructLiteral = false;
		try
		{
			return expression();
		}
		finally
		{
			noStructLiteral = saved;
		}
	}

	/**
	 * Parses the condition of an if or the scrutinee of a match.
	 */
	private Expression conditionExpression() throws ParseException
	{
		boolean saved = noStructLiteral;
		noStructLiteral = true;
		try
		{
			return expression();
		}
		finally
		{
			noStructLiteral = saved;
		}
	}

	/**
	 * Precedence climbing over the left-associative binary operators.
	 *
	 * @param minPrecedence The weakest operator this call may consume.
	 */
	private Expression binary(int minPrecedence) throws ParseException
	{
		Expression left = unary();

		while (true)
		{
			Integer precedence = BINARY_PRECEDENCE.get(peek().getType());
			if (precedence == null || precedence < minPrecedence)
			{
				break;
			}
			Token operator = advance();
			Expression right = binary(precedence + 1);
			left = new BinaryExpression(left, operator, right);
		}
		return left;
	}

	/**
	 * Grammar: `( - | ! )* POSTFIX`
	 */
	private Expression unary() throws ParseException
	{
		if (match(TokenType.MINUS, TokenType.BANG))
		{
			Token operator = previous();
			Expression operand = unary();
			return new UnaryExpression(operator, operand);
		}
		return postfix();
	}

	/**
	 * Handles calls, method calls, field access and indexing. This method is left-associative for chaining.
	 * Grammar: `PRIMARY ( ( ARGUMENTS ) | . IDENTIFIER ( ARGUMENTS )? | [ EXPRESSION ] )*`
	 */
	private Expression postfix() throws ParseException
	{
		Expression expr = primary();

		while (true)
		{
			if (check(TokenType.LEFT_PAREN))
			{
				Token paren = advance();
				expr = new CallExpression(expr, paren, arguments());
			}
			else if (match(TokenType.DOT))
			{
				Token member = consume(TokenType.IDENTIFIER, "Expected a field or method name after '.'.");
				if (match(TokenType.LEFT_PAREN))
				{
					expr = new MethodCallExpression(expr, member, arguments());
				}
				else
				{
					expr = new FieldAccessExpression(expr, member);
				}
			}
			else if (match(TokenType.LEFT_BRACKET))
			{
				Token bracket = previous();
				Expression index = nestedExpression();
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after index expression.");
				expr = new IndexExpression(expr, bracket, index);
			}
			else
			{
				break;
			}
		}
		return expr;
	}

	/**
	 * Parses call arguments after an already consumed '(' up to and including ')'.
	 */
	private List<Expression> arguments() throws ParseException
	{
		List<Expression> arguments = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			arguments.add(nestedExpression());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
		return arguments;
	}

	/**
	 * Parses the most basic expressions: literals, identifiers, paths, struct literals, parenthesized
	 * forms, lists, blocks, bitstrings and the keyword-introduced expressions.
	 */
	private Expression primary() throws ParseException
	{
		if (check(TokenType.INTEGER_LITERAL, TokenType.STRING_LITERAL, TokenType.ATOM_LITERAL,
				TokenType.TRUE, TokenType.FALSE))
		{
			return new LiteralExpression(literal(advance()));
		}
		if (match(TokenType.IDENTIFIER))
		{
			return new IdentifierExpression(previous());
		}
		if (match(TokenType.TYPE_IDENTIFIER))
		{
			return typeLeadExpression(previous());
		}
		if (match(TokenType.LEFT_PAREN))
		{
			return parenthesized(previous());
		}
		if (match(TokenType.LEFT_BRACKET))
		{
			Token leftBracket = previous();
			List<Expression> elements = new ArrayList<>();
			while (!check(TokenType.RIGHT_BRACKET))
			{
				elements.add(nestedExpression());
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after list elements.");
			return new ListExpression(leftBracket, elements);
		}
		if (startsBlockLike())
		{
			return blockLike();
		}
		if (match(TokenType.SPAWN))
		{
			return spawnExpression();
		}
		if (match(TokenType.RETURN))
		{
			Token returnKeyword = previous();
			Expression value = null;
			if (!check(TokenType.RIGHT_BRACE, TokenType.SEMICOLON, TokenType.COMMA, TokenType.RIGHT_PAREN,
					TokenType.RIGHT_BRACKET) && !isAtEnd())
			{
				value = expression();
			}
			return new ReturnExpression(returnKeyword, value);
		}
		if (match(TokenType.LESS_LESS))
		{
			return bitstringExpression(previous());
		}
		throw error(peek(), "Expected an expression.");
	}

	/**
	 * A type identifier starts a path ({@code Type::member}) or a struct literal ({@code Type { ... }}).
	 */
	private Expression typeLeadExpression(Token typeName) throws ParseException
	{
		if (match(TokenType.DOUBLE_COLON))
		{
			Token member = consume(new TokenType[]{TokenType.IDENTIFIER, TokenType.TYPE_IDENTIFIER},
					"Expected a variant or function name after '::'.");
			return new PathExpression(typeName, member);
		}
		if (check(TokenType.LEFT_BRACE))
		{
			if (noStructLiteral)
			{
				throw new ParseException(ErrorKind.AMBIGUOUS_CONSTRUCT, typeName.getSpan(),
						"Struct literal '" + typeName.getLexeme() + " { ... }' is ambiguous here; wrap it in parentheses.");
			}
			advance();
			List<FieldInitializer> fields = new ArrayList<>();
			while (!check(TokenType.RIGHT_BRACE))
			{
				Token fieldName = consume(TokenType.IDENTIFIER, "Expected a field name in struct literal.");
				Expression value = match(TokenType.COLON) ? nestedExpression() : new IdentifierExpression(fieldName);
				fields.add(new FieldInitializer(fieldName, value));
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RIGHT_BRACE, "Expected '}' after struct fields.");
			return new StructExpression(typeName, fields);
		}
		throw error(peek(), "Expected '::' or '{' after type name '" + typeName.getLexeme() + "'.");
	}

	/**
	 * Disambiguates after an already consumed '(': unit, grouping or tuple.
	 */
	private Expression parenthesized(Token leftParen) throws ParseException
	{
		if (match(TokenType.RIGHT_PAREN))
		{
			return new LiteralExpression(new Literal(Literal.Kind.UNIT, null, leftParen));
		}

		Expression first = nestedExpression();
		if (match(TokenType.RIGHT_PAREN))
		{
			return new GroupingExpression(leftParen, first);
		}

		consume(TokenType.COMMA, "Expected ',' or ')' after expression.");
		List<Expression> elements = new ArrayList<>();
		elements.add(first);
		while (!check(TokenType.RIGHT_PAREN))
		{
			elements.add(nestedExpression());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple elements.");
		return new TupleExpression(leftParen, elements);
	}

	/**
	 * Grammar: `IF CONDITION BLOCK ( ELSE ( IF_EXPRESSION | BLOCK ) )?`
	 */
	private IfExpression ifExpression() throws ParseException
	{
		Token ifKeyword = previous();
		Expression condition = conditionExpression();
		BlockExpression thenBranch = block();

		Expression elseBranch = null;
		if (match(TokenType.ELSE))
		{
			if (match(TokenType.IF))
			{
				elseBranch = ifExpression();
			}
			else
			{
				elseBranch = block();
			}
		}
		return new IfExpression(ifKeyword, condition, thenBranch, elseBranch);
	}

	/**
	 * Grammar: `MATCH SCRUTINEE { ARM* }`
	 */
	private MatchExpression matchExpression() throws ParseException
	{
		Token matchKeyword = previous();
		Expression scrutinee = conditionExpression();
		consume(TokenType.LEFT_BRACE, "Expected '{' after match scrutinee.");

		List<MatchArm> arms = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			arms.add(matchArm());
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after match arms.");
		return new MatchExpression(matchKeyword, scrutinee, arms);
	}

	/**
	 * Grammar: `RECEIVE { ARM* ( AFTER EXPRESSION => BODY )? }`, also accepting the after clause
	 * directly behind the closing brace.
	 */
	private ReceiveExpression receiveExpression() throws ParseException
	{
		Token receiveKeyword = previous();
		consume(TokenType.LEFT_BRACE, "Expected '{' after 'receive'.");
		boolean savedNoStruct = noStructLiteral;
		noStructLiteral = false;
		try
		{
			List<MatchArm> arms = new ArrayList<>();
			AfterClause after = null;
			while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
			{
				if (match(TokenType.AFTER))
				{
					after = afterClause();
					break;
				}
				arms.add(matchArm());
			}
			consume(TokenType.RIGHT_BRACE, "Expected '}' after receive clauses.");

			if (after == null && match(TokenType.AFTER))
			{
				after = afterClause();
			}
			return new ReceiveExpression(receiveKeyword, arms, after);
		}
		finally
		{
			noStructLiteral = savedNoStruct;
		}
	}

	private AfterClause afterClause() throws ParseException
	{
		Token afterKeyword = previous();
		Expression timeout = expression();
		consume(TokenType.FAT_ARROW, "Expected '=>' after receive timeout.");
		Expression body = armBody();
		match(TokenType.COMMA);
		return new AfterClause(afterKeyword, timeout, body);
	}

	/**
	 * Grammar: `PATTERN ( IF GUARD )? => BODY ,?`
	 */
	private MatchArm matchArm() throws ParseException
	{
		Pattern pattern = pattern();
		Expression guard = null;
		if (match(TokenType.IF))
		{
			guard = expression();
		}
		consume(TokenType.FAT_ARROW, "Expected '=>' after match pattern.");
		Expression body = armBody();
		match(TokenType.COMMA);
		return new MatchArm(pattern, guard, body);
	}

	/**
	 * A braced arm body ends at its closing brace, so the next arm may follow without a comma.
	 */
	private Expression armBody() throws ParseException
	{
		if (check(TokenType.LEFT_BRACE))
		{
			return block();
		}
		return expression();
	}

	/**
	 * Grammar: `SPAWN || BLOCK | SPAWN ( EXPRESSION )`
	 */
	private SpawnExpression spawnExpression() throws ParseException
	{
		Token spawnKeyword = previous();
		if (match(TokenType.PIPE_PIPE))
		{
			return SpawnExpression.ofClosure(spawnKeyword, block());
		}
		consume(TokenType.LEFT_PAREN, "Expected '||' or '(' after 'spawn'.");
		Expression callable = nestedExpression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after spawned function.");
		return SpawnExpression.ofCallable(spawnKeyword, callable);
	}

	/**
	 * Parses a bitstring construction after an already consumed '<<'.
	 * Segment values and sizes are parsed at unary level so '/' and '>>' are left for the segment syntax.
	 */
	private BitstringExpression bitstringExpression(Token open) throws ParseException
	{
		boolean saved = noStructLiteral;
		noStructLiteral = false;
		try
		{
			List<BitstringSegment<Expression>> segments = new ArrayList<>();
			while (!check(TokenType.GREATER_GREATER))
			{
				Token first = peek();
				Expression value = unary();
				Expression size = segmentSize();
				segments.add(new BitstringSegment<>(value, first, size, segmentSpecifiers()));
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.GREATER_GREATER, "Expected '>>' to close the bitstring.");
			return new BitstringExpression(open, segments);
		}
		finally
		{
			noStructLiteral = saved;
		}
	}

	private Expression segmentSize() throws ParseException
	{
		return match(TokenType.COLON) ? unary() : null;
	}

	/**
	 * Grammar: `( / SPECIFIER ( - SPECIFIER )* )?`
	 */
	private List<Token> segmentSpecifiers() throws ParseException
	{
		List<Token> specifiers = new ArrayList<>();
		if (match(TokenType.SLASH))
		{
			do
			{
				Token specifier = consume(TokenType.IDENTIFIER, "Expected a segment specifier after '/'.");
				if (!SEGMENT_SPECIFIERS.contains(specifier.getLexeme()))
				{
					throw new ParseException(ErrorKind.UNEXPECTED_TOKEN, specifier.getSpan(),
							"Unknown bitstring segment specifier '" + specifier.getLexeme() + "'.");
				}
				specifiers.add(specifier);
			}
			while (match(TokenType.MINUS));
		}
		return specifiers;
	}

	// --- Patterns ---

	/**
	 * Parses a pattern.
	 * Grammar: `_ | IDENTIFIER | LITERAL | -INTEGER | ( PATTERN,* ) | [ PATTERN,* ( | PATTERN )? ]
	 * | TYPE_IDENTIFIER :: TYPE_IDENTIFIER ( ( PATTERN,* ) )? | TYPE_IDENTIFIER { FIELD_PATTERN,* } | << SEGMENT,* >>`
	 */
	private Pattern pattern() throws ParseException
	{
		if (match(TokenType.IDENTIFIER))
		{
			Token name = previous();
			if (name.getLexeme().equals("_"))
			{
				return new WildcardPattern(name);
			}
			return new IdentifierPattern(name);
		}
		if (check(TokenType.INTEGER_LITERAL, TokenType.STRING_LITERAL, TokenType.ATOM_LITERAL,
				TokenType.TRUE, TokenType.FALSE))
		{
			return new LiteralPattern(literal(advance()));
		}
		if (match(TokenType.MINUS))
		{
			Token minus = previous();
			Token integer = consume(TokenType.INTEGER_LITERAL, "Expected an integer after '-' in pattern.");
			return new LiteralPattern(literal(integer).negate(minus));
		}
		if (match(TokenType.LEFT_PAREN))
		{
			return parenthesizedPattern(previous());
		}
		if (match(TokenType.LEFT_BRACKET))
		{
			return listPattern(previous());
		}
		if (match(TokenType.TYPE_IDENTIFIER))
		{
			Token typeName = previous();
			if (match(TokenType.DOUBLE_COLON))
			{
				return enumPattern(typeName);
			}
			if (match(TokenType.LEFT_BRACE))
			{
				return structPattern(typeName);
			}
			throw error(peek(), "Expected '::' or '{' after type name '" + typeName.getLexeme() + "' in pattern.");
		}
		if (match(TokenType.LESS_LESS))
		{
			return bitstringPattern(previous());
		}
		throw error(peek(), "Expected a pattern.");
	}

	private Pattern parenthesizedPattern(Token leftParen) throws ParseException
	{
		if (match(TokenType.RIGHT_PAREN))
		{
			return new LiteralPattern(new Literal(Literal.Kind.UNIT, null, leftParen));
		}

		Pattern first = pattern();
		if (match(TokenType.RIGHT_PAREN))
		{
			return first;
		}

		consume(TokenType.COMMA, "Expected ',' or ')' in tuple pattern.");
		List<Pattern> elements = new ArrayList<>();
		elements.add(first);
		while (!check(TokenType.RIGHT_PAREN))
		{
			elements.add(pattern());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple pattern.");
		return new TuplePattern(leftParen, elements);
	}

	private Pattern listPattern(Token leftBracket) throws ParseException
	{
		List<Pattern> elements = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACKET, TokenType.PIPE))
		{
			elements.add(pattern());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}

		if (match(TokenType.PIPE))
		{
			if (elements.isEmpty())
			{
				throw error(previous(), "Expected at least one head pattern before '|'.");
			}
			Pattern tail = pattern();
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after list tail pattern.");
			return new ConsPattern(leftBracket, elements, tail);
		}
		consume(TokenType.RIGHT_BRACKET, "Expected ']' after list pattern.");
		return new ListPattern(leftBracket, elements);
	}

	private Pattern enumPattern(Token typeName) throws ParseException
	{
		Token variant = consume(TokenType.TYPE_IDENTIFIER, "Expected a variant name after '::'.");
		List<Pattern> arguments = new ArrayList<>();
		boolean parenthesized = match(TokenType.LEFT_PAREN);
		if (parenthesized)
		{
			while (!check(TokenType.RIGHT_PAREN))
			{
				arguments.add(pattern());
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RIGHT_PAREN, "Expected ')' after variant sub-patterns.");
		}
		return new EnumPattern(typeName, variant, arguments, parenthesized);
	}

	private Pattern structPattern(Token typeName) throws ParseException
	{
		List<FieldPattern> fields = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE))
		{
			Token fieldName = consume(TokenType.IDENTIFIER, "Expected a field name in struct pattern.");
			Pattern fieldPattern = match(TokenType.COLON) ? pattern() : new IdentifierPattern(fieldName);
			fields.add(new FieldPattern(fieldName, fieldPattern));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after struct pattern fields.");
		return new StructPattern(typeName, fields);
	}

	private Pattern bitstringPattern(Token open) throws ParseException
	{
		List<BitstringSegment<Pattern>> segments = new ArrayList<>();
		while (!check(TokenType.GREATER_GREATER))
		{
			Token first = peek();
			Pattern value = pattern();
			Expression size = segmentSize();
			segments.add(new BitstringSegment<>(value, first, size, segmentSpecifiers()));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.GREATER_GREATER, "Expected '>>' to close the bitstring pattern.");
		return new BitstringPattern(open, segments);
	}

	/**
	 * Builds the literal value carried by a literal token.
	 */
	private Literal literal(Token token)
	{
		switch (token.getType())
		{
			case INTEGER_LITERAL:
				return new Literal(Literal.Kind.INTEGER, token.getLiteral(), token);
			case STRING_LITERAL:
				return new Literal(Literal.Kind.STRING, token.getLiteral(), token);
			case ATOM_LITERAL:
				return new Literal(Literal.Kind.ATOM, token.getLiteral(), token);
			case TRUE:
				return new Literal(Literal.Kind.BOOLEAN, Boolean.TRUE, token);
			default:
				return new Literal(Literal.Kind.BOOLEAN, Boolean.FALSE, token);
		}
	}

	// --- Token helpers ---

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, or fails.
	 *
	 * @param type    The expected TokenType.
	 * @param message The error message to report if the type doesn't match.
	 * @return The consumed Token.
	 * @throws ParseException if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws ParseException
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private Token consume(TokenType[] types, String message) throws ParseException
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				return advance();
			}
		}
		throw error(peek(), message);
	}

	/**
	 * Checks if the current token's type matches any of the given types.
	 */
	private boolean check(TokenType... types)
	{
		if (isAtEnd())
		{
			return false;
		}
		TokenType currentType = peek().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Creates the exception for a syntax error at the given token. Running out of tokens is
	 * reported as its own kind.
	 */
	private ParseException error(Token token, String message)
	{
		if (token.getType() == TokenType.EOF)
		{
			return new ParseException(ErrorKind.UNEXPECTED_END_OF_INPUT, token.getSpan(),
					"Unexpected end of input. " + message);
		}
		return new ParseException(ErrorKind.UNEXPECTED_TOKEN, token.getSpan(),
				message + " Found '" + token.getLexeme() + "'.");
	}
}
