package org.lokray.toybeam.codegen;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.Literal;
import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.expressions.*;
import org.lokray.toybeam.ast.items.EnumDeclaration;
import org.lokray.toybeam.ast.items.FunctionDeclaration;
import org.lokray.toybeam.ast.items.Item;
import org.lokray.toybeam.ast.items.Parameter;
import org.lokray.toybeam.ast.items.StructDeclaration;
import org.lokray.toybeam.ast.patterns.Pattern;
import org.lokray.toybeam.ast.statements.ExpressionStatement;
import org.lokray.toybeam.ast.statements.LetStatement;
import org.lokray.toybeam.ast.statements.Statement;
import org.lokray.toybeam.exception.CodegenException;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.lexer.Token;
import org.lokray.toybeam.lexer.TokenType;
import org.lokray.toybeam.patterns.Arm;
import org.lokray.toybeam.patterns.ClauseLowering;
import org.lokray.toybeam.patterns.DispatchStrategy;
import org.lokray.toybeam.patterns.MailboxDispatch;
import org.lokray.toybeam.patterns.PatternCompiler;
import org.lokray.toybeam.patterns.ValueDispatch;
import org.lokray.toybeam.semantics.BuiltinFunction;
import org.lokray.toybeam.semantics.Builtins;
import org.lokray.toybeam.semantics.FunctionSymbol;
import org.lokray.toybeam.semantics.ModuleSymbols;
import org.lokray.toybeam.semantics.StructSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CoreErlangGenerator is responsible for traversing the resolved Abstract Syntax Tree (AST)
 * and generating the text of one Core Erlang module.
 * <p>
 * Every visit returns the Core Erlang expression for its node. Sequencing is expressed with
 * nested {@code let}s: each block statement binds its value and the rest of the block becomes
 * the body. Operands that are not already a variable or a constant are bound to temporaries
 * first, left to right, so the source evaluation order is kept exactly.
 * <p>
 * Checks that depend on position are made here rather than in semantic analysis:
 * {@code return} must be the value of its function, and guards may only use
 * side-effect-free operations. Both fail with {@code UNSUPPORTED_CONSTRUCT}.
 */
public class CoreErlangGenerator implements ASTVisitor<String>, ClauseLowering
{
	private static final Logger LOGGER = LoggerFactory.getLogger(CoreErlangGenerator.class);

	private static final Map<TokenType, String> OPERATORS = new EnumMap<>(TokenType.class);

	static
	{
		OPERATORS.put(TokenType.PLUS, "+");
		OPERATORS.put(TokenType.MINUS, "-");
		OPERATORS.put(TokenType.STAR, "*");
		OPERATORS.put(TokenType.SLASH, "div");
		OPERATORS.put(TokenType.PERCENT, "rem");
		OPERATORS.put(TokenType.EQUAL_EQUAL, "=:=");
		OPERATORS.put(TokenType.BANG_EQUAL, "=/=");
		OPERATORS.put(TokenType.LESS, "<");
		OPERATORS.put(TokenType.LESS_EQUAL, "=<");
		OPERATORS.put(TokenType.GREATER, ">");
		OPERATORS.put(TokenType.GREATER_EQUAL, ">=");
	}

	private final ModuleSymbols symbols;
	private final HygieneContext hygiene;
	private final PatternCompiler patterns;

	private StringBuilder output;
	private int indentLevel = 0;

	// True while lowering the expression whose value is the value of the enclosing function
	private boolean inTail = false;

	public CoreErlangGenerator(ModuleSymbols symbols)
	{
		this(symbols, new HygieneContext());
	}

	public CoreErlangGenerator(ModuleSymbols symbols, HygieneContext hygiene)
	{
		this.symbols = symbols;
		this.hygiene = hygiene;
		this.patterns = new PatternCompiler(symbols, hygiene, this);
	}

	/**
	 * Generates the Core Erlang module for an analyzed module.
	 *
	 * @param module The module, already filtered and analyzed against the symbols given at construction.
	 * @return The module text.
	 * @throws CodegenException for constructs with no valid lowering.
	 */
	public String generate(ModuleDeclaration module) throws CodegenException
	{
		try
		{
			return module.accept(this);
		}
		catch (CodegenException e)
		{
			throw e;
		}
		catch (CompileException e)
		{
			throw new IllegalStateException("Unexpected failure during code generation", e);
		}
	}

	public HygieneContext getHygiene()
	{
		return hygiene;
	}

	private CodegenException error(Token token, String message)
	{
		return new CodegenException(ErrorKind.UNSUPPORTED_CONSTRUCT, token.getSpan(), message);
	}

	private void appendLine(String line)
	{
		output.append(CoreErlang.indent(line, indentLevel * 4)).append("\n");
	}

	private void indent()
	{
		indentLevel++;
	}

	private void dedent()
	{
		if (indentLevel > 0)
		{
			indentLevel--;
		}
	}

	private String lower(Expression expression) throws CompileException
	{
		return lower(expression, false);
	}

	private String lower(Expression expression, boolean tail) throws CompileException
	{
		boolean saved = inTail;
		inTail = tail;
		String result = expression.accept(this);
		inTail = saved;
		return result;
	}

	/**
	 * Returns the term for an expression that needs no evaluation, or null.
	 */
	private String simpleTerm(Expression expression)
	{
		if (expression instanceof LiteralExpression)
		{
			return CoreErlang.literal(((LiteralExpression) expression).getLiteral());
		}
		if (expression instanceof IdentifierExpression)
		{
			return reference(((IdentifierExpression) expression).getName());
		}
		if (expression instanceof GroupingExpression)
		{
			return simpleTerm(((GroupingExpression) expression).getExpression());
		}
		if (expression instanceof UnaryExpression)
		{
			BigInteger negative = negativeLiteral((UnaryExpression) expression);
			return negative != null ? CoreErlang.integer(negative) : null;
		}
		if (expression instanceof PathExpression && symbols.isEnum(((PathExpression) expression).getTypeName()))
		{
			return CoreErlang.atom(((PathExpression) expression).getMember());
		}
		return null;
	}

	/**
	 * The value of {@code -N} for an integer literal N, or null for any other unary expression.
	 */
	private static BigInteger negativeLiteral(UnaryExpression expression)
	{
		if (expression.getOperator().getType() == TokenType.MINUS
				&& expression.getOperand() instanceof LiteralExpression)
		{
			Literal literal = ((LiteralExpression) expression.getOperand()).getLiteral();
			if (literal.getKind() == Literal.Kind.INTEGER)
			{
				return ((BigInteger) literal.getValue()).negate();
			}
		}
		return null;
	}

	/**
	 * Lowers an operand to a variable or constant, binding it to a fresh temporary when it
	 * needs evaluating.
	 */
	private String operand(Expression expression, LetChain chain, String hint) throws CompileException
	{
		String simple = simpleTerm(expression);
		if (simple != null)
		{
			return simple;
		}
		String temporary = hygiene.temporary(hint);
		chain.add(temporary, lower(expression));
		return temporary;
	}

	private List<String> operands(List<Expression> expressions, LetChain chain, String hint) throws CompileException
	{
		List<String> terms = new ArrayList<>();
		for (Expression expression : expressions)
		{
			terms.add(operand(expression, chain, hint));
		}
		return terms;
	}

	/**
	 * A name in value position: a variable, or a function of this module.
	 */
	private String reference(String name)
	{
		String variable = hygiene.resolve(name);
		if (variable != null)
		{
			return variable;
		}
		FunctionSymbol function = symbols.getFunction(name);
		if (function != null)
		{
			return CoreErlang.functionName(name, function.getArity());
		}
		throw new IllegalStateException("Unresolved name '" + name + "' reached code generation");
	}

	// --- Items ---

	@Override
	public String visitModule(ModuleDeclaration module) throws CompileException
	{
		output = new StringBuilder();
		indentLevel = 0;

		List<String> exports = new ArrayList<>();
		for (FunctionSymbol function : symbols.getExports())
		{
			exports.add(CoreErlang.functionName(function.getName(), function.getArity()));
		}
		appendLine("module " + CoreErlang.atom(module.getName()) + " " + CoreErlang.list(exports));
		indent();
		appendLine("attributes []");
		dedent();

		for (Item item : module.getItems())
		{
			String definition = item.accept(this);
			if (!definition.isEmpty())
			{
				appendLine("");
				appendLine(definition);
			}
		}
		appendLine("end");
		LOGGER.debug("Generated module '{}' with {} export(s)", module.getName(), exports.size());
		return output.toString();
	}

	/**
	 * Parameters that are plain variables become the fun's own parameters. Any other
	 * parameter pattern turns the body into a dispatch over all parameters at once.
	 */
	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration) throws CompileException
	{
		hygiene.enterScope();
		List<Pattern> parameterPatterns = new ArrayList<>();
		boolean irrefutable = true;
		for (Parameter parameter : declaration.getParameters())
		{
			parameterPatterns.add(parameter.getPattern());
			irrefutable &= PatternCompiler.isIrrefutable(parameter.getPattern());
		}

		List<String> parameters = new ArrayList<>();
		String body;
		if (irrefutable)
		{
			for (Pattern pattern : parameterPatterns)
			{
				parameters.add(patterns.compilePattern(pattern));
			}
			body = lower(declaration.getBody(), true);
		}
		else
		{
			for (int i = 0; i < parameterPatterns.size(); i++)
			{
				parameters.add(hygiene.temporary("Arg"));
			}
			Arm arm = new Arm(parameterPatterns, null, () -> lower(declaration.getBody(), true));
			body = patterns.compile(new ValueDispatch(parameters, ValueDispatch.FUNCTION_CLAUSE),
					Collections.singletonList(arm));
		}
		hygiene.exitScope();

		LOGGER.trace("Lowered function {}/{}", declaration.getName(), declaration.getArity());
		return CoreErlang.functionName(declaration.getName(), declaration.getArity()) + " =\n"
				+ CoreErlang.indent(CoreErlang.fun(parameters, body), 4);
	}

	// Types only shape the tuples; they produce no definitions of their own.
	@Override
	public String visitStructDeclaration(StructDeclaration declaration)
	{
		return "";
	}

	@Override
	public String visitEnumDeclaration(EnumDeclaration declaration)
	{
		return "";
	}

	// --- Statements ---

	@Override
	public String visitLetStatement(LetStatement statement)
	{
		throw new IllegalStateException("Statements are lowered together with the rest of their block");
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		throw new IllegalStateException("Statements are lowered together with the rest of their block");
	}

	/**
	 * Lowers the statements from {@code index} on, with the rest of the block as the body of each binding.
	 */
	private String lowerStatements(BlockExpression block, int index, boolean tail) throws CompileException
	{
		List<Statement> statements = block.getStatements();
		if (index == statements.size())
		{
			return block.getTail() != null ? lower(block.getTail(), tail) : CoreErlang.UNIT;
		}

		Statement statement = statements.get(index);
		if (statement instanceof LetStatement)
		{
			return lowerLet((LetStatement) statement, block, index, tail);
		}

		Expression expression = ((ExpressionStatement) statement).getExpression();
		if (index == statements.size() - 1 && block.getTail() == null && expression instanceof ReturnExpression)
		{
			// `return x;` closing a block gives the block its value
			return lower(expression, tail);
		}
		String value = lower(expression);
		return CoreErlang.let(hygiene.wildcard(), value, lowerStatements(block, index + 1, tail));
	}

	private String lowerLet(LetStatement statement, BlockExpression block, int index, boolean tail) throws CompileException
	{
		// The value is lowered before the pattern binds, so `let x = x + 1` reads the outer x
		String value = lower(statement.getValue());
		Pattern pattern = statement.getPattern();
		if (PatternCompiler.isIrrefutable(pattern))
		{
			String variable = patterns.compilePattern(pattern);
			return CoreErlang.let(variable, value, lowerStatements(block, index + 1, tail));
		}
		Arm arm = Arm.of(pattern, null, () -> lowerStatements(block, index + 1, tail));
		return patterns.compile(new ValueDispatch(value, ValueDispatch.BADMATCH), Collections.singletonList(arm));
	}

	// --- Expressions ---

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return reference(expression.getName());
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		return CoreErlang.literal(expression.getLiteral());
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression) throws CompileException
	{
		TokenType operator = expression.getOperator().getType();
		if (operator == TokenType.AMPERSAND_AMPERSAND || operator == TokenType.PIPE_PIPE)
		{
			return shortCircuit(operator == TokenType.AMPERSAND_AMPERSAND,
					lower(expression.getLeft()), lower(expression.getRight()));
		}

		LetChain chain = new LetChain();
		String left = operand(expression.getLeft(), chain, "Lhs");
		String right = operand(expression.getRight(), chain, "Rhs");
		return chain.wrap(CoreErlang.call("erlang", OPERATORS.get(operator), List.of(left, right)));
	}

	/**
	 * The right operand is only evaluated when the left one does not decide the result.
	 */
	private String shortCircuit(boolean conjunction, String left, String right)
	{
		String other = hygiene.temporary("Other");
		List<String> clauses = new ArrayList<>();
		if (conjunction)
		{
			clauses.add(CoreErlang.clause(CoreErlang.TRUE, CoreErlang.TRUE, right));
			clauses.add(CoreErlang.clause(CoreErlang.FALSE, CoreErlang.TRUE, CoreErlang.FALSE));
		}
		else
		{
			clauses.add(CoreErlang.clause(CoreErlang.TRUE, CoreErlang.TRUE, CoreErlang.TRUE));
			clauses.add(CoreErlang.clause(CoreErlang.FALSE, CoreErlang.TRUE, right));
		}
		clauses.add(CoreErlang.clause(other, CoreErlang.TRUE,
				CoreErlang.call("erlang", "error", List.of(CoreErlang.tuple(List.of("'badarg'", other))))));
		return CoreErlang.caseOf(left, clauses);
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression) throws CompileException
	{
		BigInteger negative = negativeLiteral(expression);
		if (negative != null)
		{
			return CoreErlang.integer(negative);
		}
		String function = expression.getOperator().getType() == TokenType.MINUS ? "-" : "not";
		LetChain chain = new LetChain();
		String value = operand(expression.getOperand(), chain, "Val");
		return chain.wrap(CoreErlang.call("erlang", function, List.of(value)));
	}

	@Override
	public String visitCallExpression(CallExpression expression) throws CompileException
	{
		Expression callee = expression.getCallee();
		LetChain chain = new LetChain();

		if (callee instanceof IdentifierExpression)
		{
			String name = ((IdentifierExpression) callee).getName();
			int arity = expression.getArguments().size();
			String variable = hygiene.resolve(name);
			FunctionSymbol function = symbols.getFunction(name);
			BuiltinFunction builtin = Builtins.lookup(name, arity);
			List<String> arguments = operands(expression.getArguments(), chain, "Arg");

			if (variable != null)
			{
				return chain.wrap(CoreErlang.apply(variable, arguments));
			}
			if (function != null)
			{
				return chain.wrap(CoreErlang.apply(CoreErlang.functionName(name, function.getArity()), arguments));
			}
			if (builtin != null)
			{
				return chain.wrap(builtin.render(arguments));
			}
			throw new IllegalStateException("Unresolved function '" + name + "/" + arity + "' reached code generation");
		}

		if (callee instanceof PathExpression)
		{
			PathExpression path = (PathExpression) callee;
			List<String> arguments = operands(expression.getArguments(), chain, "Arg");
			if (symbols.isEnum(path.getTypeName()))
			{
				List<String> elements = new ArrayList<>();
				elements.add(CoreErlang.atom(path.getMember()));
				elements.addAll(arguments);
				return chain.wrap(CoreErlang.tuple(elements));
			}
			return chain.wrap(CoreErlang.call(CoreErlang.snakeCase(path.getTypeName()), path.getMember(), arguments));
		}

		String function = operand(callee, chain, "Fun");
		List<String> arguments = operands(expression.getArguments(), chain, "Arg");
		return chain.wrap(CoreErlang.apply(function, arguments));
	}

	/**
	 * {@code r.m(a)} calls the module function {@code m/2} with the receiver first.
	 */
	@Override
	public String visitMethodCallExpression(MethodCallExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		List<String> arguments = new ArrayList<>();
		arguments.add(operand(expression.getReceiver(), chain, "Recv"));
		arguments.addAll(operands(expression.getArguments(), chain, "Arg"));
		String function = CoreErlang.functionName(expression.getMethodName(), arguments.size());
		return chain.wrap(CoreErlang.apply(function, arguments));
	}

	/**
	 * Field access has no static type to go by, so it dispatches at run time over every
	 * struct declaring the field.
	 */
	@Override
	public String visitFieldAccessExpression(FieldAccessExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		String record = operand(expression.getObject(), chain, "Rec");
		String field = expression.getFieldName();

		List<String> clauses = new ArrayList<>();
		for (StructSymbol struct : symbols.structsWithField(field))
		{
			String value = hygiene.temporary(field);
			List<String> elements = new ArrayList<>();
			elements.add(CoreErlang.atom(struct.getName()));
			for (String name : struct.getFieldNames())
			{
				elements.add(name.equals(field) ? value : hygiene.wildcard());
			}
			clauses.add(CoreErlang.clause(CoreErlang.tuple(elements), CoreErlang.TRUE, value));
		}
		String other = hygiene.temporary("Other");
		clauses.add(CoreErlang.clause(other, CoreErlang.TRUE, CoreErlang.call("erlang", "error",
				List.of(CoreErlang.tuple(List.of("'badfield'", CoreErlang.atom(field), other))))));
		return chain.wrap(CoreErlang.caseOf(record, clauses));
	}

	/**
	 * Zero-based indexing into a tuple or a list.
	 */
	@Override
	public String visitIndexExpression(IndexExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		String collection = operand(expression.getObject(), chain, "Coll");
		String position;
		Expression index = expression.getIndex();
		if (index instanceof LiteralExpression
				&& ((LiteralExpression) index).getLiteral().getKind() == Literal.Kind.INTEGER)
		{
			BigInteger value = (BigInteger) ((LiteralExpression) index).getLiteral().getValue();
			position = CoreErlang.integer(value.add(BigInteger.ONE));
		}
		else
		{
			String offset = operand(index, chain, "Idx");
			position = hygiene.temporary("Pos");
			chain.add(position, CoreErlang.call("erlang", "+", List.of(offset, "1")));
		}

		String tuple = hygiene.temporary("Tuple");
		String list = hygiene.temporary("List");
		String other = hygiene.temporary("Other");
		List<String> clauses = new ArrayList<>();
		clauses.add(CoreErlang.clause(tuple, CoreErlang.call("erlang", "is_tuple", List.of(tuple)),
				CoreErlang.call("erlang", "element", List.of(position, tuple))));
		clauses.add(CoreErlang.clause(list, CoreErlang.call("erlang", "is_list", List.of(list)),
				CoreErlang.call("lists", "nth", List.of(position, list))));
		clauses.add(CoreErlang.clause(other, CoreErlang.TRUE,
				CoreErlang.call("erlang", "error", List.of(CoreErlang.tuple(List.of("'badarg'", other))))));
		return chain.wrap(CoreErlang.caseOf(collection, clauses));
	}

	@Override
	public String visitIfExpression(IfExpression expression) throws CompileException
	{
		String condition = lower(expression.getCondition());
		String thenBranch = lower(expression.getThenBranch(), inTail);
		String elseBranch = expression.getElseBranch() != null
				? lower(expression.getElseBranch(), inTail)
				: CoreErlang.UNIT;
		String other = hygiene.temporary("Other");

		List<String> clauses = new ArrayList<>();
		clauses.add(CoreErlang.clause(CoreErlang.TRUE, CoreErlang.TRUE, thenBranch));
		clauses.add(CoreErlang.clause(CoreErlang.FALSE, CoreErlang.TRUE, elseBranch));
		clauses.add(CoreErlang.clause(other, CoreErlang.TRUE, CoreErlang.matchFail("'if_clause'")));
		return CoreErlang.caseOf(condition, clauses);
	}

	@Override
	public String visitMatchExpression(MatchExpression expression) throws CompileException
	{
		String scrutinee = lower(expression.getScrutinee());
		return patterns.compile(new ValueDispatch(scrutinee, ValueDispatch.CASE_CLAUSE), arms(expression.getArms()));
	}

	private List<Arm> arms(List<MatchArm> source)
	{
		boolean tail = inTail;
		List<Arm> arms = new ArrayList<>();
		for (MatchArm arm : source)
		{
			arms.add(Arm.of(arm.getPattern(), arm.getGuard(), () -> lower(arm.getBody(), tail)));
		}
		return arms;
	}

	@Override
	public String visitBlockExpression(BlockExpression expression) throws CompileException
	{
		hygiene.enterScope();
		String result = lowerStatements(expression, 0, inTail);
		hygiene.exitScope();
		return result;
	}

	@Override
	public String visitTupleExpression(TupleExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		return chain.wrap(CoreErlang.tuple(operands(expression.getElements(), chain, "Elem")));
	}

	@Override
	public String visitListExpression(ListExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		return chain.wrap(CoreErlang.list(operands(expression.getElements(), chain, "Elem")));
	}

	/**
	 * Field values are evaluated in the order written and laid out in the order declared.
	 */
	@Override
	public String visitStructExpression(StructExpression expression) throws CompileException
	{
		StructSymbol struct = symbols.getStruct(expression.getTypeName());
		LetChain chain = new LetChain();
		Map<String, String> values = new HashMap<>();
		for (FieldInitializer field : expression.getFields())
		{
			values.put(field.getName(), operand(field.getValue(), chain, field.getName()));
		}

		List<String> elements = new ArrayList<>();
		elements.add(CoreErlang.atom(struct.getName()));
		for (String field : struct.getFieldNames())
		{
			elements.add(values.get(field));
		}
		return chain.wrap(CoreErlang.tuple(elements));
	}

	@Override
	public String visitPathExpression(PathExpression expression)
	{
		// Only payload-free variants reach here; anything else was rejected during analysis
		return CoreErlang.atom(expression.getMember());
	}

	@Override
	public String visitSpawnExpression(SpawnExpression expression) throws CompileException
	{
		if (expression.isClosure())
		{
			hygiene.enterScope();
			String body = lower(expression.getClosureBody(), true);
			hygiene.exitScope();
			return CoreErlang.call("erlang", "spawn", List.of(CoreErlang.fun(Collections.emptyList(), body)));
		}
		LetChain chain = new LetChain();
		String function = operand(expression.getCallable(), chain, "Fun");
		return chain.wrap(CoreErlang.call("erlang", "spawn", List.of(function)));
	}

	@Override
	public String visitSendExpression(SendExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		String target = operand(expression.getTarget(), chain, "Dest");
		String message = operand(expression.getMessage(), chain, "Msg");
		return chain.wrap(CoreErlang.call("erlang", "!", List.of(target, message)));
	}

	@Override
	public String visitReceiveExpression(ReceiveExpression expression) throws CompileException
	{
		boolean tail = inTail;
		LetChain chain = new LetChain();
		DispatchStrategy strategy;
		AfterClause after = expression.getAfter();
		if (after != null)
		{
			Expression timeout = unwrap(after.getTimeout());
			if (timeout instanceof UnaryExpression && negativeLiteral((UnaryExpression) timeout) != null)
			{
				throw error(after.getAfterKeyword(), "A receive timeout cannot be negative.");
			}
			String timeoutTerm = operand(after.getTimeout(), chain, "Timeout");
			strategy = new MailboxDispatch(timeoutTerm, () -> lower(after.getBody(), tail));
		}
		else
		{
			strategy = MailboxDispatch.forever();
		}
		return chain.wrap(patterns.compile(strategy, arms(expression.getArms())));
	}

	private static Expression unwrap(Expression expression)
	{
		Expression current = expression;
		while (current instanceof GroupingExpression)
		{
			current = ((GroupingExpression) current).getExpression();
		}
		return current;
	}

	@Override
	public String visitReturnExpression(ReturnExpression expression) throws CompileException
	{
		if (!inTail)
		{
			throw error(expression.getFirstToken(), "'return' is only supported where its value is the value of the function.");
		}
		return expression.getValue() != null ? lower(expression.getValue(), true) : CoreErlang.UNIT;
	}

	@Override
	public String visitBitstringExpression(BitstringExpression expression) throws CompileException
	{
		LetChain chain = new LetChain();
		List<String> segments = new ArrayList<>();
		for (BitstringSegment<Expression> segment : expression.getSegments())
		{
			BitstringSpecifiers specifiers = BitstringSpecifiers.resolve(segment.getSpecifiers(),
					segment.getSize() != null, segment.getFirstToken().getSpan());
			Expression value = unwrap(segment.getValue());
			if (value instanceof LiteralExpression
					&& ((LiteralExpression) value).getLiteral().getKind() == Literal.Kind.STRING)
			{
				segments.addAll(specifiers.stringSegments(segment,
						(String) ((LiteralExpression) value).getLiteral().getValue()));
				continue;
			}
			String term = operand(segment.getValue(), chain, "Seg");
			String size = segment.getSize() != null ? operand(segment.getSize(), chain, "Size") : null;
			segments.add(specifiers.render(term, size));
		}
		return chain.wrap(CoreErlang.binary(segments));
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression) throws CompileException
	{
		return lower(expression.getExpression(), inTail);
	}

	// --- Clause lowering for the pattern compiler ---

	@Override
	public String lowerGuard(Expression guard) throws CompileException
	{
		return guardTerm(guard);
	}

	/**
	 * Guards nest calls directly instead of binding operands; evaluation order cannot be
	 * observed without side effects.
	 */
	private String guardTerm(Expression expression) throws CompileException
	{
		if (expression instanceof LiteralExpression)
		{
			return CoreErlang.literal(((LiteralExpression) expression).getLiteral());
		}
		if (expression instanceof GroupingExpression)
		{
			return guardTerm(((GroupingExpression) expression).getExpression());
		}
		if (expression instanceof IdentifierExpression)
		{
			String variable = hygiene.resolve(((IdentifierExpression) expression).getName());
			if (variable != null)
			{
				return variable;
			}
		}
		else if (expression instanceof UnaryExpression)
		{
			UnaryExpression unary = (UnaryExpression) expression;
			BigInteger negative = negativeLiteral(unary);
			if (negative != null)
			{
				return CoreErlang.integer(negative);
			}
			String function = unary.getOperator().getType() == TokenType.MINUS ? "-" : "not";
			return CoreErlang.call("erlang", function, List.of(guardTerm(unary.getOperand())));
		}
		else if (expression instanceof BinaryExpression)
		{
			BinaryExpression binary = (BinaryExpression) expression;
			TokenType operator = binary.getOperator().getType();
			String function;
			if (operator == TokenType.AMPERSAND_AMPERSAND)
			{
				function = "and";
			}
			else if (operator == TokenType.PIPE_PIPE)
			{
				function = "or";
			}
			else
			{
				function = OPERATORS.get(operator);
			}
			return CoreErlang.call("erlang", function,
					List.of(guardTerm(binary.getLeft()), guardTerm(binary.getRight())));
		}
		else if (expression instanceof TupleExpression)
		{
			return CoreErlang.tuple(guardTerms(((TupleExpression) expression).getElements()));
		}
		else if (expression instanceof ListExpression)
		{
			return CoreErlang.list(guardTerms(((ListExpression) expression).getElements()));
		}
		else if (expression instanceof PathExpression)
		{
			return CoreErlang.atom(((PathExpression) expression).getMember());
		}
		else if (expression instanceof CallExpression)
		{
			String call = guardCall((CallExpression) expression);
			if (call != null)
			{
				return call;
			}
		}
		throw error(expression.getFirstToken(), "This expression is not allowed in a guard.");
	}

	/**
	 * Guard-safe built-ins and variant construction; null for any other call.
	 */
	private String guardCall(CallExpression call) throws CompileException
	{
		Expression callee = call.getCallee();
		if (callee instanceof PathExpression && symbols.isEnum(((PathExpression) callee).getTypeName()))
		{
			List<String> elements = new ArrayList<>();
			elements.add(CoreErlang.atom(((PathExpression) callee).getMember()));
			elements.addAll(guardTerms(call.getArguments()));
			return CoreErlang.tuple(elements);
		}
		if (callee instanceof IdentifierExpression)
		{
			String name = ((IdentifierExpression) callee).getName();
			BuiltinFunction builtin = Builtins.lookup(name, call.getArguments().size());
			if (!hygiene.isBound(name) && symbols.getFunction(name) == null
					&& builtin != null && builtin.isGuardSafe())
			{
				return builtin.render(guardTerms(call.getArguments()));
			}
		}
		return null;
	}

	private List<String> guardTerms(List<Expression> expressions) throws CompileException
	{
		List<String> terms = new ArrayList<>();
		for (Expression expression : expressions)
		{
			terms.add(guardTerm(expression));
		}
		return terms;
	}

	@Override
	public String lowerSegmentSize(Expression size) throws CompileException
	{
		Expression value = unwrap(size);
		if (value instanceof IdentifierExpression)
		{
			String variable = hygiene.resolve(((IdentifierExpression) value).getName());
			if (variable != null)
			{
				return variable;
			}
		}
		else if (value instanceof LiteralExpression
				&& ((LiteralExpression) value).getLiteral().getKind() == Literal.Kind.INTEGER)
		{
			return CoreErlang.literal(((LiteralExpression) value).getLiteral());
		}
		throw error(size.getFirstToken(), "A segment size in a pattern must be a variable or an integer.");
	}
}
