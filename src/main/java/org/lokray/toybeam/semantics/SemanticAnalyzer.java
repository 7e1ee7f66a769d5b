package org.lokray.toybeam.semantics;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.ModuleDeclaration;
import org.lokray.toybeam.ast.expressions.*;
import org.lokray.toybeam.ast.items.*;
import org.lokray.toybeam.ast.patterns.*;
import org.lokray.toybeam.ast.statements.ExpressionStatement;
import org.lokray.toybeam.ast.statements.LetStatement;
import org.lokray.toybeam.ast.statements.Statement;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.exception.ErrorKind;
import org.lokray.toybeam.exception.SemanticException;
import org.lokray.toybeam.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Performs semantic analysis with a two-phase approach:
 * Phase 1: Discover all functions, structs and enums and build the {@link ModuleSymbols}.
 * Phase 2: Walk every function body, checking names, arities and bindings against it.
 * <p>
 * Checks made here: duplicate declarations, fields, variants and pattern variables
 * ({@code DUPLICATE_BINDING}); struct and variant field counts at construction and pattern
 * sites, and the arity of direct calls ({@code ARITY_MISMATCH}); unknown variants, types,
 * fields, variables and directly named functions. A tag (struct or variant name) must have
 * one shape across the whole module.
 */
public class SemanticAnalyzer implements ASTVisitor<Void>, PatternVisitor<Void>
{
	private static final Logger LOGGER = LoggerFactory.getLogger(SemanticAnalyzer.class);

	private ModuleSymbols symbols;
	private SymbolTable currentScope;

	// Variables bound by the pattern currently being visited, null outside patterns
	private Map<String, VariableSymbol> patternBindings;
	private boolean bindMutable;

	/**
	 * Analyzes a module whose items have already been filtered by {@link CfgEvaluator}.
	 *
	 * @return The module's symbol table.
	 * @throws SemanticException on the first semantic error.
	 */
	public ModuleSymbols analyze(ModuleDeclaration module) throws SemanticException
	{
		symbols = new ModuleSymbols(module.getName());

		// Phase 1: item discovery
		for (Item item : module.getItems())
		{
			declare(item);
		}
		checkTagShapes();
		LOGGER.debug("Symbols of module '{}': {}", module.getName(), symbols);

		// Phase 2: bodies
		try
		{
			module.accept(this);
		}
		catch (SemanticException e)
		{
			throw e;
		}
		catch (CompileException e)
		{
			// Only semantic checks run in this pass
			throw new IllegalStateException("Unexpected failure during semantic analysis", e);
		}
		return symbols;
	}

	// --- Phase 1 ---

	private void declare(Item item) throws SemanticException
	{
		if (item instanceof FunctionDeclaration)
		{
			FunctionDeclaration function = (FunctionDeclaration) item;
			if (symbols.getFunction(function.getName()) != null)
			{
				throw error(ErrorKind.DUPLICATE_BINDING, function.getNameToken(),
						"Function '" + function.getName() + "' is already defined in this module.");
			}
			symbols.defineFunction(new FunctionSymbol(function.getName(), function.getArity(), function.isPublic(),
					function.getNameToken()));
			return;
		}

		if (item.getName().equals(ModuleSymbols.SIGNAL_ENUM))
		{
			throw error(ErrorKind.DUPLICATE_BINDING, item.getNameToken(),
					"'" + ModuleSymbols.SIGNAL_ENUM + "' is predeclared and cannot be redefined.");
		}
		if (symbols.isType(item.getName()))
		{
			throw error(ErrorKind.DUPLICATE_BINDING, item.getNameToken(),
					"Type '" + item.getName() + "' is already defined in this module.");
		}

		if (item instanceof StructDeclaration)
		{
			StructDeclaration struct = (StructDeclaration) item;
			Set<String> seen = new HashSet<>();
			for (FieldDeclaration field : struct.getFields())
			{
				if (!seen.add(field.getName()))
				{
					throw error(ErrorKind.DUPLICATE_BINDING, field.getNameToken(),
							"Field '" + field.getName() + "' is declared twice in struct '" + struct.getName() + "'.");
				}
			}
			symbols.defineStruct(new StructSymbol(struct.getName(), fieldNames(struct), struct.getNameToken()));
		}
		else if (item instanceof EnumDeclaration)
		{
			EnumDeclaration enumDeclaration = (EnumDeclaration) item;
			EnumSymbol enumSymbol = new EnumSymbol(enumDeclaration.getName(), enumDeclaration.getNameToken());
			for (EnumVariant variant : enumDeclaration.getVariants())
			{
				VariantSymbol variantSymbol = new VariantSymbol(enumDeclaration.getName(), variant.getName(),
						variant.getArity(), variant.getNameToken());
				if (!enumSymbol.addVariant(variantSymbol))
				{
					throw error(ErrorKind.DUPLICATE_BINDING, variant.getNameToken(),
							"Variant '" + variant.getName() + "' is declared twice in enum '" + enumDeclaration.getName() + "'.");
				}
			}
			symbols.defineEnum(enumSymbol);
		}
	}

	private static List<String> fieldNames(StructDeclaration struct)
	{
		return struct.getFields().stream().map(FieldDeclaration::getName).collect(Collectors.toList());
	}

	/**
	 * Every tag has one runtime shape: a bare atom, or a tuple of a fixed size.
	 * The same variant name in two enums is fine as long as the shapes agree.
	 */
	private void checkTagShapes() throws SemanticException
	{
		Map<String, Integer> shapes = new HashMap<>(); // -1 for a bare atom, otherwise the payload size
		Map<String, String> owners = new HashMap<>();

		for (StructSymbol struct : symbols.getStructs())
		{
			registerShape(shapes, owners, struct.getName(), struct.getArity(), "struct " + struct.getName(),
					struct.getDeclarationToken());
		}
		for (EnumSymbol enumSymbol : symbols.getEnums())
		{
			for (VariantSymbol variant : enumSymbol.getVariants())
			{
				int shape = variant.isBareAtom() ? -1 : variant.getArity();
				registerShape(shapes, owners, variant.getName(), shape, variant.toString(), variant.getDeclarationToken());
			}
		}
	}

	private void registerShape(Map<String, Integer> shapes, Map<String, String> owners, String tag, int shape,
							   String owner, Token token) throws SemanticException
	{
		Integer existing = shapes.putIfAbsent(tag, shape);
		if (existing != null && existing != shape)
		{
			throw error(ErrorKind.ARITY_MISMATCH, token, "Tag '" + tag + "' of " + owner + " has a different arity than "
					+ owners.get(tag) + "; a tag must have one arity across the module.");
		}
		owners.putIfAbsent(tag, owner);
	}

	// --- Phase 2: items ---

	@Override
	public Void visitModule(ModuleDeclaration module) throws CompileException
	{
		for (Item item : module.getItems())
		{
			item.accept(this);
		}
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration) throws CompileException
	{
		currentScope = new SymbolTable(null, "fn:" + declaration.getName());

		// All parameters form one binding group: fn f(x: int, x: int) is a duplicate
		beginPattern(false);
		for (Parameter parameter : declaration.getParameters())
		{
			parameter.getPattern().accept(this);
		}
		endPattern();

		declaration.getBody().accept(this);
		currentScope = null;
		return null;
	}

	@Override
	public Void visitStructDeclaration(StructDeclaration declaration)
	{
		return null; // fully checked during discovery
	}

	@Override
	public Void visitEnumDeclaration(EnumDeclaration declaration)
	{
		return null; // fully checked during discovery
	}

	// --- Phase 2: statements ---

	@Override
	public Void visitLetStatement(LetStatement statement) throws CompileException
	{
		// The value is evaluated before its pattern's names come into scope
		statement.getValue().accept(this);
		beginPattern(statement.isMutable());
		statement.getPattern().accept(this);
		endPattern();
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement) throws CompileException
	{
		statement.getExpression().accept(this);
		return null;
	}

	// --- Phase 2: expressions ---

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression) throws CompileException
	{
		String name = expression.getName();
		if (isVariable(name) || symbols.getFunction(name) != null)
		{
			return null;
		}
		if (Builtins.isBuiltin(name))
		{
			throw error(ErrorKind.UNDEFINED_VARIABLE, expression.getNameToken(),
					"Built-in '" + name + "' can only be called directly, not used as a value.");
		}
		throw error(ErrorKind.UNDEFINED_VARIABLE, expression.getNameToken(), "Undefined variable '" + name + "'.");
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression) throws CompileException
	{
		expression.getLeft().accept(this);
		expression.getRight().accept(this);
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression) throws CompileException
	{
		expression.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression) throws CompileException
	{
		Expression callee = expression.getCallee();
		int arity = expression.getArguments().size();

		if (callee instanceof IdentifierExpression && !isVariable(((IdentifierExpression) callee).getName()))
		{
			checkDirectCall((IdentifierExpression) callee, arity);
		}
		else if (callee instanceof PathExpression)
		{
			PathExpression path = (PathExpression) callee;
			if (symbols.isEnum(path.getTypeName()))
			{
				VariantSymbol variant = resolveVariant(path.getTypeNameToken(), path.getMemberToken());
				if (variant.isBareAtom() || variant.getArity() != arity)
				{
					throw arityMismatch(path.getMemberToken(), variant, arity);
				}
			}
			// Any other Type::function(...) is a call into a runtime module
		}
		else
		{
			callee.accept(this);
		}

		for (Expression argument : expression.getArguments())
		{
			argument.accept(this);
		}
		return null;
	}

	private void checkDirectCall(IdentifierExpression callee, int arity) throws SemanticException
	{
		String name = callee.getName();
		FunctionSymbol function = symbols.getFunction(name);
		if (function != null)
		{
			if (function.getArity() != arity)
			{
				throw error(ErrorKind.ARITY_MISMATCH, callee.getNameToken(), "Function '" + name + "' takes "
						+ function.getArity() + " argument(s) but was called with " + arity + ".");
			}
			return;
		}
		if (Builtins.isBuiltin(name))
		{
			if (Builtins.lookup(name, arity) == null)
			{
				throw error(ErrorKind.ARITY_MISMATCH, callee.getNameToken(), "Built-in '" + name + "' takes "
						+ Builtins.aritiesOf(name) + " argument(s) but was called with " + arity + ".");
			}
			return;
		}
		throw error(ErrorKind.UNDEFINED_FUNCTION_CALL, callee.getNameToken(), "Call to undefined function '" + name + "'.");
	}

	@Override
	public Void visitMethodCallExpression(MethodCallExpression expression) throws CompileException
	{
		expression.getReceiver().accept(this);

		String name = expression.getMethodName();
		int arity = expression.getArguments().size() + 1;
		FunctionSymbol function = symbols.getFunction(name);
		if (function == null)
		{
			throw error(ErrorKind.UNDEFINED_FUNCTION_CALL, expression.getMethodToken(),
					"No function '" + name + "/" + arity + "' to call as a method.");
		}
		if (function.getArity() != arity)
		{
			throw error(ErrorKind.ARITY_MISMATCH, expression.getMethodToken(), "Method call '" + name + "' passes "
					+ arity + " argument(s) including the receiver, but the function takes " + function.getArity() + ".");
		}

		for (Expression argument : expression.getArguments())
		{
			argument.accept(this);
		}
		return null;
	}

	@Override
	public Void visitFieldAccessExpression(FieldAccessExpression expression) throws CompileException
	{
		expression.getObject().accept(this);
		if (symbols.structsWithField(expression.getFieldName()).isEmpty())
		{
			throw error(ErrorKind.UNDEFINED_FIELD, expression.getFieldToken(),
					"No struct declares a field named '" + expression.getFieldName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitIndexExpression(IndexExpression expression) throws CompileException
	{
		expression.getObject().accept(this);
		expression.getIndex().accept(this);
		return null;
	}

	@Override
	public Void visitIfExpression(IfExpression expression) throws CompileException
	{
		expression.getCondition().accept(this);
		expression.getThenBranch().accept(this);
		if (expression.getElseBranch() != null)
		{
			expression.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitMatchExpression(MatchExpression expression) throws CompileException
	{
		expression.getScrutinee().accept(this);
		for (MatchArm arm : expression.getArms())
		{
			visitArm(arm);
		}
		return null;
	}

	/**
	 * Each arm gets its own scope; its pattern's names are visible in its guard and body only.
	 */
	private void visitArm(MatchArm arm) throws CompileException
	{
		enterScope("arm");
		try
		{
			beginPattern(false);
			arm.getPattern().accept(this);
			endPattern();
			if (arm.getGuard() != null)
			{
				arm.getGuard().accept(this);
			}
			arm.getBody().accept(this);
		}
		finally
		{
			exitScope();
		}
	}

	@Override
	public Void visitBlockExpression(BlockExpression expression) throws CompileException
	{
		enterScope("block");
		try
		{
			for (Statement statement : expression.getStatements())
			{
				statement.accept(this);
			}
			if (expression.getTail() != null)
			{
				expression.getTail().accept(this);
			}
		}
		finally
		{
			exitScope();
		}
		return null;
	}

	@Override
	public Void visitTupleExpression(TupleExpression expression) throws CompileException
	{
		for (Expression element : expression.getElements())
		{
			element.accept(this);
		}
		return null;
	}

	@Override
	public Void visitListExpression(ListExpression expression) throws CompileException
	{
		for (Expression element : expression.getElements())
		{
			element.accept(this);
		}
		return null;
	}

	@Override
	public Void visitStructExpression(StructExpression expression) throws CompileException
	{
		StructSymbol struct = resolveStruct(expression.getTypeNameToken());
		Set<String> seen = new HashSet<>();
		for (FieldInitializer field : expression.getFields())
		{
			checkField(struct, field.getNameToken(), seen);
			field.getValue().accept(this);
		}
		checkAllFieldsPresent(struct, expression.getTypeNameToken(), seen);
		return null;
	}

	@Override
	public Void visitPathExpression(PathExpression expression) throws CompileException
	{
		if (!symbols.isEnum(expression.getTypeName()))
		{
			throw error(ErrorKind.UNDEFINED_TYPE, expression.getTypeNameToken(), "'" + expression.getTypeName()
					+ "' is not an enum; '" + expression + "' can only be used as a call.");
		}
		VariantSymbol variant = resolveVariant(expression.getTypeNameToken(), expression.getMemberToken());
		if (!variant.isBareAtom())
		{
			throw arityMismatch(expression.getMemberToken(), variant, 0);
		}
		return null;
	}

	@Override
	public Void visitSpawnExpression(SpawnExpression expression) throws CompileException
	{
		if (expression.isClosure())
		{
			expression.getClosureBody().accept(this);
		}
		else
		{
			expression.getCallable().accept(this);
		}
		return null;
	}

	@Override
	public Void visitSendExpression(SendExpression expression) throws CompileException
	{
		expression.getTarget().accept(this);
		expression.getMessage().accept(this);
		return null;
	}

	@Override
	public Void visitReceiveExpression(ReceiveExpression expression) throws CompileException
	{
		for (MatchArm arm : expression.getArms())
		{
			visitArm(arm);
		}
		if (expression.getAfter() != null)
		{
			expression.getAfter().getTimeout().accept(this);
			expression.getAfter().getBody().accept(this);
		}
		return null;
	}

	@Override
	public Void visitReturnExpression(ReturnExpression expression) throws CompileException
	{
		if (expression.getValue() != null)
		{
			expression.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visitBitstringExpression(BitstringExpression expression) throws CompileException
	{
		for (BitstringSegment<Expression> segment : expression.getSegments())
		{
			segment.getValue().accept(this);
			if (segment.getSize() != null)
			{
				segment.getSize().accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression) throws CompileException
	{
		expression.getExpression().accept(this);
		return null;
	}

	// --- Phase 2: patterns ---

	@Override
	public Void visitIdentifierPattern(IdentifierPattern pattern) throws CompileException
	{
		if (patternBindings.containsKey(pattern.getName()))
		{
			throw error(ErrorKind.DUPLICATE_BINDING, pattern.getNameToken(),
					"Variable '" + pattern.getName() + "' is bound more than once in the same pattern.");
		}
		patternBindings.put(pattern.getName(), new VariableSymbol(pattern.getName(), bindMutable, pattern.getNameToken()));
		return null;
	}

	@Override
	public Void visitWildcardPattern(WildcardPattern pattern)
	{
		return null;
	}

	@Override
	public Void visitLiteralPattern(LiteralPattern pattern)
	{
		return null;
	}

	@Override
	public Void visitTuplePattern(TuplePattern pattern) throws CompileException
	{
		for (Pattern element : pattern.getElements())
		{
			element.accept(this);
		}
		return null;
	}

	@Override
	public Void visitListPattern(ListPattern pattern) throws CompileException
	{
		for (Pattern element : pattern.getElements())
		{
			element.accept(this);
		}
		return null;
	}

	@Override
	public Void visitConsPattern(ConsPattern pattern) throws CompileException
	{
		for (Pattern head : pattern.getHeads())
		{
			head.accept(this);
		}
		pattern.getTail().accept(this);
		return null;
	}

	@Override
	public Void visitStructPattern(StructPattern pattern) throws CompileException
	{
		StructSymbol struct = resolveStruct(pattern.getTypeNameToken());
		Set<String> seen = new HashSet<>();
		for (FieldPattern field : pattern.getFields())
		{
			checkField(struct, field.getNameToken(), seen);
			field.getPattern().accept(this);
		}
		checkAllFieldsPresent(struct, pattern.getTypeNameToken(), seen);
		return null;
	}

	@Override
	public Void visitEnumPattern(EnumPattern pattern) throws CompileException
	{
		if (!symbols.isEnum(pattern.getTypeName()))
		{
			throw error(ErrorKind.UNDEFINED_TYPE, pattern.getTypeNameToken(), "Unknown enum '" + pattern.getTypeName() + "'.");
		}
		VariantSymbol variant = resolveVariant(pattern.getTypeNameToken(), pattern.getVariantToken());
		int given = pattern.getArguments().size();
		boolean shapeMatches = variant.isBareAtom() ? !pattern.isParenthesized() : pattern.isParenthesized() && given == variant.getArity();
		if (!shapeMatches)
		{
			throw arityMismatch(pattern.getVariantToken(), variant, given);
		}
		for (Pattern argument : pattern.getArguments())
		{
			argument.accept(this);
		}
		return null;
	}

	@Override
	public Void visitBitstringPattern(BitstringPattern pattern) throws CompileException
	{
		for (BitstringSegment<Pattern> segment : pattern.getSegments())
		{
			segment.getValue().accept(this);
			if (segment.getSize() != null)
			{
				checkSizeExpression(segment.getSize(), patternBindings);
			}
		}
		return null;
	}

	/**
	 * A segment size may name a variable bound by an earlier segment of the same pattern.
	 */
	private void checkSizeExpression(Expression size, Map<String, VariableSymbol> pending) throws CompileException
	{
		if (size instanceof IdentifierExpression && pending.containsKey(((IdentifierExpression) size).getName()))
		{
			return;
		}
		size.accept(this);
	}

	// --- Helpers ---

	private void beginPattern(boolean mutable)
	{
		patternBindings = new LinkedHashMap<>();
		bindMutable = mutable;
	}

	/**
	 * Brings the names bound by the finished pattern into the current scope.
	 */
	private void endPattern()
	{
		for (VariableSymbol symbol : patternBindings.values())
		{
			currentScope.define(symbol);
		}
		patternBindings = null;
	}

	private boolean isVariable(String name)
	{
		return currentScope != null && currentScope.resolve(name) != null;
	}

	private void enterScope(String name)
	{
		currentScope = new SymbolTable(currentScope, name);
	}

	private void exitScope()
	{
		currentScope = currentScope.getEnclosingScope();
	}

	private StructSymbol resolveStruct(Token typeName) throws SemanticException
	{
		StructSymbol struct = symbols.getStruct(typeName.getLexeme());
		if (struct == null)
		{
			String detail = symbols.isEnum(typeName.getLexeme()) ? " ('" + typeName.getLexeme() + "' is an enum)" : "";
			throw error(ErrorKind.UNDEFINED_TYPE, typeName, "Unknown struct '" + typeName.getLexeme() + "'" + detail + ".");
		}
		return struct;
	}

	private VariantSymbol resolveVariant(Token typeName, Token variantName) throws SemanticException
	{
		EnumSymbol enumSymbol = symbols.getEnum(typeName.getLexeme());
		VariantSymbol variant = enumSymbol.getVariant(variantName.getLexeme());
		if (variant == null)
		{
			throw error(ErrorKind.UNDEFINED_VARIANT, variantName,
					"Enum '" + typeName.getLexeme() + "' has no variant '" + variantName.getLexeme() + "'.");
		}
		return variant;
	}

	private void checkField(StructSymbol struct, Token field, Set<String> seen) throws SemanticException
	{
		if (!struct.hasField(field.getLexeme()))
		{
			throw error(ErrorKind.UNDEFINED_FIELD, field,
					"Struct '" + struct.getName() + "' has no field '" + field.getLexeme() + "'.");
		}
		if (!seen.add(field.getLexeme()))
		{
			throw error(ErrorKind.DUPLICATE_BINDING, field, "Field '" + field.getLexeme() + "' is given twice.");
		}
	}

	private void checkAllFieldsPresent(StructSymbol struct, Token typeName, Set<String> seen) throws SemanticException
	{
		if (seen.size() != struct.getArity())
		{
			Set<String> missing = new LinkedHashSet<>(struct.getFieldNames());
			missing.removeAll(seen);
			throw error(ErrorKind.ARITY_MISMATCH, typeName, "Struct '" + struct.getName() + "' has "
					+ struct.getArity() + " field(s) but " + seen.size() + " were given; missing " + missing + ".");
		}
	}

	private SemanticException arityMismatch(Token at, VariantSymbol variant, int given)
	{
		return error(ErrorKind.ARITY_MISMATCH, at, "Variant '" + variant + "' takes " + variant.getArity()
				+ " value(s)" + (variant.isBareAtom() ? " and is written without parentheses" : "")
				+ ", but " + given + " were given.");
	}

	private SemanticException error(ErrorKind kind, Token token, String message)
	{
		return new SemanticException(kind, token != null ? token.getSpan() : null, message);
	}
}
