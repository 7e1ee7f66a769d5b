package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.Attribute;
import org.lokray.toybeam.ast.expressions.BlockExpression;
import org.lokray.toybeam.ast.types.TypeAnnotation;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a function definition.
 * Grammar: `ATTRIBUTE* PUB? FN IDENTIFIER TYPE_PARAMETERS? ( PARAMETERS ) ( -> TYPE )? BLOCK`
 */
public class FunctionDeclaration implements Item
{
	private final List<Attribute> attributes;
	private final boolean isPublic;
	private final Token fnKeyword;
	private final Token name;
	private final List<Token> typeParameters;
	private final List<Parameter> parameters;
	private final TypeAnnotation returnType; // null when omitted
	private final BlockExpression body;

	public FunctionDeclaration(List<Attribute> attributes, boolean isPublic, Token fnKeyword, Token name,
							   List<Token> typeParameters, List<Parameter> parameters,
							   TypeAnnotation returnType, BlockExpression body)
	{
		this.attributes = new ArrayList<>(attributes);
		this.isPublic = isPublic;
		this.fnKeyword = fnKeyword;
		this.name = name;
		this.typeParameters = new ArrayList<>(typeParameters);
		this.parameters = new ArrayList<>(parameters);
		this.returnType = returnType;
		this.body = body;
	}

	@Override
	public Token getNameToken()
	{
		return name;
	}

	@Override
	public boolean isPublic()
	{
		return isPublic;
	}

	@Override
	public List<Attribute> getAttributes()
	{
		return Collections.unmodifiableList(attributes);
	}

	@Override
	public List<Token> getTypeParameters()
	{
		return Collections.unmodifiableList(typeParameters);
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public int getArity()
	{
		return parameters.size();
	}

	public TypeAnnotation getReturnType()
	{
		return returnType;
	}

	public BlockExpression getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return fnKeyword;
	}

	@Override
	public String toString()
	{
		String params = parameters.stream().map(Parameter::toString).collect(Collectors.joining(", "));
		return (isPublic ? "pub " : "") + "fn " + getName() + "(" + params + ")"
				+ (returnType != null ? " -> " + returnType : "") + " " + body;
	}
}
