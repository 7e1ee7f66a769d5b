package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.Attribute;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a struct definition. Field order is significant: it is the
 * positional order of the tagged tuple the struct lowers to.
 */
public class StructDeclaration implements Item
{
	private final List<Attribute> attributes;
	private final boolean isPublic;
	private final Token structKeyword;
	private final Token name;
	private final List<Token> typeParameters;
	private final List<FieldDeclaration> fields;

	public StructDeclaration(List<Attribute> attributes, boolean isPublic, Token structKeyword, Token name,
							 List<Token> typeParameters, List<FieldDeclaration> fields)
	{
		this.attributes = new ArrayList<>(attributes);
		this.isPublic = isPublic;
		this.structKeyword = structKeyword;
		this.name = name;
		this.typeParameters = new ArrayList<>(typeParameters);
		this.fields = new ArrayList<>(fields);
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

	public List<FieldDeclaration> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitStructDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return structKeyword;
	}

	@Override
	public String toString()
	{
		return "struct " + getName() + " { "
				+ fields.stream().map(FieldDeclaration::toString).collect(Collectors.joining(", ")) + " }";
	}
}
