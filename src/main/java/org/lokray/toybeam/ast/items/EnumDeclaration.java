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
 * AST node representing an enum definition with its ordered variants.
 */
public class EnumDeclaration implements Item
{
	private final List<Attribute> attributes;
	private final boolean isPublic;
	private final Token enumKeyword;
	private final Token name;
	private final List<Token> typeParameters;
	private final List<EnumVariant> variants;

	public EnumDeclaration(List<Attribute> attributes, boolean isPublic, Token enumKeyword, Token name,
						   List<Token> typeParameters, List<EnumVariant> variants)
	{
		this.attributes = new ArrayList<>(attributes);
		this.isPublic = isPublic;
		this.enumKeyword = enumKeyword;
		this.name = name;
		this.typeParameters = new ArrayList<>(typeParameters);
		this.variants = new ArrayList<>(variants);
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

	public List<EnumVariant> getVariants()
	{
		return Collections.unmodifiableList(variants);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitEnumDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return enumKeyword;
	}

	@Override
	public String toString()
	{
		return "enum " + getName() + " { "
				+ variants.stream().map(EnumVariant::toString).collect(Collectors.joining(", ")) + " }";
	}
}
