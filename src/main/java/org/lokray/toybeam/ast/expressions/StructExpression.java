package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing {@code Type { field: value, ... }}. Initializers may appear in
 * any order; the lowering reorders them into declaration order.
 */
public class StructExpression implements Expression
{
	private final Token typeName;
	private final List<FieldInitializer> fields;

	public StructExpression(Token typeName, List<FieldInitializer> fields)
	{
		this.typeName = typeName;
		this.fields = new ArrayList<>(fields);
	}

	public Token getTypeNameToken()
	{
		return typeName;
	}

	public String getTypeName()
	{
		return typeName.getLexeme();
	}

	public List<FieldInitializer> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitStructExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return typeName;
	}

	@Override
	public String toString()
	{
		return getTypeName() + " { " + fields.stream().map(FieldInitializer::toString).collect(Collectors.joining(", ")) + " }";
	}
}
