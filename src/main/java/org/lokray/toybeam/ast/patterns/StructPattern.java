package org.lokray.toybeam.ast.patterns;

import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches a struct value; every declared field must be listed, in any order.
 */
public class StructPattern implements Pattern
{
	private final Token typeName;
	private final List<FieldPattern> fields;

	public StructPattern(Token typeName, List<FieldPattern> fields)
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

	public List<FieldPattern> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	@Override
	public <R> R accept(PatternVisitor<R> visitor) throws CompileException
	{
		return visitor.visitStructPattern(this);
	}

	@Override
	public Token getFirstToken()
	{
		return typeName;
	}

	@Override
	public String toString()
	{
		return getTypeName() + " { " + fields.stream().map(Object::toString).collect(Collectors.joining(", ")) + " }";
	}
}
