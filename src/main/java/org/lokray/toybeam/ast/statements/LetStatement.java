package org.lokray.toybeam.ast.statements;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.ast.expressions.Expression;
import org.lokray.toybeam.ast.patterns.Pattern;
import org.lokray.toybeam.ast.types.TypeAnnotation;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing a binding: `LET MUT? PATTERN ( : TYPE )? = EXPRESSION ;`
 * The bound names scope over the remainder of the enclosing block.
 */
public class LetStatement implements Statement
{
	private final Token letKeyword;
	private final boolean mutable;
	private final Pattern pattern;
	private final TypeAnnotation type; // null when omitted
	private final Expression value;

	public LetStatement(Token letKeyword, boolean mutable, Pattern pattern, TypeAnnotation type, Expression value)
	{
		this.letKeyword = letKeyword;
		this.mutable = mutable;
		this.pattern = pattern;
		this.type = type;
		this.value = value;
	}

	public boolean isMutable()
	{
		return mutable;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public TypeAnnotation getType()
	{
		return type;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitLetStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return letKeyword;
	}

	@Override
	public String toString()
	{
		return "let " + (mutable ? "mut " : "") + pattern + (type != null ? ": " + type : "") + " = " + value + ";";
	}
}
