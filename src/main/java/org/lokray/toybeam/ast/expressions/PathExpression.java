package org.lokray.toybeam.ast.expressions;

import org.lokray.toybeam.ast.ASTVisitor;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

/**
 * AST node representing {@code Type::member}: an enum variant, or a function of a runtime module.
 */
public class PathExpression implements Expression
{
	private final Token typeName;
	private final Token member;

	public PathExpression(Token typeName, Token member)
	{
		this.typeName = typeName;
		this.member = member;
	}

	public Token getTypeNameToken()
	{
		return typeName;
	}

	public String getTypeName()
	{
		return typeName.getLexeme();
	}

	public Token getMemberToken()
	{
		return member;
	}

	public String getMember()
	{
		return member.getLexeme();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitPathExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return typeName;
	}

	@Override
	public String toString()
	{
		return getTypeName() + "::" + getMember();
	}
}
