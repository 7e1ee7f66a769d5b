package org.lokray.toybeam.ast.items;

import org.lokray.toybeam.ast.ASTNode;
import org.lokray.toybeam.ast.Attribute;
import org.lokray.toybeam.lexer.Token;

import java.util.List;

/**
 * A top-level declaration inside a module: a function, a struct or an enum.
 */
public interface Item extends ASTNode
{
	Token getNameToken();

	default String getName()
	{
		return getNameToken().getLexeme();
	}

	boolean isPublic();

	List<Attribute> getAttributes();

	List<Token> getTypeParameters();
}
