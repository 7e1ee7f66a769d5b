package org.lokray.toybeam.ast;

import org.lokray.toybeam.ast.items.Item;
import org.lokray.toybeam.exception.CompileException;
import org.lokray.toybeam.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node: one {@code mod name { ... }} wrapper and the items it declares, in source order.
 */
public class ModuleDeclaration implements ASTNode
{
	private final Token modKeyword;
	private final Token name;
	private final List<Item> items;

	public ModuleDeclaration(Token modKeyword, Token name, List<Item> items)
	{
		this.modKeyword = modKeyword;
		this.name = name;
		this.items = new ArrayList<>(items);
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public List<Item> getItems()
	{
		return Collections.unmodifiableList(items);
	}

	/**
	 * Returns a copy of this module that keeps only the given items.
	 */
	public ModuleDeclaration withItems(List<Item> keptItems)
	{
		return new ModuleDeclaration(modKeyword, name, keptItems);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor) throws CompileException
	{
		return visitor.visitModule(this);
	}

	@Override
	public Token getFirstToken()
	{
		return modKeyword;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("mod ").append(getName()).append(" {\n");
		for (Item item : items)
		{
			sb.append(item).append("\n");
		}
		return sb.append("}").toString();
	}
}
