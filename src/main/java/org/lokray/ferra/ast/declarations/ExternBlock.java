package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST node for a block of foreign declarations, {@code extern "C" { ... }}.
 * The items are {@link ExternFunction} and {@link ExternVariable} nodes.
 */
public class ExternBlock extends AbstractDeclaration
{
	private final String abi; // null when no ABI string was given
	private final List<Declaration> items;

	public ExternBlock(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, String abi, List<Declaration> items)
	{
		super(span, attributes, modifiers);
		this.abi = abi;
		this.items = List.copyOf(items);
	}

	public String getAbi()
	{
		return abi;
	}

	public List<Declaration> getItems()
	{
		return items;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExternBlock(this);
	}

	@Override
	public String toString()
	{
		return prefix() + "extern " + (abi != null ? "\"" + abi + "\" " : "")
				+ "{ " + items.stream().map(item -> item + "; ").collect(Collectors.joining()) + "}";
	}
}
