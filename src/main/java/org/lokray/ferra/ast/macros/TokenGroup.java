package org.lokray.ferra.ast.macros;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;

/**
 * A delimited sequence of token trees: {@code ( ... )}, {@code [ ... ]} or {@code { ... }}.
 * Groups nest, so a macro body containing further invocations is a tree, never a linked structure.
 */
public class TokenGroup implements TokenTree
{
	private final SourceSpan span;
	private final GroupDelimiter delimiter;
	private final List<TokenTree> trees;

	public TokenGroup(SourceSpan span, GroupDelimiter delimiter, List<TokenTree> trees)
	{
		this.span = span;
		this.delimiter = delimiter;
		this.trees = List.copyOf(trees);
	}

	public GroupDelimiter getDelimiter()
	{
		return delimiter;
	}

	public List<TokenTree> getTrees()
	{
		return trees;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTokenGroup(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(delimiter.getOpenText());
		for (TokenTree tree : trees)
		{
			sb.append(' ').append(tree);
		}
		return sb.append(' ').append(delimiter.getCloseText()).toString();
	}
}
