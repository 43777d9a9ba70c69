package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;

/**
 * AST node representing a block of statements, written either as `{ ... }` or as an indented block.
 * The style is recorded for tooling but is not part of the node's structure, so the same
 * statements in either style render identically. A standalone block may be marked
 * {@code unsafe} or {@code async}.
 */
public class BlockStatement implements Statement
{
	private final SourceSpan span;
	private final List<Statement> statements;
	private final BlockStyle style;
	private final boolean unsafe;
	private final boolean async;

	public BlockStatement(SourceSpan span, List<Statement> statements, BlockStyle style)
	{
		this(span, statements, style, false, false);
	}

	public BlockStatement(SourceSpan span, List<Statement> statements, BlockStyle style, boolean unsafe, boolean async)
	{
		this.span = span;
		this.statements = List.copyOf(statements);
		this.style = style;
		this.unsafe = unsafe;
		this.async = async;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public BlockStyle getStyle()
	{
		return style;
	}

	public boolean isUnsafe()
	{
		return unsafe;
	}

	public boolean isAsync()
	{
		return async;
	}

	/**
	 * @return The keywords in front of the block, e.g. "unsafe async", or an empty string.
	 */
	public String getMarkers()
	{
		if (unsafe && async)
		{
			return "unsafe async";
		}
		return unsafe ? "unsafe" : (async ? "async" : "");
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (unsafe || async)
		{
			sb.append(getMarkers()).append(' ');
		}
		sb.append("{ ");
		for (Statement statement : statements)
		{
			sb.append(statement).append("; ");
		}
		return sb.append('}').toString();
	}
}
