package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing a 'break' statement.
 */
public class BreakStatement implements Statement
{
	private final SourceSpan span;

	public BreakStatement(SourceSpan span)
	{
		this.span = span;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBreakStatement(this);
	}

	@Override
	public String toString()
	{
		return "break";
	}
}
