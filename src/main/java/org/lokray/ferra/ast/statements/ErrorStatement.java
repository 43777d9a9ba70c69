package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * Stands in for a region the parser skipped while recovering from a syntax error.
 * The span covers the skipped tokens.
 */
public class ErrorStatement implements Statement
{
	private final SourceSpan span;

	public ErrorStatement(SourceSpan span)
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
		return visitor.visitErrorStatement(this);
	}

	@Override
	public String toString()
	{
		return "(error-stmt)";
	}
}
