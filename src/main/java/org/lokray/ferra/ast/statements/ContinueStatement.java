package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

public class ContinueStatement implements Statement
{
	private final SourceSpan span;

	public ContinueStatement(SourceSpan span)
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
		return visitor.visitContinueStatement(this);
	}

	@Override
	public String toString()
	{
		return "continue";
	}
}
