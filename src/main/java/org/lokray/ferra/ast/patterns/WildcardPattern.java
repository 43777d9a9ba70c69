package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

public class WildcardPattern implements Pattern
{
	private final SourceSpan span;

	public WildcardPattern(SourceSpan span)
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
		return visitor.visitWildcardPattern(this);
	}

	@Override
	public String toString()
	{
		return "_";
	}
}
