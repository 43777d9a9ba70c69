package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * The {@code ..} element of a slice pattern, matching any number of elements.
 */
public class RestPattern implements Pattern
{
	private final SourceSpan span;

	public RestPattern(SourceSpan span)
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
		return visitor.visitRestPattern(this);
	}

	@Override
	public String toString()
	{
		return "..";
	}
}
