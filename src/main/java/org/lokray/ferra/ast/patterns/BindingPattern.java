package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * {@code name @ pattern}: matches the inner pattern and binds the whole value to {@code name}.
 */
public class BindingPattern implements Pattern
{
	private final SourceSpan span;
	private final Token name;
	private final Pattern pattern;

	public BindingPattern(SourceSpan span, Token name, Pattern pattern)
	{
		this.span = span;
		this.name = name;
		this.pattern = pattern;
	}

	public Token getName()
	{
		return name;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBindingPattern(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + " @ " + pattern;
	}
}
