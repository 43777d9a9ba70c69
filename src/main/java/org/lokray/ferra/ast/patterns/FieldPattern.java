package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * One field of a data-class pattern: {@code y: 0}, or the shorthand {@code x} which binds the field to a
 * variable of the same name.
 */
public class FieldPattern implements ASTNode
{
	private final SourceSpan span;
	private final Token name;
	private final Pattern pattern; // null for the shorthand form

	public FieldPattern(SourceSpan span, Token name, Pattern pattern)
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

	public boolean isShorthand()
	{
		return pattern == null;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldPattern(this);
	}

	@Override
	public String toString()
	{
		return pattern == null ? name.getLexeme() : name.getLexeme() + ": " + pattern;
	}
}
