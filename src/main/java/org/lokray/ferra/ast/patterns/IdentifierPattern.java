package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * Binds the matched value to a name.
 */
public class IdentifierPattern implements Pattern
{
	private final SourceSpan span;
	private final Token name;

	public IdentifierPattern(SourceSpan span, Token name)
	{
		this.span = span;
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierPattern(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
