package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * AST node representing a bare name (e.g., `total`, `println`).
 */
public class IdentifierExpression implements Expression
{
	private final SourceSpan span;
	private final Token name;

	public IdentifierExpression(SourceSpan span, Token name)
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
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
