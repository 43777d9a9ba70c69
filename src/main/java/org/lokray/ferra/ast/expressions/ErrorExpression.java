package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * Placeholder for an expression that failed to parse. When part of the input could still be read
 * (a rejected comparison chain, the elements before a missing bracket) it is kept as {@code partial}.
 */
public class ErrorExpression implements Expression
{
	private final SourceSpan span;
	private final Expression partial; // may be null

	public ErrorExpression(SourceSpan span, Expression partial)
	{
		this.span = span;
		this.partial = partial;
	}

	public Expression getPartial()
	{
		return partial;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitErrorExpression(this);
	}

	@Override
	public String toString()
	{
		return partial != null ? "(error " + partial + ")" : "(error)";
	}
}
