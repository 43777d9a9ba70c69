package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.LiteralExpression;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * Matches a literal value. Numeric literals may carry a leading minus ({@code -1 => ...}).
 */
public class LiteralPattern implements Pattern
{
	private final SourceSpan span;
	private final Token literal;
	private final boolean negated;

	public LiteralPattern(SourceSpan span, Token literal, boolean negated)
	{
		this.span = span;
		this.literal = literal;
		this.negated = negated;
	}

	public Token getLiteral()
	{
		return literal;
	}

	public boolean isNegated()
	{
		return negated;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralPattern(this);
	}

	@Override
	public String toString()
	{
		return (negated ? "-" : "") + LiteralExpression.render(literal.getType(), literal.getLiteral());
	}
}
