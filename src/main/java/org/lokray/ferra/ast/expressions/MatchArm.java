package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.patterns.Pattern;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * One arm of a match expression: {@code pattern (if guard)? => body}.
 */
public class MatchArm implements ASTNode
{
	private final SourceSpan span;
	private final Pattern pattern;
	private final Expression guard; // may be null
	private final Expression body;

	public MatchArm(SourceSpan span, Pattern pattern, Expression guard, Expression body)
	{
		this.span = span;
		this.pattern = pattern;
		this.guard = guard;
		this.body = body;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public Expression getBody()
	{
		return body;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMatchArm(this);
	}

	@Override
	public String toString()
	{
		return pattern + (guard != null ? " if " + guard : "") + " => " + body;
	}
}
