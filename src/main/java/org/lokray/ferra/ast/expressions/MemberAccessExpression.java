package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * AST node representing a member access expression (e.g., `point.x`, `response.json`).
 * It has a left-hand side expression and an identifier (or tuple index) for the member.
 */
public class MemberAccessExpression implements Expression
{
	private final SourceSpan span;
	private final Expression object;
	private final Token member;

	public MemberAccessExpression(SourceSpan span, Expression object, Token member)
	{
		this.span = span;
		this.object = object;
		this.member = member;
	}

	public Expression getObject()
	{
		return object;
	}

	public Token getMember()
	{
		return member;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMemberAccessExpression(this);
	}

	@Override
	public String toString()
	{
		// Example: (point.x) or ((a.b).c)
		return "(" + object + "." + member.getLexeme() + ")";
	}
}
