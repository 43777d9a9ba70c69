package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for {@code match scrutinee { arms }} in either block style.
 */
public class MatchExpression implements Expression
{
	private final SourceSpan span;
	private final Expression scrutinee;
	private final List<MatchArm> arms;

	public MatchExpression(SourceSpan span, Expression scrutinee, List<MatchArm> arms)
	{
		this.span = span;
		this.scrutinee = scrutinee;
		this.arms = List.copyOf(arms);
	}

	public Expression getScrutinee()
	{
		return scrutinee;
	}

	public List<MatchArm> getArms()
	{
		return arms;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMatchExpression(this);
	}

	@Override
	public String toString()
	{
		return "(match " + scrutinee + " { " + arms.stream().map(Object::toString).collect(Collectors.joining(", ")) + " })";
	}
}
