package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node for {@code if} used as a value. Unlike the statement form the else branch is mandatory;
 * it is either a {@link BlockExpression} or another {@code IfExpression}.
 */
public class IfExpression implements Expression
{
	private final SourceSpan span;
	private final Expression condition;
	private final BlockExpression thenBranch;
	private final Expression elseBranch;

	public IfExpression(SourceSpan span, Expression condition, BlockExpression thenBranch, Expression elseBranch)
	{
		this.span = span;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockExpression getThenBranch()
	{
		return thenBranch;
	}

	public Expression getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfExpression(this);
	}

	@Override
	public String toString()
	{
		return "(if " + condition + " then " + thenBranch + " else " + elseBranch + ")";
	}
}
