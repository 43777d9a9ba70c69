package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing an index access (e.g., `items[0]`, `grid[i][j]`).
 */
public class IndexExpression implements Expression
{
	private final SourceSpan span;
	private final Expression target;
	private final Expression index;

	public IndexExpression(SourceSpan span, Expression target, Expression index)
	{
		this.span = span;
		this.target = target;
		this.index = index;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIndexExpression(this);
	}

	@Override
	public String toString()
	{
		return target + "[" + index + "]";
	}
}
