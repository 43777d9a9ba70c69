package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing an expression enclosed in parentheses (e.g., `(a + b)`).
 */
public class GroupingExpression implements Expression
{
	private final SourceSpan span;
	private final Expression expression;

	public GroupingExpression(SourceSpan span, Expression expression)
	{
		this.span = span;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public String toString()
	{
		return "(group " + expression + ")";
	}
}
