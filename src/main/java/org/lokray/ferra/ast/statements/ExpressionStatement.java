package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing a statement that consists solely of an expression
 * (e.g., `println("hi")`, `count += 1`, a match used for its effects).
 */
public class ExpressionStatement implements Statement
{
	private final SourceSpan span;
	private final Expression expression;

	public ExpressionStatement(SourceSpan span, Expression expression)
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
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression.toString();
	}
}
