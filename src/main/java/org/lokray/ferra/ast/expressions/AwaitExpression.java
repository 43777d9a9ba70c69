package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node for the postfix {@code expr.await}.
 */
public class AwaitExpression implements Expression
{
	private final SourceSpan span;
	private final Expression operand;

	public AwaitExpression(SourceSpan span, Expression operand)
	{
		this.span = span;
		this.operand = operand;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAwaitExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operand + ".await)";
	}
}
