package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * AST node representing a prefix unary operation (e.g., -x, !flag, +n).
 */
public class UnaryExpression implements Expression
{
	private final SourceSpan span;
	private final Token operator;
	private final Expression operand;

	public UnaryExpression(SourceSpan span, Token operator, Expression operand)
	{
		this.span = span;
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
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
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getCanonicalText() + operand + ")";
	}
}
