package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, a && b).
 * Contains a left-hand operand, an operator token, and a right-hand operand.
 */
public class BinaryExpression implements Expression
{
	private final SourceSpan span;
	private final Expression left;
	private final Token operator;
	private final Expression right;

	public BinaryExpression(SourceSpan span, Expression left, Token operator, Expression right)
	{
		this.span = span;
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public TokenType getOperatorType()
	{
		return operator.getType();
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getCanonicalText() + " " + right + ")";
	}
}
