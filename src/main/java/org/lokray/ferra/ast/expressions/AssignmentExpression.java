package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * AST node representing an assignment (e.g., `x = 10`, `total += n`).
 * Assignments only appear in statement position; they are right-associative.
 */
public class AssignmentExpression implements Expression
{
	private final SourceSpan span;
	private final Expression target; // The left-hand side of the assignment
	private final Token operator; // '=' or one of the compound assignment operators
	private final Expression value; // The right-hand side of the assignment

	public AssignmentExpression(SourceSpan span, Expression target, Token operator, Expression value)
	{
		this.span = span;
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + target + " " + operator.getCanonicalText() + " " + value + ")";
	}
}
