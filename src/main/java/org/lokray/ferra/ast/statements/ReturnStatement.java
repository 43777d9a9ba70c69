package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing a return statement.
 * Can optionally contain an expression to be returned.
 */
public class ReturnStatement implements Statement
{
	private final SourceSpan span;
	private final Expression value; // Can be null for a bare `return`

	public ReturnStatement(SourceSpan span, Expression value)
	{
		this.span = span;
		this.value = value;
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
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return value != null ? "return " + value : "return";
	}
}
