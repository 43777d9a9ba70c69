package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing a while loop.
 */
public class WhileStatement implements Statement
{
	private final SourceSpan span;
	private final Expression condition;
	private final BlockStatement body;

	public WhileStatement(SourceSpan span, Expression condition, BlockStatement body)
	{
		this.span = span;
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "while " + condition + " " + body;
	}
}
