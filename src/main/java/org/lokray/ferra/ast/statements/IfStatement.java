package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node representing an if-else statement.
 * Contains a condition, a then-block, and an optional else-branch (a block or another if statement).
 */
public class IfStatement implements Statement
{
	private final SourceSpan span;
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final Statement elseBranch; // Can be null

	public IfStatement(SourceSpan span, Expression condition, BlockStatement thenBranch, Statement elseBranch)
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

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
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
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("if ").append(condition).append(' ').append(thenBranch);
		if (elseBranch != null)
		{
			sb.append(" else ").append(elseBranch);
		}
		return sb.toString();
	}
}
