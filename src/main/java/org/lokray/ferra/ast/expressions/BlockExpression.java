package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * A block used in expression position: the branches of an if-expression and block-bodied match arms.
 */
public class BlockExpression implements Expression
{
	private final SourceSpan span;
	private final BlockStatement block;

	public BlockExpression(SourceSpan span, BlockStatement block)
	{
		this.span = span;
		this.block = block;
	}

	public BlockStatement getBlock()
	{
		return block;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockExpression(this);
	}

	@Override
	public String toString()
	{
		return block.toString();
	}
}
