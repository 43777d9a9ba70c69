package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node for {@code start..end} and {@code start..=end}.
 */
public class RangeExpression implements Expression
{
	private final SourceSpan span;
	private final Expression start;
	private final Expression end;
	private final boolean inclusive;

	public RangeExpression(SourceSpan span, Expression start, Expression end, boolean inclusive)
	{
		this.span = span;
		this.start = start;
		this.end = end;
		this.inclusive = inclusive;
	}

	public Expression getStart()
	{
		return start;
	}

	public Expression getEnd()
	{
		return end;
	}

	public boolean isInclusive()
	{
		return inclusive;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRangeExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + start + (inclusive ? " ..= " : " .. ") + end + ")";
	}
}
