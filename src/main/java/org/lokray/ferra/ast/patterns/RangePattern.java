package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * {@code 1..=5} or {@code 'a'..'z'}; both bounds are literal patterns.
 */
public class RangePattern implements Pattern
{
	private final SourceSpan span;
	private final LiteralPattern low;
	private final LiteralPattern high;
	private final boolean inclusive;

	public RangePattern(SourceSpan span, LiteralPattern low, LiteralPattern high, boolean inclusive)
	{
		this.span = span;
		this.low = low;
		this.high = high;
		this.inclusive = inclusive;
	}

	public LiteralPattern getLow()
	{
		return low;
	}

	public LiteralPattern getHigh()
	{
		return high;
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
		return visitor.visitRangePattern(this);
	}

	@Override
	public String toString()
	{
		return low + (inclusive ? "..=" : "..") + high;
	}
}
