package org.lokray.ferra.lexer;

/**
 * A region of the source buffer. Offsets are UTF-8 byte offsets (end exclusive);
 * line and column are 1-based and refer to the first character of the region.
 */
public record SourceSpan(int start, int end, int line, int column)
{
	public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

	/**
	 * Returns a span covering this span through the end of {@code other}.
	 */
	public SourceSpan to(SourceSpan other)
	{
		if (other == null || other == NONE)
		{
			return this;
		}
		if (this == NONE)
		{
			return other;
		}
		return new SourceSpan(start, Math.max(end, other.end), line, column);
	}

	public int length()
	{
		return end - start;
	}

	@Override
	public String toString()
	{
		return line + ":" + column;
	}
}
