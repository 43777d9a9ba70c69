package org.lokray.ferra.lexer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Tracks the unclosed {@code (}, {@code [} and {@code {} openers in scanning order.
 * Braces come in two flavours: a block brace delimits statements, so newlines directly inside it
 * still separate statements; a delimiter brace (a macro body, an import group) behaves like a
 * parenthesis.
 */
public class DelimiterDepthCounters
{
	public enum Kind
	{
		PAREN, BRACKET, BLOCK_BRACE, DELIMITER_BRACE;

		public boolean isExpressionDelimiter()
		{
			return this != BLOCK_BRACE;
		}
	}

	private final Deque<Kind> open = new ArrayDeque<>();
	private final int[] counts = new int[Kind.values().length];

	public void open(Kind kind)
	{
		open.push(kind);
		counts[kind.ordinal()]++;
	}

	/**
	 * Closes the innermost opener matching the closer. A closer with no matching opener is ignored;
	 * a closer that skips over unmatched openers closes them as well.
	 *
	 * @return The kind that was closed, or null for a stray closer.
	 */
	public Kind close(TokenType closer)
	{
		if (!contains(closer))
		{
			return null;
		}
		while (!open.isEmpty())
		{
			Kind kind = open.pop();
			counts[kind.ordinal()]--;
			if (matches(kind, closer))
			{
				return kind;
			}
		}
		return null;
	}

	private boolean contains(TokenType closer)
	{
		for (Kind kind : open)
		{
			if (matches(kind, closer))
			{
				return true;
			}
		}
		return false;
	}

	private static boolean matches(Kind kind, TokenType closer)
	{
		switch (closer)
		{
			case RIGHT_PAREN:
				return kind == Kind.PAREN;
			case RIGHT_BRACKET:
				return kind == Kind.BRACKET;
			case RIGHT_BRACE:
				return kind == Kind.BLOCK_BRACE || kind == Kind.DELIMITER_BRACE;
			default:
				return false;
		}
	}

	/**
	 * @return The innermost unclosed opener, or null when nothing is open.
	 */
	public Kind innermost()
	{
		return open.peek();
	}

	public int depth(Kind kind)
	{
		return counts[kind.ordinal()];
	}

	public boolean isEmpty()
	{
		return open.isEmpty();
	}

	/**
	 * True when the innermost opener is a parenthesis, bracket or delimiter brace.
	 */
	public boolean insideExpressionDelimiter()
	{
		Kind kind = open.peek();
		return kind != null && kind.isExpressionDelimiter();
	}

	public boolean hasOpenParenOrBracket()
	{
		return depth(Kind.PAREN) + depth(Kind.BRACKET) > 0;
	}

	/**
	 * Forgets every expression delimiter above the innermost block brace.
	 *
	 * @return How many openers were dropped.
	 */
	public int abandonExpressionDelimiters()
	{
		int dropped = 0;
		while (!open.isEmpty() && open.peek().isExpressionDelimiter())
		{
			counts[open.pop().ordinal()]--;
			dropped++;
		}
		return dropped;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("[");
		Iterator<Kind> it = open.descendingIterator();
		while (it.hasNext())
		{
			sb.append(it.next());
			if (it.hasNext())
			{
				sb.append(", ");
			}
		}
		return sb.append(']').toString();
	}
}
