package org.lokray.ferra.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The active indentation levels of the lines scanned so far. Widths strictly increase from
 * bottom to top; the bottom level (width 0) is never popped.
 * <p>
 * A level is <em>silent</em> when it records the indentation of a brace-delimited body. Silent
 * levels are pushed and popped without INDENT/DEDENT tokens, since the braces already delimit
 * the block.
 */
public class IndentationStack
{
	/**
	 * Which characters make up an indentation run.
	 */
	public enum WhitespaceKind
	{
		NONE, SPACES, TABS, MIXED;

		public static WhitespaceKind of(boolean sawTab, boolean sawSpace)
		{
			if (sawTab && sawSpace)
			{
				return MIXED;
			}
			if (sawTab)
			{
				return TABS;
			}
			return sawSpace ? SPACES : NONE;
		}

		/**
		 * Two runs conflict when one is all tabs and the other all spaces.
		 */
		public boolean conflictsWith(WhitespaceKind other)
		{
			return (this == SPACES && other == TABS) || (this == TABS && other == SPACES);
		}
	}

	public record Level(int width, WhitespaceKind kind, boolean silent)
	{
	}

	private final Deque<Level> levels = new ArrayDeque<>();
	private int misalignedWidth = -1; // a width already reported as matching no level

	public IndentationStack()
	{
		levels.push(new Level(0, WhitespaceKind.NONE, false));
	}

	public Level top()
	{
		return levels.peek();
	}

	/**
	 * @return The number of levels, including the bottom one.
	 */
	public int depth()
	{
		return levels.size();
	}

	public void push(int width, WhitespaceKind kind, boolean silent)
	{
		if (width <= top().width())
		{
			throw new IllegalStateException("Indentation width " + width + " does not exceed the current level " + top().width());
		}
		levels.push(new Level(width, kind, silent));
		misalignedWidth = -1;
	}

	public Level pop()
	{
		if (levels.size() == 1)
		{
			throw new IllegalStateException("The outermost indentation level cannot be popped");
		}
		misalignedWidth = -1;
		return levels.pop();
	}

	/**
	 * Remembers a width that was reported as misaligned so further lines at the same width are
	 * treated as belonging to the current level instead of being reported again.
	 */
	public void alias(int width)
	{
		misalignedWidth = width;
	}

	public boolean isAlias(int width)
	{
		return width == misalignedWidth;
	}

	/**
	 * The active widths from bottom to top.
	 */
	public List<Integer> widths()
	{
		List<Integer> widths = new ArrayList<>();
		Iterator<Level> it = levels.descendingIterator();
		while (it.hasNext())
		{
			widths.add(it.next().width());
		}
		return widths;
	}

	@Override
	public String toString()
	{
		return widths().toString();
	}
}
