package org.lokray.ferra.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indented trace output for the parser, written to the {@code org.lokray.ferra.trace} logger
 * at trace level. Switched on by {@code debug.trace=true} or by enabling trace on that logger.
 */
public class Debug
{
	private static final Logger log = LoggerFactory.getLogger("org.lokray.ferra.trace");

	private static volatile boolean forced = false;

	// Each parse runs on one thread; keep the nesting per thread.
	private static final ThreadLocal<Integer> indentLevel = ThreadLocal.withInitial(() -> 0);

	private Debug()
	{
	}

	public static void setEnabled(boolean enabled)
	{
		forced = enabled;
	}

	public static boolean isEnabled()
	{
		return forced || log.isTraceEnabled();
	}

	/**
	 * Logs a formatted message if tracing is enabled.
	 *
	 * @param format The message format string (e.g., "Found var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (isEnabled())
		{
			String indent = "  ".repeat(indentLevel.get());
			String message = indent + String.format(format, args);
			if (log.isTraceEnabled())
			{
				log.trace(message);
			}
			else
			{
				log.debug(message);
			}
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (isEnabled())
		{
			indentLevel.set(indentLevel.get() + 1);
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (isEnabled())
		{
			indentLevel.set(Math.max(0, indentLevel.get() - 1));
		}
	}

	/**
	 * Drops the nesting left behind by a parse that unwound early.
	 */
	public static void resetIndent()
	{
		indentLevel.set(0);
	}
}
