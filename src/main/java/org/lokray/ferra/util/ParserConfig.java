package org.lokray.ferra.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Holds configuration settings for the Ferra front end, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class ParserConfig
{
	private static final Logger log = LoggerFactory.getLogger(ParserConfig.class);

	public static final String RESOURCE_NAME = "ferra-parser.properties";

	public static final String TAB_WIDTH = "lexer.tabWidth";
	public static final String MAX_DIAGNOSTICS = "diagnostics.max";
	public static final String GLR_LOOKAHEAD_LIMIT = "glr.lookaheadLimit";
	public static final String DEBUG_TRACE = "debug.trace";

	private final int tabWidth;
	private final int maxDiagnostics;
	private final int glrLookaheadLimit;
	private final boolean traceEnabled;

	public ParserConfig(Properties props)
	{
		this.tabWidth = intProperty(props, TAB_WIDTH, "4", 1);
		this.maxDiagnostics = intProperty(props, MAX_DIAGNOSTICS, "0", 0);
		this.glrLookaheadLimit = intProperty(props, GLR_LOOKAHEAD_LIMIT, "64", 2);
		this.traceEnabled = Boolean.parseBoolean(props.getProperty(DEBUG_TRACE, "false"));
	}

	/**
	 * A configuration where every setting has its default value.
	 */
	public static ParserConfig defaults()
	{
		return new ParserConfig(new Properties());
	}

	/**
	 * Loads {@value #RESOURCE_NAME} from the classpath, if present, and lets system properties
	 * with the same keys override it.
	 */
	public static ParserConfig load()
	{
		Properties props = new Properties();
		try (InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
		{
			if (in != null)
			{
				props.load(in);
				log.debug("Loaded {} from the classpath", RESOURCE_NAME);
			}
			else
			{
				log.debug("{} not found on the classpath, using defaults", RESOURCE_NAME);
			}
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Could not read " + RESOURCE_NAME, e);
		}
		for (String key : new String[]{TAB_WIDTH, MAX_DIAGNOSTICS, GLR_LOOKAHEAD_LIMIT, DEBUG_TRACE})
		{
			String override = System.getProperty(key);
			if (override != null)
			{
				props.setProperty(key, override);
			}
		}
		return new ParserConfig(props);
	}

	private static int intProperty(Properties props, String key, String defaultValue, int minimum)
	{
		String raw = props.getProperty(key, defaultValue).trim();
		int value;
		try
		{
			value = Integer.parseInt(raw);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Property '" + key + "' must be an integer, got '" + raw + "'", e);
		}
		if (value < minimum)
		{
			throw new IllegalArgumentException("Property '" + key + "' must be at least " + minimum + ", got " + value);
		}
		return value;
	}

	public int getTabWidth()
	{
		return tabWidth;
	}

	/**
	 * @return The diagnostic count after which the pass halts, or 0 for no limit.
	 */
	public int getMaxDiagnostics()
	{
		return maxDiagnostics;
	}

	public int getGlrLookaheadLimit()
	{
		return glrLookaheadLimit;
	}

	public boolean isTraceEnabled()
	{
		return traceEnabled;
	}
}
