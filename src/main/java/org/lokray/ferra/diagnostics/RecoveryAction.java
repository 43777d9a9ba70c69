package org.lokray.ferra.diagnostics;

/**
 * How the scanner or parser resumed after reporting a diagnostic.
 */
public enum RecoveryAction
{
	/** Skip tokens up to the start of the next statement. */
	SKIP_TO_STATEMENT,
	/** Resume after the next quote or at the end of the line. */
	SKIP_TO_QUOTE,
	/** Treat the offending line as aligned with the nearest enclosing level. */
	REALIGN_INDENT,
	/** Close the current block at the next block boundary. */
	SKIP_TO_BLOCK_BOUNDARY,
	/** Skip to the closing bracket, or stop at the statement boundary when there is none. */
	SKIP_TO_BRACKET,
	/** Drop the offending token. */
	SKIP_TOKEN,
	/** The pass cannot continue. */
	ABORT
}
