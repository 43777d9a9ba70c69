package org.lokray.ferra.diagnostics;

public enum Severity
{
	WARNING,
	ERROR,
	/**
	 * Aborts the whole pass; no AST is produced.
	 */
	FATAL;

	public String label()
	{
		return name().toLowerCase();
	}
}
