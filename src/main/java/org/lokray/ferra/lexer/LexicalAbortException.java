package org.lokray.ferra.lexer;

import org.lokray.ferra.diagnostics.Diagnostic;

/**
 * Thrown by the lexer for conditions that leave nothing to recover to, such as an unterminated
 * block comment. The diagnostic has already been reported when this is thrown.
 */
public class LexicalAbortException extends RuntimeException
{
	private final transient Diagnostic diagnostic;

	public LexicalAbortException(Diagnostic diagnostic)
	{
		super(diagnostic.getMessage());
		this.diagnostic = diagnostic;
	}

	public Diagnostic getDiagnostic()
	{
		return diagnostic;
	}
}
