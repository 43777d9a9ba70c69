package org.lokray.ferra.parser;

import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;

/**
 * Unwinds the parser from a syntax error to the nearest statement boundary, or to the
 * boundary of the active trial parse. The diagnostic, if any, has already been reported.
 */
public class ParseException extends RuntimeException
{
	private final transient Token token;
	private final DiagnosticCode code;

	public ParseException(DiagnosticCode code, Token token, String message)
	{
		// Trial parses throw these as ordinary control flow; the stack trace is never read.
		super(message, null, false, false);
		this.code = code;
		this.token = token;
	}

	public Token getToken()
	{
		return token;
	}

	public DiagnosticCode getCode()
	{
		return code;
	}
}
