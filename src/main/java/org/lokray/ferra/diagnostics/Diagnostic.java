package org.lokray.ferra.diagnostics;

import org.lokray.ferra.lexer.SourceSpan;

import java.util.Objects;

/**
 * One problem found in the source. Diagnostics are produced once and never mutated.
 */
public final class Diagnostic
{
	private final DiagnosticCode code;
	private final Severity severity;
	private final SourceSpan span;
	private final String message;
	private final String suggestion;
	private final RecoveryAction recovery;

	public Diagnostic(DiagnosticCode code, Severity severity, SourceSpan span, String message, String suggestion, RecoveryAction recovery)
	{
		this.code = Objects.requireNonNull(code, "code");
		this.severity = Objects.requireNonNull(severity, "severity");
		this.span = Objects.requireNonNull(span, "span");
		this.message = Objects.requireNonNull(message, "message");
		this.suggestion = suggestion;
		this.recovery = Objects.requireNonNull(recovery, "recovery");
	}

	/**
	 * Creates a diagnostic with the code's default severity, suggestion and recovery action.
	 */
	public static Diagnostic of(DiagnosticCode code, SourceSpan span, String message)
	{
		return new Diagnostic(code, code.getDefaultSeverity(), span, message, code.getDefaultSuggestion(), code.getRecovery());
	}

	public static Diagnostic of(DiagnosticCode code, SourceSpan span, String message, String suggestion)
	{
		return new Diagnostic(code, code.getDefaultSeverity(), span, message, suggestion, code.getRecovery());
	}

	public DiagnosticCode getCode()
	{
		return code;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	public String getMessage()
	{
		return message;
	}

	/**
	 * Suggested-fix text, or null when none is defined.
	 */
	public String getSuggestion()
	{
		return suggestion;
	}

	public RecoveryAction getRecovery()
	{
		return recovery;
	}

	public boolean isFatal()
	{
		return severity == Severity.FATAL;
	}

	/**
	 * Renders the diagnostic as {@code name:line:col: error[E001]: message}, followed by the
	 * suggestion on its own line when there is one.
	 */
	public String format(String sourceName)
	{
		StringBuilder sb = new StringBuilder();
		sb.append(sourceName).append(':').append(span.line()).append(':').append(span.column()).append(": ")
				.append(severity.label()).append('[').append(code.name()).append("]: ").append(message);
		if (suggestion != null)
		{
			sb.append("\n  help: ").append(suggestion);
		}
		return sb.toString();
	}

	@Override
	public String toString()
	{
		return code + " at " + span + ": " + message;
	}
}
