package org.lokray.ferra.diagnostics;

/**
 * The catalog of diagnostics the front end can emit. Each code fixes its default severity,
 * its recovery action and a default suggestion.
 */
public enum DiagnosticCode
{
	// --- Syntactic and shared lexical codes ---
	E001("unexpected token", Severity.ERROR, RecoveryAction.SKIP_TO_STATEMENT,
			"Check for a missing operator, separator or closing delimiter"),
	E002("unterminated string", Severity.ERROR, RecoveryAction.SKIP_TO_QUOTE,
			"Close the literal with a matching quote on the same line"),
	E003("invalid indentation", Severity.ERROR, RecoveryAction.REALIGN_INDENT,
			"Indent with either tabs or spaces and align with an enclosing block"),
	E004("missing closing brace", Severity.ERROR, RecoveryAction.SKIP_TO_BLOCK_BOUNDARY,
			"Add a '}' to close the block, or use indentation for the whole block"),
	E005("invalid array literal", Severity.ERROR, RecoveryAction.SKIP_TO_BRACKET,
			"Separate elements with ',' and close the array with ']'"),
	E006("invalid tuple literal", Severity.ERROR, RecoveryAction.SKIP_TO_BRACKET,
			"Separate elements with ',' and close the tuple with ')'"),
	E007("invalid string interpolation", Severity.ERROR, RecoveryAction.SKIP_TO_QUOTE,
			"Put a single expression between '{' and '}' inside the string"),
	E008("invalid operator", Severity.ERROR, RecoveryAction.SKIP_TOKEN,
			"Add parentheses to make the grouping explicit"),
	E009("invalid identifier", Severity.ERROR, RecoveryAction.SKIP_TOKEN,
			"Identifiers start with a letter or '_' and cannot be reserved keywords"),
	E010("invalid numeric literal", Severity.ERROR, RecoveryAction.SKIP_TOKEN,
			"Use digits valid for the literal's radix, e.g. 0x1F, 0o17, 0b1010"),
	E011("expected block", Severity.ERROR, RecoveryAction.SKIP_TO_BLOCK_BOUNDARY,
			"Consider adding a block (either braced or indented)"),

	// --- Lexical-specific codes ---
	L001("invalid escape sequence", Severity.ERROR, RecoveryAction.SKIP_TOKEN,
			"Valid escapes are \\\\ \\\" \\' \\n \\r \\t \\0 and \\u{...}"),
	L002("unterminated block comment", Severity.FATAL, RecoveryAction.ABORT,
			"Close the comment with '*/'; block comments nest"),
	L003("invalid character literal", Severity.ERROR, RecoveryAction.SKIP_TOKEN,
			"A character literal holds exactly one character, e.g. 'a' or '\\n'"),
	L004("invalid encoding", Severity.FATAL, RecoveryAction.ABORT,
			"Save the file as UTF-8");

	private final String title;
	private final Severity defaultSeverity;
	private final RecoveryAction recovery;
	private final String defaultSuggestion;

	DiagnosticCode(String title, Severity defaultSeverity, RecoveryAction recovery, String defaultSuggestion)
	{
		this.title = title;
		this.defaultSeverity = defaultSeverity;
		this.recovery = recovery;
		this.defaultSuggestion = defaultSuggestion;
	}

	public String getTitle()
	{
		return title;
	}

	public Severity getDefaultSeverity()
	{
		return defaultSeverity;
	}

	public RecoveryAction getRecovery()
	{
		return recovery;
	}

	public String getDefaultSuggestion()
	{
		return defaultSuggestion;
	}

	public boolean isLexical()
	{
		return name().startsWith("L");
	}
}
