package org.lokray.ferra.util;

import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.diagnostics.RecoveryAction;
import org.lokray.ferra.diagnostics.Severity;
import org.lokray.ferra.lexer.SourceSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorReporterTest
{
	private static SourceSpan at(int offset)
	{
		return new SourceSpan(offset, offset + 1, 1, offset + 1);
	}

	@Test
	@DisplayName("should hand out diagnostics ordered by position")
	void ordersByPosition()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.report(DiagnosticCode.E001, at(9), "late");
		reporter.report(DiagnosticCode.E003, at(2), "early");
		reporter.report(DiagnosticCode.E008, at(9), "late too");
		assertThat(reporter.getDiagnostics()).extracting(Diagnostic::getMessage)
				.containsExactly("early", "late", "late too");
	}

	@Test
	@DisplayName("should drop a second report of the same code at the same offset")
	void dropsDuplicates()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.report(DiagnosticCode.E001, at(3), "first");
		reporter.report(DiagnosticCode.E001, at(3), "second");
		assertThat(reporter.getDiagnostics()).extracting(Diagnostic::getMessage).containsExactly("first");
	}

	@Test
	@DisplayName("should roll back to a mark")
	void truncatesToMark()
	{
		ErrorReporter reporter = new ErrorReporter(2);
		reporter.report(DiagnosticCode.E001, at(0), "kept");
		int mark = reporter.mark();
		reporter.report(DiagnosticCode.E001, at(5), "discarded");
		assertThat(reporter.isLimitReached()).isTrue();
		reporter.truncate(mark);
		assertThat(reporter.size()).isEqualTo(1);
		assertThat(reporter.isLimitReached()).isFalse();
	}

	@Test
	@DisplayName("should stop collecting at the limit but keep fatal diagnostics")
	void limit()
	{
		ErrorReporter reporter = new ErrorReporter(1);
		reporter.report(DiagnosticCode.E001, at(0), "one");
		reporter.report(DiagnosticCode.E002, at(1), "two");
		assertThat(reporter.size()).isEqualTo(1);
		reporter.report(DiagnosticCode.L002, at(2), "fatal");
		assertThat(reporter.size()).isEqualTo(2);
		assertThat(reporter.hasFatal()).isTrue();
	}

	@Test
	@DisplayName("should tell warnings from errors")
	void severities()
	{
		ErrorReporter reporter = new ErrorReporter();
		assertThat(reporter.hasErrors()).isFalse();
		reporter.report(new Diagnostic(DiagnosticCode.E009, Severity.WARNING, at(0), "soft", null, RecoveryAction.SKIP_TOKEN));
		assertThat(reporter.hasErrors()).isFalse();
		reporter.report(DiagnosticCode.E009, at(4), "hard");
		assertThat(reporter.hasErrors()).isTrue();
		reporter.reset();
		assertThat(reporter.size()).isZero();
	}

	@Test
	@DisplayName("should fill in the default suggestion and recovery of a code")
	void defaults()
	{
		Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.E011, at(0), "Expected a block");
		assertThat(diagnostic.getSuggestion()).isEqualTo("Consider adding a block (either braced or indented)");
		assertThat(diagnostic.getRecovery()).isEqualTo(RecoveryAction.SKIP_TO_BLOCK_BOUNDARY);
		assertThat(diagnostic.getSeverity()).isEqualTo(Severity.ERROR);
		assertThat(DiagnosticCode.L004.isLexical()).isTrue();
		assertThat(DiagnosticCode.L004.getDefaultSeverity()).isEqualTo(Severity.FATAL);
	}

	@Test
	@DisplayName("should reject a negative limit")
	void negativeLimit()
	{
		assertThatThrownBy(() -> new ErrorReporter(-1)).isInstanceOf(IllegalArgumentException.class);
	}
}
