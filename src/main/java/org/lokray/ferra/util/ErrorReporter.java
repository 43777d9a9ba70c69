package org.lokray.ferra.util;

import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.diagnostics.Severity;
import org.lokray.ferra.lexer.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the diagnostics of one parse invocation.
 * Lexer and parser report into the same instance; the collected list is handed out
 * ordered by source position. The reporter can be rolled back to a mark so a
 * discarded trial parse leaves no diagnostics behind.
 */
public class ErrorReporter
{
	private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final int maxDiagnostics; // 0 means unlimited
	private boolean limitReached = false;

	public ErrorReporter()
	{
		this(0);
	}

	/**
	 * @param maxDiagnostics Number of diagnostics after which the driver should halt, or 0 for no limit.
	 */
	public ErrorReporter(int maxDiagnostics)
	{
		if (maxDiagnostics < 0)
		{
			throw new IllegalArgumentException("maxDiagnostics must not be negative: " + maxDiagnostics);
		}
		this.maxDiagnostics = maxDiagnostics;
	}

	/**
	 * Reports a diagnostic. A second report with the same code at the same offset is dropped,
	 * since it describes the same root cause.
	 *
	 * @param diagnostic The diagnostic to record.
	 */
	public void report(Diagnostic diagnostic)
	{
		if (limitReached && !diagnostic.isFatal())
		{
			return;
		}
		for (Diagnostic existing : diagnostics)
		{
			if (existing.getCode() == diagnostic.getCode() && existing.getSpan().start() == diagnostic.getSpan().start())
			{
				log.debug("Dropping duplicate {} at {}", diagnostic.getCode(), diagnostic.getSpan());
				return;
			}
		}
		diagnostics.add(diagnostic);
		log.debug("[{}] {}: {}", diagnostic.getCode(), diagnostic.getSpan(), diagnostic.getMessage());
		if (maxDiagnostics > 0 && diagnostics.size() >= maxDiagnostics)
		{
			limitReached = true;
		}
	}

	public void report(DiagnosticCode code, SourceSpan span, String message)
	{
		report(Diagnostic.of(code, span, message));
	}

	public void report(DiagnosticCode code, SourceSpan span, String message, String suggestion)
	{
		report(Diagnostic.of(code, span, message, suggestion));
	}

	/**
	 * @return A position that {@link #truncate(int)} can roll back to.
	 */
	public int mark()
	{
		return diagnostics.size();
	}

	/**
	 * Discards every diagnostic reported after the given mark.
	 */
	public void truncate(int mark)
	{
		while (diagnostics.size() > mark)
		{
			diagnostics.remove(diagnostics.size() - 1);
		}
		limitReached = maxDiagnostics > 0 && diagnostics.size() >= maxDiagnostics;
	}

	/**
	 * The collected diagnostics ordered by source position; diagnostics at the same
	 * position keep the order in which they were reported.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		List<Diagnostic> sorted = new ArrayList<>(diagnostics);
		sorted.sort(Comparator.comparingInt(d -> d.getSpan().start()));
		return Collections.unmodifiableList(sorted);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if at least one diagnostic of severity ERROR or FATAL exists.
	 */
	public boolean hasErrors()
	{
		for (Diagnostic diagnostic : diagnostics)
		{
			if (diagnostic.getSeverity() != Severity.WARNING)
			{
				return true;
			}
		}
		return false;
	}

	public boolean hasFatal()
	{
		for (Diagnostic diagnostic : diagnostics)
		{
			if (diagnostic.isFatal())
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @return True once the configured maximum number of diagnostics has been collected.
	 */
	public boolean isLimitReached()
	{
		return limitReached;
	}

	public int size()
	{
		return diagnostics.size();
	}

	/**
	 * Clears every collected diagnostic.
	 */
	public void reset()
	{
		diagnostics.clear();
		limitReached = false;
	}
}
