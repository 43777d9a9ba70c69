package org.lokray.ferra;

import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.Severity;
import org.lokray.ferra.lexer.TerminatorResolver;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of one front-end pass over a source buffer: the AST, the diagnostics ordered by
 * source position and the token stream.
 */
public class ParseResult
{
	private final String sourceName;
	private final CompilationUnit compilationUnit;
	private final List<Diagnostic> diagnostics;
	private final List<Token> tokens;
	private final TerminatorResolver resolver;
	private final boolean aborted;
	private final boolean truncated;
	private final int nodeCount;

	ParseResult(String sourceName, CompilationUnit compilationUnit, List<Diagnostic> diagnostics, List<Token> tokens,
				TerminatorResolver resolver, boolean aborted, boolean truncated, int nodeCount)
	{
		this.sourceName = sourceName;
		this.compilationUnit = compilationUnit;
		this.diagnostics = List.copyOf(diagnostics);
		this.tokens = List.copyOf(tokens);
		this.resolver = resolver;
		this.aborted = aborted;
		this.truncated = truncated;
		this.nodeCount = nodeCount;
	}

	public String getSourceName()
	{
		return sourceName;
	}

	/**
	 * @return The AST, or null if the pass was aborted or only tokenized the input.
	 */
	public CompilationUnit getCompilationUnit()
	{
		return compilationUnit;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	/**
	 * @return True if the NEWLINE token at the given index of {@link #getTokens()} ends a statement.
	 */
	public boolean isTerminator(int index)
	{
		if (index < 0 || index >= tokens.size())
		{
			throw new IndexOutOfBoundsException("Token index " + index + " out of range (" + tokens.size() + " tokens)");
		}
		return resolver != null && tokens.get(index).getType() == TokenType.NEWLINE && resolver.isTerminator(index);
	}

	/**
	 * @return True if the given token from {@link #getTokens()} is a NEWLINE that ends a statement.
	 */
	public boolean isTerminator(Token token)
	{
		for (int i = 0; i < tokens.size(); i++)
		{
			if (tokens.get(i) == token)
			{
				return isTerminator(i);
			}
		}
		throw new IllegalArgumentException("Token " + token + " is not part of this result");
	}

	/**
	 * @return True if a fatal diagnostic stopped the pass; there is no AST then.
	 */
	public boolean isAborted()
	{
		return aborted;
	}

	/**
	 * @return True if the pass stopped early because the diagnostic limit was reached.
	 */
	public boolean isTruncated()
	{
		return truncated;
	}

	/**
	 * @return The number of AST nodes allocated for the final tree.
	 */
	public int getNodeCount()
	{
		return nodeCount;
	}

	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(d -> d.getSeverity() != Severity.WARNING);
	}

	/**
	 * Renders every diagnostic as {@code name:line:col: error[E001]: message}.
	 */
	public List<String> formatDiagnostics()
	{
		return diagnostics.stream().map(d -> d.format(sourceName)).collect(Collectors.toList());
	}
}
