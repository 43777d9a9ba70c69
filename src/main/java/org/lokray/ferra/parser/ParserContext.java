package org.lokray.ferra.parser;

import org.lokray.ferra.util.ErrorReporter;
import org.lokray.ferra.util.ParserConfig;

/**
 * The state shared by the sub-parsers of one parse: the token cursor, the node arena, the
 * diagnostics and the trial-parse depth. It also wires the sub-parsers to each other.
 */
public class ParserContext
{
	/**
	 * Everything a trial parse must restore when its branch is discarded.
	 */
	public record Snapshot(TokenCursor.Checkpoint cursor, int arenaMark, int diagnosticMark)
	{
	}

	private final TokenCursor cursor;
	private final AstArena arena;
	private final ErrorReporter reporter;
	private final ParserConfig config;
	private int trialDepth = 0;
	private boolean truncated = false;

	private final ExpressionParser expressions;
	private final StatementParser statements;
	private final DeclarationParser declarations;
	private final TypeParser types;
	private final PatternParser patterns;
	private final MacroParser macros;
	private final GenericDisambiguator disambiguator;

	public ParserContext(TokenCursor cursor, AstArena arena, ErrorReporter reporter, ParserConfig config)
	{
		this.cursor = cursor;
		this.arena = arena;
		this.reporter = reporter;
		this.config = config;
		this.expressions = new ExpressionParser(this);
		this.statements = new StatementParser(this);
		this.declarations = new DeclarationParser(this);
		this.types = new TypeParser(this);
		this.patterns = new PatternParser(this);
		this.macros = new MacroParser(this);
		this.disambiguator = new GenericDisambiguator(this);
	}

	public Snapshot snapshot()
	{
		return new Snapshot(cursor.checkpoint(), arena.mark(), reporter.mark());
	}

	/**
	 * Rewinds the cursor and drops every node and diagnostic created since the snapshot.
	 */
	public void restore(Snapshot snapshot)
	{
		cursor.restore(snapshot.cursor());
		arena.reset(snapshot.arenaMark());
		reporter.truncate(snapshot.diagnosticMark());
	}

	public void enterTrial()
	{
		trialDepth++;
	}

	public void exitTrial()
	{
		trialDepth--;
	}

	/**
	 * While a trial parse is active, errors propagate to the trial instead of being recovered locally.
	 */
	public boolean inTrial()
	{
		return trialDepth > 0;
	}

	public TokenCursor getCursor()
	{
		return cursor;
	}

	public AstArena getArena()
	{
		return arena;
	}

	public ErrorReporter getReporter()
	{
		return reporter;
	}

	public ParserConfig getConfig()
	{
		return config;
	}

	public boolean isTruncated()
	{
		return truncated;
	}

	void markTruncated()
	{
		truncated = true;
	}

	ExpressionParser expressions()
	{
		return expressions;
	}

	StatementParser statements()
	{
		return statements;
	}

	DeclarationParser declarations()
	{
		return declarations;
	}

	TypeParser types()
	{
		return types;
	}

	PatternParser patterns()
	{
		return patterns;
	}

	MacroParser macros()
	{
		return macros;
	}

	GenericDisambiguator disambiguator()
	{
		return disambiguator;
	}
}
