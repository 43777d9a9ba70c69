package org.lokray.ferra.parser;

import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.lexer.TerminatorResolver;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.util.Debug;
import org.lokray.ferra.util.ErrorReporter;
import org.lokray.ferra.util.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The Ferra parser. It consumes the token stream produced by the Lexer, together with the
 * Lexer's newline classification, and builds a {@link CompilationUnit}.
 * <p>
 * Syntax errors are reported to the shared {@link ErrorReporter} and recovered from at
 * statement boundaries, so one parse reports every error it can find. A parser instance is
 * used for a single parse.
 */
public class FerraParser
{
	private static final Logger log = LoggerFactory.getLogger(FerraParser.class);

	private final List<Token> tokens;
	private final ParserContext ctx;

	/**
	 * Constructs a new FerraParser.
	 *
	 * @param tokens   The tokens produced by the Lexer, ending with EOF.
	 * @param resolver The Lexer's terminator classification for the NEWLINE tokens.
	 * @param reporter Collects the diagnostics of this parse.
	 * @param config   Parser settings.
	 */
	public FerraParser(List<Token> tokens, TerminatorResolver resolver, ErrorReporter reporter, ParserConfig config)
	{
		this.tokens = tokens;
		this.ctx = new ParserContext(new TokenCursor(tokens, resolver), new AstArena(), reporter, config);
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return The compilation unit; statements that failed to parse appear as error statements.
	 */
	public CompilationUnit parse()
	{
		Token first = ctx.getCursor().peek();
		Debug.resetIndent();
		log.debug("Parsing {} tokens", tokens.size());
		List<Statement> statements = ctx.statements().parseStatements(StatementParser.BlockMode.TOP);
		Token last = tokens.get(tokens.size() - 1);
		CompilationUnit unit = ctx.getArena().alloc(new CompilationUnit(first.getSpan().to(last.getSpan()), statements));
		log.debug("Parsed {} top-level statements, {} nodes{}", statements.size(), ctx.getArena().size(),
				ctx.isTruncated() ? " (truncated)" : "");
		return unit;
	}

	public AstArena getArena()
	{
		return ctx.getArena();
	}

	/**
	 * @return True if parsing stopped early because the diagnostic limit was reached.
	 */
	public boolean isTruncated()
	{
		return ctx.isTruncated();
	}
}
