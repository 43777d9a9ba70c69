package org.lokray.ferra;

import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;
import org.lokray.ferra.util.ParserConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared helpers for front-end tests.
 */
public final class FrontEndFixtures
{
	private static final FerraFrontEnd FRONT_END = new FerraFrontEnd(ParserConfig.defaults());

	private FrontEndFixtures()
	{
	}

	public static ParseResult parse(String source)
	{
		return FRONT_END.parse("test.fe", source);
	}

	/**
	 * Parses source that is expected to be free of diagnostics and returns its statements.
	 */
	public static List<Statement> parseClean(String source)
	{
		ParseResult result = parse(source);
		if (!result.getDiagnostics().isEmpty())
		{
			throw new AssertionError("Unexpected diagnostics for:\n" + source + "\n" + String.join("\n", result.formatDiagnostics()));
		}
		return result.getCompilationUnit().getStatements();
	}

	/**
	 * The string form of the single statement in the given source.
	 */
	public static String single(String source)
	{
		List<Statement> statements = parseClean(source);
		if (statements.size() != 1)
		{
			throw new AssertionError("Expected one statement, got " + statements);
		}
		return statements.get(0).toString();
	}

	public static CompilationUnit unit(String source)
	{
		return parse(source).getCompilationUnit();
	}

	public static List<DiagnosticCode> codes(ParseResult result)
	{
		return result.getDiagnostics().stream().map(Diagnostic::getCode).collect(Collectors.toList());
	}

	public static List<DiagnosticCode> codes(String source)
	{
		return codes(parse(source));
	}

	public static List<TokenType> tokenTypes(String source)
	{
		return FRONT_END.tokenize("test.fe", source).getTokens().stream().map(Token::getType).collect(Collectors.toList());
	}

	/**
	 * Token types with the NEWLINEs that do not end a statement left out.
	 */
	public static List<TokenType> significantTypes(String source)
	{
		ParseResult result = FRONT_END.tokenize("test.fe", source);
		List<Token> tokens = result.getTokens();
		List<TokenType> types = new ArrayList<>();
		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			if (token.getType() != TokenType.NEWLINE || result.isTerminator(i))
			{
				types.add(token.getType());
			}
		}
		return types;
	}
}
