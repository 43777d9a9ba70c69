package org.lokray.ferra.parser;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

/**
 * Token-level helpers shared by the recursive-descent sub-parsers.
 */
abstract class AbstractParser
{
	protected final ParserContext ctx;

	protected AbstractParser(ParserContext ctx)
	{
		this.ctx = ctx;
	}

	/**
	 * Checks if the current token matches any of the given types. If so, consumes it.
	 *
	 * @param types The TokenTypes to check against.
	 * @return True if a match was found and consumed, false otherwise.
	 */
	protected boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it matches the expected type. Otherwise, reports an error.
	 *
	 * @param type    The expected TokenType.
	 * @param message The error message if the token doesn't match.
	 * @return The consumed token.
	 * @throws ParseException if the current token does not match the expected type.
	 */
	protected Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Checks if the current token is of any of the given types without consuming it.
	 *
	 * @param types The TokenTypes to check.
	 * @return True if the current token's type matches any of the given types, false otherwise.
	 */
	protected boolean check(TokenType... types)
	{
		TokenType current = peek().getType();
		for (TokenType type : types)
		{
			if (current == type)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Checks the type of a token ahead of the current one without consuming anything.
	 *
	 * @param offset Significant tokens to look ahead (0 is the current token).
	 * @param type   The TokenType to check.
	 */
	protected boolean checkAt(int offset, TokenType type)
	{
		return peek(offset).getType() == type;
	}

	protected Token advance()
	{
		return ctx.getCursor().advance();
	}

	protected Token peek()
	{
		return ctx.getCursor().peek();
	}

	protected Token peek(int offset)
	{
		return ctx.getCursor().peek(offset);
	}

	protected Token previous()
	{
		return ctx.getCursor().previous();
	}

	protected boolean isAtEnd()
	{
		return ctx.getCursor().isAtEnd();
	}

	/**
	 * Registers a freshly built node with the arena.
	 */
	protected <T extends ASTNode> T node(T node)
	{
		return ctx.getArena().alloc(node);
	}

	/**
	 * The span from the start token through the last consumed token.
	 */
	protected SourceSpan spanFrom(Token start)
	{
		Token last = previous();
		return last == null ? start.getSpan() : start.getSpan().to(last.getSpan());
	}

	/**
	 * Reports an E001 syntax error at the given token and returns the exception that unwinds
	 * the parse. Errors at ERROR tokens are not reported again; the lexer already did.
	 *
	 * @param token   The token where the error occurred.
	 * @param message The error message.
	 * @return A ParseException to be thrown.
	 */
	protected ParseException error(Token token, String message)
	{
		return error(DiagnosticCode.E001, token, message, null);
	}

	protected ParseException error(DiagnosticCode code, Token token, String message, String suggestion)
	{
		String full = token.getType() == TokenType.ERROR ? message : message + ", found " + describe(token);
		if (token.getType() != TokenType.ERROR)
		{
			if (suggestion == null)
			{
				ctx.getReporter().report(code, token.getSpan(), full);
			}
			else
			{
				ctx.getReporter().report(code, token.getSpan(), full, suggestion);
			}
		}
		return new ParseException(code, token, full);
	}

	/**
	 * Reports an error the caller recovers from in place. Inside a trial parse nothing is
	 * recovered, so the error is thrown instead.
	 */
	protected void recoverable(DiagnosticCode code, Token token, String message)
	{
		recoverable(code, token, message, null);
	}

	protected void recoverable(DiagnosticCode code, Token token, String message, String suggestion)
	{
		if (ctx.inTrial())
		{
			throw new ParseException(code, token, message);
		}
		if (suggestion == null)
		{
			ctx.getReporter().report(code, token.getSpan(), message);
		}
		else
		{
			ctx.getReporter().report(code, token.getSpan(), message, suggestion);
		}
	}

	/**
	 * Consumes an identifier. A reserved keyword in its place is reported as E009 and consumed
	 * as the name, so the declaration can still be built.
	 *
	 * @param what What the identifier names, for the error message (e.g. "variable name").
	 */
	protected Token consumeIdentifier(String what)
	{
		if (check(TokenType.IDENTIFIER))
		{
			return advance();
		}
		Token token = peek();
		if (token.getType().isKeyword() || token.getType() == TokenType.BOOLEAN_LITERAL)
		{
			recoverable(DiagnosticCode.E009, token,
					"'" + token.getLexeme() + "' is a reserved keyword and cannot be used as a " + what);
			return advance();
		}
		throw error(token, "Expected " + what);
	}

	/**
	 * True at a token that ends the current statement or the enclosing block.
	 */
	protected boolean atStatementBoundary()
	{
		return check(TokenType.NEWLINE, TokenType.SEMICOLON, TokenType.DEDENT, TokenType.INDENT,
				TokenType.RIGHT_BRACE, TokenType.EOF);
	}

	/**
	 * Skips a terminating NEWLINE when the next line starts with the given token, so that
	 * {@code else} or an Allman-style {@code {} may open the following line.
	 */
	protected void skipNewlineBefore(TokenType type)
	{
		if (check(TokenType.NEWLINE) && checkAt(1, type))
		{
			advance();
		}
	}

	protected static String describe(Token token)
	{
		switch (token.getType())
		{
			case NEWLINE:
				return "end of line";
			case EOF:
				return "end of input";
			case INDENT:
				return "indentation";
			case DEDENT:
				return "end of indented block";
			default:
				return "'" + token.getLexeme() + "'";
		}
	}
}
