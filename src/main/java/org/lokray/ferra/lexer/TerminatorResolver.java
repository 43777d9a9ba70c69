package org.lokray.ferra.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides, for every physical NEWLINE token, whether it terminates a statement.
 * <p>
 * The lexer feeds every significant token through {@link #observe(Token)} and asks for a
 * classification at each line break. The decision depends only on the delimiter depth, the last
 * significant token and the first token of the next logical line. The NEWLINE tokens themselves
 * stay in the token stream; the parser consults {@link #isTerminator(int)} by token index.
 */
public class TerminatorResolver
{
	private static final Logger log = LoggerFactory.getLogger(TerminatorResolver.class);

	/**
	 * How a NEWLINE affects the statement being scanned and the line after it.
	 */
	public enum NewlineClass
	{
		/** Ends the current statement. */
		TERMINATOR,
		/** Insignificant, but the next line is still a logical line with its own indentation (after a block brace). */
		LAYOUT,
		/** Insignificant; the next line continues the current statement. */
		CONTINUATION
	}

	// A statement cannot end right after one of these.
	private static final Set<TokenType> INCOMPLETE = EnumSet.of(
			TokenType.LEFT_PAREN, TokenType.LEFT_BRACKET,
			TokenType.COMMA, TokenType.DOT, TokenType.DOUBLE_COLON, TokenType.ARROW, TokenType.FAT_ARROW,
			TokenType.BANG, TokenType.QUESTION, TokenType.STAR, TokenType.SLASH, TokenType.MODULO, TokenType.PLUS, TokenType.MINUS,
			TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT,
			TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
			TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
			TokenType.AMPERSAND, TokenType.PIPE, TokenType.CARET,
			TokenType.AMPERSAND_AMPERSAND, TokenType.PIPE_PIPE, TokenType.NULL_COALESCING,
			TokenType.DOT_DOT, TokenType.DOT_DOT_EQUAL,
			TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.STAR_ASSIGN,
			TokenType.SLASH_ASSIGN, TokenType.MODULO_ASSIGN, TokenType.AMPERSAND_ASSIGN, TokenType.PIPE_ASSIGN,
			TokenType.CARET_ASSIGN, TokenType.LEFT_SHIFT_ASSIGN, TokenType.RIGHT_SHIFT_ASSIGN,
			TokenType.ASYNC, TokenType.FN, TokenType.LET, TokenType.VAR, TokenType.DATA, TokenType.MATCH);

	private final DelimiterDepthCounters delimiters = new DelimiterDepthCounters();
	private final BitSet terminators = new BitSet();
	private Token lastSignificant;
	private DelimiterDepthCounters.Kind lastOpened;

	/**
	 * Records a significant (non-layout) token.
	 */
	public void observe(Token token)
	{
		lastOpened = null;
		switch (token.getType())
		{
			case LEFT_PAREN:
				delimiters.open(DelimiterDepthCounters.Kind.PAREN);
				lastOpened = DelimiterDepthCounters.Kind.PAREN;
				break;
			case LEFT_BRACKET:
				delimiters.open(DelimiterDepthCounters.Kind.BRACKET);
				lastOpened = DelimiterDepthCounters.Kind.BRACKET;
				break;
			case LEFT_BRACE:
				lastOpened = classifyBrace();
				delimiters.open(lastOpened);
				break;
			case RIGHT_PAREN:
			case RIGHT_BRACKET:
			case RIGHT_BRACE:
				delimiters.close(token.getType());
				break;
			default:
				break;
		}
		lastSignificant = token;
	}

	private DelimiterDepthCounters.Kind classifyBrace()
	{
		if (delimiters.insideExpressionDelimiter())
		{
			return DelimiterDepthCounters.Kind.DELIMITER_BRACE;
		}
		if (lastSignificant != null
				&& (lastSignificant.getType() == TokenType.BANG || lastSignificant.getType() == TokenType.DOUBLE_COLON))
		{
			return DelimiterDepthCounters.Kind.DELIMITER_BRACE;
		}
		return DelimiterDepthCounters.Kind.BLOCK_BRACE;
	}

	/**
	 * Classifies the NEWLINE token at the given index of the token stream.
	 *
	 * @param index                Position of the NEWLINE token in the token list.
	 * @param nextLineContinues    Whether the next logical line starts with a continuation token
	 *                             (a leading {@code .}, {@code ?} or binary operator).
	 * @param nextLineDeclaration  Whether the next logical line starts with a declaration keyword.
	 * @param nextLineOpener       Whether the next logical line starts with {@code (} or {@code [}.
	 */
	public NewlineClass classifyNewline(int index, boolean nextLineContinues, boolean nextLineDeclaration, boolean nextLineOpener)
	{
		NewlineClass result;
		if (nextLineDeclaration && delimiters.hasOpenParenOrBracket())
		{
			// A declaration cannot continue an argument list or array; give up on the open delimiters.
			abandonOpenDelimiters();
			result = NewlineClass.TERMINATOR;
		}
		else if (delimiters.insideExpressionDelimiter())
		{
			result = NewlineClass.CONTINUATION;
		}
		else if (lastSignificant == null)
		{
			result = NewlineClass.LAYOUT;
		}
		else if (lastSignificant.getType() == TokenType.LEFT_BRACE)
		{
			result = NewlineClass.LAYOUT;
		}
		else if (lastSignificant.getType() == TokenType.QUESTION && !nextLineContinues && !nextLineOpener)
		{
			// Only a call, an index or an operator can follow a try.
			result = NewlineClass.TERMINATOR;
		}
		else if (INCOMPLETE.contains(lastSignificant.getType()) || nextLineContinues)
		{
			result = NewlineClass.CONTINUATION;
		}
		else
		{
			result = NewlineClass.TERMINATOR;
		}
		if (result == NewlineClass.TERMINATOR)
		{
			terminators.set(index);
		}
		return result;
	}

	/**
	 * @return True when the NEWLINE token at the given index ends a statement.
	 */
	public boolean isTerminator(int index)
	{
		return terminators.get(index);
	}

	/**
	 * True while indentation must not be tracked, i.e. inside parentheses, brackets and delimiter braces.
	 */
	public boolean suppressesLayout()
	{
		return delimiters.insideExpressionDelimiter();
	}

	public boolean hasOpenParenOrBracket()
	{
		return delimiters.hasOpenParenOrBracket();
	}

	/**
	 * Gives up on the parentheses and brackets still open, so a line that starts a new declaration
	 * is scanned as a fresh statement. The parser reports the missing closer.
	 */
	private void abandonOpenDelimiters()
	{
		int dropped = delimiters.abandonExpressionDelimiters();
		log.debug("Abandoned {} unclosed delimiter(s) at a declaration keyword", dropped);
	}

	/**
	 * @return The innermost unclosed opener, or null.
	 */
	public DelimiterDepthCounters.Kind innermostDelimiter()
	{
		return delimiters.innermost();
	}

	/**
	 * @return The kind of opener the last observed token opened, or null if it opened nothing.
	 */
	public DelimiterDepthCounters.Kind lastOpened()
	{
		return lastOpened;
	}

	public DelimiterDepthCounters getDelimiters()
	{
		return delimiters;
	}
}
