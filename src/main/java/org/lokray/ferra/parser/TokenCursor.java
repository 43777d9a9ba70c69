package org.lokray.ferra.parser;

import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.TerminatorResolver;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * A forward cursor over the scanned tokens that shows the parser only the significant ones.
 * NEWLINE tokens the {@link TerminatorResolver} did not classify as terminators are skipped;
 * INDENT and DEDENT are always visible.
 * <p>
 * A closing {@code >} of a generic argument list may be taken out of a {@code >>}, {@code >=} or
 * {@code >>=} token with {@link #splitGreater()}; the rest of the token stays pending and is part
 * of the cursor state captured by a {@link Checkpoint}.
 */
public class TokenCursor
{
	/**
	 * A restorable cursor position.
	 */
	public record Checkpoint(int position, Token split, Token previous, int consumed, int blockDepth)
	{
	}

	private final List<Token> tokens;
	private final TerminatorResolver resolver;
	private int position;
	private Token split;     // remainder of a partially consumed '>>', '>=' or '>>='
	private Token previous;
	private int consumed;    // significant tokens taken so far, split halves counted separately
	private int blockDepth;  // '{' and INDENT taken minus '}' and DEDENT taken

	public TokenCursor(List<Token> tokens, TerminatorResolver resolver)
	{
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF)
		{
			throw new IllegalArgumentException("Token stream must end with EOF");
		}
		this.tokens = tokens;
		this.resolver = resolver;
		this.position = nextSignificant(0);
	}

	public Token peek()
	{
		return split != null ? split : tokens.get(position);
	}

	/**
	 * Looks ahead over significant tokens; offset 0 is the current token.
	 */
	public Token peek(int offset)
	{
		int remaining = offset;
		if (split != null)
		{
			if (remaining == 0)
			{
				return split;
			}
			remaining--;
		}
		int index = position;
		while (remaining > 0 && tokens.get(index).getType() != TokenType.EOF)
		{
			index = nextSignificant(index + 1);
			remaining--;
		}
		return tokens.get(index);
	}

	public Token previous()
	{
		return previous;
	}

	public Token advance()
	{
		Token token;
		if (split != null)
		{
			token = split;
			split = null;
		}
		else
		{
			token = tokens.get(position);
			if (token.getType() != TokenType.EOF)
			{
				position = nextSignificant(position + 1);
			}
			switch (token.getType())
			{
				case LEFT_BRACE:
				case INDENT:
					blockDepth++;
					break;
				case RIGHT_BRACE:
				case DEDENT:
					blockDepth--;
					break;
				default:
					break;
			}
		}
		previous = token;
		consumed++;
		return token;
	}

	/**
	 * Consumes one {@code >} from the current token, leaving the rest of a {@code >>},
	 * {@code >=} or {@code >>=} as the next token.
	 *
	 * @return The consumed {@code >}.
	 */
	public Token splitGreater()
	{
		Token token = peek();
		TokenType rest;
		switch (token.getType())
		{
			case GREATER:
				return advance();
			case RIGHT_SHIFT:
				rest = TokenType.GREATER;
				break;
			case GREATER_EQUAL:
				rest = TokenType.ASSIGN;
				break;
			case RIGHT_SHIFT_ASSIGN:
				rest = TokenType.GREATER_EQUAL;
				break;
			default:
				throw new IllegalStateException("Cannot split a '>' out of " + token.getType());
		}
		advance();
		SourceSpan span = token.getSpan();
		Token first = Token.synthetic(TokenType.GREATER, new SourceSpan(span.start(), span.start() + 1, span.line(), span.column()));
		split = Token.synthetic(rest, new SourceSpan(span.start() + 1, span.end(), span.line(), span.column() + 1));
		previous = first;
		return first;
	}

	public boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	public Checkpoint checkpoint()
	{
		return new Checkpoint(position, split, previous, consumed, blockDepth);
	}

	public void restore(Checkpoint checkpoint)
	{
		position = checkpoint.position();
		split = checkpoint.split();
		previous = checkpoint.previous();
		consumed = checkpoint.consumed();
		blockDepth = checkpoint.blockDepth();
	}

	/**
	 * @return The number of significant tokens consumed since the cursor was created.
	 */
	public int consumed()
	{
		return consumed;
	}

	/**
	 * @return The number of blocks opened and not yet closed by the consumed tokens.
	 */
	public int blockDepth()
	{
		return blockDepth;
	}

	/**
	 * The next significant tokens, starting with the current one, up to the given count or EOF.
	 */
	public List<Token> window(int limit)
	{
		List<Token> window = new ArrayList<>(Math.min(limit, 16));
		for (int i = 0; i < limit; i++)
		{
			Token token = peek(i);
			window.add(token);
			if (token.getType() == TokenType.EOF)
			{
				break;
			}
		}
		return window;
	}

	/**
	 * @return True when the given token of the underlying stream is a NEWLINE that ends a statement.
	 */
	public boolean isTerminator(int index)
	{
		return resolver.isTerminator(index);
	}

	private int nextSignificant(int index)
	{
		int last = tokens.size() - 1;
		int i = index;
		while (i < last && tokens.get(i).getType() == TokenType.NEWLINE && !resolver.isTerminator(i))
		{
			i++;
		}
		return Math.min(i, last);
	}
}
