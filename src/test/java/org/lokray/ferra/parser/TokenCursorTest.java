package org.lokray.ferra.parser;

import org.lokray.ferra.lexer.Lexer;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TerminatorResolver;
import org.lokray.ferra.lexer.TokenType;
import org.lokray.ferra.util.ErrorReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenCursorTest
{
	private static TokenCursor cursor(String source)
	{
		Lexer lexer = new Lexer(source, new ErrorReporter());
		List<Token> tokens = lexer.scanTokens();
		return new TokenCursor(tokens, lexer.getTerminatorResolver());
	}

	@Test
	@DisplayName("should hide line breaks that do not end a statement")
	void hidesContinuations()
	{
		TokenCursor cursor = cursor("a +\nb\nc\n");
		assertThat(cursor.window(10)).extracting(Token::getType).containsExactly(
				TokenType.IDENTIFIER, TokenType.PLUS, TokenType.IDENTIFIER, TokenType.NEWLINE,
				TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF);
	}

	@Test
	@DisplayName("should stop at EOF when looking or moving past the end")
	void endOfInput()
	{
		TokenCursor cursor = cursor("x");
		assertThat(cursor.peek(5).getType()).isEqualTo(TokenType.EOF);
		cursor.advance();
		assertThat(cursor.advance().getType()).isEqualTo(TokenType.NEWLINE);
		assertThat(cursor.isAtEnd()).isTrue();
		cursor.advance();
		assertThat(cursor.peek().getType()).isEqualTo(TokenType.EOF);
	}

	@Test
	@DisplayName("should take a single '>' out of a shift token")
	void splitsShift()
	{
		TokenCursor cursor = cursor("a >> b");
		cursor.advance();
		Token first = cursor.splitGreater();
		assertThat(first.getType()).isEqualTo(TokenType.GREATER);
		assertThat(first.getSpan().start()).isEqualTo(2);
		assertThat(cursor.previous()).isSameAs(first);
		Token rest = cursor.peek();
		assertThat(rest.getType()).isEqualTo(TokenType.GREATER);
		assertThat(rest.getSpan().start()).isEqualTo(3);
		assertThat(cursor.peek(1).getType()).isEqualTo(TokenType.IDENTIFIER);
	}

	@Test
	@DisplayName("should leave the right remainder of '>=' and '>>='")
	void splitRemainders()
	{
		TokenCursor equal = cursor("a >= b");
		equal.advance();
		equal.splitGreater();
		assertThat(equal.peek().getType()).isEqualTo(TokenType.ASSIGN);

		TokenCursor shiftAssign = cursor("a >>= b");
		shiftAssign.advance();
		shiftAssign.splitGreater();
		assertThat(shiftAssign.peek().getType()).isEqualTo(TokenType.GREATER_EQUAL);
	}

	@Test
	@DisplayName("should refuse to split a token without a '>'")
	void splitRequiresGreater()
	{
		TokenCursor cursor = cursor("a");
		assertThatThrownBy(cursor::splitGreater).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("should restore a checkpoint taken before a split")
	void restoresSplit()
	{
		TokenCursor cursor = cursor("a >> b");
		cursor.advance();
		TokenCursor.Checkpoint checkpoint = cursor.checkpoint();
		cursor.splitGreater();
		cursor.advance();
		assertThat(cursor.consumed()).isEqualTo(3);
		cursor.restore(checkpoint);
		assertThat(cursor.peek().getType()).isEqualTo(TokenType.RIGHT_SHIFT);
		assertThat(cursor.consumed()).isEqualTo(1);
	}

	@Test
	@DisplayName("should count the blocks opened by consumed tokens")
	void blockDepth()
	{
		TokenCursor cursor = cursor("if a {\n\tif b:\n\t\tc\n}\n");
		int deepest = 0;
		while (!cursor.isAtEnd())
		{
			cursor.advance();
			deepest = Math.max(deepest, cursor.blockDepth());
		}
		assertThat(deepest).isEqualTo(2);
		assertThat(cursor.blockDepth()).isZero();
	}

	@Test
	@DisplayName("should require a stream that ends with EOF")
	void requiresEof()
	{
		Token identifier = new Token(TokenType.IDENTIFIER, "a", null, new SourceSpan(0, 1, 1, 1));
		assertThatThrownBy(() -> new TokenCursor(List.of(identifier), new TerminatorResolver()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
