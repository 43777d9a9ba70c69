package org.lokray.ferra.lexer;

import org.lokray.ferra.ParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.parse;
import static org.lokray.ferra.FrontEndFixtures.parseClean;
import static org.lokray.ferra.FrontEndFixtures.single;

class TerminatorResolverTest
{
	private static final SourceSpan SPAN = new SourceSpan(0, 0, 1, 1);

	private static Token token(TokenType type)
	{
		return new Token(type, type.getText() != null ? type.getText() : "x", null, SPAN);
	}

	@Nested
	@DisplayName("Classification")
	class Classification
	{
		@Test
		@DisplayName("should terminate after a complete operand")
		void terminatesAfterOperand()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			assertThat(resolver.classifyNewline(1, false, false, false)).isEqualTo(TerminatorResolver.NewlineClass.TERMINATOR);
			assertThat(resolver.isTerminator(1)).isTrue();
		}

		@Test
		@DisplayName("should continue after a binary operator")
		void continuesAfterOperator()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.PLUS));
			assertThat(resolver.classifyNewline(2, false, false, false)).isEqualTo(TerminatorResolver.NewlineClass.CONTINUATION);
			assertThat(resolver.isTerminator(2)).isFalse();
		}

		@Test
		@DisplayName("should continue when the next line starts with a continuation token")
		void continuesBeforeLeadingOperator()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			assertThat(resolver.classifyNewline(1, true, false, false)).isEqualTo(TerminatorResolver.NewlineClass.CONTINUATION);
		}

		@Test
		@DisplayName("should continue after a postfix '?' when the next line can extend it")
		void continuesAfterTry()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.QUESTION));
			assertThat(resolver.classifyNewline(2, false, false, true)).isEqualTo(TerminatorResolver.NewlineClass.CONTINUATION);
			assertThat(resolver.isTerminator(2)).isFalse();
		}

		@Test
		@DisplayName("should terminate after a postfix '?' when the next line starts a new statement")
		void terminatesAfterTry()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.QUESTION));
			assertThat(resolver.classifyNewline(2, false, false, false)).isEqualTo(TerminatorResolver.NewlineClass.TERMINATOR);
			assertThat(resolver.classifyNewline(3, false, true, false)).isEqualTo(TerminatorResolver.NewlineClass.TERMINATOR);
		}

		@Test
		@DisplayName("should treat a line break after a block brace as layout")
		void layoutAfterBlockBrace()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.LEFT_BRACE));
			assertThat(resolver.lastOpened()).isEqualTo(DelimiterDepthCounters.Kind.BLOCK_BRACE);
			assertThat(resolver.classifyNewline(2, false, false, false)).isEqualTo(TerminatorResolver.NewlineClass.LAYOUT);
			assertThat(resolver.suppressesLayout()).isFalse();
		}

		@Test
		@DisplayName("should treat a brace after '!' or '::' as a delimiter")
		void delimiterBraces()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.BANG));
			resolver.observe(token(TokenType.LEFT_BRACE));
			assertThat(resolver.lastOpened()).isEqualTo(DelimiterDepthCounters.Kind.DELIMITER_BRACE);
			resolver.observe(token(TokenType.IDENTIFIER));
			assertThat(resolver.classifyNewline(4, false, false, false)).isEqualTo(TerminatorResolver.NewlineClass.CONTINUATION);
			assertThat(resolver.suppressesLayout()).isTrue();
		}

		@Test
		@DisplayName("should give up open parentheses before a declaration keyword")
		void resyncsAtDeclaration()
		{
			TerminatorResolver resolver = new TerminatorResolver();
			resolver.observe(token(TokenType.IDENTIFIER));
			resolver.observe(token(TokenType.LEFT_PAREN));
			resolver.observe(token(TokenType.INTEGER_LITERAL));
			assertThat(resolver.hasOpenParenOrBracket()).isTrue();
			assertThat(resolver.classifyNewline(3, false, true, false)).isEqualTo(TerminatorResolver.NewlineClass.TERMINATOR);
			assertThat(resolver.hasOpenParenOrBracket()).isFalse();
		}

		@Test
		@DisplayName("should keep block braces when giving up open parentheses")
		void resyncKeepsBlockBraces()
		{
			DelimiterDepthCounters counters = new DelimiterDepthCounters();
			counters.open(DelimiterDepthCounters.Kind.BLOCK_BRACE);
			counters.open(DelimiterDepthCounters.Kind.PAREN);
			counters.open(DelimiterDepthCounters.Kind.BRACKET);
			assertThat(counters.abandonExpressionDelimiters()).isEqualTo(2);
			assertThat(counters.innermost()).isEqualTo(DelimiterDepthCounters.Kind.BLOCK_BRACE);
		}

		@Test
		@DisplayName("should close skipped openers and ignore stray closers")
		void closingDelimiters()
		{
			DelimiterDepthCounters counters = new DelimiterDepthCounters();
			assertThat(counters.close(TokenType.RIGHT_PAREN)).isNull();
			counters.open(DelimiterDepthCounters.Kind.PAREN);
			counters.open(DelimiterDepthCounters.Kind.BRACKET);
			assertThat(counters.close(TokenType.RIGHT_PAREN)).isEqualTo(DelimiterDepthCounters.Kind.PAREN);
			assertThat(counters.isEmpty()).isTrue();
			assertThat(counters.depth(DelimiterDepthCounters.Kind.BRACKET)).isZero();
		}
	}

	@Nested
	@DisplayName("Statements across lines")
	class StatementsAcrossLines
	{
		@Test
		@DisplayName("should join lines that end with a binary operator")
		void trailingOperator()
		{
			assertThat(single("let total = a +\n\tb +\n\tc\n")).isEqualTo("let total = ((a + b) + c)");
		}

		@Test
		@DisplayName("should join lines that start with a binary operator")
		void leadingOperator()
		{
			assertThat(single("let total = a\n\t+ b\n\t+ c\n")).isEqualTo("let total = ((a + b) + c)");
			assertThat(single("let both = a\nand b\n")).isEqualTo("let both = (a && b)");
		}

		@Test
		@DisplayName("should join a chain of postfix operations split across lines")
		void postfixChain()
		{
			assertThat(single("fetch(url)\n\t.await?\n\t.json()\n")).isEqualTo("(((fetch(url).await)?).json)()");
		}

		@Test
		@DisplayName("should not join a line that starts with '-'")
		void leadingMinus()
		{
			assertThat(parseClean("let a = 1\n-b\n")).extracting(Object::toString)
					.containsExactly("let a = 1", "(-b)");
		}

		@Test
		@DisplayName("should end a statement after a postfix '?'")
		void trailingTry()
		{
			assertThat(parseClean("let v = read()?\nlet w = 1\n")).extracting(Object::toString)
					.containsExactly("let v = (read()?)", "let w = 1");
		}

		@Test
		@DisplayName("should call or index the result of a postfix '?' on the next line")
		void tryThenCall()
		{
			assertThat(single("x = a?\n(b)\n")).isEqualTo("(x = (a?)(b))");
			assertThat(single("let y = a?\n[0]\n")).isEqualTo("let y = (a?)[0]");
			assertThat(parseClean("let v = read()?\nprint(v)\n")).extracting(Object::toString)
					.containsExactly("let v = (read()?)", "print(v)");
		}

		@Test
		@DisplayName("should join lines inside parentheses and brackets")
		void insideDelimiters()
		{
			assertThat(single("foo(1,\n2)\n")).isEqualTo("foo(1, 2)");
			assertThat(single("let xs = [\n\t1,\n\t2\n]\n")).isEqualTo("let xs = [1, 2]");
		}

		@Test
		@DisplayName("should expose the classification through the parse result")
		void terminatorFlags()
		{
			ParseResult result = parse("let a = 1 +\n2\nlet b = 3\n");
			List<Token> newlines = result.getTokens().stream()
					.filter(t -> t.getType() == TokenType.NEWLINE)
					.collect(Collectors.toList());
			assertThat(newlines).hasSize(3);
			assertThat(result.isTerminator(newlines.get(0))).isFalse();
			assertThat(result.isTerminator(newlines.get(1))).isTrue();
			assertThat(result.isTerminator(newlines.get(2))).isTrue();
		}
	}
}
