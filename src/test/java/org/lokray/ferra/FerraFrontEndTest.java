package org.lokray.ferra;

import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;
import org.lokray.ferra.util.ParserConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lokray.ferra.FrontEndFixtures.codes;

class FerraFrontEndTest
{
	private final FerraFrontEnd frontEnd = new FerraFrontEnd(ParserConfig.defaults());

	@Nested
	@DisplayName("Byte input")
	class ByteInput
	{
		@Test
		@DisplayName("should parse UTF-8 bytes like the decoded text")
		void validUtf8()
		{
			String source = "let name = \"Grüße\"\n";
			ParseResult fromBytes = frontEnd.parse("utf8.fe", source.getBytes(StandardCharsets.UTF_8));
			ParseResult fromText = frontEnd.parse("utf8.fe", source);
			assertThat(fromBytes.getDiagnostics()).isEmpty();
			assertThat(fromBytes.getCompilationUnit().getStatements()).extracting(Object::toString)
					.isEqualTo(List.of(fromText.getCompilationUnit().getStatements().get(0).toString()));
		}

		@Test
		@DisplayName("should abort with L004 at the first invalid byte")
		void invalidUtf8()
		{
			byte[] source = {'l', 'e', 't', ' ', (byte) 0xC3, '(', '\n'};
			ParseResult result = frontEnd.parse("bad.fe", source);
			assertThat(result.isAborted()).isTrue();
			assertThat(result.getCompilationUnit()).isNull();
			assertThat(result.getTokens()).isEmpty();
			assertThat(codes(result)).containsExactly(DiagnosticCode.L004);
			SourceSpan span = result.getDiagnostics().get(0).getSpan();
			assertThat(span.start()).isEqualTo(4);
			assertThat(span.line()).isEqualTo(1);
			assertThat(span.column()).isEqualTo(5);
		}

		@Test
		@DisplayName("should report the line of an invalid byte after a line break")
		void invalidUtf8OnLaterLine()
		{
			byte[] source = {'a', '\n', 'b', (byte) 0xFF};
			Diagnostic diagnostic = frontEnd.parse("bad.fe", source).getDiagnostics().get(0);
			assertThat(diagnostic.getSpan().start()).isEqualTo(3);
			assertThat(diagnostic.getSpan().line()).isEqualTo(2);
			assertThat(diagnostic.getSpan().column()).isEqualTo(2);
		}
	}

	@Nested
	@DisplayName("Results")
	class Results
	{
		@Test
		@DisplayName("should abort without a tree on an unterminated block comment")
		void unterminatedComment()
		{
			ParseResult result = frontEnd.parse("comment.fe", "let a = 1\n/* never /* closed */\n");
			assertThat(result.isAborted()).isTrue();
			assertThat(result.getCompilationUnit()).isNull();
			assertThat(codes(result)).containsExactly(DiagnosticCode.L002);
		}

		@Test
		@DisplayName("should scan without parsing")
		void tokenizeOnly()
		{
			ParseResult result = frontEnd.tokenize("scan.fe", "let s = \"abc\nlet t = 1\n");
			assertThat(result.getCompilationUnit()).isNull();
			assertThat(result.isAborted()).isFalse();
			assertThat(codes(result)).containsExactly(DiagnosticCode.E002);
			assertThat(result.getTokens()).extracting(Token::getType).startsWith(TokenType.LET, TokenType.IDENTIFIER);
		}

		@Test
		@DisplayName("should count the nodes of the tree")
		void nodeCount()
		{
			ParseResult result = frontEnd.parse("count.fe", "let x = 1 + 2\n");
			// Two literals, the binary expression, the declaration and the compilation unit.
			assertThat(result.getNodeCount()).isEqualTo(5);
			assertThat(result.hasErrors()).isFalse();
			assertThat(result.isTruncated()).isFalse();
			assertThat(result.getSourceName()).isEqualTo("count.fe");
		}

		@Test
		@DisplayName("should reject token indexes and tokens that are not part of the result")
		void terminatorLookups()
		{
			ParseResult result = frontEnd.parse("t.fe", "a\n");
			assertThatThrownBy(() -> result.isTerminator(99)).isInstanceOf(IndexOutOfBoundsException.class);
			Token foreign = new Token(TokenType.NEWLINE, "\n", null, new SourceSpan(0, 1, 1, 1));
			assertThatThrownBy(() -> result.isTerminator(foreign)).isInstanceOf(IllegalArgumentException.class);
			assertThat(result.isTerminator(0)).isFalse();
		}

		@Test
		@DisplayName("should reject missing input")
		void nullInput()
		{
			assertThatThrownBy(() -> frontEnd.parse("x.fe", (String) null)).isInstanceOf(NullPointerException.class);
			assertThatThrownBy(() -> frontEnd.parse(null, "")).isInstanceOf(NullPointerException.class);
		}

		@Test
		@DisplayName("should parse empty input into an empty unit")
		void emptyInput()
		{
			ParseResult result = frontEnd.parse("empty.fe", "");
			assertThat(result.getDiagnostics()).isEmpty();
			assertThat(result.getCompilationUnit().getStatements()).isEmpty();
			assertThat(result.getTokens()).extracting(Token::getType).containsExactly(TokenType.EOF);
		}
	}

	@Test
	@DisplayName("should parse on several threads with one instance")
	void sharedBetweenThreads() throws InterruptedException, ExecutionException
	{
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try
		{
			List<Future<ParseResult>> futures = new ArrayList<>();
			for (int i = 0; i < 16; i++)
			{
				String name = "t" + i + ".fe";
				String source = "fn f" + i + "(x: Int) -> Int:\n\treturn x * " + i + "\n";
				futures.add(pool.submit(() -> frontEnd.parse(name, source)));
			}
			for (int i = 0; i < futures.size(); i++)
			{
				ParseResult result = futures.get(i).get();
				assertThat(result.getDiagnostics()).isEmpty();
				assertThat(result.getCompilationUnit().getStatements().get(0))
						.hasToString("fn f" + i + "(x: Int) -> Int { return (x * " + i + "); }");
			}
		}
		finally
		{
			pool.shutdownNow();
		}
	}
}
