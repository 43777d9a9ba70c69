package org.lokray.ferra.lexer;

import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.significantTypes;
import static org.lokray.ferra.lexer.TokenType.*;

class IndentationTest
{
	@Nested
	@DisplayName("INDENT and DEDENT")
	class LayoutTokens
	{
		@Test
		@DisplayName("should open and close an indented block")
		void simpleBlock()
		{
			String source = "fn f():\n\tlet a = 1\n\tlet b = 2\nlet c = 3\n";
			assertThat(significantTypes(source)).containsExactly(
					FN, IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, COLON, NEWLINE,
					INDENT, LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, NEWLINE,
					LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, NEWLINE,
					DEDENT, LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, NEWLINE, EOF);
		}

		@Test
		@DisplayName("should emit one DEDENT per closed level")
		void multipleDedents()
		{
			String source = "if a:\n\tif b:\n\t\tx\ny\n";
			assertThat(significantTypes(source)).containsExactly(
					IF, IDENTIFIER, COLON, NEWLINE, INDENT,
					IF, IDENTIFIER, COLON, NEWLINE, INDENT,
					IDENTIFIER, NEWLINE, DEDENT, DEDENT,
					IDENTIFIER, NEWLINE, EOF);
		}

		@Test
		@DisplayName("should close open levels at the end of input")
		void dedentAtEof()
		{
			assertThat(significantTypes("if a:\n\tx")).containsExactly(
					IF, IDENTIFIER, COLON, NEWLINE, INDENT, IDENTIFIER, NEWLINE, DEDENT, EOF);
		}

		@Test
		@DisplayName("should ignore blank and comment-only lines")
		void blankLines()
		{
			String source = "if a:\n\tx\n\n// at column 0\n\t// indented\n\ty\n";
			assertThat(significantTypes(source)).containsExactly(
					IF, IDENTIFIER, COLON, NEWLINE, INDENT,
					IDENTIFIER, NEWLINE, IDENTIFIER, NEWLINE, DEDENT, EOF);
		}

		@Test
		@DisplayName("should not track indentation of continuation lines")
		void continuationLines()
		{
			String source = "let x = 1 +\n\t2\nlet y = 3\n";
			assertThat(significantTypes(source)).containsExactly(
					LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, PLUS, INTEGER_LITERAL, NEWLINE,
					LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, NEWLINE, EOF);
		}

		@Test
		@DisplayName("should not track indentation inside parentheses")
		void insideParentheses()
		{
			String source = "foo(\n\t1,\n\t2\n)\n";
			assertThat(significantTypes(source)).containsExactly(
					IDENTIFIER, LEFT_PAREN, INTEGER_LITERAL, COMMA, INTEGER_LITERAL, RIGHT_PAREN, NEWLINE, EOF);
		}

		@Test
		@DisplayName("should emit no layout tokens for the body of a brace block")
		void braceBody()
		{
			String source = "fn f() {\n\tlet a = 1\n}\n";
			assertThat(significantTypes(source)).containsExactly(
					FN, IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE,
					LET, IDENTIFIER, ASSIGN, INTEGER_LITERAL, NEWLINE,
					RIGHT_BRACE, NEWLINE, EOF);
		}

		@Test
		@DisplayName("should allow an indented block inside a brace block")
		void indentedInsideBraces()
		{
			String source = "fn f() {\n\tif a:\n\t\tx\n\ty\n}\n";
			assertThat(significantTypes(source)).containsExactly(
					FN, IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE,
					IF, IDENTIFIER, COLON, NEWLINE, INDENT, IDENTIFIER, NEWLINE, DEDENT,
					IDENTIFIER, NEWLINE, RIGHT_BRACE, NEWLINE, EOF);
			assertThat(codes(source)).isEmpty();
		}
	}

	@Nested
	@DisplayName("Invalid indentation")
	class InvalidIndentation
	{
		@Test
		@DisplayName("should report tabs and spaces at the same level as E003")
		void mixedAtSameLevel()
		{
			assertThat(codes("if a:\n\tx\n    y\n")).containsExactly(DiagnosticCode.E003);
			assertThat(codes("fn f():\n\tlet a = 1\n    let b = 2")).containsExactly(DiagnosticCode.E003);
		}

		@Test
		@DisplayName("should report a run mixing tabs and spaces as E003")
		void mixedRun()
		{
			assertThat(codes("if a:\n\t  x\n")).containsExactly(DiagnosticCode.E003);
		}

		@Test
		@DisplayName("should report an unindent matching no outer level as E003")
		void inconsistentDedent()
		{
			assertThat(codes("if a:\n\t\tx\n\ty\n")).containsExactly(DiagnosticCode.E003);
		}

		@Test
		@DisplayName("should report indentation that opens no block as E003")
		void unexpectedIndent()
		{
			assertThat(codes("let a = 1\n\tlet b = 2\n")).containsExactly(DiagnosticCode.E003);
		}
	}

	@Nested
	@DisplayName("IndentationStack")
	class Stack
	{
		@Test
		@DisplayName("should start at width zero and reject non-increasing pushes")
		void pushRules()
		{
			IndentationStack stack = new IndentationStack();
			assertThat(stack.top().width()).isZero();
			stack.push(4, IndentationStack.WhitespaceKind.SPACES, false);
			assertThat(stack.widths()).containsExactly(0, 4);
			assertThatThrownBy(() -> stack.push(4, IndentationStack.WhitespaceKind.SPACES, false))
					.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("should never pop the outermost level")
		void outermostLevel()
		{
			IndentationStack stack = new IndentationStack();
			assertThatThrownBy(stack::pop).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("should forget an alias once the stack changes")
		void aliases()
		{
			IndentationStack stack = new IndentationStack();
			stack.alias(2);
			assertThat(stack.isAlias(2)).isTrue();
			stack.push(4, IndentationStack.WhitespaceKind.TABS, false);
			assertThat(stack.isAlias(2)).isFalse();
		}

		@Test
		@DisplayName("should classify whitespace runs")
		void whitespaceKinds()
		{
			assertThat(IndentationStack.WhitespaceKind.of(true, true)).isEqualTo(IndentationStack.WhitespaceKind.MIXED);
			assertThat(IndentationStack.WhitespaceKind.of(false, false)).isEqualTo(IndentationStack.WhitespaceKind.NONE);
			assertThat(IndentationStack.WhitespaceKind.TABS.conflictsWith(IndentationStack.WhitespaceKind.SPACES)).isTrue();
			assertThat(IndentationStack.WhitespaceKind.NONE.conflictsWith(IndentationStack.WhitespaceKind.SPACES)).isFalse();
		}
	}
}
