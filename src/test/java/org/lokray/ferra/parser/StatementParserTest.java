package org.lokray.ferra.parser;

import org.lokray.ferra.ParseResult;
import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.declarations.FunctionDeclaration;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.ast.statements.IfStatement;
import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.parse;
import static org.lokray.ferra.FrontEndFixtures.parseClean;
import static org.lokray.ferra.FrontEndFixtures.single;

class StatementParserTest
{
	@Nested
	@DisplayName("Control flow")
	class ControlFlow
	{
		@Test
		@DisplayName("should parse if/else chains with braces")
		void ifElseBraces()
		{
			assertThat(single("if a { x } else if b { y } else { z }"))
					.isEqualTo("if a { x; } else if b { y; } else { z; }");
		}

		@Test
		@DisplayName("should parse if/else chains with indentation")
		void ifElseIndented()
		{
			String source = "if a:\n\tx\nelse if b:\n\ty\nelse:\n\tz\n";
			assertThat(single(source)).isEqualTo("if a { x; } else if b { y; } else { z; }");
		}

		@Test
		@DisplayName("should accept an opening brace on its own line")
		void allmanBraces()
		{
			String source = "if a\n{\n\tx\n}\nelse\n{\n\ty\n}\n";
			assertThat(single(source)).isEqualTo("if a { x; } else { y; }");
		}

		@Test
		@DisplayName("should parse while and for loops")
		void loops()
		{
			assertThat(single("while i < 10 { i += 1 }")).isEqualTo("while (i < 10) { (i += 1); }");
			assertThat(single("for item in items:\n\tprint(item)\n")).isEqualTo("for item in items { print(item); }");
			assertThat(single("for i in 0..n { continue }")).isEqualTo("for i in (0 .. n) { continue; }");
		}

		@Test
		@DisplayName("should parse return, break and continue")
		void jumps()
		{
			List<Statement> statements = parseClean("fn f():\n\twhile true:\n\t\tbreak\n\treturn\n\treturn 1 + 2\n");
			assertThat(statements).hasSize(1);
			FunctionDeclaration function = (FunctionDeclaration) statements.get(0);
			assertThat(function.getBody().getStatements()).extracting(Object::toString)
					.containsExactly("while true { break; }", "return", "return (1 + 2)");
		}

		@Test
		@DisplayName("should parse a standalone brace block")
		void blockStatement()
		{
			assertThat(single("{\n\tlet a = 1\n\tlet b = a\n}\n")).isEqualTo("{ let a = 1; let b = a; }");
		}

		@Test
		@DisplayName("should parse unsafe and async blocks")
		void markedBlocks()
		{
			BlockStatement unsafe = (BlockStatement) parseClean("unsafe {\n\tf()\n}\n").get(0);
			assertThat(unsafe).hasToString("unsafe { f(); }");
			assertThat(unsafe.isUnsafe()).isTrue();
			assertThat(unsafe.isAsync()).isFalse();
			assertThat(unsafe.getStyle()).isEqualTo(BlockStyle.BRACE);

			BlockStatement async = (BlockStatement) parseClean("async:\n\tlet r = 42\n").get(0);
			assertThat(async).hasToString("async { let r = 42; }");
			assertThat(async.isAsync()).isTrue();
			assertThat(async.getStyle()).isEqualTo(BlockStyle.INDENTED);

			assertThat(single("unsafe async { x }")).isEqualTo("unsafe async { x; }");
		}

		@Test
		@DisplayName("should still read unsafe as a declaration modifier")
		void unsafeFunction()
		{
			assertThat(single("unsafe fn poke(p: *Int) {}")).isEqualTo("unsafe fn poke(p: *Int) { }");
		}

		@Test
		@DisplayName("should reject a public or attributed block")
		void decoratedBlocks()
		{
			assertThat(codes("pub unsafe { f() }\n")).containsExactly(DiagnosticCode.E001);
			assertThat(codes("#[inline] async { f() }\n")).containsExactly(DiagnosticCode.E001);
		}

		@Test
		@DisplayName("should record the block style of each block")
		void blockStyles()
		{
			IfStatement braced = (IfStatement) parseClean("if a { x }\n").get(0);
			IfStatement indented = (IfStatement) parseClean("if a:\n\tx\n").get(0);
			assertThat(braced.getThenBranch().getStyle()).isEqualTo(BlockStyle.BRACE);
			assertThat(indented.getThenBranch().getStyle()).isEqualTo(BlockStyle.INDENTED);
		}
	}

	@Nested
	@DisplayName("Statement separation")
	class Separation
	{
		@Test
		@DisplayName("should separate statements with semicolons on one line")
		void semicolons()
		{
			assertThat(parseClean("let a = 1; let b = 2\n")).extracting(Object::toString)
					.containsExactly("let a = 1", "let b = 2");
		}

		@Test
		@DisplayName("should separate statements with line breaks")
		void lineBreaks()
		{
			assertThat(parseClean("a()\nb()\n\n\nc()\n")).extracting(Object::toString)
					.containsExactly("a()", "b()", "c()");
		}

		@Test
		@DisplayName("should end a statement after a nested block closes")
		void afterBlock()
		{
			assertThat(parseClean("if a { x }\nif b:\n\ty\nz\n")).extracting(Object::toString)
					.containsExactly("if a { x; }", "if b { y; }", "z");
		}

		@Test
		@DisplayName("should report two statements on one line without a separator")
		void missingSeparator()
		{
			assertThat(codes("let a = 1 let b = 2\n")).containsExactly(DiagnosticCode.E001);
		}
	}

	@Nested
	@DisplayName("Block errors")
	class BlockErrors
	{
		@Test
		@DisplayName("should report a missing block as E011")
		void missingBlock()
		{
			assertThat(codes("while x y\n")).containsExactly(DiagnosticCode.E011);
		}

		@Test
		@DisplayName("should report ':' followed by '{' as E011 with a suggestion")
		void mixedOpeners()
		{
			ParseResult result = parse("if a: {\n\tb\n}\n");
			assertThat(codes(result)).containsExactly(DiagnosticCode.E011);
			assertThat(result.getDiagnostics().get(0).getSuggestion())
					.isEqualTo("Use either braces {...} OR indentation consistently within a single block");
			assertThat(result.getCompilationUnit().getStatements()).extracting(Object::toString)
					.containsExactly("if a { b; }");
		}

		@Test
		@DisplayName("should report ':' without an indented line as E011")
		void missingIndentedBody()
		{
			ParseResult result = parse("if a:\nb\n");
			assertThat(codes(result)).containsExactly(DiagnosticCode.E011);
			assertThat(result.getCompilationUnit().getStatements()).extracting(Object::toString)
					.containsExactly("if a { }", "b");
		}

		@Test
		@DisplayName("should report a brace block left open at the end of input as E004")
		void unclosedBrace()
		{
			assertThat(codes("fn f() {\n\tlet a = 1\n")).containsExactly(DiagnosticCode.E004);
		}

		@Test
		@DisplayName("should report a stray closing brace")
		void strayBrace()
		{
			assertThat(codes("let a = 1\n}\n")).containsExactly(DiagnosticCode.E001);
		}

		@Test
		@DisplayName("should reject attributes on statements that are not declarations")
		void attributesOnExpressions()
		{
			assertThat(codes("#[inline] x = 1\n")).containsExactly(DiagnosticCode.E001);
		}
	}
}
