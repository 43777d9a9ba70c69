package org.lokray.ferra.parser;

import org.lokray.ferra.ast.expressions.MacroInvocationExpression;
import org.lokray.ferra.ast.macros.GroupDelimiter;
import org.lokray.ferra.ast.macros.MacroDefinition;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.statements.ExpressionStatement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.parseClean;
import static org.lokray.ferra.FrontEndFixtures.single;

class MacroParserTest
{
	@Nested
	@DisplayName("Invocations")
	class Invocations
	{
		@Test
		@DisplayName("should keep the body of an invocation as a token tree")
		void parenthesized()
		{
			ExpressionStatement statement = (ExpressionStatement) parseClean("println!(\"hi\", x)\n").get(0);
			MacroInvocationExpression macro = (MacroInvocationExpression) statement.getExpression();
			TokenGroup body = macro.getBody();
			assertThat(body.getDelimiter()).isEqualTo(GroupDelimiter.PAREN);
			assertThat(body.getTrees()).hasSize(3);
			assertThat(macro).hasToString("println!( \"hi\" , x )");
		}

		@Test
		@DisplayName("should read a bracket body as a macro when it balances")
		void bracketBody()
		{
			assertThat(single("let v = vec![1, 2]")).isEqualTo("let v = vec![ 1 , 2 ]");
		}

		@Test
		@DisplayName("should nest groups of every delimiter kind")
		void nestedGroups()
		{
			assertThat(single("m!(a (b [c]) {d})")).isEqualTo("m!( a ( b [ c ] ) { d } )");
		}

		@Test
		@DisplayName("should keep tokens that are not expressions")
		void arbitraryTokens()
		{
			assertThat(single("asm!(mov => , ; $)")).isEqualTo("asm!( mov => , ; $ )");
		}

		@Test
		@DisplayName("should read a body spread over several lines")
		void multiLineBody()
		{
			assertThat(single("html!{\n\tdiv\n\tspan\n}\n")).isEqualTo("html!{ div span }");
		}

		@Test
		@DisplayName("should fall back to an index expression when a bracket body does not balance")
		void unbalancedBracket()
		{
			assertThat(codes("let v = a![1, 2)\n")).containsExactly(DiagnosticCode.E008, DiagnosticCode.E001);
		}
	}

	@Nested
	@DisplayName("Definitions")
	class Definitions
	{
		@Test
		@DisplayName("should parse the rules of a brace-bodied macro")
		void braceDefinition()
		{
			MacroDefinition macro = (MacroDefinition) parseClean("macro square {\n\t($x) => ($x * $x)\n}\n").get(0);
			assertThat(macro.getName().getLexeme()).isEqualTo("square");
			assertThat(macro.getRules()).hasSize(1);
			assertThat(macro).hasToString("macro square { ( $ x ) => ( $ x * $ x ); }");
		}

		@Test
		@DisplayName("should parse an indented macro with a brace transcriber")
		void indentedDefinition()
		{
			assertThat(single("macro twice:\n\t($e) => { $e; $e }\n"))
					.isEqualTo("macro twice { ( $ e ) => { $ e ; $ e }; }");
		}

		@Test
		@DisplayName("should parse several rules")
		void severalRules()
		{
			MacroDefinition macro = (MacroDefinition) parseClean("macro pick {\n\t() => (0)\n\t($a) => ($a)\n}\n").get(0);
			assertThat(macro.getRules()).extracting(Object::toString)
					.containsExactly("( ) => ( 0 )", "( $ a ) => ( $ a )");
		}

		@Test
		@DisplayName("should require '=>' between matcher and transcriber")
		void missingArrow()
		{
			assertThat(codes("macro bad {\n\t($x) ($x)\n}\n")).containsExactly(DiagnosticCode.E001);
		}
	}
}
