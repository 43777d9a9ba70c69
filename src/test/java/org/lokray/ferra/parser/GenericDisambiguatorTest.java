package org.lokray.ferra.parser;

import org.lokray.ferra.FerraFrontEnd;
import org.lokray.ferra.ParseResult;
import org.lokray.ferra.ast.expressions.CallExpression;
import org.lokray.ferra.ast.expressions.GenericInstantiationExpression;
import org.lokray.ferra.ast.statements.ExpressionStatement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.util.ParserConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.parse;
import static org.lokray.ferra.FrontEndFixtures.parseClean;
import static org.lokray.ferra.FrontEndFixtures.single;

class GenericDisambiguatorTest
{
	@Nested
	@DisplayName("Angle brackets")
	class AngleBrackets
	{
		@Test
		@DisplayName("should read a called generic instantiation")
		void calledGeneric()
		{
			ParseResult result = parse("Pair<Int, Bool>(1, true)\n");
			assertThat(result.getDiagnostics()).isEmpty();
			ExpressionStatement statement = (ExpressionStatement) result.getCompilationUnit().getStatements().get(0);
			CallExpression call = (CallExpression) statement.getExpression();
			assertThat(call.getCallee()).isInstanceOf(GenericInstantiationExpression.class);
			assertThat(call).hasToString("Pair<Int, Bool>(1, true)");
		}

		@Test
		@DisplayName("should read a plain comparison")
		void comparison()
		{
			assertThat(single("a < b")).isEqualTo("(a < b)");
			assertThat(single("if n < limit { n }")).isEqualTo("if (n < limit) { n; }");
		}

		@Test
		@DisplayName("should read a generic followed by a path segment")
		void genericPath()
		{
			assertThat(single("Vec<Int>::new()")).isEqualTo("Vec<Int>::new()");
		}

		@Test
		@DisplayName("should split '>>' that closes nested argument lists")
		void nestedArguments()
		{
			assertThat(single("Vec<Vec<Int>>(x)")).isEqualTo("Vec<Vec<Int>>(x)");
		}

		@Test
		@DisplayName("should read two comparisons separated by a comma as arguments")
		void commaSeparatedComparisons()
		{
			assertThat(single("f(a < b, c > d)")).isEqualTo("f((a < b), (c > d))");
		}

		@Test
		@DisplayName("should read a comparison against a shift")
		void comparisonAgainstShift()
		{
			assertThat(single("x < y >> 1")).isEqualTo("(x < (y >> 1))");
		}

		@Test
		@DisplayName("should report a comparison chain that could be generic arguments")
		void comparisonChain()
		{
			ParseResult result = parse("a < b > c\n");
			assertThat(codes(result)).containsExactly(DiagnosticCode.E008);
			assertThat(result.getCompilationUnit().getStatements().get(0)).hasToString("(error ((a < b) > c))");
		}

		@Test
		@DisplayName("should read a comparison when the argument list exceeds the lookahead limit")
		void lookaheadLimit()
		{
			Properties props = new Properties();
			props.setProperty(ParserConfig.GLR_LOOKAHEAD_LIMIT, "2");
			FerraFrontEnd frontEnd = new FerraFrontEnd(new ParserConfig(props));
			assertThat(codes(frontEnd.parse("limit.fe", "Vec<Int>(x)\n"))).containsExactly(DiagnosticCode.E008);
			assertThat(codes("Vec<Int>(x)\n")).isEmpty();
		}
	}

	@Nested
	@DisplayName("Discarded branches")
	class DiscardedBranches
	{
		@Test
		@DisplayName("should keep only the nodes of the chosen reading")
		void nodeCounts()
		{
			// Expression nodes plus the statement and the compilation unit.
			assertThat(parse("Pair<Int, Bool>(1, true)\n").getNodeCount()).isEqualTo(9);
			assertThat(parse("a < b\n").getNodeCount()).isEqualTo(5);
			assertThat(parse("a < b > c\n").getNodeCount()).isEqualTo(8);
			assertThat(parse("Vec<Int>::new()\n").getNodeCount()).isEqualTo(7);
		}

		@Test
		@DisplayName("should leave no diagnostics from a failed trial")
		void noTrialDiagnostics()
		{
			assertThat(parseClean("let ok = a < b\nlet g = make<Int>()\n")).extracting(Object::toString)
					.containsExactly("let ok = (a < b)", "let g = make<Int>()");
		}

		@Test
		@DisplayName("should report an unbalanced macro body once and keep parsing")
		void unbalancedMacro()
		{
			ParseResult result = parse("x![1)\nlet y = 2\n");
			assertThat(codes(result)).startsWith(DiagnosticCode.E008);
			assertThat(result.getDiagnostics().get(0).getMessage())
					.isEqualTo("Macro body after 'x!' is not balanced; reading it as an index expression");
			assertThat(result.getCompilationUnit().getStatements()).last().hasToString("let y = 2");
		}
	}
}
