package org.lokray.ferra.parser;

import org.lokray.ferra.ast.expressions.MatchArm;
import org.lokray.ferra.ast.expressions.MatchExpression;
import org.lokray.ferra.ast.patterns.BindingPattern;
import org.lokray.ferra.ast.patterns.DataClassPattern;
import org.lokray.ferra.ast.patterns.OrPattern;
import org.lokray.ferra.ast.patterns.TuplePattern;
import org.lokray.ferra.ast.statements.ExpressionStatement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.parseClean;

class PatternParserTest
{
	private static MatchArm arm(String pattern)
	{
		ExpressionStatement statement = (ExpressionStatement) parseClean("match v { " + pattern + " => 0 }\n").get(0);
		return ((MatchExpression) statement.getExpression()).getArms().get(0);
	}

	@ParameterizedTest(name = "{0}")
	@DisplayName("should read each pattern form")
	@CsvSource(delimiter = '|', quoteCharacter = '`', value = {
			"_                     | _",
			"42                    | 42",
			"-1                    | -1",
			"x                     | x",
			"1..=5                 | 1..=5",
			"'a'..'z'              | 'a'..'z'",
			"n @ 1..=9             | n @ 1..=9",
			"(a, _)                | (a, _)",
			"(a,)                  | (a,)",
			"(a)                   | a",
			"[first, .., last]     | [first, .., last]",
			"[head, rest @ ..]     | [head, rest @ ..]",
			"Point { x, y: 0 }     | Point { x, y: 0 }",
			"Point { x, .. }       | Point { x, .. }",
			"shapes::Circle { r }  | shapes::Circle { r }",
			"Unit {}               | Unit {  }"
	})
	void patternForms(String source, String expected)
	{
		assertThat(arm(source).getPattern()).hasToString(expected);
	}

	@Test
	@DisplayName("should read string literal patterns")
	void stringPattern()
	{
		assertThat(arm("\"on\" | \"yes\"").getPattern()).hasToString("\"on\" | \"yes\"");
	}

	@Test
	@DisplayName("should read or-patterns as one pattern with alternatives")
	void orPatterns()
	{
		OrPattern pattern = (OrPattern) arm("1 | 2 | 3").getPattern();
		assertThat(pattern.getAlternatives()).hasSize(3);
		assertThat(pattern).hasToString("1 | 2 | 3");
	}

	@Test
	@DisplayName("should nest patterns inside tuples and bindings")
	void nesting()
	{
		TuplePattern tuple = (TuplePattern) arm("(Some { value: v @ 1..=3 }, rest)").getPattern();
		DataClassPattern data = (DataClassPattern) tuple.getElements().get(0);
		assertThat(data.getFields().get(0).getPattern()).isInstanceOf(BindingPattern.class);
	}

	@Test
	@DisplayName("should keep the arm guard")
	void guards()
	{
		MatchArm arm = arm("(x, y) if x == y");
		assertThat(arm.getPattern()).hasToString("(x, y)");
		assertThat(arm.getGuard()).hasToString("(x == y)");
	}

	@Test
	@DisplayName("should read field patterns spread over several lines")
	void multiLineFields()
	{
		String source = "match p {\n\tPoint {\n\t\tx,\n\t\ty\n\t} => x\n}\n";
		ExpressionStatement statement = (ExpressionStatement) parseClean(source).get(0);
		assertThat(((MatchExpression) statement.getExpression()).getArms().get(0).getPattern())
				.hasToString("Point { x, y }");
	}

	@Test
	@DisplayName("should reject a path pattern without a field list")
	void bareTypePath()
	{
		assertThat(codes("match v { a::b => 0 }\n")).containsExactly(DiagnosticCode.E001);
	}

	@Test
	@DisplayName("should reject '-' before a non-numeric literal")
	void negatedString()
	{
		assertThat(codes("match v { -\"s\" => 0 }\n")).containsExactly(DiagnosticCode.E001);
	}
}
