package org.lokray.ferra.formatter;

import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.ast.statements.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lokray.ferra.FrontEndFixtures.parse;
import static org.lokray.ferra.FrontEndFixtures.parseClean;
import static org.lokray.ferra.FrontEndFixtures.unit;

class SourcePrinterTest
{
	private static final String PROGRAM = String.join("\n",
			"import std::io::{read, write}",
			"",
			"#[inline]",
			"pub fn add<T: Num>(a: T, b: T) -> T where T: Copy {",
			"\treturn a + b",
			"}",
			"",
			"data Point<T> {",
			"\tx: T,",
			"\ty: T",
			"}",
			"",
			"extern \"C\" {",
			"\tfn puts(s: *Char) -> Int",
			"}",
			"",
			"macro square {",
			"\t($x) => ($x * $x)",
			"}",
			"",
			"module geometry {",
			"\tfn area(p: Point<Float>) -> Float {",
			"\t\tlet r = match p {",
			"\t\t\tPoint { x, y: 0 } => x,",
			"\t\t\t1 | 2 => 0.5,",
			"\t\t\t_ => { log(\"other\"); p.x * p.y }",
			"\t\t}",
			"\t\treturn r",
			"\t}",
			"}",
			"",
			"async fn load(url: String) -> Data {",
			"\tlet body = fetch(url).await?",
			"\treturn body",
			"}",
			"",
			"fn main() {",
			"\tvar total = 0",
			"\tfor i in 0..10 {",
			"\t\tif i % 2 == 0 {",
			"\t\t\ttotal += i",
			"\t\t} else if i > 7 {",
			"\t\t\tbreak",
			"\t\t} else {",
			"\t\t\tcontinue",
			"\t\t}",
			"\t}",
			"\twhile total > 0 {",
			"\t\ttotal -= 1",
			"\t}",
			"\tlet v = if total == 0 { \"zero\" } else { \"more\" }",
			"\tlet items = [1, 2, 3]",
			"\tlet pair = (items[0], \"sum {total}!\")",
			"\tlet made = Vec<Int>::new()",
			"\tlet neg = -(total + 1) * 2",
			"\tprintln!(\"%d\", pair.0)",
			"\tunsafe {",
			"\t\tpoke(nested.0.1, 0)",
			"\t}",
			"\tasync {",
			"\t\tlet page = load(\"x\").await?",
			"\t}",
			"}",
			"");

	private static List<String> statements(CompilationUnit unit)
	{
		return unit.getStatements().stream().map(Statement::toString).collect(Collectors.toList());
	}

	@Nested
	@DisplayName("Round trip")
	class RoundTrip
	{
		@ParameterizedTest
		@EnumSource(BlockStyle.class)
		@DisplayName("should reparse printed source into an equal tree")
		void reparses(BlockStyle style)
		{
			List<Statement> original = parseClean(PROGRAM);
			String printed = new SourcePrinter(style).print(unit(PROGRAM));
			List<Statement> reparsed = parseClean(printed);
			assertThat(reparsed).extracting(Object::toString)
					.containsExactlyElementsOf(original.stream().map(Object::toString).collect(Collectors.toList()));
		}

		@Test
		@DisplayName("should be stable when printed twice")
		void idempotent()
		{
			SourcePrinter printer = new SourcePrinter(BlockStyle.INDENTED);
			String once = printer.print(unit(PROGRAM));
			String twice = printer.print(unit(once));
			assertThat(twice).isEqualTo(once);
		}
	}

	@Nested
	@DisplayName("Block styles")
	class BlockStyles
	{
		@Test
		@DisplayName("should parse brace and indented forms of a program into equal trees")
		void equivalentForms()
		{
			String braces = "fn f(x: Int) -> Int {\n\tif x > 0 {\n\t\treturn x\n\t} else {\n\t\treturn -x\n\t}\n}\n";
			String indented = "fn f(x: Int) -> Int:\n\tif x > 0:\n\t\treturn x\n\telse:\n\t\treturn -x\n";
			assertThat(statements(unit(indented))).isEqualTo(statements(unit(braces)));
		}

		@Test
		@DisplayName("should print indented source as braces")
		void toBraces()
		{
			assertThat(new SourcePrinter(BlockStyle.BRACE).print(unit("if a:\n\tx\n"))).isEqualTo("if a {\n\tx\n}\n");
		}

		@Test
		@DisplayName("should print braced source as indentation")
		void toIndentation()
		{
			assertThat(new SourcePrinter(BlockStyle.INDENTED).print(unit("if a { x } else { y }\n")))
					.isEqualTo("if a:\n\tx\nelse:\n\ty\n");
		}

		@Test
		@DisplayName("should print empty blocks as braces in both styles")
		void emptyBlocks()
		{
			assertThat(new SourcePrinter(BlockStyle.INDENTED).print(unit("while x:\n\ty\nwhile z {}\n")))
					.isEqualTo("while x:\n\ty\nwhile z {}\n");
		}

		@Test
		@DisplayName("should keep the unsafe and async markers of a block in either style")
		void markedBlocks()
		{
			assertThat(new SourcePrinter(BlockStyle.INDENTED).print(unit("unsafe { f() }\n"))).isEqualTo("unsafe:\n\tf()\n");
			assertThat(new SourcePrinter(BlockStyle.BRACE).print(unit("async:\n\tg()\n"))).isEqualTo("async {\n\tg()\n}\n");
			assertThat(new SourcePrinter(BlockStyle.BRACE).print(unit("unsafe async {}\n"))).isEqualTo("unsafe async {}\n");
		}

		@Test
		@DisplayName("should keep blocks in expression position on one line")
		void inlineBlocks()
		{
			assertThat(new SourcePrinter(BlockStyle.INDENTED).print(unit("let v = if a:\n\t1\nelse:\n\t2\n")))
					.isEqualTo("let v = if a { 1 } else { 2 }\n");
		}
	}

	@Nested
	@DisplayName("Output")
	class Output
	{
		private final SourcePrinter printer = new SourcePrinter();

		@Test
		@DisplayName("should default to braces")
		void defaultStyle()
		{
			assertThat(printer.getPreferredStyle()).isEqualTo(BlockStyle.BRACE);
			assertThat(printer.print(unit("data P:\n\tx: Int\n"))).isEqualTo("data P {\n\tx: Int\n}\n");
		}

		@Test
		@DisplayName("should keep the source spelling of numbers and canonical operators")
		void spelling()
		{
			assertThat(printer.print(unit("let n = 0xFF + 1_000\n"))).isEqualTo("let n = 0xFF + 1_000\n");
			assertThat(printer.print(unit("a and b or c\n"))).isEqualTo("a && b || c\n");
		}

		@Test
		@DisplayName("should separate nested prefix operators")
		void nestedUnary()
		{
			assertThat(printer.print(unit("- -a\n"))).isEqualTo("- -a\n");
		}

		@Test
		@DisplayName("should print a placeholder comment for statements that failed to parse")
		void errorPlaceholder()
		{
			assertThat(printer.print(parse("let = 1\nlet b = 2\n").getCompilationUnit()))
					.isEqualTo("/* error */\nlet b = 2\n");
		}

		@Test
		@DisplayName("should print a single node")
		void singleNode()
		{
			Statement statement = parseClean("let t: (Int,) = (1,)\n").get(0);
			assertThat(printer.print(statement)).isEqualTo("let t: (Int,) = (1,)");
		}

		@Test
		@DisplayName("should reject a missing tree")
		void rejectsNull()
		{
			assertThatThrownBy(() -> printer.print((CompilationUnit) null)).isInstanceOf(NullPointerException.class);
		}
	}
}
