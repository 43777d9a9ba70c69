package org.lokray.ferra.parser;

import org.lokray.ferra.FerraFrontEnd;
import org.lokray.ferra.ParseResult;
import org.lokray.ferra.ast.declarations.FunctionDeclaration;
import org.lokray.ferra.ast.statements.ErrorStatement;
import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.util.ParserConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.ferra.FrontEndFixtures.codes;
import static org.lokray.ferra.FrontEndFixtures.parse;

class ErrorRecoveryTest
{
	@Test
	@DisplayName("should report an unclosed array once and resume at the next declaration")
	void unclosedArray()
	{
		ParseResult result = parse("let arr = [1, 2, 3,\nlet y = 2\n");
		assertThat(codes(result)).containsExactly(DiagnosticCode.E005);
		assertThat(result.getCompilationUnit().getStatements()).extracting(Object::toString)
				.containsExactly("let arr = (error [1, 2, 3])", "let y = 2");
	}

	@Test
	@DisplayName("should report every broken statement in one pass")
	void severalErrors()
	{
		ParseResult result = parse("let = 1\nlet b = 2\nfn (x) {}\nlet c = 3\n");
		assertThat(codes(result)).containsExactly(DiagnosticCode.E001, DiagnosticCode.E001);
		List<Statement> statements = result.getCompilationUnit().getStatements();
		assertThat(statements).hasSize(4);
		assertThat(statements.get(0)).isInstanceOf(ErrorStatement.class);
		assertThat(statements.get(1)).hasToString("let b = 2");
		assertThat(statements.get(2)).hasToString("(error-stmt)");
		assertThat(statements.get(3)).hasToString("let c = 3");
	}

	@Test
	@DisplayName("should recover inside the block that holds the error")
	void recoveryInsideBlock()
	{
		ParseResult result = parse("fn f() {\n\tlet = 1\n\tlet a = 2\n}\nlet b = 3\n");
		assertThat(codes(result)).containsExactly(DiagnosticCode.E001);
		List<Statement> statements = result.getCompilationUnit().getStatements();
		assertThat(statements).hasSize(2);
		assertThat(((FunctionDeclaration) statements.get(0)).getBody().getStatements()).extracting(Object::toString)
				.containsExactly("(error-stmt)", "let a = 2");
	}

	@Test
	@DisplayName("should skip the rest of a block left by a failed item")
	void failedItemSkipsItsBlock()
	{
		ParseResult result = parse("data P {\n\tx: Int\n\ty Int\n}\nlet z = 1\n");
		assertThat(codes(result)).containsExactly(DiagnosticCode.E001);
		assertThat(result.getCompilationUnit().getStatements()).last().hasToString("let z = 1");
	}

	@Test
	@DisplayName("should report indentation that opens no block as E003")
	void unexpectedIndent()
	{
		ParseResult result = parse("let a = 1\n\tlet b = 2\nlet c = 3\n");
		assertThat(codes(result)).containsExactly(DiagnosticCode.E003);
		assertThat(result.getCompilationUnit().getStatements()).extracting(Object::toString)
				.containsExactly("let a = 1", "let b = 2", "let c = 3");
	}

	@Test
	@DisplayName("should report an unindent to an unknown level as E003")
	void unknownUnindent()
	{
		assertThat(codes("if a:\n\t\tx\n\ty\n")).contains(DiagnosticCode.E003);
	}

	@Test
	@DisplayName("should render diagnostics with position, severity and code")
	void rendering()
	{
		ParseResult result = parse("let = 1\n");
		assertThat(result.hasErrors()).isTrue();
		assertThat(result.formatDiagnostics()).singleElement().asString()
				.startsWith("test.fe:1:5: error[E001]: Expected variable name, found '='");
	}

	@Test
	@DisplayName("should stop after the configured number of diagnostics")
	void truncation()
	{
		Properties props = new Properties();
		props.setProperty(ParserConfig.MAX_DIAGNOSTICS, "2");
		FerraFrontEnd frontEnd = new FerraFrontEnd(new ParserConfig(props));
		ParseResult result = frontEnd.parse("limit.fe", "let = 1\nlet = 2\nlet = 3\n");
		assertThat(result.getDiagnostics()).hasSize(2);
		assertThat(result.isTruncated()).isTrue();
		assertThat(result.isAborted()).isFalse();
	}
}
