package org.lokray.ferra.ast;

import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;

/**
 * The root of the AST: every top-level statement and declaration of one source buffer, in order.
 */
public class CompilationUnit implements ASTNode
{
	private final SourceSpan span;
	private final List<Statement> statements;

	public CompilationUnit(SourceSpan span, List<Statement> statements)
	{
		this.span = span;
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCompilationUnit(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : statements)
		{
			sb.append(statement).append('\n');
		}
		return sb.toString();
	}
}
