package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

/**
 * AST node for {@code for name in iterable block}.
 */
public class ForStatement implements Statement
{
	private final SourceSpan span;
	private final Token variable;
	private final Expression iterable;
	private final BlockStatement body;

	public ForStatement(SourceSpan span, Token variable, Expression iterable, BlockStatement body)
	{
		this.span = span;
		this.variable = variable;
		this.iterable = iterable;
		this.body = body;
	}

	public Token getVariable()
	{
		return variable;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "for " + variable.getLexeme() + " in " + iterable + " " + body;
	}
}
