package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a call (e.g., `println("hi")`, `Pair<Int, Bool>(1, true)`).
 */
public class CallExpression implements Expression
{
	private final SourceSpan span;
	private final Expression callee;
	private final List<Expression> arguments;

	public CallExpression(SourceSpan span, Expression callee, List<Expression> arguments)
	{
		this.span = span;
		this.callee = callee;
		this.arguments = List.copyOf(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
