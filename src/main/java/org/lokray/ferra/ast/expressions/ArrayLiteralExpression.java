package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for an array literal such as `[1, 2, 3]`.
 */
public class ArrayLiteralExpression implements Expression
{
	private final SourceSpan span;
	private final List<Expression> elements;

	public ArrayLiteralExpression(SourceSpan span, List<Expression> elements)
	{
		this.span = span;
		this.elements = List.copyOf(elements);
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return "[" + elements.stream().map(Object::toString).collect(Collectors.joining(", ")) + "]";
	}
}
