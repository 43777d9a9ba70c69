package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for a tuple: `()` (unit), `(x,)` or `(a, b)`.
 */
public class TupleExpression implements Expression
{
	private final SourceSpan span;
	private final List<Expression> elements;

	public TupleExpression(SourceSpan span, List<Expression> elements)
	{
		this.span = span;
		this.elements = List.copyOf(elements);
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	public boolean isUnit()
	{
		return elements.isEmpty();
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTupleExpression(this);
	}

	@Override
	public String toString()
	{
		if (elements.size() == 1)
		{
			return "(" + elements.get(0) + ",)";
		}
		return "(" + elements.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
