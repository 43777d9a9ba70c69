package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * `(A, B)`, or `()` for the unit type.
 */
public class TupleType implements TypeNode
{
	private final SourceSpan span;
	private final List<TypeNode> elements;

	public TupleType(SourceSpan span, List<TypeNode> elements)
	{
		this.span = span;
		this.elements = List.copyOf(elements);
	}

	public List<TypeNode> getElements()
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
		return visitor.visitTupleType(this);
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
