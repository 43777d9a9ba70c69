package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

public class TuplePattern implements Pattern
{
	private final SourceSpan span;
	private final List<Pattern> elements;

	public TuplePattern(SourceSpan span, List<Pattern> elements)
	{
		this.span = span;
		this.elements = List.copyOf(elements);
	}

	public List<Pattern> getElements()
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
		return visitor.visitTuplePattern(this);
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
