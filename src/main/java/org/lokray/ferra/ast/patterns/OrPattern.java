package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches when any of its alternatives matches: {@code 1 | 2 | 3}.
 */
public class OrPattern implements Pattern
{
	private final SourceSpan span;
	private final List<Pattern> alternatives;

	public OrPattern(SourceSpan span, List<Pattern> alternatives)
	{
		this.span = span;
		this.alternatives = List.copyOf(alternatives);
	}

	public List<Pattern> getAlternatives()
	{
		return alternatives;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitOrPattern(this);
	}

	@Override
	public String toString()
	{
		return alternatives.stream().map(Object::toString).collect(Collectors.joining(" | "));
	}
}
