package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code where T: Display, U: Clone + Send}
 */
public class WhereClause implements ASTNode
{
	private final SourceSpan span;
	private final List<GenericParameter> predicates;

	public WhereClause(SourceSpan span, List<GenericParameter> predicates)
	{
		this.span = span;
		this.predicates = List.copyOf(predicates);
	}

	public List<GenericParameter> getPredicates()
	{
		return predicates;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhereClause(this);
	}

	@Override
	public String toString()
	{
		return "where " + predicates.stream().map(Object::toString).collect(Collectors.joining(", "));
	}
}
