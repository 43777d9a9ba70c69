package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code <T, U: Bound>} list of a generic function or data class.
 */
public class GenericParameters implements ASTNode
{
	private final SourceSpan span;
	private final List<GenericParameter> parameters;

	public GenericParameters(SourceSpan span, List<GenericParameter> parameters)
	{
		this.span = span;
		this.parameters = List.copyOf(parameters);
	}

	public List<GenericParameter> getParameters()
	{
		return parameters;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGenericParameters(this);
	}

	@Override
	public String toString()
	{
		return "<" + parameters.stream().map(Object::toString).collect(Collectors.joining(", ")) + ">";
	}
}
