package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for a name applied to type arguments in expression position (e.g., `Vec<Int>`).
 */
public class GenericInstantiationExpression implements Expression
{
	private final SourceSpan span;
	private final Expression target;
	private final List<TypeNode> typeArguments;

	public GenericInstantiationExpression(SourceSpan span, Expression target, List<TypeNode> typeArguments)
	{
		this.span = span;
		this.target = target;
		this.typeArguments = List.copyOf(typeArguments);
	}

	public Expression getTarget()
	{
		return target;
	}

	public List<TypeNode> getTypeArguments()
	{
		return typeArguments;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGenericInstantiationExpression(this);
	}

	@Override
	public String toString()
	{
		return target + "<" + typeArguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ">";
	}
}
