package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A type parameter with optional bounds and default, {@code T: Display + Clone = String}.
 * Also used for the predicates of a where clause, which never carry a default.
 */
public class GenericParameter implements ASTNode
{
	private final SourceSpan span;
	private final Token name;
	private final List<TypeNode> bounds;
	private final TypeNode defaultType; // may be null

	public GenericParameter(SourceSpan span, Token name, List<TypeNode> bounds, TypeNode defaultType)
	{
		this.span = span;
		this.name = name;
		this.bounds = List.copyOf(bounds);
		this.defaultType = defaultType;
	}

	public Token getName()
	{
		return name;
	}

	public List<TypeNode> getBounds()
	{
		return bounds;
	}

	public TypeNode getDefaultType()
	{
		return defaultType;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGenericParameter(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(name.getLexeme());
		if (!bounds.isEmpty())
		{
			sb.append(": ").append(bounds.stream().map(Object::toString).collect(Collectors.joining(" + ")));
		}
		if (defaultType != null)
		{
			sb.append(" = ").append(defaultType);
		}
		return sb.toString();
	}
}
