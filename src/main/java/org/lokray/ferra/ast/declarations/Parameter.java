package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;

/**
 * A function parameter, {@code name: Type}.
 */
public class Parameter implements ASTNode
{
	private final SourceSpan span;
	private final List<Attribute> attributes;
	private final Token name;
	private final TypeNode type;

	public Parameter(SourceSpan span, List<Attribute> attributes, Token name, TypeNode type)
	{
		this.span = span;
		this.attributes = List.copyOf(attributes);
		this.name = name;
		this.type = type;
	}

	public List<Attribute> getAttributes()
	{
		return attributes;
	}

	public Token getName()
	{
		return name;
	}

	public TypeNode getType()
	{
		return type;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Attribute attribute : attributes)
		{
			sb.append(attribute).append(' ');
		}
		return sb.append(name.getLexeme()).append(": ").append(type).toString();
	}
}
