package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An attribute such as {@code #[inline]} or {@code #[link(name = "c")]}.
 */
public class Attribute implements ASTNode
{
	private final SourceSpan span;
	private final Token name;
	private final List<Expression> arguments;

	public Attribute(SourceSpan span, Token name, List<Expression> arguments)
	{
		this.span = span;
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public Token getName()
	{
		return name;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAttribute(this);
	}

	@Override
	public String toString()
	{
		if (arguments.isEmpty())
		{
			return "#[" + name.getLexeme() + "]";
		}
		return "#[" + name.getLexeme() + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")]";
	}
}
