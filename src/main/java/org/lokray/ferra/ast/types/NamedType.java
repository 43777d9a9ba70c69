package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A possibly qualified, possibly generic type name (e.g., `Int`, `std::Vec<T>`, `Map<String, Int>`).
 */
public class NamedType implements TypeNode
{
	private final SourceSpan span;
	private final List<Token> path;
	private final List<TypeNode> typeArguments;

	public NamedType(SourceSpan span, List<Token> path, List<TypeNode> typeArguments)
	{
		this.span = span;
		this.path = List.copyOf(path);
		this.typeArguments = List.copyOf(typeArguments);
	}

	public List<Token> getPath()
	{
		return path;
	}

	public String getName()
	{
		return path.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
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
		return visitor.visitNamedType(this);
	}

	@Override
	public String toString()
	{
		if (typeArguments.isEmpty())
		{
			return getName();
		}
		return getName() + "<" + typeArguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ">";
	}
}
