package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for a qualified name with at least two segments (e.g., `std::io::println`), or for
 * segments following a generic instantiation (e.g., `Vec<Int>::new`).
 */
public class PathExpression implements Expression
{
	private final SourceSpan span;
	private final Expression qualifier; // null for a plain path
	private final List<Token> segments;

	public PathExpression(SourceSpan span, List<Token> segments)
	{
		this(span, null, segments);
	}

	public PathExpression(SourceSpan span, Expression qualifier, List<Token> segments)
	{
		this.span = span;
		this.qualifier = qualifier;
		this.segments = List.copyOf(segments);
	}

	public Expression getQualifier()
	{
		return qualifier;
	}

	public List<Token> getSegments()
	{
		return segments;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPathExpression(this);
	}

	@Override
	public String toString()
	{
		String path = segments.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
		return qualifier == null ? path : qualifier + "::" + path;
	}
}
