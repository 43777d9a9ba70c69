package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Destructures a data class: {@code Point { x, y: 0, .. }}.
 */
public class DataClassPattern implements Pattern
{
	private final SourceSpan span;
	private final List<Token> path;
	private final List<FieldPattern> fields;
	private final boolean hasRest;

	public DataClassPattern(SourceSpan span, List<Token> path, List<FieldPattern> fields, boolean hasRest)
	{
		this.span = span;
		this.path = List.copyOf(path);
		this.fields = List.copyOf(fields);
		this.hasRest = hasRest;
	}

	public List<Token> getPath()
	{
		return path;
	}

	public String getTypeName()
	{
		return path.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
	}

	public List<FieldPattern> getFields()
	{
		return fields;
	}

	public boolean hasRest()
	{
		return hasRest;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDataClassPattern(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(getTypeName()).append(" { ");
		sb.append(fields.stream().map(Object::toString).collect(Collectors.joining(", ")));
		if (hasRest)
		{
			sb.append(fields.isEmpty() ? ".." : ", ..");
		}
		return sb.append(" }").toString();
	}
}
