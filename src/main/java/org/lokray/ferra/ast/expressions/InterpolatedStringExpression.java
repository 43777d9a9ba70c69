package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;

/**
 * AST node for a string literal with {@code {expr}} interpolation spans.
 * There is always one more text fragment than there are embedded expressions;
 * fragment {@code i} precedes expression {@code i}.
 */
public class InterpolatedStringExpression implements Expression
{
	private final SourceSpan span;
	private final List<String> fragments;
	private final List<Expression> expressions;

	public InterpolatedStringExpression(SourceSpan span, List<String> fragments, List<Expression> expressions)
	{
		if (fragments.size() != expressions.size() + 1)
		{
			throw new IllegalArgumentException("Expected " + (expressions.size() + 1) + " fragments, got " + fragments.size());
		}
		this.span = span;
		this.fragments = List.copyOf(fragments);
		this.expressions = List.copyOf(expressions);
	}

	public List<String> getFragments()
	{
		return fragments;
	}

	public List<Expression> getExpressions()
	{
		return expressions;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterpolatedStringExpression(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < expressions.size(); i++)
		{
			sb.append(LiteralExpression.escape(fragments.get(i), true));
			sb.append('{').append(expressions.get(i)).append('}');
		}
		sb.append(LiteralExpression.escape(fragments.get(fragments.size() - 1), true));
		return sb.append('"').toString();
	}
}
