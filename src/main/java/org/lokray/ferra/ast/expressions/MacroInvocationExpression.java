package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * AST node for a macro invocation such as `vec![1, 2]` or `log::trace!("x = {x}")`.
 * The body is kept as an unexpanded token tree.
 */
public class MacroInvocationExpression implements Expression
{
	private final SourceSpan span;
	private final Expression name; // IdentifierExpression or PathExpression
	private final TokenGroup body;

	public MacroInvocationExpression(SourceSpan span, Expression name, TokenGroup body)
	{
		this.span = span;
		this.name = name;
		this.body = body;
	}

	public Expression getName()
	{
		return name;
	}

	public TokenGroup getBody()
	{
		return body;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMacroInvocationExpression(this);
	}

	@Override
	public String toString()
	{
		return name + "!" + body;
	}
}
