package org.lokray.ferra.ast.macros;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * {@code (matcher) => {transcriber}}
 */
public class MacroRule implements ASTNode
{
	private final SourceSpan span;
	private final TokenGroup matcher;
	private final TokenGroup transcriber;

	public MacroRule(SourceSpan span, TokenGroup matcher, TokenGroup transcriber)
	{
		this.span = span;
		this.matcher = matcher;
		this.transcriber = transcriber;
	}

	public TokenGroup getMatcher()
	{
		return matcher;
	}

	public TokenGroup getTranscriber()
	{
		return transcriber;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMacroRule(this);
	}

	@Override
	public String toString()
	{
		return matcher + " => " + transcriber;
	}
}
