package org.lokray.ferra.ast.macros;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

public class TokenLeaf implements TokenTree
{
	private final SourceSpan span;
	private final Token token;

	public TokenLeaf(SourceSpan span, Token token)
	{
		this.span = span;
		this.token = token;
	}

	public Token getToken()
	{
		return token;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTokenLeaf(this);
	}

	@Override
	public String toString()
	{
		return token.getCanonicalText();
	}
}
