package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.lexer.TokenType;

/**
 * Keywords that may prefix a declaration.
 */
public enum Modifier
{
	PUB("pub"),
	UNSAFE("unsafe");

	private final String keyword;

	Modifier(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public static Modifier fromToken(TokenType type)
	{
		switch (type)
		{
			case PUB:
				return PUB;
			case UNSAFE:
				return UNSAFE;
			default:
				throw new IllegalArgumentException(type + " is not a modifier");
		}
	}
}
