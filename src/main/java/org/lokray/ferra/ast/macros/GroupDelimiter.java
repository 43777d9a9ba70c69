package org.lokray.ferra.ast.macros;

import org.lokray.ferra.lexer.TokenType;

public enum GroupDelimiter
{
	PAREN(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, "(", ")"),
	BRACKET(TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET, "[", "]"),
	BRACE(TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, "{", "}");

	private final TokenType open;
	private final TokenType close;
	private final String openText;
	private final String closeText;

	GroupDelimiter(TokenType open, TokenType close, String openText, String closeText)
	{
		this.open = open;
		this.close = close;
		this.openText = openText;
		this.closeText = closeText;
	}

	public TokenType getOpen()
	{
		return open;
	}

	public TokenType getClose()
	{
		return close;
	}

	public String getOpenText()
	{
		return openText;
	}

	public String getCloseText()
	{
		return closeText;
	}

	/**
	 * @return The delimiter opened by the given token type, or null.
	 */
	public static GroupDelimiter opening(TokenType type)
	{
		for (GroupDelimiter delimiter : values())
		{
			if (delimiter.open == type)
			{
				return delimiter;
			}
		}
		return null;
	}
}
