package org.lokray.ferra.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Ferra Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * its typed literal value and its position in the source buffer.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INTEGER_LITERAL, PLUS)
	private final String lexeme;     // The actual text of the token (e.g., "total", "0x1F", "and")
	private final Object literal;    // The parsed value of the literal (e.g., Long 31, String "hello")
	private final SourceSpan span;   // Byte offsets plus the line/column where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source code.
	 * @param literal The parsed literal value for literal tokens (Long or BigInteger for integers,
	 *                Double for floats, String for strings, Integer code point for chars,
	 *                Boolean for booleans). Null for non-literal tokens.
	 * @param span    Where this token sits in the source buffer.
	 */
	public Token(TokenType type, String lexeme, Object literal, SourceSpan span)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.span = span;
	}

	/**
	 * Creates a token that does not originate from source text, such as the halves of a split {@code >>}.
	 */
	public static Token synthetic(TokenType type, SourceSpan span)
	{
		return new Token(type, type.getText() != null ? type.getText() : "", null, span);
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	public int getLine()
	{
		return span.line();
	}

	public int getColumn()
	{
		return span.column();
	}

	/**
	 * The spelling used when printing this token back as source: the canonical text for fixed
	 * tokens (so {@code and} prints as {@code &&}), the lexeme otherwise.
	 */
	public String getCanonicalText()
	{
		return type.getText() != null ? type.getText() : lexeme;
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'Lexeme' [Literal] (Line:x, Col:y)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + span.line() + ", Col:" + span.column() + ")";
	}

	/**
	 * Equality compares type, lexeme and literal. The span is not included, since tokens
	 * from different positions are still "the same" for structural comparison.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}

		Token token = (Token) o;

		if (type != token.type)
		{
			return false;
		}
		if (!lexeme.equals(token.lexeme))
		{
			return false;
		}
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
