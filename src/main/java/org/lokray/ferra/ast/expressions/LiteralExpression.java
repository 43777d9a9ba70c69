package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

/**
 * AST node representing a literal value (e.g., 123, "hello", true, 3.14, 'c').
 * Holds the literal value and its corresponding token.
 */
public class LiteralExpression implements Expression
{
	private final SourceSpan span;
	private final Token literalToken; // The token representing the literal
	private final Object value; // Long, BigInteger, Double, String, Integer code point or Boolean

	public LiteralExpression(SourceSpan span, Token literalToken)
	{
		this.span = span;
		this.literalToken = literalToken;
		this.value = literalToken.getLiteral();
	}

	public Object getValue()
	{
		return value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	public TokenType getKind()
	{
		return literalToken.getType();
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return render(literalToken.getType(), value);
	}

	/**
	 * Renders a literal value as Ferra source text: strings and chars quoted and escaped,
	 * numbers in decimal.
	 */
	public static String render(TokenType kind, Object value)
	{
		switch (kind)
		{
			case STRING_LITERAL:
				return "\"" + escape(value.toString(), true) + "\"";
			case CHAR_LITERAL:
				return "'" + escape(new String(Character.toChars((Integer) value)), false) + "'";
			default:
				return String.valueOf(value);
		}
	}

	/**
	 * Escapes text for use inside a string or char literal.
	 *
	 * @param inString Whether the text sits in a string, where braces must be doubled.
	 */
	public static String escape(String text, boolean inString)
	{
		StringBuilder sb = new StringBuilder();
		text.codePoints().forEach(cp ->
		{
			switch (cp)
			{
				case '\\':
					sb.append("\\\\");
					break;
				case '"':
					sb.append(inString ? "\\\"" : "\"");
					break;
				case '\'':
					sb.append(inString ? "'" : "\\'");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\r':
					sb.append("\\r");
					break;
				case '\t':
					sb.append("\\t");
					break;
				case 0:
					sb.append("\\0");
					break;
				case '{':
					sb.append(inString ? "{{" : "{");
					break;
				case '}':
					sb.append(inString ? "}}" : "}");
					break;
				default:
					if (Character.isISOControl(cp))
					{
						sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
					}
					else
					{
						sb.appendCodePoint(cp);
					}
			}
		});
		return sb.toString();
	}
}
