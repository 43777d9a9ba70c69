package org.lokray.ferra.parser;

import org.lokray.ferra.ast.patterns.BindingPattern;
import org.lokray.ferra.ast.patterns.DataClassPattern;
import org.lokray.ferra.ast.patterns.FieldPattern;
import org.lokray.ferra.ast.patterns.IdentifierPattern;
import org.lokray.ferra.ast.patterns.LiteralPattern;
import org.lokray.ferra.ast.patterns.OrPattern;
import org.lokray.ferra.ast.patterns.Pattern;
import org.lokray.ferra.ast.patterns.RangePattern;
import org.lokray.ferra.ast.patterns.RestPattern;
import org.lokray.ferra.ast.patterns.SlicePattern;
import org.lokray.ferra.ast.patterns.TuplePattern;
import org.lokray.ferra.ast.patterns.WildcardPattern;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the patterns of {@code match} arms.
 */
public class PatternParser extends AbstractParser
{
	public PatternParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Parses a pattern, including or-alternatives.
	 * Grammar: Pattern ::= PrimaryPattern { '|' PrimaryPattern }
	 *
	 * @return The parsed Pattern.
	 * @throws ParseException if no pattern starts at the current token.
	 */
	public Pattern parsePattern()
	{
		Token start = peek();
		Pattern first = parsePrimaryPattern();
		if (!check(TokenType.PIPE))
		{
			return first;
		}
		List<Pattern> alternatives = new ArrayList<>();
		alternatives.add(first);
		while (match(TokenType.PIPE))
		{
			alternatives.add(parsePrimaryPattern());
		}
		return node(new OrPattern(spanFrom(start), alternatives));
	}

	private Pattern parsePrimaryPattern()
	{
		Token start = peek();
		switch (start.getType())
		{
			case UNDERSCORE:
				advance();
				return node(new WildcardPattern(start.getSpan()));
			case DOT_DOT:
				advance();
				return node(new RestPattern(start.getSpan()));
			case MINUS:
			case INTEGER_LITERAL:
			case FLOAT_LITERAL:
			case STRING_LITERAL:
			case CHAR_LITERAL:
			case BOOLEAN_LITERAL:
				return parseLiteralOrRange();
			case LEFT_BRACKET:
				return parseSlicePattern();
			case LEFT_PAREN:
				return parseTuplePattern();
			case IDENTIFIER:
				return parseNamedPattern();
			default:
				if (start.getType().isKeyword())
				{
					return parseNamedPattern(); // reported as E009 by consumeIdentifier
				}
				throw error(start, "Expected pattern");
		}
	}

	private Pattern parseLiteralOrRange()
	{
		Token start = peek();
		LiteralPattern low = parseLiteral();
		if (check(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUAL))
		{
			boolean inclusive = advance().getType() == TokenType.DOT_DOT_EQUAL;
			LiteralPattern high = parseLiteral();
			return node(new RangePattern(spanFrom(start), low, high, inclusive));
		}
		return low;
	}

	private LiteralPattern parseLiteral()
	{
		Token start = peek();
		boolean negated = match(TokenType.MINUS);
		if (negated)
		{
			if (!check(TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL))
			{
				throw error(peek(), "Expected numeric literal after '-' in pattern");
			}
		}
		else if (!check(TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
				TokenType.CHAR_LITERAL, TokenType.BOOLEAN_LITERAL))
		{
			throw error(peek(), "Expected literal in range pattern");
		}
		Token literal = advance();
		return node(new LiteralPattern(spanFrom(start), literal, negated));
	}

	private Pattern parseNamedPattern()
	{
		Token start = peek();
		if (checkAt(1, TokenType.AT))
		{
			Token name = consumeIdentifier("binding name");
			advance(); // '@'
			Pattern inner = parsePrimaryPattern();
			return node(new BindingPattern(spanFrom(start), name, inner));
		}
		List<Token> path = new ArrayList<>();
		path.add(consumeIdentifier("pattern name"));
		while (match(TokenType.DOUBLE_COLON))
		{
			path.add(consumeIdentifier("path segment"));
		}
		if (check(TokenType.LEFT_BRACE))
		{
			return parseDataClassPattern(start, path);
		}
		if (path.size() > 1)
		{
			throw error(peek(), "Expected '{' after type path in pattern");
		}
		return node(new IdentifierPattern(spanFrom(start), path.get(0)));
	}

	/**
	 * Grammar: DataClassPattern ::= Path '{' ( FieldPattern { ',' FieldPattern } )? ( ',' '..' )? '}'
	 */
	private Pattern parseDataClassPattern(Token start, List<Token> path)
	{
		consume(TokenType.LEFT_BRACE, "Expected '{' in data class pattern");
		List<FieldPattern> fields = new ArrayList<>();
		boolean hasRest = false;
		skipLayout();
		while (!check(TokenType.RIGHT_BRACE))
		{
			if (match(TokenType.DOT_DOT))
			{
				hasRest = true;
				skipLayout();
				break;
			}
			Token fieldStart = peek();
			Token name = consumeIdentifier("field name");
			Pattern pattern = match(TokenType.COLON) ? parsePattern() : null;
			fields.add(node(new FieldPattern(spanFrom(fieldStart), name, pattern)));
			skipLayout();
			if (!match(TokenType.COMMA))
			{
				break;
			}
			skipLayout();
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' to close data class pattern");
		return node(new DataClassPattern(spanFrom(start), path, fields, hasRest));
	}

	private Pattern parseSlicePattern()
	{
		Token start = advance();
		List<Pattern> elements = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACKET))
		{
			elements.add(parsePattern());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACKET, "Expected ']' to close slice pattern");
		return node(new SlicePattern(spanFrom(start), elements));
	}

	private Pattern parseTuplePattern()
	{
		Token start = advance();
		List<Pattern> elements = new ArrayList<>();
		boolean trailingComma = false;
		while (!check(TokenType.RIGHT_PAREN))
		{
			elements.add(parsePattern());
			trailingComma = match(TokenType.COMMA);
			if (!trailingComma)
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' to close tuple pattern");
		if (elements.size() == 1 && !trailingComma)
		{
			return elements.get(0); // parenthesized
		}
		return node(new TuplePattern(spanFrom(start), elements));
	}

	// Pattern braces are block braces to the scanner, so line breaks inside them are visible.
	private void skipLayout()
	{
		while (check(TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT))
		{
			advance();
		}
	}
}
