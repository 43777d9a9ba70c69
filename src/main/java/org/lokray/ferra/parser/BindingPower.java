package org.lokray.ferra.parser;

import org.lokray.ferra.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * The binding powers of Ferra's operators, from the loosest ({@link #ASSIGNMENT}) to the
 * tightest ({@link #TRY}).
 */
public final class BindingPower
{
	public static final int NONE = 0;
	public static final int ASSIGNMENT = 2;
	public static final int NULL_COALESCING = 4;
	public static final int LOGICAL_OR = 5;
	public static final int LOGICAL_AND = 6;
	public static final int COMPARISON = 7;
	public static final int RANGE = 8;
	public static final int BITWISE = 9;
	public static final int SHIFT = 10;
	public static final int ADDITIVE = 11;
	public static final int MULTIPLICATIVE = 12;
	public static final int PREFIX = 13;
	public static final int POSTFIX = 14;
	public static final int TRY = 15;

	public enum Associativity
	{
		LEFT, RIGHT, NONE
	}

	/**
	 * An infix operator's entry in the table.
	 */
	public record Infix(int power, Associativity associativity)
	{
		/**
		 * The floor for the right operand.
		 */
		public int rightPower()
		{
			return associativity == Associativity.RIGHT ? power : power + 1;
		}
	}

	private static final Map<TokenType, Infix> INFIX = new EnumMap<>(TokenType.class);

	static
	{
		infix(NULL_COALESCING, Associativity.RIGHT, TokenType.NULL_COALESCING);
		infix(LOGICAL_OR, Associativity.LEFT, TokenType.PIPE_PIPE);
		infix(LOGICAL_AND, Associativity.LEFT, TokenType.AMPERSAND_AMPERSAND);
		infix(COMPARISON, Associativity.NONE, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS,
				TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL);
		infix(RANGE, Associativity.NONE, TokenType.DOT_DOT, TokenType.DOT_DOT_EQUAL);
		infix(BITWISE, Associativity.LEFT, TokenType.AMPERSAND, TokenType.CARET, TokenType.PIPE);
		infix(SHIFT, Associativity.LEFT, TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT);
		infix(ADDITIVE, Associativity.LEFT, TokenType.PLUS, TokenType.MINUS);
		infix(MULTIPLICATIVE, Associativity.LEFT, TokenType.STAR, TokenType.SLASH, TokenType.MODULO);
	}

	private BindingPower()
	{
	}

	private static void infix(int power, Associativity associativity, TokenType... types)
	{
		for (TokenType type : types)
		{
			INFIX.put(type, new Infix(power, associativity));
		}
	}

	/**
	 * @return The table entry for an infix operator, or null if the token is not one.
	 */
	public static Infix infix(TokenType type)
	{
		return INFIX.get(type);
	}

	public static boolean isComparison(TokenType type)
	{
		Infix infix = INFIX.get(type);
		return infix != null && infix.power() == COMPARISON;
	}

	public static boolean isRange(TokenType type)
	{
		return type == TokenType.DOT_DOT || type == TokenType.DOT_DOT_EQUAL;
	}

	public static boolean isPrefix(TokenType type)
	{
		return type == TokenType.BANG || type == TokenType.MINUS || type == TokenType.PLUS;
	}
}
