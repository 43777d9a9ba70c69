package org.lokray.ferra.lexer;

/**
 * Defines the types of tokens recognized by the Ferra Lexer.
 * This enum covers keywords, operators, literals, punctuation, layout and special tokens.
 * Fixed-spelling tokens carry their canonical source text.
 */
public enum TokenType
{
	// --- Keywords ---
	// Declarations
	LET("let"), VAR("var"), FN("fn"), ASYNC("async"), DATA("data"), EXTERN("extern"), STATIC("static"),
	PUB("pub"), UNSAFE("unsafe"), WHERE("where"), MODULE("module"), IMPORT("import"), AS("as"), MACRO("macro"),

	// Control Flow
	IF("if"), ELSE("else"), WHILE("while"), FOR("for"), IN("in"), RETURN("return"), BREAK("break"),
	CONTINUE("continue"), MATCH("match"), AWAIT("await"),

	// --- Literals ---
	IDENTIFIER,
	UNDERSCORE("_"),
	INTEGER_LITERAL,
	FLOAT_LITERAL,
	STRING_LITERAL,
	CHAR_LITERAL,
	BOOLEAN_LITERAL,

	// Interpolated string pieces: HEAD expr (MIDDLE expr)* TAIL
	STRING_HEAD,
	STRING_MIDDLE,
	STRING_TAIL,

	// --- Punctuation & Delimiters ---
	LEFT_PAREN("("), RIGHT_PAREN(")"),
	LEFT_BRACE("{"), RIGHT_BRACE("}"),
	LEFT_BRACKET("["), RIGHT_BRACKET("]"),
	COMMA(","), SEMICOLON(";"), COLON(":"), DOUBLE_COLON("::"),
	DOT("."), DOT_DOT(".."), DOT_DOT_EQUAL("..="),
	ARROW("->"), FAT_ARROW("=>"),
	QUESTION("?"), NULL_COALESCING("??"),
	HASH("#"), AT("@"), DOLLAR("$"),

	// --- Operators ---
	// Unary
	BANG("!"),

	// Multiplicative
	STAR("*"), SLASH("/"), MODULO("%"),

	// Additive
	PLUS("+"), MINUS("-"),

	// Shift
	LEFT_SHIFT("<<"), RIGHT_SHIFT(">>"),

	// Relational & Equality
	LESS("<"), LESS_EQUAL("<="),
	GREATER(">"), GREATER_EQUAL(">="),
	EQUAL_EQUAL("=="), BANG_EQUAL("!="),

	// Bitwise
	AMPERSAND("&"), PIPE("|"), CARET("^"),

	// Logical (the 'and' / 'or' keywords are lexed into these)
	AMPERSAND_AMPERSAND("&&"), PIPE_PIPE("||"),

	// Assignment & Compound Assignment
	ASSIGN("="),
	PLUS_ASSIGN("+="), MINUS_ASSIGN("-="),
	STAR_ASSIGN("*="), SLASH_ASSIGN("/="), MODULO_ASSIGN("%="),
	AMPERSAND_ASSIGN("&="), PIPE_ASSIGN("|="), CARET_ASSIGN("^="),
	LEFT_SHIFT_ASSIGN("<<="), RIGHT_SHIFT_ASSIGN(">>="),

	// --- Layout ---
	NEWLINE, INDENT, DEDENT,

	// --- Special ---
	EOF,
	ERROR;

	private final String text;

	TokenType()
	{
		this(null);
	}

	TokenType(String text)
	{
		this.text = text;
	}

	/**
	 * The canonical spelling of a fixed token, or null for tokens whose text varies.
	 */
	public String getText()
	{
		return text;
	}

	public boolean isKeyword()
	{
		return ordinal() <= AWAIT.ordinal();
	}

	public boolean isLayout()
	{
		return this == NEWLINE || this == INDENT || this == DEDENT;
	}

	public boolean isAssignment()
	{
		switch (this)
		{
			case ASSIGN:
			case PLUS_ASSIGN:
			case MINUS_ASSIGN:
			case STAR_ASSIGN:
			case SLASH_ASSIGN:
			case MODULO_ASSIGN:
			case AMPERSAND_ASSIGN:
			case PIPE_ASSIGN:
			case CARET_ASSIGN:
			case LEFT_SHIFT_ASSIGN:
			case RIGHT_SHIFT_ASSIGN:
				return true;
			default:
				return false;
		}
	}
}
