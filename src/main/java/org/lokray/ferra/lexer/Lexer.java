package org.lokray.ferra.lexer;

import org.lokray.ferra.diagnostics.Diagnostic;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.util.ErrorReporter;
import org.lokray.ferra.util.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw Ferra source code and converts it into a stream of Tokens, including the
 * NEWLINE, INDENT and DEDENT layout tokens. Every significant token is also fed to a
 * {@link TerminatorResolver}, which classifies the NEWLINE tokens as they are produced.
 */
public class Lexer
{
	private static final Logger log = LoggerFactory.getLogger(Lexer.class);

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	// A line starting with one of these cannot continue an open parenthesis or bracket.
	private static final Set<String> RESYNC_KEYWORDS = Set.of("let", "var", "fn", "data", "extern", "module", "import", "macro");

	static
	{
		keywords = new HashMap<>();
		keywords.put("let", TokenType.LET);
		keywords.put("var", TokenType.VAR);
		keywords.put("fn", TokenType.FN);
		keywords.put("async", TokenType.ASYNC);
		keywords.put("await", TokenType.AWAIT);
		keywords.put("data", TokenType.DATA);
		keywords.put("match", TokenType.MATCH);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("for", TokenType.FOR);
		keywords.put("in", TokenType.IN);
		keywords.put("return", TokenType.RETURN);
		keywords.put("break", TokenType.BREAK);
		keywords.put("continue", TokenType.CONTINUE);
		keywords.put("extern", TokenType.EXTERN);
		keywords.put("static", TokenType.STATIC);
		keywords.put("pub", TokenType.PUB);
		keywords.put("unsafe", TokenType.UNSAFE);
		keywords.put("where", TokenType.WHERE);
		keywords.put("module", TokenType.MODULE);
		keywords.put("import", TokenType.IMPORT);
		keywords.put("as", TokenType.AS);
		keywords.put("macro", TokenType.MACRO);
		keywords.put("true", TokenType.BOOLEAN_LITERAL);
		keywords.put("false", TokenType.BOOLEAN_LITERAL);
		// Word aliases are normalised to the canonical operator tokens here.
		keywords.put("and", TokenType.AMPERSAND_AMPERSAND);
		keywords.put("or", TokenType.PIPE_PIPE);
	}

	/**
	 * Returns true if the word is reserved and can never be used as an identifier.
	 */
	public static boolean isReservedWord(String word)
	{
		return keywords.containsKey(word);
	}

	private final String source; // The raw source code string
	private final ErrorReporter errorReporter; // For reporting lexical errors
	private final int tabWidth;
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private final IndentationStack indentation = new IndentationStack();
	private final TerminatorResolver resolver = new TerminatorResolver();
	private final Deque<Interpolation> interpolations = new ArrayDeque<>();
	private final Deque<BraceLayout> braceLayouts = new ArrayDeque<>();

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number
	private int startByte = 0;
	private int currentByte = 0; // UTF-8 byte offset of `current`

	private int startLine = 1;
	private int startColumn = 1;

	private boolean atLineStart = true;
	private boolean lineHasTokens = false;
	private boolean continuationLine = false;
	private boolean pendingBraceBaseline = false;

	/**
	 * An open {@code {expr}} span inside a string literal.
	 */
	private static final class Interpolation
	{
		private final SourceSpan openedAt;
		private int braceDepth = 0;

		private Interpolation(SourceSpan openedAt)
		{
			this.openedAt = openedAt;
		}
	}

	/**
	 * The indentation depth at which a block brace was opened.
	 */
	private static final class BraceLayout
	{
		private final int depth;
		private boolean abandoned = false;

		private BraceLayout(int depth)
		{
			this.depth = depth;
		}
	}

	private record Position(int offset, int bytes, int line, int column)
	{
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for collecting diagnostics.
	 * @param config        Supplies the tab width used to measure indentation.
	 */
	public Lexer(String source, ErrorReporter errorReporter, ParserConfig config)
	{
		this.source = source;
		this.errorReporter = errorReporter;
		this.tabWidth = config.getTabWidth();
	}

	public Lexer(String source, ErrorReporter errorReporter)
	{
		this(source, errorReporter, ParserConfig.defaults());
	}

	/**
	 * Scans the entire source code and returns a list of tokens ending with EOF.
	 *
	 * @throws LexicalAbortException on an unterminated block comment.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd() && !errorReporter.isLimitReached())
		{
			if (atLineStart)
			{
				beginLine();
				continue;
			}
			markStart();
			scanToken();
		}
		finish();
		log.debug("Scanned {} tokens", tokens.size());
		return tokens;
	}

	/**
	 * The resolver holding the terminator classification of the NEWLINE tokens produced by this lexer.
	 */
	public TerminatorResolver getTerminatorResolver()
	{
		return resolver;
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance(); // Get and consume the current character

		switch (c)
		{
			case ' ':
			case '\t':
				break;
			case '\r':
				match('\n');
				handleLineBreak();
				break;
			case '\n':
				handleLineBreak();
				break;

			// --- Single-character tokens ---
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '[':
				addToken(TokenType.LEFT_BRACKET);
				break;
			case ']':
				addToken(TokenType.RIGHT_BRACKET);
				break;
			case '{':
				openBrace();
				break;
			case '}':
				closeBrace();
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '#':
				addToken(TokenType.HASH);
				break;
			case '@':
				addToken(TokenType.AT);
				break;
			case '$':
				addToken(TokenType.DOLLAR);
				break;

			// --- Tokens that can be one, two or three characters (maximal munch) ---
			case ':':
				addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
				break;
			case '.':
				if (match('.'))
				{
					addToken(match('=') ? TokenType.DOT_DOT_EQUAL : TokenType.DOT_DOT);
				}
				else
				{
					addToken(TokenType.DOT);
				}
				break;
			case '?':
				addToken(match('?') ? TokenType.NULL_COALESCING : TokenType.QUESTION);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : (match('>') ? TokenType.FAT_ARROW : TokenType.ASSIGN));
				break;
			case '<':
				addToken(match('=') ? TokenType.LESS_EQUAL : (match('<') ? (match('=') ? TokenType.LEFT_SHIFT_ASSIGN : TokenType.LEFT_SHIFT) : TokenType.LESS));
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : (match('>') ? (match('=') ? TokenType.RIGHT_SHIFT_ASSIGN : TokenType.RIGHT_SHIFT) : TokenType.GREATER));
				break;
			case '+':
				addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
				break;
			case '-':
				addToken(match('>') ? TokenType.ARROW : (match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS));
				break;
			case '*':
				addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
				break;
			case '%':
				addToken(match('=') ? TokenType.MODULO_ASSIGN : TokenType.MODULO);
				break;
			case '^':
				addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
				break;
			case '&':
				addToken(match('&') ? TokenType.AMPERSAND_AMPERSAND : (match('=') ? TokenType.AMPERSAND_ASSIGN : TokenType.AMPERSAND));
				break;
			case '|':
				addToken(match('|') ? TokenType.PIPE_PIPE : (match('=') ? TokenType.PIPE_ASSIGN : TokenType.PIPE));
				break;
			case '/':
				if (match('/'))
				{
					skipLineComment();
				}
				else if (match('*'))
				{
					skipBlockComment();
				}
				else
				{
					addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
				}
				break;

			// --- Literals ---
			case '"':
				scanStringBody(false);
				break;
			case '\'':
				scanCharacterLiteral();
				break;

			case '~':
			case '`':
				error(DiagnosticCode.E008, "Unknown operator '" + c + "'");
				addToken(TokenType.ERROR);
				break;

			default:
				if (isDigit(c))
				{
					scanNumber(c);
				}
				else
				{
					int codePoint = c;
					if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek()))
					{
						codePoint = Character.toCodePoint(c, advance());
					}
					if (isIdentifierStart(codePoint))
					{
						scanIdentifier();
					}
					else
					{
						error(DiagnosticCode.E009, String.format("Unexpected character '%s' (U+%04X)", new String(Character.toChars(codePoint)), codePoint));
						addToken(TokenType.ERROR);
					}
				}
				break;
		}
	}

	// --- Layout ---

	/**
	 * Consumes the leading whitespace of the next logical line and emits the INDENT/DEDENT tokens
	 * it implies. Blank and comment-only lines are skipped entirely.
	 */
	private void beginLine()
	{
		while (true)
		{
			markStart();
			int width = 0;
			boolean sawTab = false;
			boolean sawSpace = false;
			while (peek() == ' ' || peek() == '\t')
			{
				if (advance() == '\t')
				{
					width = (width / tabWidth + 1) * tabWidth;
					sawTab = true;
				}
				else
				{
					width++;
					sawSpace = true;
				}
			}
			SourceSpan run = currentSpan();
			if (isAtEnd())
			{
				atLineStart = false;
				return;
			}
			char c = peek();
			if (c == '\n' || c == '\r')
			{
				advance();
				if (c == '\r')
				{
					match('\n');
				}
				newLine();
				continue;
			}
			if (c == '/' && peekNext() == '/')
			{
				skipLineComment();
				continue;
			}
			if (c == '/' && peekNext() == '*')
			{
				markStart();
				advance();
				advance();
				skipBlockComment();
				while (peek() == ' ' || peek() == '\t')
				{
					advance();
				}
				if (isAtEnd() || peek() == '\n' || peek() == '\r' || (peek() == '/' && (peekNext() == '/' || peekNext() == '*')))
				{
					continue;
				}
			}
			atLineStart = false;
			applyIndentation(width, IndentationStack.WhitespaceKind.of(sawTab, sawSpace), run);
			return;
		}
	}

	/**
	 * Compares the indentation of a logical line with the indentation stack.
	 */
	private void applyIndentation(int width, IndentationStack.WhitespaceKind kind, SourceSpan run)
	{
		if (continuationLine || resolver.suppressesLayout())
		{
			return;
		}
		// A line opening with '}' is settled by the brace itself.
		if (peek() == '}' && resolver.innermostDelimiter() == DelimiterDepthCounters.Kind.BLOCK_BRACE
				&& !braceLayouts.isEmpty() && !braceLayouts.peek().abandoned)
		{
			pendingBraceBaseline = false;
			return;
		}

		boolean reported = false;
		if (kind == IndentationStack.WhitespaceKind.MIXED)
		{
			errorReporter.report(DiagnosticCode.E003, run, "Indentation mixes tabs and spaces");
			reported = true;
		}

		IndentationStack.Level top = indentation.top();
		if (pendingBraceBaseline)
		{
			pendingBraceBaseline = false;
			if (width > top.width())
			{
				if (!reported && top.width() > 0 && top.kind().conflictsWith(kind))
				{
					reportMixedLevel(run, kind);
				}
				indentation.push(width, kind, true);
				return;
			}
		}

		if (indentation.isAlias(width))
		{
			return;
		}
		if (width == top.width())
		{
			if (!reported && top.kind().conflictsWith(kind))
			{
				reportMixedLevel(run, kind);
			}
			return;
		}
		if (width > top.width())
		{
			if (!reported && top.width() > 0 && top.kind().conflictsWith(kind))
			{
				reportMixedLevel(run, kind);
			}
			indentation.push(width, kind, false);
			addLayoutToken(TokenType.INDENT);
			return;
		}

		while (indentation.top().width() > width)
		{
			IndentationStack.Level popped = indentation.pop();
			if (popped.silent())
			{
				// The brace body ended without its '}'; the parser reports the missing brace.
				for (BraceLayout layout : braceLayouts)
				{
					if (!layout.abandoned)
					{
						layout.abandoned = true;
						break;
					}
				}
			}
			else
			{
				addLayoutToken(TokenType.DEDENT);
			}
		}
		top = indentation.top();
		if (top.width() != width)
		{
			if (!reported)
			{
				errorReporter.report(DiagnosticCode.E003, run, "Unindent to width " + width + " does not match any outer indentation level "
						+ indentation.widths());
			}
			indentation.alias(width);
		}
		else if (!reported && top.kind().conflictsWith(kind))
		{
			reportMixedLevel(run, kind);
		}
	}

	private void reportMixedLevel(SourceSpan run, IndentationStack.WhitespaceKind kind)
	{
		String used = kind == IndentationStack.WhitespaceKind.TABS ? "tabs" : "spaces";
		String expected = kind == IndentationStack.WhitespaceKind.TABS ? "spaces" : "tabs";
		errorReporter.report(DiagnosticCode.E003, run, "Indentation uses " + used + " where the enclosing block uses " + expected);
	}

	private void handleLineBreak()
	{
		SourceSpan breakSpan = currentSpan();
		if (!interpolations.isEmpty())
		{
			errorReporter.report(DiagnosticCode.E007, interpolations.peekLast().openedAt, "String interpolation is not closed before the end of the line");
			interpolations.clear();
			tokens.add(new Token(TokenType.ERROR, "", null, breakSpan));
			lineHasTokens = true;
		}
		newLine();
		if (lineHasTokens)
		{
			emitNewline(breakSpan, true);
		}
		atLineStart = true;
	}

	private void emitNewline(SourceSpan span, boolean lookAhead)
	{
		boolean continues = false;
		boolean declaration = false;
		boolean opener = false;
		if (lookAhead)
		{
			int next = nextSignificantOffset();
			continues = next >= 0 && startsContinuation(next);
			declaration = next >= 0 && RESYNC_KEYWORDS.contains(wordAt(next));
			opener = next >= 0 && (source.charAt(next) == '(' || source.charAt(next) == '[');
		}
		int index = tokens.size();
		tokens.add(new Token(TokenType.NEWLINE, "\n", null, span));
		TerminatorResolver.NewlineClass newlineClass = resolver.classifyNewline(index, continues, declaration, opener);
		continuationLine = newlineClass == TerminatorResolver.NewlineClass.CONTINUATION;
		lineHasTokens = false;
	}

	/**
	 * Finds the first character of the next logical line, skipping whitespace, blank lines and comments.
	 *
	 * @return Its offset, or -1 at the end of the input.
	 */
	private int nextSignificantOffset()
	{
		int i = current;
		int length = source.length();
		while (i < length)
		{
			char c = source.charAt(i);
			if (c == ' ' || c == '\t' || c == '\n' || c == '\r')
			{
				i++;
			}
			else if (c == '/' && i + 1 < length && source.charAt(i + 1) == '/')
			{
				while (i < length && source.charAt(i) != '\n')
				{
					i++;
				}
			}
			else if (c == '/' && i + 1 < length && source.charAt(i + 1) == '*')
			{
				int depth = 1;
				i += 2;
				while (i < length && depth > 0)
				{
					if (source.startsWith("/*", i))
					{
						depth++;
						i += 2;
					}
					else if (source.startsWith("*/", i))
					{
						depth--;
						i += 2;
					}
					else
					{
						i++;
					}
				}
				if (depth > 0)
				{
					return -1;
				}
			}
			else
			{
				return i;
			}
		}
		return -1;
	}

	/**
	 * A line that starts with member access, postfix '?' or a binary operator continues the statement above it.
	 * A leading '-' does not, since lines (and match arms) often start with a negative literal.
	 */
	private boolean startsContinuation(int offset)
	{
		char c = source.charAt(offset);
		char next = offset + 1 < source.length() ? source.charAt(offset + 1) : '\0';
		switch (c)
		{
			case '.':
			case '?':
			case '+':
			case '*':
			case '/':
			case '%':
			case '^':
			case '<':
			case '>':
			case '&':
			case '|':
				return true;
			case '=':
				return next == '=';
			case '!':
				return next == '=';
			default:
				String word = wordAt(offset);
				return word.equals("and") || word.equals("or");
		}
	}

	private String wordAt(int offset)
	{
		int end = offset;
		while (end < source.length())
		{
			int cp = source.codePointAt(end);
			if (!isIdentifierPart(cp))
			{
				break;
			}
			end += Character.charCount(cp);
		}
		return source.substring(offset, end);
	}

	private void openBrace()
	{
		if (!interpolations.isEmpty())
		{
			interpolations.peek().braceDepth++;
		}
		addToken(TokenType.LEFT_BRACE);
		if (resolver.lastOpened() == DelimiterDepthCounters.Kind.BLOCK_BRACE)
		{
			braceLayouts.push(new BraceLayout(indentation.depth()));
			pendingBraceBaseline = true;
		}
	}

	private void closeBrace()
	{
		if (!interpolations.isEmpty())
		{
			Interpolation interpolation = interpolations.peek();
			if (interpolation.braceDepth == 0)
			{
				interpolations.pop();
				scanStringBody(true);
				return;
			}
			interpolation.braceDepth--;
		}
		if (resolver.innermostDelimiter() == DelimiterDepthCounters.Kind.BLOCK_BRACE && !braceLayouts.isEmpty())
		{
			BraceLayout layout = braceLayouts.pop();
			pendingBraceBaseline = false;
			if (!layout.abandoned)
			{
				// Indented blocks still open inside the braces end here.
				while (indentation.depth() > layout.depth)
				{
					if (!indentation.pop().silent())
					{
						addLayoutToken(TokenType.DEDENT);
					}
				}
			}
		}
		addToken(TokenType.RIGHT_BRACE);
	}

	private void finish()
	{
		if (!interpolations.isEmpty())
		{
			errorReporter.report(DiagnosticCode.E007, interpolations.peekLast().openedAt, "String interpolation is not closed before the end of the input");
			interpolations.clear();
			markStart();
			addToken(TokenType.ERROR);
		}
		markStart();
		if (lineHasTokens)
		{
			emitNewline(currentSpan(), false);
		}
		while (indentation.depth() > 1)
		{
			if (!indentation.pop().silent())
			{
				addLayoutToken(TokenType.DEDENT);
			}
		}
		tokens.add(new Token(TokenType.EOF, "", null, currentSpan()));
	}

	// --- Comments ---

	private void skipLineComment()
	{
		while (peek() != '\n' && peek() != '\r' && !isAtEnd())
		{
			advance();
		}
	}

	/**
	 * Skips a block comment whose opening {@code /*} has been consumed. Block comments nest.
	 */
	private void skipBlockComment()
	{
		SourceSpan opening = new SourceSpan(startByte, startByte + 2, startLine, startColumn);
		int depth = 1;
		while (depth > 0)
		{
			if (isAtEnd())
			{
				Diagnostic fatal = Diagnostic.of(DiagnosticCode.L002, opening, "Unterminated block comment");
				errorReporter.report(fatal);
				throw new LexicalAbortException(fatal);
			}
			char c = advance();
			if (c == '/' && peek() == '*')
			{
				advance();
				depth++;
			}
			else if (c == '*' && peek() == '/')
			{
				advance();
				depth--;
			}
			else if (c == '\n' || (c == '\r' && peek() != '\n'))
			{
				newLine();
			}
		}
	}

	// --- Literals ---

	/**
	 * Scans the body of a string literal. Called after the opening quote, or after the '}' that
	 * closes an interpolation span when {@code continuation} is set.
	 */
	private void scanStringBody(boolean continuation)
	{
		StringBuilder value = new StringBuilder();
		while (true)
		{
			if (isAtEnd() || peek() == '\n' || peek() == '\r')
			{
				error(DiagnosticCode.E002, "Unterminated string literal");
				addToken(TokenType.ERROR);
				return;
			}
			Position before = position();
			char c = advance();
			if (c == '"')
			{
				addToken(continuation ? TokenType.STRING_TAIL : TokenType.STRING_LITERAL, value.toString());
				return;
			}
			if (c == '\\')
			{
				readEscape(value, before);
			}
			else if (c == '{')
			{
				if (match('{'))
				{
					value.append('{');
				}
				else if (peek() == '}')
				{
					advance();
					errorReporter.report(DiagnosticCode.E007, spanFrom(before), "Empty interpolation '{}' in string literal");
				}
				else
				{
					addToken(continuation ? TokenType.STRING_MIDDLE : TokenType.STRING_HEAD, value.toString());
					interpolations.push(new Interpolation(spanFrom(before)));
					return;
				}
			}
			else if (c == '}')
			{
				if (!match('}'))
				{
					errorReporter.report(DiagnosticCode.E007, spanFrom(before), "Unmatched '}' in string literal; write '}}' for a literal brace");
				}
				value.append('}');
			}
			else
			{
				value.append(c);
			}
		}
	}

	/**
	 * Reads one escape sequence whose backslash has been consumed.
	 */
	private void readEscape(StringBuilder value, Position backslash)
	{
		if (isAtEnd() || peek() == '\n' || peek() == '\r')
		{
			return; // the caller reports the unterminated literal
		}
		char escapeChar = advance();
		switch (escapeChar)
		{
			case '\\':
				value.append('\\');
				break;
			case '"':
				value.append('"');
				break;
			case '\'':
				value.append('\'');
				break;
			case 'n':
				value.append('\n');
				break;
			case 'r':
				value.append('\r');
				break;
			case 't':
				value.append('\t');
				break;
			case '0':
				value.append('\0');
				break;
			case 'u':
				readUnicodeEscape(value, backslash);
				break;
			default:
				errorReporter.report(DiagnosticCode.L001, spanFrom(backslash), "Invalid escape sequence '\\" + escapeChar + "'");
				value.append(escapeChar);
				break;
		}
	}

	private void readUnicodeEscape(StringBuilder value, Position backslash)
	{
		if (!match('{'))
		{
			errorReporter.report(DiagnosticCode.L001, spanFrom(backslash), "Unicode escape must have the form \\u{XXXX}");
			return;
		}
		int digitsStart = current;
		while (isHexDigit(peek()))
		{
			advance();
		}
		String digits = source.substring(digitsStart, current);
		if (!match('}'))
		{
			errorReporter.report(DiagnosticCode.L001, spanFrom(backslash), "Unicode escape is missing its closing '}'");
			return;
		}
		if (digits.isEmpty() || digits.length() > 6)
		{
			errorReporter.report(DiagnosticCode.L001, spanFrom(backslash), "Unicode escape needs 1 to 6 hex digits, found " + digits.length());
			return;
		}
		int codePoint = Integer.parseInt(digits, 16);
		if (codePoint > Character.MAX_CODE_POINT || (codePoint >= 0xD800 && codePoint <= 0xDFFF))
		{
			errorReporter.report(DiagnosticCode.L001, spanFrom(backslash), "'\\u{" + digits + "}' is not a Unicode scalar value");
			return;
		}
		value.appendCodePoint(codePoint);
	}

	/**
	 * Scans a character literal enclosed in single quotes.
	 */
	private void scanCharacterLiteral()
	{
		if (isAtEnd() || peek() == '\n' || peek() == '\r')
		{
			error(DiagnosticCode.E002, "Unterminated character literal");
			addToken(TokenType.ERROR);
			return;
		}
		if (match('\''))
		{
			error(DiagnosticCode.L003, "Empty character literal");
			addToken(TokenType.ERROR);
			return;
		}
		StringBuilder value = new StringBuilder();
		while (!isAtEnd() && peek() != '\'' && peek() != '\n' && peek() != '\r')
		{
			Position before = position();
			char c = advance();
			if (c == '\\')
			{
				readEscape(value, before);
			}
			else
			{
				value.append(c);
			}
		}
		if (!match('\''))
		{
			error(DiagnosticCode.E002, "Unterminated character literal");
			addToken(TokenType.ERROR);
			return;
		}
		if (value.codePointCount(0, value.length()) != 1)
		{
			error(DiagnosticCode.L003, "Character literal must contain exactly one character");
			addToken(TokenType.ERROR);
			return;
		}
		addToken(TokenType.CHAR_LITERAL, value.codePointAt(0));
	}

	/**
	 * Scans a number literal (integer or float). The first digit has been consumed.
	 */
	private void scanNumber(char first)
	{
		if (first == '0' && (peek() == 'x' || peek() == 'o' || peek() == 'b'))
		{
			char prefix = advance();
			scanRadixNumber(prefix == 'x' ? 16 : (prefix == 'o' ? 8 : 2), prefix);
			return;
		}

		consumeDigits();
		boolean isFloat = false;
		// A tuple field after '.' never has a fraction: a.0.1 selects field 1 of field 0.
		boolean tupleField = !tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() == TokenType.DOT;
		// A '.' only starts a fraction when a digit follows, so 1..2 and 1.abs() stay intact.
		if (!tupleField && peek() == '.' && isDigit(peekNext()))
		{
			advance();
			consumeDigits();
			isFloat = true;
		}
		if (!tupleField && (peek() == 'e' || peek() == 'E')
				&& (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peek(2)))))
		{
			advance();
			if (peek() == '+' || peek() == '-')
			{
				advance();
			}
			consumeDigits();
			isFloat = true;
		}
		if (!isAtEnd() && isIdentifierPart(source.codePointAt(current)))
		{
			while (!isAtEnd() && isIdentifierPart(source.codePointAt(current)))
			{
				advance();
			}
			error(DiagnosticCode.E010, "Invalid numeric literal '" + source.substring(start, current) + "'");
			addToken(TokenType.ERROR);
			return;
		}

		String text = source.substring(start, current).replace("_", "");
		if (isFloat)
		{
			double value = Double.parseDouble(text);
			if (Double.isInfinite(value))
			{
				error(DiagnosticCode.E010, "Float literal '" + source.substring(start, current) + "' is out of range");
				addToken(TokenType.ERROR);
				return;
			}
			addToken(TokenType.FLOAT_LITERAL, value);
		}
		else
		{
			addToken(TokenType.INTEGER_LITERAL, integerValue(new BigInteger(text)));
		}
	}

	private void scanRadixNumber(int radix, char prefix)
	{
		int digitsStart = current;
		while (!isAtEnd() && (isIdentifierPart(source.codePointAt(current))))
		{
			advance();
		}
		String digits = source.substring(digitsStart, current).replace("_", "");
		if (digits.isEmpty())
		{
			error(DiagnosticCode.E010, "Missing digits after '0" + prefix + "'");
			addToken(TokenType.ERROR);
			return;
		}
		for (int i = 0; i < digits.length(); i++)
		{
			if (Character.digit(digits.charAt(i), radix) < 0)
			{
				error(DiagnosticCode.E010, "Digit '" + digits.charAt(i) + "' is not valid in a base-" + radix + " literal");
				addToken(TokenType.ERROR);
				return;
			}
		}
		addToken(TokenType.INTEGER_LITERAL, integerValue(new BigInteger(digits, radix)));
	}

	private static Object integerValue(BigInteger value)
	{
		return value.bitLength() < 64 ? (Object) value.longValue() : value;
	}

	private void consumeDigits()
	{
		while (isDigit(peek()) || peek() == '_')
		{
			advance();
		}
	}

	private void scanIdentifier()
	{
		while (!isAtEnd())
		{
			int codePoint = source.codePointAt(current);
			if (!isIdentifierPart(codePoint))
			{
				break;
			}
			advance();
			if (Character.charCount(codePoint) == 2)
			{
				advance();
			}
		}

		String text = source.substring(start, current);
		if (text.equals("_"))
		{
			addToken(TokenType.UNDERSCORE);
			return;
		}
		TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
		if (type == TokenType.BOOLEAN_LITERAL)
		{
			addToken(type, Boolean.valueOf(text));
		}
		else
		{
			addToken(type);
		}
	}

	// --- Character helpers ---

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isHexDigit(char c)
	{
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean isIdentifierStart(int codePoint)
	{
		return codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint);
	}

	private static boolean isIdentifierPart(int codePoint)
	{
		return Character.isUnicodeIdentifierPart(codePoint) && !Character.isIdentifierIgnorable(codePoint);
	}

	/**
	 * Consumes the current character and returns it, also updates column and byte offset.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		if (c < 0x80)
		{
			currentByte += 1;
		}
		else if (c < 0x800)
		{
			currentByte += 2;
		}
		else if (Character.isSurrogate(c))
		{
			currentByte += 2; // a surrogate pair encodes to four bytes
		}
		else
		{
			currentByte += 3;
		}
		return c;
	}

	private void newLine()
	{
		line++;
		column = 1;
	}

	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	private char peek()
	{
		return isAtEnd() ? '\0' : source.charAt(current);
	}

	private char peekNext()
	{
		return peek(1);
	}

	private char peek(int offset)
	{
		if (current + offset >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + offset);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private void markStart()
	{
		start = current;
		startByte = currentByte;
		startLine = line;
		startColumn = column;
	}

	private Position position()
	{
		return new Position(current, currentByte, line, column);
	}

	private SourceSpan spanFrom(Position position)
	{
		return new SourceSpan(position.bytes(), currentByte, position.line(), position.column());
	}

	private SourceSpan currentSpan()
	{
		return new SourceSpan(startByte, currentByte, startLine, startColumn);
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Adds a token spanning from the start mark to the current position and feeds it to the resolver.
	 */
	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		Token token = new Token(type, text, literal, currentSpan());
		tokens.add(token);
		lineHasTokens = true;
		resolver.observe(token);
	}

	private void addLayoutToken(TokenType type)
	{
		tokens.add(new Token(type, "", null, new SourceSpan(currentByte, currentByte, line, column)));
	}

	private void error(DiagnosticCode code, String message)
	{
		errorReporter.report(code, currentSpan(), message);
	}
}
