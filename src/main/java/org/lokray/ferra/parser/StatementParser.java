package org.lokray.ferra.parser;

import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.declarations.Attribute;
import org.lokray.ferra.ast.declarations.Modifier;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.ast.statements.BreakStatement;
import org.lokray.ferra.ast.statements.ContinueStatement;
import org.lokray.ferra.ast.statements.ErrorStatement;
import org.lokray.ferra.ast.statements.ExpressionStatement;
import org.lokray.ferra.ast.statements.ForStatement;
import org.lokray.ferra.ast.statements.IfStatement;
import org.lokray.ferra.ast.statements.ReturnStatement;
import org.lokray.ferra.ast.statements.Statement;
import org.lokray.ferra.ast.statements.WhileStatement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;
import org.lokray.ferra.util.Debug;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Parses statements and blocks. A block is either braced or indented, never both; this class
 * enforces the style of each block and decides where statements end.
 */
public class StatementParser extends AbstractParser
{
	private static final Logger log = LoggerFactory.getLogger(StatementParser.class);

	private static final String MIXED_STYLE_SUGGESTION = "Use either braces {...} OR indentation consistently within a single block";

	// Keywords that can only start a statement; error recovery stops in front of them.
	private static final Set<TokenType> STATEMENT_KEYWORDS = EnumSet.of(
			TokenType.LET, TokenType.VAR, TokenType.DATA, TokenType.MODULE, TokenType.IMPORT, TokenType.MACRO,
			TokenType.WHILE, TokenType.FOR, TokenType.RETURN);

	/**
	 * Where a statement list sits, which decides the tokens that close it.
	 */
	public enum BlockMode
	{
		TOP, BRACE, INDENTED
	}

	public StatementParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Parses statements until the closer of the given block mode, which is left unconsumed.
	 * Indentation changes that open no block are absorbed in pairs: silently inside braces,
	 * as E003 elsewhere.
	 */
	public List<Statement> parseStatements(BlockMode mode)
	{
		List<Statement> statements = new ArrayList<>();
		int absorbed = 0;
		while (true)
		{
			if (ctx.getReporter().isLimitReached())
			{
				if (!ctx.isTruncated())
				{
					log.debug("Diagnostic limit reached at {}; stopping", peek().getSpan());
				}
				ctx.markTruncated();
				break;
			}
			TokenType type = peek().getType();
			if (type == TokenType.EOF)
			{
				break;
			}
			if (type == TokenType.NEWLINE || type == TokenType.SEMICOLON)
			{
				advance();
				continue;
			}
			if (type == TokenType.INDENT)
			{
				if (mode != BlockMode.BRACE)
				{
					recoverable(DiagnosticCode.E003, peek(), "Unexpected indentation");
				}
				advance();
				absorbed++;
				continue;
			}
			if (type == TokenType.DEDENT)
			{
				if (absorbed > 0 || mode == BlockMode.TOP)
				{
					absorbed = Math.max(0, absorbed - 1);
					advance();
					continue;
				}
				break;
			}
			if (type == TokenType.RIGHT_BRACE)
			{
				if (mode == BlockMode.BRACE)
				{
					break;
				}
				recoverable(DiagnosticCode.E001, peek(),
						mode == BlockMode.TOP ? "Unmatched '}'" : "'}' cannot close an indented block");
				advance();
				continue;
			}
			statements.add(parseStatementRecovering());
		}
		return statements;
	}

	private Statement parseStatementRecovering()
	{
		Token start = peek();
		int before = ctx.getCursor().consumed();
		int depth = ctx.getCursor().blockDepth();
		try
		{
			return parseStatement();
		}
		catch (ParseException e)
		{
			if (ctx.inTrial())
			{
				throw e;
			}
			Debug.log("Recovering from: %s", e.getMessage());
			synchronize(ctx.getCursor().blockDepth() - depth);
			if (ctx.getCursor().consumed() == before)
			{
				advance();
			}
			return node(new ErrorStatement(spanFrom(start)));
		}
	}

	/**
	 * Parses a single statement, including its terminator.
	 * Grammar: Statement ::= Attribute* Modifier* Declaration | IfStmt | WhileStmt | ForStmt
	 * | ReturnStmt | BreakStmt | ContinueStmt | BraceBlock | MarkedBlock | ExpressionStmt
	 *
	 * @return The parsed Statement.
	 * @throws ParseException if a syntax error occurs.
	 */
	public Statement parseStatement()
	{
		Token start = peek();
		Debug.log("Statement at %s: %s", start.getSpan(), start.getType());
		Debug.indent();
		try
		{
			DeclarationParser declarations = ctx.declarations();
			List<Attribute> attributes = declarations.parseAttributes();
			Set<Modifier> modifiers = declarations.parseModifiers();
			if (attributes.isEmpty() && atMarkedBlock(modifiers))
			{
				boolean async = match(TokenType.ASYNC);
				Statement block = parseBlock(start, async ? "async block" : "unsafe block", modifiers.contains(Modifier.UNSAFE), async);
				endStatement();
				return block;
			}
			if (declarations.atDeclaration())
			{
				Statement declaration = declarations.parseDeclaration(start, attributes, modifiers);
				endStatement();
				return declaration;
			}
			if (!attributes.isEmpty() || !modifiers.isEmpty())
			{
				throw error(peek(), "Attributes and modifiers are only allowed on declarations");
			}

			Statement statement;
			switch (peek().getType())
			{
				case IF:
					statement = parseIfStatement();
					break;
				case WHILE:
					statement = parseWhileStatement();
					break;
				case FOR:
					statement = parseForStatement();
					break;
				case RETURN:
					advance();
					Expression value = atStatementBoundary() ? null : ctx.expressions().parseExpression();
					statement = node(new ReturnStatement(spanFrom(start), value));
					break;
				case BREAK:
					advance();
					statement = node(new BreakStatement(start.getSpan()));
					break;
				case CONTINUE:
					advance();
					statement = node(new ContinueStatement(start.getSpan()));
					break;
				case LEFT_BRACE:
					statement = parseBlock("block");
					break;
				default:
					Expression expression = ctx.expressions().parseAssignment();
					statement = node(new ExpressionStatement(spanFrom(start), expression));
					break;
			}
			endStatement();
			return statement;
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * Grammar: MarkedBlock ::= 'unsafe'? 'async'? Block, with at least one of the two keywords.
	 */
	private boolean atMarkedBlock(Set<Modifier> modifiers)
	{
		if (modifiers.contains(Modifier.PUB))
		{
			return false;
		}
		int offset = check(TokenType.ASYNC) ? 1 : 0;
		if (offset == 0 && modifiers.isEmpty())
		{
			return false;
		}
		return checkAt(offset, TokenType.LEFT_BRACE) || checkAt(offset, TokenType.COLON);
	}

	/**
	 * Grammar: IfStmt ::= 'if' Expr Block ('else' (IfStmt | Block))?
	 */
	private Statement parseIfStatement()
	{
		Token start = consume(TokenType.IF, "Expected 'if'");
		Expression condition = ctx.expressions().parseExpression();
		BlockStatement thenBranch = parseBlock("if statement");
		Statement elseBranch = null;
		skipNewlineBefore(TokenType.ELSE);
		if (match(TokenType.ELSE))
		{
			elseBranch = check(TokenType.IF) ? parseIfStatement() : parseBlock("else branch");
		}
		return node(new IfStatement(spanFrom(start), condition, thenBranch, elseBranch));
	}

	/**
	 * Grammar: WhileStmt ::= 'while' Expr Block
	 */
	private Statement parseWhileStatement()
	{
		Token start = advance();
		Expression condition = ctx.expressions().parseExpression();
		BlockStatement body = parseBlock("while loop");
		return node(new WhileStatement(spanFrom(start), condition, body));
	}

	/**
	 * Grammar: ForStmt ::= 'for' IDENT 'in' Expr Block
	 */
	private Statement parseForStatement()
	{
		Token start = advance();
		Token variable = consumeIdentifier("loop variable");
		consume(TokenType.IN, "Expected 'in' after loop variable");
		Expression iterable = ctx.expressions().parseExpression();
		BlockStatement body = parseBlock("for loop");
		return node(new ForStatement(spanFrom(start), variable, iterable, body));
	}

	/**
	 * Parses a braced or indented block. A '{' on the line after the header is accepted.
	 * Grammar: Block ::= '{' Statement* '}' | ':' NEWLINE INDENT Statement+ DEDENT
	 *
	 * @param owner What the block belongs to, for error messages (e.g. "while loop").
	 * @return The parsed block; empty if an indented block had no statements.
	 */
	public BlockStatement parseBlock(String owner)
	{
		skipNewlineBefore(TokenType.LEFT_BRACE);
		return parseBlock(peek(), owner, false, false);
	}

	private BlockStatement parseBlock(Token start, String owner, boolean unsafe, boolean async)
	{
		Token opener = peek();
		BlockStyle style = openBlock(owner);
		if (style == null)
		{
			return node(new BlockStatement(spanFrom(start), List.of(), BlockStyle.INDENTED, unsafe, async));
		}
		List<Statement> statements = parseStatements(style == BlockStyle.BRACE ? BlockMode.BRACE : BlockMode.INDENTED);
		closeBlock(style, opener);
		return node(new BlockStatement(spanFrom(start), statements, style, unsafe, async));
	}

	/**
	 * Consumes the opener of a block body: a '{', or a ':' followed by a line break and an
	 * indented line.
	 *
	 * @return The style of the opened block, or null when ':' is not followed by an indented
	 * line (reported as E011; there is nothing to close).
	 * @throws ParseException with E011 if no block starts here.
	 */
	BlockStyle openBlock(String owner)
	{
		skipNewlineBefore(TokenType.LEFT_BRACE);
		if (match(TokenType.LEFT_BRACE))
		{
			return BlockStyle.BRACE;
		}
		if (match(TokenType.COLON))
		{
			if (check(TokenType.LEFT_BRACE))
			{
				recoverable(DiagnosticCode.E011, peek(), "A block cannot be opened with both ':' and '{'", MIXED_STYLE_SUGGESTION);
				advance();
				return BlockStyle.BRACE;
			}
			if (!match(TokenType.NEWLINE))
			{
				throw error(DiagnosticCode.E011, peek(), "Expected a line break after ':' to start an indented block", null);
			}
			if (!match(TokenType.INDENT))
			{
				recoverable(DiagnosticCode.E011, peek(), "Expected an indented block for the " + owner);
				return null;
			}
			return BlockStyle.INDENTED;
		}
		throw error(DiagnosticCode.E011, peek(), "Expected a block for the " + owner, null);
	}

	/**
	 * Consumes the closer matching {@link #openBlock(String)}. A braced block that meets a
	 * DEDENT or the end of input instead of '}' is reported as E004 and closed there.
	 */
	void closeBlock(BlockStyle style, Token opener)
	{
		if (style == null)
		{
			return;
		}
		if (style == BlockStyle.BRACE)
		{
			if (!match(TokenType.RIGHT_BRACE))
			{
				recoverable(DiagnosticCode.E004, peek(), "Missing closing '}' for the block opened at " + opener.getSpan());
			}
			return;
		}
		match(TokenType.DEDENT);
	}

	/**
	 * Parses the separated items of a declaration body (fields, extern items, macro rules,
	 * match arms). Items are separated by ',', ';' or a line break; a missing separator is
	 * reported and the next item is read anyway.
	 */
	<T> List<T> parseBlockItems(BlockStyle style, Supplier<T> item, String separatorMessage)
	{
		List<T> items = new ArrayList<>();
		if (style == null)
		{
			return items;
		}
		while (true)
		{
			skipNewlines();
			if (atBlockEnd(style))
			{
				break;
			}
			items.add(item.get());
			boolean separated = match(TokenType.COMMA, TokenType.SEMICOLON) || check(TokenType.NEWLINE);
			if (!separated && !atBlockEnd(style) && !closedBlock())
			{
				// Read on as if the separator were there.
				recoverable(DiagnosticCode.E001, peek(), separatorMessage + ", found " + describe(peek()));
			}
		}
		return items;
	}

	private void skipNewlines()
	{
		while (check(TokenType.NEWLINE))
		{
			advance();
		}
	}

	private boolean atBlockEnd(BlockStyle style)
	{
		return isAtEnd() || check(TokenType.DEDENT) || style == BlockStyle.BRACE && check(TokenType.RIGHT_BRACE);
	}

	private boolean closedBlock()
	{
		Token last = previous();
		// A NEWLINE here was taken by an indented-block opener that found no indented line.
		return last != null && (last.getType() == TokenType.RIGHT_BRACE || last.getType() == TokenType.DEDENT
				|| last.getType() == TokenType.NEWLINE);
	}

	/**
	 * Ends a statement: at ';', at a terminating line break, before '}', a DEDENT or the end of
	 * input, or right after a statement that closed a block.
	 *
	 * @throws ParseException if anything else follows.
	 */
	void endStatement()
	{
		if (match(TokenType.SEMICOLON, TokenType.NEWLINE))
		{
			return;
		}
		if (check(TokenType.RIGHT_BRACE, TokenType.DEDENT, TokenType.EOF) || closedBlock())
		{
			return;
		}
		throw error(peek(), "Expected end of statement");
	}

	/**
	 * Discards tokens until the next statement boundary so that one syntax error does not
	 * cascade. Blocks opened while skipping are skipped whole; the closer of the enclosing
	 * block is left in place.
	 *
	 * @param opened Blocks the failed statement opened and left unclosed; they are skipped to their end.
	 */
	void synchronize(int opened)
	{
		int depth = Math.max(0, opened);
		while (!isAtEnd())
		{
			TokenType type = peek().getType();
			switch (type)
			{
				case NEWLINE:
				case SEMICOLON:
					advance();
					if (depth == 0)
					{
						return;
					}
					break;
				case LEFT_BRACE:
				case INDENT:
					depth++;
					advance();
					break;
				case RIGHT_BRACE:
				case DEDENT:
					if (depth == 0)
					{
						return;
					}
					depth--;
					advance();
					break;
				default:
					if (depth == 0 && STATEMENT_KEYWORDS.contains(type))
					{
						return;
					}
					advance();
					break;
			}
		}
	}
}
