package org.lokray.ferra.parser;

import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.expressions.ArrayLiteralExpression;
import org.lokray.ferra.ast.expressions.AssignmentExpression;
import org.lokray.ferra.ast.expressions.AwaitExpression;
import org.lokray.ferra.ast.expressions.BinaryExpression;
import org.lokray.ferra.ast.expressions.BlockExpression;
import org.lokray.ferra.ast.expressions.CallExpression;
import org.lokray.ferra.ast.expressions.ErrorExpression;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.ast.expressions.GenericInstantiationExpression;
import org.lokray.ferra.ast.expressions.GroupingExpression;
import org.lokray.ferra.ast.expressions.IdentifierExpression;
import org.lokray.ferra.ast.expressions.IfExpression;
import org.lokray.ferra.ast.expressions.IndexExpression;
import org.lokray.ferra.ast.expressions.InterpolatedStringExpression;
import org.lokray.ferra.ast.expressions.LiteralExpression;
import org.lokray.ferra.ast.expressions.MacroInvocationExpression;
import org.lokray.ferra.ast.expressions.MatchArm;
import org.lokray.ferra.ast.expressions.MatchExpression;
import org.lokray.ferra.ast.expressions.MemberAccessExpression;
import org.lokray.ferra.ast.expressions.PathExpression;
import org.lokray.ferra.ast.expressions.RangeExpression;
import org.lokray.ferra.ast.expressions.TryExpression;
import org.lokray.ferra.ast.expressions.TupleExpression;
import org.lokray.ferra.ast.expressions.UnaryExpression;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.patterns.Pattern;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * The Pratt expression engine. Infix operators are driven by {@link BindingPower}; member
 * access, calls, indexing, {@code .await}, {@code ?}, macro invocations and generic
 * instantiations are read by one left-to-right postfix loop.
 */
public class ExpressionParser extends AbstractParser
{
	private static final String EXPRESSION_SUGGESTION = "Consider adding a literal, identifier, or parenthesized expression";

	public ExpressionParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Parses an expression. Assignment is not an expression operator and is not consumed.
	 *
	 * @return The parsed Expression.
	 * @throws ParseException if no expression starts at the current token.
	 */
	public Expression parseExpression()
	{
		return parseBinary(BindingPower.NULL_COALESCING);
	}

	/**
	 * Parses an expression that may be the target of an assignment, as in statement position.
	 * Grammar: Assignment ::= Expr ( AssignOp Assignment )?
	 */
	public Expression parseAssignment()
	{
		Token start = peek();
		Expression target = parseExpression();
		if (peek().getType().isAssignment())
		{
			Token operator = advance();
			Expression value = parseAssignment();
			return node(new AssignmentExpression(spanFrom(start), target, operator, value));
		}
		return target;
	}

	/**
	 * Parses operators that bind at least as tightly as the given power.
	 */
	Expression parseBinary(int minPower)
	{
		Token start = peek();
		Expression left = parseUnary();
		while (true)
		{
			TokenType type = peek().getType();
			BindingPower.Infix infix = BindingPower.infix(type);
			if (infix == null || infix.power() < minPower)
			{
				break;
			}
			if (BindingPower.isComparison(type))
			{
				left = parseComparison(start, left);
			}
			else if (BindingPower.isRange(type))
			{
				left = parseRange(start, left);
			}
			else
			{
				Token operator = advance();
				Expression right = parseBinary(infix.rightPower());
				left = node(new BinaryExpression(spanFrom(start), left, operator, right));
			}
		}
		return left;
	}

	// Comparisons do not associate: a second comparison on the same chain is kept as an error.
	private Expression parseComparison(Token start, Expression left)
	{
		Token operator = advance();
		Expression right = parseBinary(BindingPower.COMPARISON + 1);
		Expression result = node(new BinaryExpression(spanFrom(start), left, operator, right));
		if (!BindingPower.isComparison(peek().getType()))
		{
			return result;
		}
		recoverable(DiagnosticCode.E008, peek(), "Comparison operators cannot be chained; combine comparisons with '&&'");
		while (BindingPower.isComparison(peek().getType()))
		{
			operator = advance();
			right = parseBinary(BindingPower.COMPARISON + 1);
			result = node(new BinaryExpression(spanFrom(start), result, operator, right));
		}
		return node(new ErrorExpression(spanFrom(start), result));
	}

	private Expression parseRange(Token start, Expression from)
	{
		Token operator = advance();
		Expression to = parseBinary(BindingPower.RANGE + 1);
		Expression result = node(new RangeExpression(spanFrom(start), from, to, operator.getType() == TokenType.DOT_DOT_EQUAL));
		if (!BindingPower.isRange(peek().getType()))
		{
			return result;
		}
		recoverable(DiagnosticCode.E008, peek(), "Range operators cannot be chained");
		while (BindingPower.isRange(peek().getType()))
		{
			operator = advance();
			to = parseBinary(BindingPower.RANGE + 1);
			result = node(new RangeExpression(spanFrom(start), result, to, operator.getType() == TokenType.DOT_DOT_EQUAL));
		}
		return node(new ErrorExpression(spanFrom(start), result));
	}

	private Expression parseUnary()
	{
		if (BindingPower.isPrefix(peek().getType()))
		{
			Token operator = advance();
			Expression operand = parseUnary();
			return node(new UnaryExpression(spanFrom(operator), operator, operand));
		}
		Token start = peek();
		return parsePostfix(start, parsePrimary());
	}

	private Expression parsePostfix(Token start, Expression primary)
	{
		Expression expression = primary;
		while (true)
		{
			if (match(TokenType.DOT))
			{
				if (match(TokenType.AWAIT))
				{
					expression = node(new AwaitExpression(spanFrom(start), expression));
				}
				else
				{
					// A tuple field is selected by an integer: pair.0
					Token member = check(TokenType.INTEGER_LITERAL) ? advance() : consumeIdentifier("member name");
					expression = node(new MemberAccessExpression(spanFrom(start), expression, member));
				}
			}
			else if (check(TokenType.LEFT_PAREN))
			{
				List<Expression> arguments = parseArguments();
				expression = node(new CallExpression(spanFrom(start), expression, arguments));
			}
			else if (match(TokenType.LEFT_BRACKET))
			{
				Expression index = parseExpression();
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
				expression = node(new IndexExpression(spanFrom(start), expression, index));
			}
			else if (match(TokenType.QUESTION))
			{
				expression = node(new TryExpression(spanFrom(start), expression));
			}
			else if (check(TokenType.BANG) && isName(expression) && GroupOpeners.isOpener(peek(1).getType()))
			{
				if (checkAt(1, TokenType.LEFT_BRACKET))
				{
					Expression macro = ctx.disambiguator().resolveBang(expression, start);
					if (macro != null)
					{
						expression = macro;
					}
					// otherwise the '[' is read as an index on the next iteration
				}
				else
				{
					advance();
					TokenGroup body = ctx.macros().parseTokenGroup();
					expression = node(new MacroInvocationExpression(spanFrom(start), expression, body));
				}
			}
			else if (check(TokenType.LESS) && isName(expression))
			{
				Expression generic = ctx.disambiguator().resolveAngle(expression, start);
				if (generic == null)
				{
					break;
				}
				expression = generic;
			}
			else if (check(TokenType.DOUBLE_COLON) && expression instanceof GenericInstantiationExpression)
			{
				List<Token> segments = new ArrayList<>();
				while (match(TokenType.DOUBLE_COLON))
				{
					segments.add(consumeIdentifier("path segment"));
				}
				expression = node(new PathExpression(spanFrom(start), expression, segments));
			}
			else
			{
				break;
			}
		}
		return expression;
	}

	private static boolean isName(Expression expression)
	{
		return expression instanceof IdentifierExpression
				|| expression instanceof PathExpression && ((PathExpression) expression).getQualifier() == null;
	}

	private List<Expression> parseArguments()
	{
		consume(TokenType.LEFT_PAREN, "Expected '('");
		List<Expression> arguments = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			arguments.add(parseExpression());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
		return arguments;
	}

	private Expression parsePrimary()
	{
		Token token = peek();
		switch (token.getType())
		{
			case INTEGER_LITERAL:
			case FLOAT_LITERAL:
			case STRING_LITERAL:
			case CHAR_LITERAL:
			case BOOLEAN_LITERAL:
				advance();
				return node(new LiteralExpression(token.getSpan(), token));
			case STRING_HEAD:
				return parseInterpolatedString();
			case IDENTIFIER:
				return parseName();
			case LEFT_PAREN:
				return parseParenthesized();
			case LEFT_BRACKET:
				return parseArray();
			case IF:
				return parseIfExpression();
			case MATCH:
				return parseMatch();
			case ERROR:
				// Already reported by the lexer.
				advance();
				return node(new ErrorExpression(token.getSpan(), null));
			default:
				throw error(DiagnosticCode.E001, token, "Expected expression", EXPRESSION_SUGGESTION);
		}
	}

	private Expression parseName()
	{
		Token first = advance();
		if (!check(TokenType.DOUBLE_COLON))
		{
			return node(new IdentifierExpression(first.getSpan(), first));
		}
		List<Token> segments = new ArrayList<>();
		segments.add(first);
		while (match(TokenType.DOUBLE_COLON))
		{
			segments.add(consumeIdentifier("path segment"));
		}
		return node(new PathExpression(spanFrom(first), segments));
	}

	private Expression parseInterpolatedString()
	{
		Token head = advance();
		List<String> fragments = new ArrayList<>();
		List<Expression> expressions = new ArrayList<>();
		fragments.add((String) head.getLiteral());
		while (true)
		{
			if (check(TokenType.ERROR))
			{
				advance();
				return node(new ErrorExpression(spanFrom(head), null));
			}
			expressions.add(parseExpression());
			if (match(TokenType.STRING_MIDDLE))
			{
				fragments.add((String) previous().getLiteral());
			}
			else if (match(TokenType.STRING_TAIL))
			{
				fragments.add((String) previous().getLiteral());
				break;
			}
			else if (check(TokenType.ERROR))
			{
				advance();
				return node(new ErrorExpression(spanFrom(head), null));
			}
			else
			{
				throw error(DiagnosticCode.E007, peek(), "Expected '}' to close the interpolated expression", null);
			}
		}
		return node(new InterpolatedStringExpression(spanFrom(head), fragments, expressions));
	}

	/**
	 * Grammar: '(' ')' | '(' Expr ')' | '(' Expr ',' ( Expr { ',' Expr } ','? )? ')'
	 */
	private Expression parseParenthesized()
	{
		Token open = advance();
		if (match(TokenType.RIGHT_PAREN))
		{
			return node(new TupleExpression(spanFrom(open), List.of()));
		}
		Expression first = parseExpression();
		if (match(TokenType.RIGHT_PAREN))
		{
			return node(new GroupingExpression(spanFrom(open), first));
		}
		if (!check(TokenType.COMMA))
		{
			throw error(peek(), "Expected ')' after expression");
		}
		List<Expression> elements = new ArrayList<>();
		elements.add(first);
		while (match(TokenType.COMMA))
		{
			if (check(TokenType.RIGHT_PAREN))
			{
				break;
			}
			if (atStatementBoundary())
			{
				return recoverLiteral(DiagnosticCode.E006, open, "Expected ')' to close tuple literal",
						TokenType.RIGHT_PAREN, node(new TupleExpression(spanFrom(open), elements)));
			}
			elements.add(parseExpression());
		}
		if (!match(TokenType.RIGHT_PAREN))
		{
			return recoverLiteral(DiagnosticCode.E006, open, "Expected ')' to close tuple literal",
					TokenType.RIGHT_PAREN, node(new TupleExpression(spanFrom(open), elements)));
		}
		return node(new TupleExpression(spanFrom(open), elements));
	}

	/**
	 * Grammar: '[' ( Expr { ',' Expr } ','? )? ']'
	 */
	private Expression parseArray()
	{
		Token open = advance();
		List<Expression> elements = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACKET))
		{
			if (atStatementBoundary())
			{
				return recoverLiteral(DiagnosticCode.E005, open, "Expected ']' to close array literal",
						TokenType.RIGHT_BRACKET, node(new ArrayLiteralExpression(spanFrom(open), elements)));
			}
			elements.add(parseExpression());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		if (!match(TokenType.RIGHT_BRACKET))
		{
			return recoverLiteral(DiagnosticCode.E005, open, "Expected ']' to close array literal",
					TokenType.RIGHT_BRACKET, node(new ArrayLiteralExpression(spanFrom(open), elements)));
		}
		return node(new ArrayLiteralExpression(spanFrom(open), elements));
	}

	/**
	 * Reports a malformed array or tuple literal and skips to its closer or to the end of the
	 * statement, whichever comes first. The elements read so far are kept under an ErrorExpression.
	 */
	private Expression recoverLiteral(DiagnosticCode code, Token open, String message, TokenType closer, Expression partial)
	{
		recoverable(code, peek(), message + " opened at " + open.getSpan());
		int depth = 0;
		while (!isAtEnd())
		{
			TokenType type = peek().getType();
			if (depth == 0 && type == closer)
			{
				advance();
				break;
			}
			if (depth == 0 && atStatementBoundary())
			{
				break;
			}
			if (GroupOpeners.isOpener(type))
			{
				depth++;
			}
			else if (GroupOpeners.isCloser(type) && depth > 0)
			{
				depth--;
			}
			advance();
		}
		return node(new ErrorExpression(spanFrom(open), partial));
	}

	/**
	 * An {@code if} in expression position. Unlike the statement form it must have an else branch.
	 * Grammar: IfExpr ::= 'if' Expr Block 'else' ( IfExpr | Block )
	 */
	private Expression parseIfExpression()
	{
		Token start = advance();
		Expression condition = parseExpression();
		BlockExpression thenBranch = blockExpression(ctx.statements().parseBlock("if expression"));
		skipNewlineBefore(TokenType.ELSE);
		consume(TokenType.ELSE, "Expected 'else': an 'if' used as a value needs an else branch");
		Expression elseBranch;
		if (check(TokenType.IF))
		{
			elseBranch = parseIfExpression();
		}
		else
		{
			elseBranch = blockExpression(ctx.statements().parseBlock("else branch"));
		}
		return node(new IfExpression(spanFrom(start), condition, thenBranch, elseBranch));
	}

	private BlockExpression blockExpression(BlockStatement block)
	{
		return node(new BlockExpression(block.getSpan(), block));
	}

	/**
	 * Grammar: MatchExpr ::= 'match' Expr ( '{' Arms '}' | ':' NEWLINE INDENT Arms DEDENT )
	 */
	private Expression parseMatch()
	{
		Token start = advance();
		Expression scrutinee = parseExpression();
		StatementParser statements = ctx.statements();
		skipNewlineBefore(TokenType.LEFT_BRACE);
		Token opener = peek();
		BlockStyle style = statements.openBlock("match expression");
		List<MatchArm> arms = statements.parseBlockItems(style, this::parseArm,
				"Expected ',' or a line break between match arms");
		statements.closeBlock(style, opener);
		return node(new MatchExpression(spanFrom(start), scrutinee, arms));
	}

	/**
	 * Grammar: Arm ::= Pattern ('if' Expr)? '=>' (Expr | Block)
	 */
	private MatchArm parseArm()
	{
		Token start = peek();
		Pattern pattern = ctx.patterns().parsePattern();
		Expression guard = match(TokenType.IF) ? parseExpression() : null;
		consume(TokenType.FAT_ARROW, "Expected '=>' after match pattern");
		Expression body;
		if (check(TokenType.LEFT_BRACE))
		{
			body = blockExpression(ctx.statements().parseBlock("match arm"));
		}
		else
		{
			body = parseExpression();
		}
		return node(new MatchArm(spanFrom(start), pattern, guard, body));
	}

	/**
	 * Token classes for delimiter matching.
	 */
	static final class GroupOpeners
	{
		private GroupOpeners()
		{
		}

		static boolean isOpener(TokenType type)
		{
			return type == TokenType.LEFT_PAREN || type == TokenType.LEFT_BRACKET || type == TokenType.LEFT_BRACE;
		}

		static boolean isCloser(TokenType type)
		{
			return type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET || type == TokenType.RIGHT_BRACE;
		}
	}
}
