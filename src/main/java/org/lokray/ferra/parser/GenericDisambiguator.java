package org.lokray.ferra.parser;

import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.ast.expressions.GenericInstantiationExpression;
import org.lokray.ferra.ast.expressions.MacroInvocationExpression;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the places where Ferra's grammar is ambiguous by trying both readings.
 * <ul>
 *     <li>{@code a < b > c} (a comparison chain) against {@code a<b<c>>} (nested generic arguments);</li>
 *     <li>{@code foo(x)} against {@code Foo<T>(x)} (a generic instantiation that is then called);</li>
 *     <li>{@code foo![x]} (a macro invocation) against {@code foo[x]} when the macro body does not balance.</li>
 * </ul>
 * Each decision is a bounded two-branch backtrack: the cursor, the node arena and the
 * diagnostics are checkpointed, the first reading is tried with local recovery switched off,
 * and a losing branch is rolled back completely.
 */
public class GenericDisambiguator extends AbstractParser
{
	private static final Logger log = LoggerFactory.getLogger(GenericDisambiguator.class);

	// Tokens that may appear between '<' and its '>' in a type argument list.
	private static final Set<TokenType> TYPE_TOKENS = EnumSet.of(
			TokenType.IDENTIFIER, TokenType.DOUBLE_COLON, TokenType.COMMA,
			TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACKET, TokenType.RIGHT_BRACKET,
			TokenType.STAR, TokenType.FN, TokenType.EXTERN, TokenType.ARROW, TokenType.STRING_LITERAL);

	public GenericDisambiguator(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Decides how to read a {@code <} that follows a name operand.
	 *
	 * @param target The name before the {@code <}.
	 * @param start  The first token of the target, for the node span.
	 * @return The generic instantiation with the cursor after its closing {@code >}, or null for
	 * the comparison reading with the cursor left at the {@code <}.
	 */
	public Expression resolveAngle(Expression target, Token start)
	{
		Token angle = peek();
		if (!looksLikeTypeArguments())
		{
			log.debug("'<' at {}: no type-shaped argument list within {} tokens, reading a comparison",
					angle.getSpan(), ctx.getConfig().getGlrLookaheadLimit());
			return null;
		}

		ParserContext.Snapshot before = ctx.snapshot();
		List<TypeNode> arguments = tryTypeArguments();
		if (arguments == null)
		{
			ctx.restore(before);
			log.debug("'<' at {}: type arguments do not parse, reading a comparison", angle.getSpan());
			return null;
		}
		TokenType next = peek().getType();
		if (prefersGeneric(next))
		{
			log.debug("'<' at {}: generic instantiation followed by {}", angle.getSpan(), next);
			return node(new GenericInstantiationExpression(spanFrom(start), target, arguments));
		}

		// Both readings may parse; the comparison wins unless it breaks.
		ctx.restore(before);
		boolean comparison = comparisonParses();
		ctx.restore(before);
		if (comparison)
		{
			log.debug("'<' at {}: both readings parse, preferring the comparison", angle.getSpan());
			return null;
		}
		log.debug("'<' at {}: comparison does not parse, reading a generic instantiation", angle.getSpan());
		arguments = ctx.types().parseTypeArguments();
		return node(new GenericInstantiationExpression(spanFrom(start), target, arguments));
	}

	/**
	 * Decides how to read {@code name ! [}. The macro reading is tried first; when the bracket
	 * body does not balance, E008 is reported at the {@code !} and the caller continues with an
	 * index expression.
	 *
	 * @return The macro invocation, or null with the cursor after the {@code !} at the {@code [}.
	 */
	public Expression resolveBang(Expression name, Token start)
	{
		ParserContext.Snapshot before = ctx.snapshot();
		Token bang = advance();
		TokenGroup body = tryTokenGroup();
		if (body != null)
		{
			log.debug("'!' at {}: bracket macro invocation", bang.getSpan());
			return node(new MacroInvocationExpression(spanFrom(start), name, body));
		}
		ctx.restore(before);
		advance();
		log.debug("'!' at {}: macro body does not balance, reading an index expression", bang.getSpan());
		recoverable(DiagnosticCode.E008, bang,
				"Macro body after '" + name + "!' is not balanced; reading it as an index expression");
		return null;
	}

	private List<TypeNode> tryTypeArguments()
	{
		ctx.enterTrial();
		try
		{
			return ctx.types().parseTypeArguments();
		}
		catch (ParseException e)
		{
			log.trace("Generic trial failed: {}", e.getMessage());
			return null;
		}
		finally
		{
			ctx.exitTrial();
		}
	}

	private TokenGroup tryTokenGroup()
	{
		ctx.enterTrial();
		try
		{
			return ctx.macros().parseTokenGroup();
		}
		catch (ParseException e)
		{
			log.trace("Macro body trial failed: {}", e.getMessage());
			return null;
		}
		finally
		{
			ctx.exitTrial();
		}
	}

	/**
	 * Reads the comparison operators and operands from the {@code <} on, without building
	 * anything that survives.
	 */
	private boolean comparisonParses()
	{
		ctx.enterTrial();
		try
		{
			while (BindingPower.isComparison(peek().getType()))
			{
				advance();
				ctx.expressions().parseBinary(BindingPower.COMPARISON + 1);
			}
			return true;
		}
		catch (ParseException e)
		{
			log.trace("Comparison trial failed: {}", e.getMessage());
			return false;
		}
		finally
		{
			ctx.exitTrial();
		}
	}

	/**
	 * Scans ahead for the {@code >} matching the current {@code <}, over tokens that can occur in
	 * type arguments only.
	 */
	private boolean looksLikeTypeArguments()
	{
		int depth = 0;
		for (Token token : ctx.getCursor().window(ctx.getConfig().getGlrLookaheadLimit()))
		{
			switch (token.getType())
			{
				case LESS:
					depth++;
					break;
				case GREATER:
				case GREATER_EQUAL:
					depth--;
					break;
				case RIGHT_SHIFT:
				case RIGHT_SHIFT_ASSIGN:
					depth -= 2;
					break;
				default:
					if (!TYPE_TOKENS.contains(token.getType()))
					{
						return false;
					}
					break;
			}
			if (depth <= 0)
			{
				return true;
			}
		}
		return false;
	}

	// The token after the closing '>' that settles an instantiation even when a comparison would parse.
	private static boolean prefersGeneric(TokenType next)
	{
		return next == TokenType.LEFT_PAREN || next == TokenType.DOUBLE_COLON;
	}
}
