package org.lokray.ferra.parser;

import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.declarations.Attribute;
import org.lokray.ferra.ast.declarations.Modifier;
import org.lokray.ferra.ast.macros.GroupDelimiter;
import org.lokray.ferra.ast.macros.MacroDefinition;
import org.lokray.ferra.ast.macros.MacroRule;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.macros.TokenLeaf;
import org.lokray.ferra.ast.macros.TokenTree;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses macro definitions and the token trees of macro bodies. Token trees are kept
 * unexpanded; only the delimiters have to balance.
 */
public class MacroParser extends AbstractParser
{
	public MacroParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Parses a delimited token group.
	 * Grammar: TokenGroup ::= '(' TT* ')' | '[' TT* ']' | '{' TT* '}'
	 *
	 * @return The parsed TokenGroup.
	 * @throws ParseException if the delimiters do not balance.
	 */
	public TokenGroup parseTokenGroup()
	{
		Token open = peek();
		GroupDelimiter delimiter = GroupDelimiter.opening(open.getType());
		if (delimiter == null)
		{
			throw error(open, "Expected '(', '[' or '{' to open a macro body");
		}
		advance();
		List<TokenTree> trees = new ArrayList<>();
		while (!check(delimiter.getClose()))
		{
			Token token = peek();
			switch (token.getType())
			{
				case EOF:
					throw error(token, "Unclosed '" + delimiter.getOpenText() + "' in macro body");
				case NEWLINE:
				case INDENT:
				case DEDENT:
					advance(); // layout is not part of a token tree
					break;
				case LEFT_PAREN:
				case LEFT_BRACKET:
				case LEFT_BRACE:
					trees.add(parseTokenGroup());
					break;
				case RIGHT_PAREN:
				case RIGHT_BRACKET:
				case RIGHT_BRACE:
					throw error(token, "Mismatched '" + token.getLexeme() + "' in macro body, expected '" + delimiter.getCloseText() + "'");
				default:
					advance();
					trees.add(node(new TokenLeaf(token.getSpan(), token)));
					break;
			}
		}
		advance();
		return node(new TokenGroup(spanFrom(open), delimiter, trees));
	}

	/**
	 * Grammar: MacroDef ::= 'macro' IDENT ( '{' MacroRule* '}' | ':' NEWLINE INDENT MacroRule+ DEDENT )
	 */
	public MacroDefinition parseMacroDefinition(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		consume(TokenType.MACRO, "Expected 'macro'");
		Token name = consumeIdentifier("macro name");
		StatementParser statements = ctx.statements();
		skipNewlineBefore(TokenType.LEFT_BRACE);
		Token opener = peek();
		BlockStyle style = statements.openBlock("macro body");
		List<MacroRule> rules = statements.parseBlockItems(style, this::parseRule,
				"Expected a line break between macro rules");
		statements.closeBlock(style, opener);
		return node(new MacroDefinition(spanFrom(start), attributes, modifiers, name, rules));
	}

	/**
	 * Grammar: MacroRule ::= TokenGroup '=>' TokenGroup
	 */
	private MacroRule parseRule()
	{
		Token start = peek();
		TokenGroup matcher = parseTokenGroup();
		consume(TokenType.FAT_ARROW, "Expected '=>' after macro matcher");
		TokenGroup transcriber = parseTokenGroup();
		return node(new MacroRule(spanFrom(start), matcher, transcriber));
	}
}
