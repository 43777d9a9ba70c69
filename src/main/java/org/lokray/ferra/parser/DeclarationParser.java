package org.lokray.ferra.parser;

import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.declarations.Attribute;
import org.lokray.ferra.ast.declarations.DataClassDeclaration;
import org.lokray.ferra.ast.declarations.Declaration;
import org.lokray.ferra.ast.declarations.ExternBlock;
import org.lokray.ferra.ast.declarations.ExternFunction;
import org.lokray.ferra.ast.declarations.ExternVariable;
import org.lokray.ferra.ast.declarations.FieldDeclaration;
import org.lokray.ferra.ast.declarations.FunctionDeclaration;
import org.lokray.ferra.ast.declarations.ImportDeclaration;
import org.lokray.ferra.ast.declarations.Modifier;
import org.lokray.ferra.ast.declarations.ModuleDeclaration;
import org.lokray.ferra.ast.declarations.Parameter;
import org.lokray.ferra.ast.declarations.VariableDeclaration;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.ast.types.GenericParameters;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.ast.types.WhereClause;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parses declarations and their attribute and modifier prefixes.
 */
public class DeclarationParser extends AbstractParser
{
	public DeclarationParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Grammar: Attribute ::= '#' '[' IDENT ( '(' AttrArg { ',' AttrArg } ')' )? ']'
	 */
	public List<Attribute> parseAttributes()
	{
		List<Attribute> attributes = new ArrayList<>();
		while (check(TokenType.HASH) && checkAt(1, TokenType.LEFT_BRACKET))
		{
			Token start = advance();
			advance();
			Token name = consumeIdentifier("attribute name");
			List<Expression> arguments = new ArrayList<>();
			if (match(TokenType.LEFT_PAREN))
			{
				while (!check(TokenType.RIGHT_PAREN))
				{
					arguments.add(ctx.expressions().parseAssignment()); // #[link(name = "c")]
					if (!match(TokenType.COMMA))
					{
						break;
					}
				}
				consume(TokenType.RIGHT_PAREN, "Expected ')' after attribute arguments");
			}
			consume(TokenType.RIGHT_BRACKET, "Expected ']' to close attribute");
			attributes.add(node(new Attribute(spanFrom(start), name, arguments)));
			match(TokenType.NEWLINE);
		}
		return attributes;
	}

	public Set<Modifier> parseModifiers()
	{
		Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
		while (check(TokenType.PUB, TokenType.UNSAFE))
		{
			Token token = advance();
			if (!modifiers.add(Modifier.fromToken(token.getType())))
			{
				recoverable(DiagnosticCode.E001, token, "Duplicate modifier '" + token.getLexeme() + "'");
			}
		}
		return modifiers;
	}

	public boolean atDeclaration()
	{
		return check(TokenType.LET, TokenType.VAR, TokenType.FN, TokenType.DATA, TokenType.EXTERN,
				TokenType.MODULE, TokenType.IMPORT, TokenType.MACRO)
				|| check(TokenType.ASYNC) && checkAt(1, TokenType.FN);
	}

	/**
	 * Parses the declaration at the current token, after its attributes and modifiers.
	 *
	 * @param start The first token of the declaration, attributes included.
	 * @return The parsed Declaration.
	 * @throws ParseException if a syntax error occurs.
	 */
	public Declaration parseDeclaration(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		switch (peek().getType())
		{
			case LET:
			case VAR:
				return parseVariable(start, attributes, modifiers);
			case ASYNC:
			case FN:
				return parseFunction(start, attributes, modifiers);
			case DATA:
				return parseDataClass(start, attributes, modifiers);
			case EXTERN:
				return parseExternBlock(start, attributes, modifiers);
			case MODULE:
				return parseModule(start, attributes, modifiers);
			case IMPORT:
				return parseImport(start, attributes, modifiers);
			case MACRO:
				return ctx.macros().parseMacroDefinition(start, attributes, modifiers);
			default:
				throw error(peek(), "Expected declaration");
		}
	}

	/**
	 * Grammar: VariableDecl ::= ('let' | 'var') IDENT (':' Type)? ('=' Expr)?
	 */
	private Declaration parseVariable(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		boolean mutable = advance().getType() == TokenType.VAR;
		Token name = consumeIdentifier("variable name");
		TypeNode type = match(TokenType.COLON) ? ctx.types().parseType() : null;
		Expression initializer = match(TokenType.ASSIGN) ? ctx.expressions().parseExpression() : null;
		return node(new VariableDeclaration(spanFrom(start), attributes, modifiers, mutable, name, type, initializer));
	}

	/**
	 * Grammar: FunctionDecl ::= 'async'? 'fn' IDENT GenericParams? '(' Params? ')' ('->' Type)? WhereClause? (Block)?
	 */
	private Declaration parseFunction(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		boolean async = match(TokenType.ASYNC);
		consume(TokenType.FN, "Expected 'fn'");
		Token name = consumeIdentifier("function name");
		GenericParameters generics = check(TokenType.LESS) ? ctx.types().parseGenericParameters() : null;
		consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
		List<Parameter> parameters = parseParameters();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
		TypeNode returnType = match(TokenType.ARROW) ? ctx.types().parseType() : null;
		skipNewlineBefore(TokenType.WHERE);
		WhereClause where = check(TokenType.WHERE) ? ctx.types().parseWhereClause() : null;
		skipNewlineBefore(TokenType.LEFT_BRACE);
		BlockStatement body = check(TokenType.LEFT_BRACE, TokenType.COLON) ? ctx.statements().parseBlock("function body") : null;
		return node(new FunctionDeclaration(spanFrom(start), attributes, modifiers, async, name, generics,
				parameters, returnType, where, body));
	}

	/**
	 * Grammar: Params ::= Param { ',' Param } ','?    Param ::= Attribute* IDENT ':' Type
	 */
	private List<Parameter> parseParameters()
	{
		List<Parameter> parameters = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			Token start = peek();
			List<Attribute> attributes = parseAttributes();
			Token name = consumeIdentifier("parameter name");
			consume(TokenType.COLON, "Expected ':' after parameter name");
			TypeNode type = ctx.types().parseType();
			parameters.add(node(new Parameter(spanFrom(start), attributes, name, type)));
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		return parameters;
	}

	/**
	 * Grammar: DataClassDecl ::= 'data' IDENT GenericParams? ( '{' Fields '}' | ':' NEWLINE INDENT Fields DEDENT )
	 */
	private Declaration parseDataClass(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		advance();
		Token name = consumeIdentifier("data class name");
		GenericParameters generics = check(TokenType.LESS) ? ctx.types().parseGenericParameters() : null;
		StatementParser statements = ctx.statements();
		skipNewlineBefore(TokenType.LEFT_BRACE);
		Token opener = peek();
		BlockStyle style = statements.openBlock("data class body");
		List<FieldDeclaration> fields = statements.parseBlockItems(style, this::parseField,
				"Expected ',' or a line break between fields");
		statements.closeBlock(style, opener);
		return node(new DataClassDeclaration(spanFrom(start), attributes, modifiers, name, generics, fields));
	}

	/**
	 * Grammar: Field ::= Attribute* 'pub'? IDENT ':' Type
	 */
	private FieldDeclaration parseField()
	{
		Token start = peek();
		List<Attribute> attributes = parseAttributes();
		Set<Modifier> modifiers = match(TokenType.PUB) ? EnumSet.of(Modifier.PUB) : EnumSet.noneOf(Modifier.class);
		Token name = consumeIdentifier("field name");
		consume(TokenType.COLON, "Expected ':' after field name");
		TypeNode type = ctx.types().parseType();
		return node(new FieldDeclaration(spanFrom(start), attributes, modifiers, name, type));
	}

	/**
	 * Grammar: ExternBlock ::= 'extern' STRING? ( '{' ExternItem* '}' | ':' NEWLINE INDENT ExternItem+ DEDENT )
	 */
	private Declaration parseExternBlock(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		advance();
		String abi = check(TokenType.STRING_LITERAL) ? (String) advance().getLiteral() : null;
		StatementParser statements = ctx.statements();
		skipNewlineBefore(TokenType.LEFT_BRACE);
		Token opener = peek();
		BlockStyle style = statements.openBlock("extern block");
		List<Declaration> items = statements.parseBlockItems(style, this::parseExternItem,
				"Expected ';' or a line break between extern items");
		statements.closeBlock(style, opener);
		return node(new ExternBlock(spanFrom(start), attributes, modifiers, abi, items));
	}

	/**
	 * Grammar: ExternItem ::= 'fn' IDENT '(' Params? ')' ('->' Type)? | 'static' IDENT ':' Type
	 */
	private Declaration parseExternItem()
	{
		Token start = peek();
		List<Attribute> attributes = parseAttributes();
		Set<Modifier> modifiers = parseModifiers();
		if (match(TokenType.FN))
		{
			Token name = consumeIdentifier("function name");
			consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
			List<Parameter> parameters = parseParameters();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
			TypeNode returnType = match(TokenType.ARROW) ? ctx.types().parseType() : null;
			return node(new ExternFunction(spanFrom(start), attributes, modifiers, name, parameters, returnType));
		}
		if (match(TokenType.STATIC))
		{
			Token name = consumeIdentifier("variable name");
			consume(TokenType.COLON, "Expected ':' after extern variable name");
			TypeNode type = ctx.types().parseType();
			return node(new ExternVariable(spanFrom(start), attributes, modifiers, name, type));
		}
		throw error(peek(), "Expected 'fn' or 'static' in extern block");
	}

	/**
	 * Grammar: ModuleDecl ::= 'module' Path Block?
	 */
	private Declaration parseModule(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		advance();
		List<Token> path = new ArrayList<>();
		path.add(consumeIdentifier("module name"));
		while (match(TokenType.DOUBLE_COLON))
		{
			path.add(consumeIdentifier("module name"));
		}
		skipNewlineBefore(TokenType.LEFT_BRACE);
		BlockStatement body = check(TokenType.LEFT_BRACE, TokenType.COLON) ? ctx.statements().parseBlock("module body") : null;
		return node(new ModuleDeclaration(spanFrom(start), attributes, modifiers, path, body));
	}

	/**
	 * Grammar: ImportDecl ::= 'import' Path ( '::' '*' | '::' '{' IDENT {',' IDENT} '}' )? ('as' IDENT)?
	 */
	private Declaration parseImport(Token start, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		advance();
		List<Token> path = new ArrayList<>();
		path.add(consumeIdentifier("module name"));
		boolean wildcard = false;
		List<Token> members = new ArrayList<>();
		while (match(TokenType.DOUBLE_COLON))
		{
			if (match(TokenType.STAR))
			{
				wildcard = true;
				break;
			}
			if (match(TokenType.LEFT_BRACE))
			{
				while (!check(TokenType.RIGHT_BRACE))
				{
					members.add(consumeIdentifier("imported name"));
					if (!match(TokenType.COMMA))
					{
						break;
					}
				}
				consume(TokenType.RIGHT_BRACE, "Expected '}' to close the import list");
				if (members.isEmpty())
				{
					throw error(previous(), "Expected at least one imported name");
				}
				break;
			}
			path.add(consumeIdentifier("module name"));
		}
		Token alias = match(TokenType.AS) ? consumeIdentifier("import alias") : null;
		return node(new ImportDeclaration(spanFrom(start), attributes, modifiers, path, wildcard, members, alias));
	}
}
