package org.lokray.ferra.parser;

import org.lokray.ferra.ast.types.ArrayType;
import org.lokray.ferra.ast.types.FunctionType;
import org.lokray.ferra.ast.types.GenericParameter;
import org.lokray.ferra.ast.types.GenericParameters;
import org.lokray.ferra.ast.types.NamedType;
import org.lokray.ferra.ast.types.PointerType;
import org.lokray.ferra.ast.types.TupleType;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.ast.types.WhereClause;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses types, generic parameter lists and where clauses.
 */
public class TypeParser extends AbstractParser
{
	public TypeParser(ParserContext ctx)
	{
		super(ctx);
	}

	/**
	 * Parses a type.
	 * Grammar: Type ::= Path TypeArguments? | '(' Types? ')' | '[' Type ']' | '*' Type
	 * | ('extern' STRING?)? 'fn' '(' Types? ')' ('->' Type)?
	 *
	 * @return The parsed TypeNode.
	 * @throws ParseException if no type starts at the current token.
	 */
	public TypeNode parseType()
	{
		Token start = peek();
		if (match(TokenType.LEFT_PAREN))
		{
			List<TypeNode> elements = new ArrayList<>();
			boolean trailingComma = false;
			while (!check(TokenType.RIGHT_PAREN))
			{
				elements.add(parseType());
				trailingComma = match(TokenType.COMMA);
				if (!trailingComma)
				{
					break;
				}
			}
			consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple type");
			if (elements.size() == 1 && !trailingComma)
			{
				return elements.get(0); // parenthesized
			}
			return node(new TupleType(spanFrom(start), elements));
		}
		if (match(TokenType.LEFT_BRACKET))
		{
			TypeNode element = parseType();
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after array element type");
			return node(new ArrayType(spanFrom(start), element));
		}
		if (match(TokenType.STAR))
		{
			TypeNode pointee = parseType();
			return node(new PointerType(spanFrom(start), pointee));
		}
		if (check(TokenType.FN, TokenType.EXTERN))
		{
			return parseFunctionType();
		}
		if (check(TokenType.IDENTIFIER) || peek().getType().isKeyword())
		{
			return parseNamedType();
		}
		throw error(peek(), "Expected type");
	}

	private TypeNode parseNamedType()
	{
		Token start = peek();
		List<Token> path = new ArrayList<>();
		path.add(consumeIdentifier("type name"));
		while (check(TokenType.DOUBLE_COLON) && checkAt(1, TokenType.IDENTIFIER))
		{
			advance();
			path.add(advance());
		}
		List<TypeNode> arguments = check(TokenType.LESS) ? parseTypeArguments() : List.of();
		return node(new NamedType(spanFrom(start), path, arguments));
	}

	private TypeNode parseFunctionType()
	{
		Token start = peek();
		boolean external = false;
		String abi = null;
		if (match(TokenType.EXTERN))
		{
			external = true;
			if (check(TokenType.STRING_LITERAL))
			{
				abi = (String) advance().getLiteral();
			}
		}
		consume(TokenType.FN, "Expected 'fn' in function type");
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'fn'");
		List<TypeNode> parameters = new ArrayList<>();
		while (!check(TokenType.RIGHT_PAREN))
		{
			parameters.add(parseType());
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after function type parameters");
		TypeNode returnType = match(TokenType.ARROW) ? parseType() : null;
		return node(new FunctionType(spanFrom(start), external, abi, parameters, returnType));
	}

	/**
	 * Parses a type argument list. The closing {@code >} may be the first half of a
	 * {@code >>}, {@code >=} or {@code >>=} token.
	 * Grammar: TypeArguments ::= '<' Type { ',' Type } ','? '>'
	 */
	public List<TypeNode> parseTypeArguments()
	{
		consume(TokenType.LESS, "Expected '<' to open type arguments");
		List<TypeNode> arguments = new ArrayList<>();
		do
		{
			if (atClosingAngle())
			{
				break;
			}
			arguments.add(parseType());
		}
		while (match(TokenType.COMMA));
		if (arguments.isEmpty())
		{
			throw error(peek(), "Expected type argument");
		}
		closeAngle("Expected '>' to close type arguments");
		return arguments;
	}

	/**
	 * Grammar: GenericParams ::= '<' GenericParam { ',' GenericParam } '>'
	 * GenericParam ::= IDENT (':' Bound {'+' Bound})? ('=' Type)?
	 */
	public GenericParameters parseGenericParameters()
	{
		Token start = consume(TokenType.LESS, "Expected '<' to open generic parameters");
		List<GenericParameter> parameters = new ArrayList<>();
		do
		{
			if (atClosingAngle())
			{
				break;
			}
			Token paramStart = peek();
			Token name = consumeIdentifier("type parameter name");
			List<TypeNode> bounds = match(TokenType.COLON) ? parseBounds() : List.of();
			TypeNode defaultType = match(TokenType.ASSIGN) ? parseType() : null;
			parameters.add(node(new GenericParameter(spanFrom(paramStart), name, bounds, defaultType)));
		}
		while (match(TokenType.COMMA));
		if (parameters.isEmpty())
		{
			throw error(peek(), "Expected generic parameter");
		}
		closeAngle("Expected '>' to close generic parameters");
		return node(new GenericParameters(spanFrom(start), parameters));
	}

	/**
	 * Grammar: WhereClause ::= 'where' IDENT ':' Bound {'+' Bound} { ',' IDENT ':' Bound {'+' Bound} }
	 */
	public WhereClause parseWhereClause()
	{
		Token start = consume(TokenType.WHERE, "Expected 'where'");
		List<GenericParameter> predicates = new ArrayList<>();
		do
		{
			Token predicateStart = peek();
			Token name = consumeIdentifier("type parameter name");
			consume(TokenType.COLON, "Expected ':' after type parameter in where clause");
			List<TypeNode> bounds = parseBounds();
			predicates.add(node(new GenericParameter(spanFrom(predicateStart), name, bounds, null)));
		}
		while (match(TokenType.COMMA));
		return node(new WhereClause(spanFrom(start), predicates));
	}

	private List<TypeNode> parseBounds()
	{
		List<TypeNode> bounds = new ArrayList<>();
		bounds.add(parseType());
		while (match(TokenType.PLUS))
		{
			bounds.add(parseType());
		}
		return bounds;
	}

	private boolean atClosingAngle()
	{
		return check(TokenType.GREATER, TokenType.RIGHT_SHIFT, TokenType.GREATER_EQUAL, TokenType.RIGHT_SHIFT_ASSIGN);
	}

	private void closeAngle(String message)
	{
		if (!atClosingAngle())
		{
			throw error(peek(), message);
		}
		ctx.getCursor().splitGreater();
	}
}
