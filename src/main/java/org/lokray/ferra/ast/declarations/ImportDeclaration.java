package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST node for an import. Three forms exist:
 * {@code import a::b (as c)?}, {@code import a::*} and {@code import a::{x, y}}.
 */
public class ImportDeclaration extends AbstractDeclaration
{
	private final List<Token> path;
	private final boolean wildcard;
	private final List<Token> members; // empty unless the group form was used
	private final Token alias; // may be null

	public ImportDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, List<Token> path,
							 boolean wildcard, List<Token> members, Token alias)
	{
		super(span, attributes, modifiers);
		this.path = List.copyOf(path);
		this.wildcard = wildcard;
		this.members = List.copyOf(members);
		this.alias = alias;
	}

	public List<Token> getPath()
	{
		return path;
	}

	public String getQualifiedName()
	{
		return path.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
	}

	public boolean isWildcard()
	{
		return wildcard;
	}

	public List<Token> getMembers()
	{
		return members;
	}

	public Token getAlias()
	{
		return alias;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitImportDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(prefix()).append("import ").append(getQualifiedName());
		if (wildcard)
		{
			sb.append("::*");
		}
		else if (!members.isEmpty())
		{
			sb.append("::{").append(members.stream().map(Token::getLexeme).collect(Collectors.joining(", "))).append('}');
		}
		if (alias != null)
		{
			sb.append(" as ").append(alias.getLexeme());
		}
		return sb.toString();
	}
}
