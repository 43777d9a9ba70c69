package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;

/**
 * AST node representing a field of a data class, {@code pub name: Type}.
 */
public class FieldDeclaration extends AbstractDeclaration
{
	private final Token name;
	private final TypeNode type;

	public FieldDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, Token name, TypeNode type)
	{
		super(span, attributes, modifiers);
		this.name = name;
		this.type = type;
	}

	public Token getName()
	{
		return name;
	}

	public TypeNode getType()
	{
		return type;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldDeclaration(this);
	}

	@Override
	public String toString()
	{
		return prefix() + name.getLexeme() + ": " + type;
	}
}
