package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.types.GenericParameters;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST node for {@code data Name<T> { fields }}, in either block style.
 */
public class DataClassDeclaration extends AbstractDeclaration
{
	private final Token name;
	private final GenericParameters genericParameters; // may be null
	private final List<FieldDeclaration> fields;

	public DataClassDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, Token name,
								GenericParameters genericParameters, List<FieldDeclaration> fields)
	{
		super(span, attributes, modifiers);
		this.name = name;
		this.genericParameters = genericParameters;
		this.fields = List.copyOf(fields);
	}

	public Token getName()
	{
		return name;
	}

	public GenericParameters getGenericParameters()
	{
		return genericParameters;
	}

	public List<FieldDeclaration> getFields()
	{
		return fields;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDataClassDeclaration(this);
	}

	@Override
	public String toString()
	{
		return prefix() + "data " + name.getLexeme() + (genericParameters != null ? genericParameters.toString() : "")
				+ " { " + fields.stream().map(Object::toString).collect(Collectors.joining(", ")) + " }";
	}
}
