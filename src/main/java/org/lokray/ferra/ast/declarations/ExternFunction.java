package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A foreign function signature inside an extern block.
 */
public class ExternFunction extends AbstractDeclaration
{
	private final Token name;
	private final List<Parameter> parameters;
	private final TypeNode returnType; // null when omitted

	public ExternFunction(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, Token name,
						  List<Parameter> parameters, TypeNode returnType)
	{
		super(span, attributes, modifiers);
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
	}

	public Token getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public TypeNode getReturnType()
	{
		return returnType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExternFunction(this);
	}

	@Override
	public String toString()
	{
		return prefix() + "fn " + name.getLexeme() + "(" + parameters.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")"
				+ (returnType != null ? " -> " + returnType : "");
	}
}
