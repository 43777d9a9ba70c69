package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.ast.types.GenericParameters;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.ast.types.WhereClause;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST node representing a function declaration.
 * Example: `pub async fn fetch<T: Decode>(url: String) -> Result<T> where T: Send { ... }`
 */
public class FunctionDeclaration extends AbstractDeclaration
{
	private final boolean async;
	private final Token name;
	private final GenericParameters genericParameters; // may be null
	private final List<Parameter> parameters;
	private final TypeNode returnType; // null when omitted
	private final WhereClause whereClause; // may be null
	private final BlockStatement body; // null for a signature without a body

	public FunctionDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, boolean async, Token name,
							   GenericParameters genericParameters, List<Parameter> parameters, TypeNode returnType,
							   WhereClause whereClause, BlockStatement body)
	{
		super(span, attributes, modifiers);
		this.async = async;
		this.name = name;
		this.genericParameters = genericParameters;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
		this.whereClause = whereClause;
		this.body = body;
	}

	public boolean isAsync()
	{
		return async;
	}

	public Token getName()
	{
		return name;
	}

	public GenericParameters getGenericParameters()
	{
		return genericParameters;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public TypeNode getReturnType()
	{
		return returnType;
	}

	public WhereClause getWhereClause()
	{
		return whereClause;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(prefix());
		if (async)
		{
			sb.append("async ");
		}
		sb.append("fn ").append(name.getLexeme());
		if (genericParameters != null)
		{
			sb.append(genericParameters);
		}
		sb.append('(').append(parameters.stream().map(Object::toString).collect(Collectors.joining(", "))).append(')');
		if (returnType != null)
		{
			sb.append(" -> ").append(returnType);
		}
		if (whereClause != null)
		{
			sb.append(' ').append(whereClause);
		}
		if (body != null)
		{
			sb.append(' ').append(body);
		}
		return sb.toString();
	}
}
