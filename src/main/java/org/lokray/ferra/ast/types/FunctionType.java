package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function type such as `fn(Int, Int) -> Bool` or `extern "C" fn(*u8) -> ()`.
 */
public class FunctionType implements TypeNode
{
	private final SourceSpan span;
	private final boolean external;
	private final String abi; // null unless an ABI string was given
	private final List<TypeNode> parameterTypes;
	private final TypeNode returnType; // null when omitted

	public FunctionType(SourceSpan span, boolean external, String abi, List<TypeNode> parameterTypes, TypeNode returnType)
	{
		this.span = span;
		this.external = external;
		this.abi = abi;
		this.parameterTypes = List.copyOf(parameterTypes);
		this.returnType = returnType;
	}

	public boolean isExternal()
	{
		return external;
	}

	public String getAbi()
	{
		return abi;
	}

	public List<TypeNode> getParameterTypes()
	{
		return parameterTypes;
	}

	public TypeNode getReturnType()
	{
		return returnType;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionType(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (external)
		{
			sb.append("extern ");
			if (abi != null)
			{
				sb.append('"').append(abi).append("\" ");
			}
		}
		sb.append("fn(").append(parameterTypes.stream().map(Object::toString).collect(Collectors.joining(", "))).append(')');
		if (returnType != null)
		{
			sb.append(" -> ").append(returnType);
		}
		return sb.toString();
	}
}
