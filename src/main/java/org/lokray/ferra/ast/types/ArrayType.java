package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * `[T]`
 */
public class ArrayType implements TypeNode
{
	private final SourceSpan span;
	private final TypeNode elementType;

	public ArrayType(SourceSpan span, TypeNode elementType)
	{
		this.span = span;
		this.elementType = elementType;
	}

	public TypeNode getElementType()
	{
		return elementType;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayType(this);
	}

	@Override
	public String toString()
	{
		return "[" + elementType + "]";
	}
}
