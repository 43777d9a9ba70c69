package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.lexer.SourceSpan;

/**
 * A raw pointer type `*T`, used at FFI boundaries.
 */
public class PointerType implements TypeNode
{
	private final SourceSpan span;
	private final TypeNode pointee;

	public PointerType(SourceSpan span, TypeNode pointee)
	{
		this.span = span;
		this.pointee = pointee;
	}

	public TypeNode getPointee()
	{
		return pointee;
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPointerType(this);
	}

	@Override
	public String toString()
	{
		return "*" + pointee;
	}
}
