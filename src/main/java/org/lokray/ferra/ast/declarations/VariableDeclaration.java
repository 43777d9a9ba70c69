package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.expressions.Expression;
import org.lokray.ferra.ast.types.TypeNode;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;

/**
 * AST node for {@code let} (immutable) and {@code var} (mutable) bindings.
 * Example: `let total: Int = a + b`
 */
public class VariableDeclaration extends AbstractDeclaration
{
	private final boolean mutable;
	private final Token name;
	private final TypeNode type; // null when inferred
	private final Expression initializer; // null when absent

	public VariableDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers,
							   boolean mutable, Token name, TypeNode type, Expression initializer)
	{
		super(span, attributes, modifiers);
		this.mutable = mutable;
		this.name = name;
		this.type = type;
		this.initializer = initializer;
	}

	public boolean isMutable()
	{
		return mutable;
	}

	public Token getName()
	{
		return name;
	}

	public TypeNode getType()
	{
		return type;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(prefix()).append(mutable ? "var " : "let ").append(name.getLexeme());
		if (type != null)
		{
			sb.append(": ").append(type);
		}
		if (initializer != null)
		{
			sb.append(" = ").append(initializer);
		}
		return sb.toString();
	}
}
