package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.lexer.SourceSpan;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Holds the span, attributes and modifiers shared by every declaration node.
 */
public abstract class AbstractDeclaration implements Declaration
{
	private final SourceSpan span;
	private final List<Attribute> attributes;
	private final Set<Modifier> modifiers;

	protected AbstractDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers)
	{
		this.span = span;
		this.attributes = List.copyOf(attributes);
		this.modifiers = modifiers.isEmpty()
				? Collections.emptySet()
				: Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
	}

	@Override
	public SourceSpan getSpan()
	{
		return span;
	}

	@Override
	public List<Attribute> getAttributes()
	{
		return attributes;
	}

	@Override
	public Set<Modifier> getModifiers()
	{
		return modifiers;
	}

	/**
	 * Attributes and modifiers as they prefix the declaration, e.g. {@code "#[inline] pub "}.
	 */
	protected String prefix()
	{
		StringBuilder sb = new StringBuilder();
		for (Attribute attribute : attributes)
		{
			sb.append(attribute).append(' ');
		}
		for (Modifier modifier : modifiers)
		{
			sb.append(modifier.getKeyword()).append(' ');
		}
		return sb.toString();
	}
}
