package org.lokray.ferra.ast.macros;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.declarations.AbstractDeclaration;
import org.lokray.ferra.ast.declarations.Attribute;
import org.lokray.ferra.ast.declarations.Modifier;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;

/**
 * AST node for {@code macro name { rules }}. Only the syntax of the rules is recorded.
 */
public class MacroDefinition extends AbstractDeclaration
{
	private final Token name;
	private final List<MacroRule> rules;

	public MacroDefinition(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, Token name, List<MacroRule> rules)
	{
		super(span, attributes, modifiers);
		this.name = name;
		this.rules = List.copyOf(rules);
	}

	public Token getName()
	{
		return name;
	}

	public List<MacroRule> getRules()
	{
		return rules;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMacroDefinition(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(prefix()).append("macro ").append(name.getLexeme()).append(" { ");
		for (MacroRule rule : rules)
		{
			sb.append(rule).append("; ");
		}
		return sb.append('}').toString();
	}
}
