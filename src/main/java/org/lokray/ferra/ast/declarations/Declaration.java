package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.statements.Statement;

import java.util.List;
import java.util.Set;

/**
 * A statement that introduces a named item. Declarations may be prefixed by attributes and modifiers.
 */
public interface Declaration extends Statement
{
	List<Attribute> getAttributes();

	Set<Modifier> getModifiers();
}
