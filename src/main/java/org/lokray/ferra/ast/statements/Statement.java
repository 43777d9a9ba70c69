package org.lokray.ferra.ast.statements;

import org.lokray.ferra.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree.
 * Statements are units of execution that do not necessarily produce a value.
 */
public interface Statement extends ASTNode
{
}
