package org.lokray.ferra.ast.expressions;

import org.lokray.ferra.ast.ASTNode;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value.
 */
public interface Expression extends ASTNode
{
}
