package org.lokray.ferra.ast;

import org.lokray.ferra.lexer.SourceSpan;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * All elements that form the structured representation of a Ferra program
 * implement this interface.
 * <p>
 * {@code toString()} of every node renders its structure without any source positions, so two
 * trees are equal up to span exactly when their string forms are equal.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 * This is part of the Visitor design pattern, allowing operations to be
	 * performed on the AST nodes without modifying the node classes themselves.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * @return The region of source text this node was parsed from.
	 */
	SourceSpan getSpan();
}
