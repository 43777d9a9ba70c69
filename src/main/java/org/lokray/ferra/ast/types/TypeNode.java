package org.lokray.ferra.ast.types;

import org.lokray.ferra.ast.ASTNode;

/**
 * Base interface for type annotations as written in source.
 * These are syntax only; resolving them to semantic types happens downstream.
 */
public interface TypeNode extends ASTNode
{
}
