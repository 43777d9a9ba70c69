package org.lokray.ferra.ast.patterns;

import org.lokray.ferra.ast.ASTNode;

/**
 * Base interface for the patterns of match arms.
 */
public interface Pattern extends ASTNode
{
}
