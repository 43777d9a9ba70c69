package org.lokray.ferra.ast.macros;

import org.lokray.ferra.ast.ASTNode;

/**
 * An unexpanded macro body: either a single token or a delimited group of token trees.
 */
public interface TokenTree extends ASTNode
{
}
