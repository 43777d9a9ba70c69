package org.lokray.ferra.parser;

import org.lokray.ferra.ast.ASTNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The allocation log of one parse. Every AST node is registered here when it is built, so a
 * discarded trial parse can drop the nodes it created with {@link #reset(int)}.
 */
public class AstArena
{
	private final List<ASTNode> nodes = new ArrayList<>();

	public <T extends ASTNode> T alloc(T node)
	{
		nodes.add(node);
		return node;
	}

	public int mark()
	{
		return nodes.size();
	}

	/**
	 * Discards every node allocated after the given mark.
	 */
	public void reset(int mark)
	{
		if (mark < 0 || mark > nodes.size())
		{
			throw new IllegalArgumentException("Invalid arena mark " + mark + " (size " + nodes.size() + ")");
		}
		nodes.subList(mark, nodes.size()).clear();
	}

	/**
	 * @return The number of live nodes.
	 */
	public int size()
	{
		return nodes.size();
	}

	public List<ASTNode> getNodes()
	{
		return Collections.unmodifiableList(nodes);
	}
}
