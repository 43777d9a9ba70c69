package org.lokray.ferra.ast.declarations;

import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.statements.BlockStatement;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST node for {@code module a::b}, optionally with an inline body.
 */
public class ModuleDeclaration extends AbstractDeclaration
{
	private final List<Token> path;
	private final BlockStatement body; // null for a file-level module header

	public ModuleDeclaration(SourceSpan span, List<Attribute> attributes, Set<Modifier> modifiers, List<Token> path, BlockStatement body)
	{
		super(span, attributes, modifiers);
		this.path = List.copyOf(path);
		this.body = body;
	}

	public List<Token> getPath()
	{
		return path;
	}

	public String getQualifiedName()
	{
		return path.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitModuleDeclaration(this);
	}

	@Override
	public String toString()
	{
		return prefix() + "module " + getQualifiedName() + (body != null ? " " + body : "");
	}
}
