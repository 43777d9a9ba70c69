package org.lokray.ferra.formatter;

import org.lokray.ferra.ast.ASTNode;
import org.lokray.ferra.ast.ASTVisitor;
import org.lokray.ferra.ast.BlockStyle;
import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.ast.declarations.AbstractDeclaration;
import org.lokray.ferra.ast.declarations.Attribute;
import org.lokray.ferra.ast.declarations.DataClassDeclaration;
import org.lokray.ferra.ast.declarations.Declaration;
import org.lokray.ferra.ast.declarations.ExternBlock;
import org.lokray.ferra.ast.declarations.ExternFunction;
import org.lokray.ferra.ast.declarations.ExternVariable;
import org.lokray.ferra.ast.declarations.FieldDeclaration;
import org.lokray.ferra.ast.declarations.FunctionDeclaration;
import org.lokray.ferra.ast.declarations.ImportDeclaration;
import org.lokray.ferra.ast.declarations.Modifier;
import org.lokray.ferra.ast.declarations.ModuleDeclaration;
import org.lokray.ferra.ast.declarations.Parameter;
import org.lokray.ferra.ast.declarations.VariableDeclaration;
import org.lokray.ferra.ast.expressions.*;
import org.lokray.ferra.ast.macros.MacroDefinition;
import org.lokray.ferra.ast.macros.MacroRule;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.macros.TokenLeaf;
import org.lokray.ferra.ast.macros.TokenTree;
import org.lokray.ferra.ast.patterns.*;
import org.lokray.ferra.ast.statements.*;
import org.lokray.ferra.ast.types.*;
import org.lokray.ferra.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prints an AST back to Ferra source. Statement blocks use the preferred {@link BlockStyle};
 * blocks in expression position (if-expression branches, match arm bodies) and everything nested
 * inside them are printed braced on one line, so the output does not depend on layout inside
 * parentheses. Parsing the output yields a tree equal to the printed one, up to spans.
 */
public class SourcePrinter implements ASTVisitor<String>
{
	private static final String INDENT = "\t";
	private static final String ERROR_PLACEHOLDER = "/* error */";

	private final BlockStyle preferredStyle;
	private int inlineDepth = 0;

	public SourcePrinter()
	{
		this(BlockStyle.BRACE);
	}

	public SourcePrinter(BlockStyle preferredStyle)
	{
		this.preferredStyle = Objects.requireNonNull(preferredStyle, "preferredStyle");
	}

	public BlockStyle getPreferredStyle()
	{
		return preferredStyle;
	}

	/**
	 * Prints a compilation unit, one top-level statement per line.
	 */
	public String print(CompilationUnit unit)
	{
		Objects.requireNonNull(unit, "unit");
		inlineDepth = 0;
		return unit.accept(this);
	}

	/**
	 * Prints any node on its own; statements that own blocks may span several lines.
	 */
	public String print(ASTNode node)
	{
		Objects.requireNonNull(node, "node");
		inlineDepth = 0;
		return node.accept(this);
	}

	// --- Layout helpers ---

	private static String indent(String text)
	{
		StringBuilder sb = new StringBuilder();
		for (String line : text.split("\n", -1))
		{
			if (sb.length() > 0)
			{
				sb.append('\n');
			}
			if (!line.isEmpty())
			{
				sb.append(INDENT).append(line);
			}
		}
		return sb.toString();
	}

	private boolean inline()
	{
		return inlineDepth > 0;
	}

	private String join(List<? extends ASTNode> nodes, String separator)
	{
		return nodes.stream().map(node -> node.accept(this)).collect(Collectors.joining(separator));
	}

	/**
	 * Renders a statement block, including the separator from its header: {@code " { ... }"}
	 * for braces, {@code ":\n..."} for indentation.
	 */
	private String block(BlockStatement block)
	{
		return block(block, false);
	}

	private String block(BlockStatement block, boolean forceBraces)
	{
		List<String> statements = new ArrayList<>();
		for (Statement statement : block.getStatements())
		{
			statements.add(statement.accept(this));
		}
		return body(statements, forceBraces, "; ");
	}

	/**
	 * Renders the body of a block or a declaration from its already printed items.
	 */
	private String body(List<String> items, boolean forceBraces, String inlineSeparator)
	{
		if (items.isEmpty())
		{
			return " {}";
		}
		if (inline())
		{
			return " { " + String.join(inlineSeparator, items) + " }";
		}
		String lines = indent(String.join("\n", items));
		if (forceBraces || preferredStyle == BlockStyle.BRACE)
		{
			return " {\n" + lines + "\n}";
		}
		return ":\n" + lines;
	}

	/**
	 * Renders a block in expression position.
	 */
	private String expressionBlock(BlockStatement block)
	{
		inlineDepth++;
		try
		{
			return block(block, true).substring(1);
		}
		finally
		{
			inlineDepth--;
		}
	}

	/**
	 * True if {@link #block(BlockStatement)} prints the block indented rather than braced.
	 */
	private boolean printsIndented(BlockStatement block)
	{
		return !inline() && preferredStyle == BlockStyle.INDENTED && !block.getStatements().isEmpty();
	}

	private String prefix(AbstractDeclaration declaration, boolean attributesOnOwnLine)
	{
		StringBuilder sb = new StringBuilder();
		for (Attribute attribute : declaration.getAttributes())
		{
			sb.append(attribute.accept(this)).append(attributesOnOwnLine && !inline() ? "\n" : " ");
		}
		for (Modifier modifier : declaration.getModifiers())
		{
			sb.append(modifier.getKeyword()).append(' ');
		}
		return sb.toString();
	}

	private static String path(List<Token> segments)
	{
		return segments.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
	}

	private static String quote(String text)
	{
		return "\"" + LiteralExpression.escape(text, true) + "\"";
	}

	@Override
	public String visitCompilationUnit(CompilationUnit unit)
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : unit.getStatements())
		{
			sb.append(statement.accept(this)).append('\n');
		}
		return sb.toString();
	}

	// --- Declarations ---

	@Override
	public String visitVariableDeclaration(VariableDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(prefix(declaration, true));
		sb.append(declaration.isMutable() ? "var " : "let ").append(declaration.getName().getLexeme());
		if (declaration.getType() != null)
		{
			sb.append(": ").append(declaration.getType().accept(this));
		}
		if (declaration.getInitializer() != null)
		{
			sb.append(" = ").append(declaration.getInitializer().accept(this));
		}
		return sb.toString();
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(prefix(declaration, true));
		if (declaration.isAsync())
		{
			sb.append("async ");
		}
		sb.append("fn ").append(declaration.getName().getLexeme());
		if (declaration.getGenericParameters() != null)
		{
			sb.append(declaration.getGenericParameters().accept(this));
		}
		sb.append('(').append(join(declaration.getParameters(), ", ")).append(')');
		if (declaration.getReturnType() != null)
		{
			sb.append(" -> ").append(declaration.getReturnType().accept(this));
		}
		if (declaration.getWhereClause() != null)
		{
			sb.append(' ').append(declaration.getWhereClause().accept(this));
		}
		if (declaration.getBody() != null)
		{
			sb.append(block(declaration.getBody()));
		}
		return sb.toString();
	}

	@Override
	public String visitParameter(Parameter parameter)
	{
		StringBuilder sb = new StringBuilder();
		for (Attribute attribute : parameter.getAttributes())
		{
			sb.append(attribute.accept(this)).append(' ');
		}
		return sb.append(parameter.getName().getLexeme()).append(": ").append(parameter.getType().accept(this)).toString();
	}

	@Override
	public String visitDataClassDeclaration(DataClassDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(prefix(declaration, true));
		sb.append("data ").append(declaration.getName().getLexeme());
		if (declaration.getGenericParameters() != null)
		{
			sb.append(declaration.getGenericParameters().accept(this));
		}
		List<String> fields = new ArrayList<>();
		for (FieldDeclaration field : declaration.getFields())
		{
			fields.add(field.accept(this));
		}
		return sb.append(body(fields, false, ", ")).toString();
	}

	@Override
	public String visitFieldDeclaration(FieldDeclaration declaration)
	{
		return prefix(declaration, false) + declaration.getName().getLexeme() + ": " + declaration.getType().accept(this);
	}

	@Override
	public String visitExternBlock(ExternBlock block)
	{
		StringBuilder sb = new StringBuilder(prefix(block, true));
		sb.append("extern");
		if (block.getAbi() != null)
		{
			sb.append(' ').append(quote(block.getAbi()));
		}
		List<String> items = new ArrayList<>();
		for (Declaration item : block.getItems())
		{
			items.add(item.accept(this));
		}
		return sb.append(body(items, false, "; ")).toString();
	}

	@Override
	public String visitExternFunction(ExternFunction function)
	{
		StringBuilder sb = new StringBuilder(prefix(function, false));
		sb.append("fn ").append(function.getName().getLexeme());
		sb.append('(').append(join(function.getParameters(), ", ")).append(')');
		if (function.getReturnType() != null)
		{
			sb.append(" -> ").append(function.getReturnType().accept(this));
		}
		return sb.toString();
	}

	@Override
	public String visitExternVariable(ExternVariable variable)
	{
		return prefix(variable, false) + "static " + variable.getName().getLexeme() + ": " + variable.getType().accept(this);
	}

	@Override
	public String visitModuleDeclaration(ModuleDeclaration declaration)
	{
		String header = prefix(declaration, true) + "module " + path(declaration.getPath());
		return declaration.getBody() != null ? header + block(declaration.getBody()) : header;
	}

	@Override
	public String visitImportDeclaration(ImportDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(prefix(declaration, true));
		sb.append("import ").append(path(declaration.getPath()));
		if (declaration.isWildcard())
		{
			sb.append("::*");
		}
		else if (!declaration.getMembers().isEmpty())
		{
			sb.append("::{").append(declaration.getMembers().stream().map(Token::getLexeme).collect(Collectors.joining(", "))).append('}');
		}
		if (declaration.getAlias() != null)
		{
			sb.append(" as ").append(declaration.getAlias().getLexeme());
		}
		return sb.toString();
	}

	@Override
	public String visitAttribute(Attribute attribute)
	{
		if (attribute.getArguments().isEmpty())
		{
			return "#[" + attribute.getName().getLexeme() + "]";
		}
		return "#[" + attribute.getName().getLexeme() + "(" + join(attribute.getArguments(), ", ") + ")]";
	}

	@Override
	public String visitMacroDefinition(MacroDefinition definition)
	{
		StringBuilder sb = new StringBuilder(prefix(definition, true));
		sb.append("macro ").append(definition.getName().getLexeme());
		List<String> rules = new ArrayList<>();
		for (MacroRule rule : definition.getRules())
		{
			rules.add(rule.accept(this));
		}
		return sb.append(body(rules, false, "; ")).toString();
	}

	@Override
	public String visitMacroRule(MacroRule rule)
	{
		return rule.getMatcher().accept(this) + " => " + rule.getTranscriber().accept(this);
	}

	// --- Statements ---

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		if (statement.isUnsafe() || statement.isAsync())
		{
			return statement.getMarkers() + block(statement);
		}
		// A block on its own can only be opened by '{'.
		return block(statement, true).substring(1);
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		return statement.getExpression().accept(this);
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		String printed = "if " + statement.getCondition().accept(this) + block(statement.getThenBranch());
		if (statement.getElseBranch() == null)
		{
			return printed;
		}
		String separator = printsIndented(statement.getThenBranch()) ? "\n" : " ";
		if (statement.getElseBranch() instanceof IfStatement)
		{
			return printed + separator + "else " + statement.getElseBranch().accept(this);
		}
		return printed + separator + "else" + block((BlockStatement) statement.getElseBranch());
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		return "while " + statement.getCondition().accept(this) + block(statement.getBody());
	}

	@Override
	public String visitForStatement(ForStatement statement)
	{
		return "for " + statement.getVariable().getLexeme() + " in " + statement.getIterable().accept(this) + block(statement.getBody());
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		return statement.getValue() != null ? "return " + statement.getValue().accept(this) : "return";
	}

	@Override
	public String visitBreakStatement(BreakStatement statement)
	{
		return "break";
	}

	@Override
	public String visitContinueStatement(ContinueStatement statement)
	{
		return "continue";
	}

	@Override
	public String visitErrorStatement(ErrorStatement statement)
	{
		return ERROR_PLACEHOLDER;
	}

	// --- Expressions ---

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		switch (expression.getKind())
		{
			case STRING_LITERAL:
			case CHAR_LITERAL:
				return LiteralExpression.render(expression.getKind(), expression.getValue());
			default:
				// Keeps the source spelling of numbers, e.g. 0xFF or 1_000.
				return expression.getLiteralToken().getLexeme();
		}
	}

	@Override
	public String visitInterpolatedStringExpression(InterpolatedStringExpression expression)
	{
		StringBuilder sb = new StringBuilder("\"");
		List<String> fragments = expression.getFragments();
		List<Expression> expressions = expression.getExpressions();
		for (int i = 0; i < fragments.size(); i++)
		{
			sb.append(LiteralExpression.escape(fragments.get(i), true));
			if (i < expressions.size())
			{
				sb.append('{').append(expressions.get(i).accept(this)).append('}');
			}
		}
		return sb.append('"').toString();
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getName().getLexeme();
	}

	@Override
	public String visitPathExpression(PathExpression expression)
	{
		String segments = path(expression.getSegments());
		return expression.getQualifier() == null ? segments : expression.getQualifier().accept(this) + "::" + segments;
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		return expression.getLeft().accept(this) + " " + expression.getOperator().getCanonicalText() + " "
				+ expression.getRight().accept(this);
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		String operand = expression.getOperand().accept(this);
		// "- -x", not "--x"
		String separator = expression.getOperand() instanceof UnaryExpression ? " " : "";
		return expression.getOperator().getCanonicalText() + separator + operand;
	}

	@Override
	public String visitRangeExpression(RangeExpression expression)
	{
		return expression.getStart().accept(this) + (expression.isInclusive() ? " ..= " : " .. ") + expression.getEnd().accept(this);
	}

	@Override
	public String visitAssignmentExpression(AssignmentExpression expression)
	{
		return expression.getTarget().accept(this) + " " + expression.getOperator().getCanonicalText() + " "
				+ expression.getValue().accept(this);
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		return expression.getCallee().accept(this) + "(" + join(expression.getArguments(), ", ") + ")";
	}

	@Override
	public String visitGenericInstantiationExpression(GenericInstantiationExpression expression)
	{
		return expression.getTarget().accept(this) + "<" + join(expression.getTypeArguments(), ", ") + ">";
	}

	@Override
	public String visitMemberAccessExpression(MemberAccessExpression expression)
	{
		return expression.getObject().accept(this) + "." + expression.getMember().getLexeme();
	}

	@Override
	public String visitIndexExpression(IndexExpression expression)
	{
		return expression.getTarget().accept(this) + "[" + expression.getIndex().accept(this) + "]";
	}

	@Override
	public String visitAwaitExpression(AwaitExpression expression)
	{
		return expression.getOperand().accept(this) + ".await";
	}

	@Override
	public String visitTryExpression(TryExpression expression)
	{
		return expression.getOperand().accept(this) + "?";
	}

	@Override
	public String visitArrayLiteralExpression(ArrayLiteralExpression expression)
	{
		return "[" + join(expression.getElements(), ", ") + "]";
	}

	@Override
	public String visitTupleExpression(TupleExpression expression)
	{
		if (expression.getElements().size() == 1)
		{
			return "(" + expression.getElements().get(0).accept(this) + ",)";
		}
		return "(" + join(expression.getElements(), ", ") + ")";
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		return "(" + expression.getExpression().accept(this) + ")";
	}

	@Override
	public String visitBlockExpression(BlockExpression expression)
	{
		return expressionBlock(expression.getBlock());
	}

	@Override
	public String visitIfExpression(IfExpression expression)
	{
		return "if " + expression.getCondition().accept(this) + " " + expression.getThenBranch().accept(this)
				+ " else " + expression.getElseBranch().accept(this);
	}

	@Override
	public String visitMatchExpression(MatchExpression expression)
	{
		String header = "match " + expression.getScrutinee().accept(this);
		if (expression.getArms().isEmpty())
		{
			return header + " {}";
		}
		if (inline())
		{
			return header + " { " + join(expression.getArms(), ", ") + " }";
		}
		// Arms are comma separated, so the layout inside stays irrelevant.
		return header + " {\n" + indent(join(expression.getArms(), ",\n")) + "\n}";
	}

	@Override
	public String visitMatchArm(MatchArm arm)
	{
		StringBuilder sb = new StringBuilder(arm.getPattern().accept(this));
		if (arm.getGuard() != null)
		{
			sb.append(" if ").append(arm.getGuard().accept(this));
		}
		return sb.append(" => ").append(arm.getBody().accept(this)).toString();
	}

	@Override
	public String visitMacroInvocationExpression(MacroInvocationExpression expression)
	{
		return expression.getName().accept(this) + "!" + expression.getBody().accept(this);
	}

	@Override
	public String visitErrorExpression(ErrorExpression expression)
	{
		return expression.getPartial() != null ? expression.getPartial().accept(this) : ERROR_PLACEHOLDER;
	}

	// --- Types ---

	@Override
	public String visitNamedType(NamedType type)
	{
		if (type.getTypeArguments().isEmpty())
		{
			return path(type.getPath());
		}
		return path(type.getPath()) + "<" + join(type.getTypeArguments(), ", ") + ">";
	}

	@Override
	public String visitTupleType(TupleType type)
	{
		if (type.getElements().size() == 1)
		{
			return "(" + type.getElements().get(0).accept(this) + ",)";
		}
		return "(" + join(type.getElements(), ", ") + ")";
	}

	@Override
	public String visitArrayType(ArrayType type)
	{
		return "[" + type.getElementType().accept(this) + "]";
	}

	@Override
	public String visitPointerType(PointerType type)
	{
		return "*" + type.getPointee().accept(this);
	}

	@Override
	public String visitFunctionType(FunctionType type)
	{
		StringBuilder sb = new StringBuilder();
		if (type.isExternal())
		{
			sb.append("extern ");
			if (type.getAbi() != null)
			{
				sb.append(quote(type.getAbi())).append(' ');
			}
		}
		sb.append("fn(").append(join(type.getParameterTypes(), ", ")).append(')');
		if (type.getReturnType() != null)
		{
			sb.append(" -> ").append(type.getReturnType().accept(this));
		}
		return sb.toString();
	}

	@Override
	public String visitGenericParameters(GenericParameters parameters)
	{
		return "<" + join(parameters.getParameters(), ", ") + ">";
	}

	@Override
	public String visitGenericParameter(GenericParameter parameter)
	{
		StringBuilder sb = new StringBuilder(parameter.getName().getLexeme());
		if (!parameter.getBounds().isEmpty())
		{
			sb.append(": ").append(join(parameter.getBounds(), " + "));
		}
		if (parameter.getDefaultType() != null)
		{
			sb.append(" = ").append(parameter.getDefaultType().accept(this));
		}
		return sb.toString();
	}

	@Override
	public String visitWhereClause(WhereClause clause)
	{
		return "where " + join(clause.getPredicates(), ", ");
	}

	// --- Patterns ---

	@Override
	public String visitLiteralPattern(LiteralPattern pattern)
	{
		Token literal = pattern.getLiteral();
		String text;
		switch (literal.getType())
		{
			case STRING_LITERAL:
			case CHAR_LITERAL:
				text = LiteralExpression.render(literal.getType(), literal.getLiteral());
				break;
			default:
				text = literal.getLexeme();
				break;
		}
		return pattern.isNegated() ? "-" + text : text;
	}

	@Override
	public String visitIdentifierPattern(IdentifierPattern pattern)
	{
		return pattern.getName().getLexeme();
	}

	@Override
	public String visitWildcardPattern(WildcardPattern pattern)
	{
		return "_";
	}

	@Override
	public String visitRestPattern(RestPattern pattern)
	{
		return "..";
	}

	@Override
	public String visitDataClassPattern(DataClassPattern pattern)
	{
		List<String> parts = new ArrayList<>();
		for (FieldPattern field : pattern.getFields())
		{
			parts.add(field.accept(this));
		}
		if (pattern.hasRest())
		{
			parts.add("..");
		}
		if (parts.isEmpty())
		{
			return path(pattern.getPath()) + " {}";
		}
		return path(pattern.getPath()) + " { " + String.join(", ", parts) + " }";
	}

	@Override
	public String visitFieldPattern(FieldPattern pattern)
	{
		if (pattern.isShorthand())
		{
			return pattern.getName().getLexeme();
		}
		return pattern.getName().getLexeme() + ": " + pattern.getPattern().accept(this);
	}

	@Override
	public String visitRangePattern(RangePattern pattern)
	{
		return pattern.getLow().accept(this) + (pattern.isInclusive() ? "..=" : "..") + pattern.getHigh().accept(this);
	}

	@Override
	public String visitSlicePattern(SlicePattern pattern)
	{
		return "[" + join(pattern.getElements(), ", ") + "]";
	}

	@Override
	public String visitOrPattern(OrPattern pattern)
	{
		List<String> alternatives = new ArrayList<>();
		for (Pattern alternative : pattern.getAlternatives())
		{
			alternatives.add(nestedPattern(alternative));
		}
		return String.join(" | ", alternatives);
	}

	@Override
	public String visitBindingPattern(BindingPattern pattern)
	{
		return pattern.getName().getLexeme() + " @ " + nestedPattern(pattern.getPattern());
	}

	// Alternatives and binding targets are primary patterns; an or-pattern there needs parentheses.
	private String nestedPattern(Pattern pattern)
	{
		String printed = pattern.accept(this);
		return pattern instanceof OrPattern ? "(" + printed + ")" : printed;
	}

	@Override
	public String visitTuplePattern(TuplePattern pattern)
	{
		if (pattern.getElements().size() == 1)
		{
			return "(" + pattern.getElements().get(0).accept(this) + ",)";
		}
		return "(" + join(pattern.getElements(), ", ") + ")";
	}

	// --- Macro token trees ---

	@Override
	public String visitTokenLeaf(TokenLeaf leaf)
	{
		return leaf.getToken().getCanonicalText();
	}

	@Override
	public String visitTokenGroup(TokenGroup group)
	{
		StringBuilder sb = new StringBuilder(group.getDelimiter().getOpenText());
		for (TokenTree tree : group.getTrees())
		{
			sb.append(' ').append(tree.accept(this));
		}
		return sb.append(' ').append(group.getDelimiter().getCloseText()).toString();
	}
}
