package org.lokray.ferra.ast;

import org.lokray.ferra.ast.declarations.*;
import org.lokray.ferra.ast.expressions.*;
import org.lokray.ferra.ast.macros.MacroDefinition;
import org.lokray.ferra.ast.macros.MacroRule;
import org.lokray.ferra.ast.macros.TokenGroup;
import org.lokray.ferra.ast.macros.TokenLeaf;
import org.lokray.ferra.ast.patterns.*;
import org.lokray.ferra.ast.statements.*;
import org.lokray.ferra.ast.types.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * The generic type `R` represents the return value type of the `visit` methods;
 * read-only consumers such as the source printer use `Void`.
 */
public interface ASTVisitor<R>
{
	R visitCompilationUnit(CompilationUnit unit);

	// --- Declarations ---
	R visitVariableDeclaration(VariableDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitParameter(Parameter parameter);

	R visitDataClassDeclaration(DataClassDeclaration declaration);

	R visitFieldDeclaration(FieldDeclaration declaration);

	R visitExternBlock(ExternBlock block);

	R visitExternFunction(ExternFunction function);

	R visitExternVariable(ExternVariable variable);

	R visitModuleDeclaration(ModuleDeclaration declaration);

	R visitImportDeclaration(ImportDeclaration declaration);

	R visitAttribute(Attribute attribute);

	R visitMacroDefinition(MacroDefinition definition);

	R visitMacroRule(MacroRule rule);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	R visitErrorStatement(ErrorStatement statement);

	// --- Expressions ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitInterpolatedStringExpression(InterpolatedStringExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitPathExpression(PathExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitRangeExpression(RangeExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitGenericInstantiationExpression(GenericInstantiationExpression expression);

	R visitMemberAccessExpression(MemberAccessExpression expression);

	R visitIndexExpression(IndexExpression expression);

	R visitAwaitExpression(AwaitExpression expression);

	R visitTryExpression(TryExpression expression);

	R visitArrayLiteralExpression(ArrayLiteralExpression expression);

	R visitTupleExpression(TupleExpression expression);

	R visitGroupingExpression(GroupingExpression expression);

	R visitBlockExpression(BlockExpression expression);

	R visitIfExpression(IfExpression expression);

	R visitMatchExpression(MatchExpression expression);

	R visitMatchArm(MatchArm arm);

	R visitMacroInvocationExpression(MacroInvocationExpression expression);

	R visitErrorExpression(ErrorExpression expression);

	// --- Types ---
	R visitNamedType(NamedType type);

	R visitTupleType(TupleType type);

	R visitArrayType(ArrayType type);

	R visitPointerType(PointerType type);

	R visitFunctionType(FunctionType type);

	R visitGenericParameters(GenericParameters parameters);

	R visitGenericParameter(GenericParameter parameter);

	R visitWhereClause(WhereClause clause);

	// --- Patterns ---
	R visitLiteralPattern(LiteralPattern pattern);

	R visitIdentifierPattern(IdentifierPattern pattern);

	R visitWildcardPattern(WildcardPattern pattern);

	R visitRestPattern(RestPattern pattern);

	R visitDataClassPattern(DataClassPattern pattern);

	R visitFieldPattern(FieldPattern pattern);

	R visitRangePattern(RangePattern pattern);

	R visitSlicePattern(SlicePattern pattern);

	R visitOrPattern(OrPattern pattern);

	R visitBindingPattern(BindingPattern pattern);

	R visitTuplePattern(TuplePattern pattern);

	// --- Macro token trees ---
	R visitTokenLeaf(TokenLeaf leaf);

	R visitTokenGroup(TokenGroup group);
}
