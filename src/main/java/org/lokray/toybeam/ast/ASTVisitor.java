package org.lokray.toybeam.ast;

import org.lokray.toybeam.ast.expressions.*;
import org.lokray.toybeam.ast.items.EnumDeclaration;
import org.lokray.toybeam.ast.items.FunctionDeclaration;
import org.lokray.toybeam.ast.items.StructDeclaration;
import org.lokray.toybeam.ast.statements.ExpressionStatement;
import org.lokray.toybeam.ast.statements.LetStatement;
import org.lokray.toybeam.exception.CompileException;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to exactly one node class, so a new node kind
 * cannot be added without every consumer handling it.
 * Every visit may abort compilation with the first error it finds.
 */
public interface ASTVisitor<R>
{
	// --- Items ---
	R visitModule(ModuleDeclaration module) throws CompileException;

	R visitFunctionDeclaration(FunctionDeclaration declaration) throws CompileException;

	R visitStructDeclaration(StructDeclaration declaration) throws CompileException;

	R visitEnumDeclaration(EnumDeclaration declaration) throws CompileException;

	// --- Statements ---
	R visitLetStatement(LetStatement statement) throws CompileException;

	R visitExpressionStatement(ExpressionStatement statement) throws CompileException;

	// --- Expressions ---
	R visitIdentifierExpression(IdentifierExpression expression) throws CompileException;

	R visitLiteralExpression(LiteralExpression expression) throws CompileException;

	R visitBinaryExpression(BinaryExpression expression) throws CompileException;

	R visitUnaryExpression(UnaryExpression expression) throws CompileException;

	R visitCallExpression(CallExpression expression) throws CompileException;

	R visitMethodCallExpression(MethodCallExpression expression) throws CompileException;

	R visitFieldAccessExpression(FieldAccessExpression expression) throws CompileException;

	R visitIndexExpression(IndexExpression expression) throws CompileException;

	R visitIfExpression(IfExpression expression) throws CompileException;

	R visitMatchExpression(MatchExpression expression) throws CompileException;

	R visitBlockExpression(BlockExpression expression) throws CompileException;

	R visitTupleExpression(TupleExpression expression) throws CompileException;

	R visitListExpression(ListExpression expression) throws CompileException;

	R visitStructExpression(StructExpression expression) throws CompileException;

	R visitPathExpression(PathExpression expression) throws CompileException;

	R visitSpawnExpression(SpawnExpression expression) throws CompileException;

	R visitSendExpression(SendExpression expression) throws CompileException;

	R visitReceiveExpression(ReceiveExpression expression) throws CompileException;

	R visitReturnExpression(ReturnExpression expression) throws CompileException;

	R visitBitstringExpression(BitstringExpression expression) throws CompileException;

	R visitGroupingExpression(GroupingExpression expression) throws CompileException;
}
