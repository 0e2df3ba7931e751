package org.stencilir.compiler.ast;

/**
 * An expression of the stencil AST.
 */
public sealed interface Expr extends AstNode permits UnaryOperator, BinaryOperator, AssignmentExpr,
        TernaryOperator, FunCallExpr, StencilFunCallExpr, StencilFunArgExpr, VarAccessExpr,
        FieldAccessExpr, LiteralAccessExpr {
}
