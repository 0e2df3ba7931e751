package org.stencilir.compiler.ast;

/**
 * A statement of the stencil AST.
 */
public sealed interface Stmt extends AstNode permits BlockStmt, ExprStmt, ReturnStmt, VarDeclStmt,
        StencilCallDeclStmt, VerticalRegionDeclStmt, BoundaryConditionDeclStmt, IfStmt {
}
