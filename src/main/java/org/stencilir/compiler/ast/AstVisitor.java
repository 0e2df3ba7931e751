package org.stencilir.compiler.ast;

/**
 * Visitor over the closed set of AST node variants. Implementations handle every statement and
 * expression kind; adding a variant breaks every visitor at compile time.
 *
 * @param <R> The result type of the visit.
 */
public interface AstVisitor<R> {

    R visitBlockStmt(BlockStmt stmt);

    R visitExprStmt(ExprStmt stmt);

    R visitReturnStmt(ReturnStmt stmt);

    R visitVarDeclStmt(VarDeclStmt stmt);

    R visitStencilCallDeclStmt(StencilCallDeclStmt stmt);

    R visitVerticalRegionDeclStmt(VerticalRegionDeclStmt stmt);

    R visitBoundaryConditionDeclStmt(BoundaryConditionDeclStmt stmt);

    R visitIfStmt(IfStmt stmt);

    R visitUnaryOperator(UnaryOperator expr);

    R visitBinaryOperator(BinaryOperator expr);

    R visitAssignmentExpr(AssignmentExpr expr);

    R visitTernaryOperator(TernaryOperator expr);

    R visitFunCallExpr(FunCallExpr expr);

    R visitStencilFunCallExpr(StencilFunCallExpr expr);

    R visitStencilFunArgExpr(StencilFunArgExpr expr);

    R visitVarAccessExpr(VarAccessExpr expr);

    R visitFieldAccessExpr(FieldAccessExpr expr);

    R visitLiteralAccessExpr(LiteralAccessExpr expr);
}
