package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A statement wrapping an expression.
 *
 * @param expr The expression.
 * @param loc The source location (ignored by {@code equals}).
 */
public record ExprStmt(Expr expr, SourceLocation loc) implements Stmt {

    public ExprStmt {
        Objects.requireNonNull(expr, "expr");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public ExprStmt(Expr expr) {
        this(expr, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExprStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExprStmt that && expr.equals(that.expr));
    }

    @Override
    public int hashCode() {
        return Objects.hash("expr-stmt", expr);
    }
}
