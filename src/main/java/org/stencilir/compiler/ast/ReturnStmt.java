package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A return statement of a stencil function.
 *
 * @param expr The returned expression.
 * @param loc The source location (ignored by {@code equals}).
 */
public record ReturnStmt(Expr expr, SourceLocation loc) implements Stmt {

    public ReturnStmt {
        Objects.requireNonNull(expr, "expr");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public ReturnStmt(Expr expr) {
        this(expr, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturnStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ReturnStmt that && expr.equals(that.expr));
    }

    @Override
    public int hashCode() {
        return Objects.hash("return", expr);
    }
}
