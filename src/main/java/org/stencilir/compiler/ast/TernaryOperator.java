package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code cond ? left : right}
 *
 * @param cond The condition.
 * @param left The value if the condition holds.
 * @param right The value otherwise.
 * @param loc The source location (ignored by {@code equals}).
 */
public record TernaryOperator(Expr cond, Expr left, Expr right, SourceLocation loc) implements Expr {

    public TernaryOperator {
        Objects.requireNonNull(cond, "cond");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public TernaryOperator(Expr cond, Expr left, Expr right) {
        this(cond, left, right, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(cond, left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTernaryOperator(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TernaryOperator that)) return false;
        return cond.equals(that.cond) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cond, left, right);
    }
}
