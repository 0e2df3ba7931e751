package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code left op right} where {@code op} is {@code "="} or a compound assignment like {@code "+="}.
 *
 * @param left The assignment target.
 * @param op The assignment operator.
 * @param right The assigned value.
 * @param loc The source location (ignored by {@code equals}).
 */
public record AssignmentExpr(Expr left, String op, Expr right, SourceLocation loc) implements Expr {

    public AssignmentExpr {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public AssignmentExpr(Expr left, Expr right) {
        this(left, "=", right, SourceLocation.UNKNOWN);
    }

    /**
     * @return {@code true} for compound assignments, which also read their target.
     */
    public boolean isCompound() {
        return !"=".equals(op);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignmentExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignmentExpr that)) return false;
        return left.equals(that.left) && op.equals(that.op) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("assign", left, op, right);
    }
}
