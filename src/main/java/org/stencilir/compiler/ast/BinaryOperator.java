package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code left op right}
 *
 * @param left The left operand.
 * @param op The operator, e.g. {@code "+"}.
 * @param right The right operand.
 * @param loc The source location (ignored by {@code equals}).
 */
public record BinaryOperator(Expr left, String op, Expr right, SourceLocation loc) implements Expr {

    public BinaryOperator {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public BinaryOperator(Expr left, String op, Expr right) {
        this(left, op, right, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOperator(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOperator that)) return false;
        return left.equals(that.left) && op.equals(that.op) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("binary", left, op, right);
    }
}
