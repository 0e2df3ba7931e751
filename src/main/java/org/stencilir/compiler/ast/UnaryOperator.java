package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code op operand}
 *
 * @param op The operator, e.g. {@code "-"}.
 * @param operand The operand.
 * @param loc The source location (ignored by {@code equals}).
 */
public record UnaryOperator(String op, Expr operand, SourceLocation loc) implements Expr {

    public UnaryOperator {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public UnaryOperator(String op, Expr operand) {
        this(op, operand, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOperator(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof UnaryOperator that && op.equals(that.op) && operand.equals(that.operand));
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operand);
    }
}
