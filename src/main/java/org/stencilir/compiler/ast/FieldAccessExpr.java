package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * Access of a field at an offset, e.g. {@code in(i+1)}.
 *
 * @param name The field name.
 * @param offset The offset, resolved or awaiting stencil function instantiation.
 * @param negateOffset Whether the parameter-dependent part of the offset is negated ({@code in(-off)}).
 * @param loc The source location (ignored by {@code equals}).
 */
public record FieldAccessExpr(String name, FieldOffset offset, boolean negateOffset, SourceLocation loc)
        implements Expr {

    public FieldAccessExpr {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(offset, "offset");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    /**
     * Creates an access at a resolved offset.
     * @param name The field name.
     * @param i The offset in I.
     * @param j The offset in J.
     * @param k The offset in K.
     * @return The access.
     */
    public static FieldAccessExpr at(String name, int i, int j, int k) {
        return new FieldAccessExpr(name, FieldOffset.of(i, j, k), false, SourceLocation.UNKNOWN);
    }

    public static FieldAccessExpr of(String name) {
        return at(name, 0, 0, 0);
    }

    public boolean isResolved() {
        return offset instanceof FieldOffset.Resolved;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFieldAccessExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldAccessExpr that)) return false;
        return negateOffset == that.negateOffset && name.equals(that.name) && offset.equals(that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, offset, negateOffset);
    }
}
