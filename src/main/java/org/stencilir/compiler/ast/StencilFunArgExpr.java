package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * A directional or offset argument of a stencil function call, e.g. {@code i} or {@code i+1}.
 * <p>
 * Inside a nested call the dimension may be unknown ({@link Dimension#INVALID}) and refer to a
 * parameter of the enclosing stencil function through {@code argumentIndex}; for
 * {@code foo(storage a, dimension dir) { bar(dir+1, a); }} the argument {@code dir+1} has
 * dimension {@code INVALID}, offset 1 and argument index 1.
 *
 * @param dimension The dimension, or {@code INVALID} if it depends on an enclosing parameter.
 * @param offset The offset added to the dimension.
 * @param argumentIndex The index of the enclosing function's parameter, or -1 if unused.
 * @param loc The source location (ignored by {@code equals}).
 */
public record StencilFunArgExpr(Dimension dimension, int offset, int argumentIndex, SourceLocation loc)
        implements Expr {

    public StencilFunArgExpr {
        Objects.requireNonNull(dimension, "dimension");
        if (argumentIndex < -1) {
            throw new IllegalArgumentException("Argument index " + argumentIndex + " is neither -1 nor a parameter index");
        }
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    /**
     * Creates a concrete argument such as {@code j-1}.
     * @param dimension The dimension.
     * @param offset The offset.
     * @return The argument.
     */
    public static StencilFunArgExpr of(Dimension dimension, int offset) {
        return new StencilFunArgExpr(dimension, offset, -1, SourceLocation.UNKNOWN);
    }

    /**
     * @return {@code true} if the argument depends on a parameter of the enclosing stencil function.
     */
    public boolean isDeferred() {
        return argumentIndex != -1;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStencilFunArgExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StencilFunArgExpr that)) return false;
        return offset == that.offset && argumentIndex == that.argumentIndex && dimension == that.dimension;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, offset, argumentIndex);
    }
}
