package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A field argument of a stencil, stencil function, stencil call or boundary condition.
 *
 * @param name The field name.
 * @param loc The source location (ignored by {@code equals}).
 * @param isTemporary Whether the field is a temporary of the stencil.
 * @param fieldDimensions The user-declared legal dimensions, one flag per dimension, or empty.
 */
public record Field(String name, SourceLocation loc, boolean isTemporary, List<Integer> fieldDimensions)
        implements StencilFunctionArg {

    public Field {
        Objects.requireNonNull(name, "name");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
        fieldDimensions = fieldDimensions == null ? List.of() : List.copyOf(fieldDimensions);
    }

    /**
     * Creates a non-temporary field without declared dimensions.
     * @param name The field name.
     */
    public Field(String name) {
        this(name, SourceLocation.UNKNOWN, false, List.of());
    }

    public static Field temporary(String name) {
        return new Field(name, SourceLocation.UNKNOWN, true, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field that)) return false;
        return isTemporary == that.isTemporary
                && name.equals(that.name)
                && fieldDimensions.equals(that.fieldDimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, isTemporary, fieldDimensions);
    }
}
