package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * A directional parameter of a stencil function (e.g. {@code dir}, bound to {@code i} at the call).
 *
 * @param name The parameter name.
 * @param loc The source location (ignored by {@code equals}).
 */
public record Direction(String name, SourceLocation loc) implements StencilFunctionArg {

    public Direction {
        Objects.requireNonNull(name, "name");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Direction that && name.equals(that.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
