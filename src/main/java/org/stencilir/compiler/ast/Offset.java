package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * An offset parameter of a stencil function (e.g. {@code off}, bound to {@code i+1} at the call).
 *
 * @param name The parameter name.
 * @param loc The source location (ignored by {@code equals}).
 */
public record Offset(String name, SourceLocation loc) implements StencilFunctionArg {

    public Offset {
        Objects.requireNonNull(name, "name");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Offset that && name.equals(that.name));
    }

    @Override
    public int hashCode() {
        return Objects.hash("offset", name);
    }
}
