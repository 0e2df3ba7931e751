package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A call of a stencil with field arguments. Also used as a frame of the call stack attached to
 * stencil description statements.
 *
 * @param loc The source location (ignored by {@code equals}).
 * @param callee The name of the called stencil.
 * @param arguments The fields passed to the callee.
 */
public record StencilCall(SourceLocation loc, String callee, List<Field> arguments) {

    public StencilCall {
        Objects.requireNonNull(callee, "callee");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public StencilCall(String callee, List<Field> arguments) {
        this(SourceLocation.UNKNOWN, callee, arguments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StencilCall that)) return false;
        return callee.equals(that.callee) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, arguments);
    }
}
