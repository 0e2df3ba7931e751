package org.stencilir.compiler.sir;

import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.ast.StencilFunctionArg;

import java.util.List;
import java.util.Objects;

/**
 * A stencil function.
 * <p>
 * A function either has a single body valid on every level ({@code intervals} empty) or one body
 * per vertical interval, which lets it specialize on vertical boundaries.
 *
 * @param name The function name.
 * @param loc The source location.
 * @param bodies The bodies.
 * @param intervals The interval of each body, or empty for a single unconditional body.
 * @param arguments The parameters in declaration order.
 */
public record StencilFunction(String name, SourceLocation loc, List<Stmt> bodies, List<Interval> intervals,
                              List<StencilFunctionArg> arguments) {

    public StencilFunction {
        Objects.requireNonNull(name, "name");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
        bodies = bodies == null ? List.of() : List.copyOf(bodies);
        intervals = intervals == null ? List.of() : List.copyOf(intervals);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        if (!intervals.isEmpty() && intervals.size() != bodies.size()) {
            throw new IllegalArgumentException("Stencil function " + name + " has " + bodies.size()
                    + " bodies but " + intervals.size() + " intervals");
        }
    }

    public boolean isSpecialized() {
        return !intervals.isEmpty();
    }
}
