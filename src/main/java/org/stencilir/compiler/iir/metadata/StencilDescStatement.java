package org.stencilir.compiler.iir.metadata;

import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.Stmt;

import java.util.List;
import java.util.Objects;

/**
 * A top-level statement of the stencil's control flow, with the chain of stencil calls it was
 * inlined from.
 *
 * @param statement The statement.
 * @param stackTrace The enclosing stencil calls, outermost first; empty for the stencil's own statements.
 */
public record StencilDescStatement(Stmt statement, List<StencilCall> stackTrace) {

    public StencilDescStatement {
        Objects.requireNonNull(statement, "statement");
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
    }

    public StencilDescStatement(Stmt statement) {
        this(statement, List.of());
    }
}
