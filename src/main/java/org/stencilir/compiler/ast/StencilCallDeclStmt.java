package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * Declaration of a stencil call in the control flow of a stencil.
 *
 * @param call The call.
 * @param loc The source location (ignored by {@code equals}).
 */
public record StencilCallDeclStmt(StencilCall call, SourceLocation loc) implements Stmt {

    public StencilCallDeclStmt {
        Objects.requireNonNull(call, "call");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public StencilCallDeclStmt(StencilCall call) {
        this(call, SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStencilCallDeclStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StencilCallDeclStmt that && call.equals(that.call));
    }

    @Override
    public int hashCode() {
        return Objects.hash("stencil-call", call);
    }
}
