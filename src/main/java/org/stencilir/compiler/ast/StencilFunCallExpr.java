package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call of a stencil function: {@code callee(arg0, ..., argN)}. Arguments are field accesses,
 * {@link StencilFunArgExpr}s for directional and offset parameters, or nested stencil function calls.
 *
 * @param callee The stencil function name.
 * @param arguments The arguments, in parameter order.
 * @param loc The source location (ignored by {@code equals}).
 */
public record StencilFunCallExpr(String callee, List<Expr> arguments, SourceLocation loc) implements Expr {

    public StencilFunCallExpr {
        Objects.requireNonNull(callee, "callee");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public StencilFunCallExpr(String callee, List<Expr> arguments) {
        this(callee, arguments, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStencilFunCallExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || (o instanceof StencilFunCallExpr that && callee.equals(that.callee) && arguments.equals(that.arguments));
    }

    @Override
    public int hashCode() {
        return Objects.hash("stencil-fun-call", callee, arguments);
    }
}
