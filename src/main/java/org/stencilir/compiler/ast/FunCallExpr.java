package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call of a regular (math) function: {@code callee(arg0, ..., argN)}.
 *
 * @param callee The function name.
 * @param arguments The arguments.
 * @param loc The source location (ignored by {@code equals}).
 */
public record FunCallExpr(String callee, List<Expr> arguments, SourceLocation loc) implements Expr {

    public FunCallExpr {
        Objects.requireNonNull(callee, "callee");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public FunCallExpr(String callee, List<Expr> arguments) {
        this(callee, arguments, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunCallExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o
                || (o instanceof FunCallExpr that && callee.equals(that.callee) && arguments.equals(that.arguments));
    }

    @Override
    public int hashCode() {
        return Objects.hash("fun-call", callee, arguments);
    }
}
