package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Access of a local variable or, if {@code isExternal}, of a global variable.
 *
 * @param name The variable name.
 * @param index The array index, or {@code null} for a scalar access.
 * @param isExternal Whether the variable is a global.
 * @param loc The source location (ignored by {@code equals}).
 */
public record VarAccessExpr(String name, Expr index, boolean isExternal, SourceLocation loc) implements Expr {

    public VarAccessExpr {
        Objects.requireNonNull(name, "name");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public static VarAccessExpr local(String name) {
        return new VarAccessExpr(name, null, false, SourceLocation.UNKNOWN);
    }

    public static VarAccessExpr global(String name) {
        return new VarAccessExpr(name, null, true, SourceLocation.UNKNOWN);
    }

    public Optional<Expr> arrayIndex() {
        return Optional.ofNullable(index);
    }

    @Override
    public List<AstNode> getChildren() {
        return index == null ? List.of() : List.of(index);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVarAccessExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarAccessExpr that)) return false;
        return isExternal == that.isExternal && name.equals(that.name) && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, isExternal);
    }
}
