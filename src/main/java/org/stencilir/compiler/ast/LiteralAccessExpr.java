package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * A literal, kept in its source spelling.
 *
 * @param value The literal text, e.g. {@code "1.24324"}.
 * @param type The literal's type.
 * @param loc The source location (ignored by {@code equals}).
 */
public record LiteralAccessExpr(String value, BuiltinType type, SourceLocation loc) implements Expr {

    public LiteralAccessExpr {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public LiteralAccessExpr(String value, BuiltinType type) {
        this(value, type, SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralAccessExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LiteralAccessExpr that && value.equals(that.value) && type == that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type);
    }
}
