package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of a local variable or array: {@code type name[dimension] op initList}.
 *
 * @param type The declared type.
 * @param name The variable name.
 * @param dimension The array length, or 0 for a scalar.
 * @param op The initialization operator, usually {@code "="}.
 * @param initList The initializer expressions, one per array element or a single one for a scalar.
 * @param loc The source location (ignored by {@code equals}).
 */
public record VarDeclStmt(Type type, String name, int dimension, String op, List<Expr> initList, SourceLocation loc)
        implements Stmt {

    public VarDeclStmt {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (dimension < 0) {
            throw new IllegalArgumentException("Negative array dimension " + dimension + " for " + name);
        }
        op = op == null ? "=" : op;
        initList = initList == null ? List.of() : List.copyOf(initList);
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    /**
     * Declares an initialized scalar.
     * @param type The type.
     * @param name The name.
     * @param init The initializer.
     */
    public VarDeclStmt(Type type, String name, Expr init) {
        this(type, name, 0, "=", List.of(init), SourceLocation.UNKNOWN);
    }

    public boolean isArray() {
        return dimension > 0;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(initList);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVarDeclStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarDeclStmt that)) return false;
        return dimension == that.dimension
                && type.equals(that.type)
                && name.equals(that.name)
                && op.equals(that.op)
                && initList.equals(that.initList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, dimension, op, initList);
    }
}
