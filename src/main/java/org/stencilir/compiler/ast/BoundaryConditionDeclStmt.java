package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of a boundary condition: a functor applied to a list of fields.
 *
 * @param functor The name of the boundary condition functor.
 * @param fields The fields the functor is applied to.
 * @param loc The source location (ignored by {@code equals}).
 */
public record BoundaryConditionDeclStmt(String functor, List<Field> fields, SourceLocation loc) implements Stmt {

    public BoundaryConditionDeclStmt {
        Objects.requireNonNull(functor, "functor");
        fields = fields == null ? List.of() : List.copyOf(fields);
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public BoundaryConditionDeclStmt(String functor, List<Field> fields) {
        this(functor, fields, SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBoundaryConditionDeclStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundaryConditionDeclStmt that)) return false;
        return functor.equals(that.functor) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functor, fields);
    }
}
