package org.stencilir.compiler.sir;

import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.Stmt;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A user stencil: its body AST and the fields it operates on.
 *
 * @param name The stencil name.
 * @param loc The source location.
 * @param body The root statement of the body, usually a {@link BlockStmt}.
 * @param fields The fields, API fields and temporaries in declaration order.
 */
public record Stencil(String name, SourceLocation loc, Stmt body, List<Field> fields) {

    public Stencil {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * @param fieldName The field name.
     * @return The field with that name, if declared.
     */
    public Optional<Field> findField(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }
}
