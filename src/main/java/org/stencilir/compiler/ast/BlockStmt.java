package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * A block of statements executed in order.
 *
 * @param statements The statements.
 * @param loc The source location (ignored by {@code equals}).
 */
public record BlockStmt(List<Stmt> statements, SourceLocation loc) implements Stmt {

    public BlockStmt {
        statements = statements == null ? List.of() : List.copyOf(statements);
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public BlockStmt(List<Stmt> statements) {
        this(statements, SourceLocation.UNKNOWN);
    }

    public static BlockStmt of(Stmt... statements) {
        return new BlockStmt(List.of(statements));
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlockStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof BlockStmt that && statements.equals(that.statements));
    }

    @Override
    public int hashCode() {
        return statements.hashCode();
    }
}
