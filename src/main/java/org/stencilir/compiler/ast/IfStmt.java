package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An if/then/else statement.
 *
 * @param condStmt The condition, always an {@link ExprStmt}.
 * @param thenStmt The then part.
 * @param elseStmt The else part, or {@code null} if absent.
 * @param loc The source location (ignored by {@code equals}).
 */
public record IfStmt(Stmt condStmt, Stmt thenStmt, Stmt elseStmt, SourceLocation loc) implements Stmt {

    public IfStmt {
        Objects.requireNonNull(condStmt, "condStmt");
        Objects.requireNonNull(thenStmt, "thenStmt");
        if (!(condStmt instanceof ExprStmt)) {
            throw new IllegalArgumentException("The condition of an if statement is an expression statement");
        }
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public IfStmt(Expr condition, Stmt thenStmt, Stmt elseStmt) {
        this(new ExprStmt(condition), thenStmt, elseStmt, SourceLocation.UNKNOWN);
    }

    /**
     * @return The condition expression.
     */
    public Expr condition() {
        return ((ExprStmt) condStmt).expr();
    }

    public Optional<Stmt> elsePart() {
        return Optional.ofNullable(elseStmt);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(3);
        children.add(condStmt);
        children.add(thenStmt);
        if (elseStmt != null) {
            children.add(elseStmt);
        }
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IfStmt that)) return false;
        return condStmt.equals(that.condStmt)
                && thenStmt.equals(that.thenStmt)
                && Objects.equals(elseStmt, that.elseStmt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condStmt, thenStmt, elseStmt);
    }
}
