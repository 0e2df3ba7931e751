package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of a vertical region in the body of a stencil.
 *
 * @param region The vertical region.
 * @param loc The source location (ignored by {@code equals}).
 */
public record VerticalRegionDeclStmt(VerticalRegion region, SourceLocation loc) implements Stmt {

    public VerticalRegionDeclStmt {
        Objects.requireNonNull(region, "region");
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    public VerticalRegionDeclStmt(VerticalRegion region) {
        this(region, SourceLocation.UNKNOWN);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(region.body());
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVerticalRegionDeclStmt(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof VerticalRegionDeclStmt that && region.equals(that.region));
    }

    @Override
    public int hashCode() {
        return Objects.hash("vertical-region", region);
    }
}
