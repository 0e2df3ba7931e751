package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * A vertical region: a body executed over a vertical interval in a declared loop order.
 *
 * @param loc The source location (ignored by {@code equals}).
 * @param body The root statement of the region's AST, usually a {@link BlockStmt}.
 * @param interval The vertical interval.
 * @param loopOrder {@link LoopOrder#FORWARD} or {@link LoopOrder#BACKWARD}.
 */
public record VerticalRegion(SourceLocation loc, Stmt body, Interval interval, LoopOrder loopOrder) {

    public VerticalRegion {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(loopOrder, "loopOrder");
        if (loopOrder == LoopOrder.PARALLEL) {
            throw new IllegalArgumentException("A vertical region is declared either forward or backward");
        }
        loc = loc == null ? SourceLocation.UNKNOWN : loc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VerticalRegion that)) return false;
        return body.equals(that.body) && interval.equals(that.interval) && loopOrder == that.loopOrder;
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, interval, loopOrder);
    }
}
