package org.stencilir.compiler.iir;

import org.stencilir.compiler.ast.LoopOrder;

import java.util.List;
import java.util.Objects;

/**
 * A sequence of {@link Stage}s executed with one vertical loop order.
 */
public final class MultiStage extends IirContainer<Stage> {

    private final int id;
    private LoopOrder loopOrder;

    public MultiStage(int id, LoopOrder loopOrder, List<Stage> stages) {
        super(stages);
        this.id = id;
        this.loopOrder = Objects.requireNonNull(loopOrder, "loopOrder");
    }

    public MultiStage(int id, LoopOrder loopOrder) {
        this(id, loopOrder, List.of());
    }

    public int getId() {
        return id;
    }

    public LoopOrder getLoopOrder() {
        return loopOrder;
    }

    public void setLoopOrder(LoopOrder loopOrder) {
        this.loopOrder = Objects.requireNonNull(loopOrder, "loopOrder");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MultiStage that)) return false;
        return id == that.id && loopOrder == that.loopOrder && sameChildren(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, loopOrder, childrenHash());
    }

    @Override
    public String toString() {
        return "MultiStage#" + id + "(" + loopOrder + ")";
    }
}
