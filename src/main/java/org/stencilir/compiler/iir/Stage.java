package org.stencilir.compiler.iir;

import java.util.List;
import java.util.Objects;

/**
 * A horizontal-parallel unit of a {@link MultiStage}: its do-methods cover disjoint vertical
 * intervals.
 */
public final class Stage extends IirContainer<DoMethod> {

    private final int id;

    public Stage(int id, List<DoMethod> doMethods) {
        super(doMethods);
        this.id = id;
    }

    public Stage(int id) {
        this(id, List.of());
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stage that)) return false;
        return id == that.id && sameChildren(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, childrenHash());
    }

    @Override
    public String toString() {
        return "Stage#" + id;
    }
}
