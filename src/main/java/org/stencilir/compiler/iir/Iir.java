package org.stencilir.compiler.iir;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The root of the internal IR tree: the lowered stencils of one instantiation.
 */
public final class Iir extends IirContainer<Stencil> {

    public Iir(List<Stencil> stencils) {
        super(stencils);
    }

    public Iir() {
        this(List.of());
    }

    public Optional<Stencil> findStencil(int id) {
        return getChildren().stream().filter(s -> s.getId() == id).findFirst();
    }

    /**
     * Visits every statement-access pair of the tree in execution order.
     * @param action The action.
     */
    public void forEachStatement(Consumer<StatementAccessPair> action) {
        for (Stencil stencil : getChildren()) {
            for (MultiStage multiStage : stencil.getChildren()) {
                for (Stage stage : multiStage.getChildren()) {
                    for (DoMethod doMethod : stage.getChildren()) {
                        doMethod.getChildren().forEach(action);
                    }
                }
            }
        }
    }

    /**
     * @return The largest node ID in the tree, or {@code 0} if it is empty.
     */
    public int maxNodeId() {
        int max = 0;
        for (Stencil stencil : getChildren()) {
            max = Math.max(max, stencil.getId());
            for (MultiStage multiStage : stencil.getChildren()) {
                max = Math.max(max, multiStage.getId());
                for (Stage stage : multiStage.getChildren()) {
                    max = Math.max(max, stage.getId());
                    for (DoMethod doMethod : stage.getChildren()) {
                        max = Math.max(max, doMethod.getId());
                    }
                }
            }
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Iir that && sameChildren(that));
    }

    @Override
    public int hashCode() {
        return childrenHash();
    }

    @Override
    public String toString() {
        return "Iir" + getChildren();
    }
}
