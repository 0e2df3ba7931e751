package org.stencilir.compiler.iir;

import java.util.List;
import java.util.Objects;

/**
 * A lowered stencil: the multi-stages that replace one run of vertical regions of the user's
 * stencil.
 */
public final class Stencil extends IirContainer<MultiStage> {

    private final int id;
    private StencilAttributes attributes;

    public Stencil(int id, StencilAttributes attributes, List<MultiStage> multiStages) {
        super(multiStages);
        this.id = id;
        this.attributes = attributes == null ? StencilAttributes.NONE : attributes;
    }

    public Stencil(int id) {
        this(id, StencilAttributes.NONE, List.of());
    }

    public int getId() {
        return id;
    }

    public StencilAttributes getAttributes() {
        return attributes;
    }

    public void setAttributes(StencilAttributes attributes) {
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stencil that)) return false;
        return id == that.id && attributes.equals(that.attributes) && sameChildren(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes, childrenHash());
    }

    @Override
    public String toString() {
        return "Stencil#" + id + attributes;
    }
}
