package org.stencilir.compiler.iir;

import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.validation.IrValidator;

import java.util.List;
import java.util.Objects;

/**
 * One lowered stencil: its symbol table and its internal IR tree.
 * <p>
 * The factory methods hand out nodes with fresh IDs drawn from a counter owned by this
 * instantiation. The counter is not part of the wire form; it restarts after the largest node ID
 * found in the tree when an instantiation is created from existing parts.
 */
public class StencilInstantiation {

    private final StencilMetaInfo metadata;
    private final Iir iir;
    private int nextUid;

    public StencilInstantiation(StencilMetaInfo metadata, Iir iir) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.iir = Objects.requireNonNull(iir, "iir");
        this.nextUid = iir.maxNodeId() + 1;
    }

    public StencilInstantiation() {
        this(new StencilMetaInfo(), new Iir());
    }

    public StencilMetaInfo getMetadata() {
        return metadata;
    }

    public Iir getIir() {
        return iir;
    }

    /**
     * @return A node ID not yet handed out by this instantiation.
     */
    public int nextUid() {
        return nextUid++;
    }

    /**
     * Creates a stencil with a fresh ID. The caller attaches it with {@link Iir#append(Object)}.
     * @param attributes The optimizer hints.
     * @return The new, empty stencil.
     */
    public Stencil newStencil(StencilAttributes attributes) {
        return new Stencil(nextUid(), attributes, List.of());
    }

    public MultiStage newMultiStage(LoopOrder loopOrder) {
        return new MultiStage(nextUid(), loopOrder);
    }

    public Stage newStage() {
        return new Stage(nextUid());
    }

    public DoMethod newDoMethod(Interval interval) {
        return new DoMethod(nextUid(), interval);
    }

    /**
     * Checks every interval, node ID, classification, name binding and version table.
     * @throws InvariantViolationException listing all violations, if there are any.
     */
    public void validate() {
        new IrValidator().validate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StencilInstantiation that)) return false;
        return metadata.equals(that.metadata) && iir.equals(that.iir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, iir);
    }

    @Override
    public String toString() {
        return "StencilInstantiation{" + metadata.getStencilName() + ", " + iir + '}';
    }
}
