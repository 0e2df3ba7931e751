package org.stencilir.compiler.iir.access;

import java.util.List;
import java.util.Objects;

/**
 * One {@link Extent} per spatial dimension.
 *
 * @param i The extent in I.
 * @param j The extent in J.
 * @param k The extent in K.
 */
public record Extents(Extent i, Extent j, Extent k) {

    public static final Extents ZERO = new Extents(Extent.ZERO, Extent.ZERO, Extent.ZERO);

    public Extents {
        Objects.requireNonNull(i, "i");
        Objects.requireNonNull(j, "j");
        Objects.requireNonNull(k, "k");
    }

    /**
     * @param offset An {i, j, k} offset.
     * @return The extents of a single access at that offset.
     */
    public static Extents at(List<Integer> offset) {
        return new Extents(Extent.at(offset.get(0)), Extent.at(offset.get(1)), Extent.at(offset.get(2)));
    }

    public static Extents at(int i, int j, int k) {
        return new Extents(Extent.at(i), Extent.at(j), Extent.at(k));
    }

    /**
     * @return The extents as an {I, J, K} list.
     */
    public List<Extent> toList() {
        return List.of(i, j, k);
    }

    public Extents merge(Extents other) {
        return new Extents(i.merge(other.i), j.merge(other.j), k.merge(other.k));
    }

    /**
     * @param offset An {i, j, k} offset.
     * @return These extents moved by the offset.
     */
    public Extents shift(List<Integer> offset) {
        return new Extents(
                new Extent(i.minus() + offset.get(0), i.plus() + offset.get(0)),
                new Extent(j.minus() + offset.get(1), j.plus() + offset.get(1)),
                new Extent(k.minus() + offset.get(2), k.plus() + offset.get(2)));
    }

    public boolean contains(Extents other) {
        return i.contains(other.i) && j.contains(other.j) && k.contains(other.k);
    }

    /**
     * @return {@code true} if the access stays in its own vertical level.
     */
    public boolean isPointwiseInK() {
        return k.equals(Extent.ZERO);
    }
}
