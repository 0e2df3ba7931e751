package org.stencilir.compiler.iir.access;

/**
 * How far an access reaches in one dimension relative to the statement's position.
 * An access at offset {@code o} has the extent {@code (o, o)}.
 *
 * @param minus The lowest relative position reached.
 * @param plus The highest relative position reached.
 */
public record Extent(int minus, int plus) {

    public static final Extent ZERO = new Extent(0, 0);

    public static Extent at(int offset) {
        return new Extent(offset, offset);
    }

    /**
     * @param other The other extent.
     * @return The smallest extent covering both.
     */
    public Extent merge(Extent other) {
        return new Extent(Math.min(minus, other.minus), Math.max(plus, other.plus));
    }

    /**
     * @param other The other extent.
     * @return {@code true} if {@code other} lies within this extent.
     */
    public boolean contains(Extent other) {
        return minus <= other.minus && other.plus <= plus;
    }
}
