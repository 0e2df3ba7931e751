package org.stencilir.compiler.iir.metadata;

import java.util.List;

/**
 * The dimensions a field is declared over.
 *
 * @param i Whether the field extends in I.
 * @param j Whether the field extends in J.
 * @param k Whether the field extends in K.
 */
public record LegalDimensions(boolean i, boolean j, boolean k) {

    public static final LegalDimensions IJK = new LegalDimensions(true, true, true);

    /**
     * Reads the flags of a user declaration.
     * @param flags One entry per dimension, non-zero meaning legal; empty means all dimensions.
     * @return The legal dimensions.
     */
    public static LegalDimensions fromFlags(List<Integer> flags) {
        if (flags.isEmpty()) {
            return IJK;
        }
        if (flags.size() != 3) {
            throw new IllegalArgumentException("Expected one flag per dimension, got " + flags);
        }
        return new LegalDimensions(flags.get(0) != 0, flags.get(1) != 0, flags.get(2) != 0);
    }

    /**
     * @return The flags as an {i, j, k} list of {@code 1}/{@code 0}.
     */
    public List<Integer> toFlags() {
        return List.of(i ? 1 : 0, j ? 1 : 0, k ? 1 : 0);
    }
}
