package org.stencilir.compiler.iir;

import java.util.EnumSet;
import java.util.Set;

/**
 * The optimizer hints of a {@link Stencil}, persisted as a bit set.
 *
 * @param bits The raw bits. Bits outside the known flags are kept as they are.
 */
public record StencilAttributes(int bits) {

    public static final StencilAttributes NONE = new StencilAttributes(0);

    /**
     * The known attribute flags and their bits.
     */
    public enum Flag {
        NO_CODE_GEN(1),
        MERGE_STAGES(1 << 1),
        MERGE_DO_METHODS(1 << 2),
        MERGE_TEMPORARIES(1 << 3),
        USE_K_CACHES(1 << 4);

        private final int bit;

        Flag(int bit) {
            this.bit = bit;
        }

        public int bit() {
            return bit;
        }
    }

    public static StencilAttributes of(Flag... flags) {
        int bits = 0;
        for (Flag flag : flags) {
            bits |= flag.bit;
        }
        return new StencilAttributes(bits);
    }

    public boolean has(Flag flag) {
        return (bits & flag.bit) != 0;
    }

    public StencilAttributes with(Flag flag) {
        return new StencilAttributes(bits | flag.bit);
    }

    public StencilAttributes without(Flag flag) {
        return new StencilAttributes(bits & ~flag.bit);
    }

    public Set<Flag> flags() {
        Set<Flag> set = EnumSet.noneOf(Flag.class);
        for (Flag flag : Flag.values()) {
            if (has(flag)) {
                set.add(flag);
            }
        }
        return set;
    }

    @Override
    public String toString() {
        return flags().toString();
    }
}
