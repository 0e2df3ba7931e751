package org.stencilir.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * The offset of a field access, in one of two states.
 * <p>
 * A {@link Resolved} offset is final. A {@link Deferred} offset belongs to a field access inside a
 * stencil function whose offset depends on directional or offset parameters; it becomes resolved
 * once the function is instantiated with concrete arguments, see {@link FieldOffsetResolver}.
 */
public sealed interface FieldOffset {

    /** Marks a dimension whose offset does not depend on a parameter. */
    int UNUSED = -1;

    /**
     * @return The static {i, j, k} offset known before instantiation.
     */
    List<Integer> offset();

    /**
     * A final {i, j, k} offset.
     * @param offset The offset triple.
     */
    record Resolved(List<Integer> offset) implements FieldOffset {
        public Resolved {
            offset = triple(offset, "offset");
        }
    }

    /**
     * An offset awaiting the arguments of the enclosing stencil function.
     *
     * @param offset The static part of the offset.
     * @param argumentMap Per dimension, the index of the parameter the dimension depends on, or {@link #UNUSED}.
     * @param argumentOffset Per dimension, the offset parsed together with the parameter ({@code dir+2} gives 2).
     */
    record Deferred(List<Integer> offset, List<Integer> argumentMap, List<Integer> argumentOffset) implements FieldOffset {
        public Deferred {
            offset = triple(offset, "offset");
            argumentMap = triple(argumentMap, "argumentMap");
            argumentOffset = triple(argumentOffset, "argumentOffset");
            if (argumentMap.stream().allMatch(index -> index == UNUSED)) {
                throw new IllegalArgumentException("A deferred offset refers to at least one parameter");
            }
        }
    }

    /**
     * @return A resolved zero offset.
     */
    static FieldOffset zero() {
        return new Resolved(List.of(0, 0, 0));
    }

    static FieldOffset of(int i, int j, int k) {
        return new Resolved(List.of(i, j, k));
    }

    private static List<Integer> triple(List<Integer> values, String what) {
        Objects.requireNonNull(values, what);
        if (values.size() != 3) {
            throw new IllegalArgumentException(what + " needs one entry per dimension, got " + values);
        }
        return List.copyOf(values);
    }
}
