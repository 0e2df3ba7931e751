package org.stencilir.compiler.ast;

/**
 * Declared vertical execution order.
 * <p>
 * {@code FORWARD} follows increasing vertical index, {@code BACKWARD} decreasing index, and
 * {@code PARALLEL} asserts that no vertical ordering dependency exists. The codes are those of
 * the exchange format; code 2 is unassigned.
 */
public enum LoopOrder {
    FORWARD(0),
    BACKWARD(1),
    PARALLEL(3);

    private final int code;

    LoopOrder(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up a loop order by its exchange-format code.
     * @param code The code.
     * @return The loop order.
     * @throws IllegalArgumentException if the code is unknown, including the unassigned code 2.
     */
    public static LoopOrder fromCode(int code) {
        for (LoopOrder order : values()) {
            if (order.code == code) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unknown loop order code " + code);
    }
}
