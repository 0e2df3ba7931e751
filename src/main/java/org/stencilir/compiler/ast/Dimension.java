package org.stencilir.compiler.ast;

/**
 * Spatial dimensions. {@code INVALID} marks a dimension that is only known once a stencil function
 * is instantiated.
 */
public enum Dimension {
    I(0),
    J(1),
    K(2),
    INVALID(3);

    private final int code;

    Dimension(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return The index of this dimension in an offset or extent triple.
     * @throws IllegalStateException for {@code INVALID}.
     */
    public int index() {
        if (this == INVALID) {
            throw new IllegalStateException("INVALID has no index");
        }
        return code;
    }

    /**
     * Looks up a dimension by its exchange-format code.
     * @param code The code.
     * @return The dimension.
     * @throws IllegalArgumentException if the code is unknown.
     */
    public static Dimension fromCode(int code) {
        for (Dimension dimension : values()) {
            if (dimension.code == code) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown dimension code " + code);
    }
}
