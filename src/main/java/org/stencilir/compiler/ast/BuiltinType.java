package org.stencilir.compiler.ast;

/**
 * Builtin scalar types. The codes are those of the exchange format.
 */
public enum BuiltinType {
    INVALID(0),
    AUTO(1),
    BOOLEAN(2),
    INTEGER(3),
    FLOAT(4);

    private final int code;

    BuiltinType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up a type by its exchange-format code.
     * @param code The code.
     * @return The type.
     * @throws IllegalArgumentException if the code is unknown.
     */
    public static BuiltinType fromCode(int code) {
        for (BuiltinType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown builtin type code " + code);
    }
}
