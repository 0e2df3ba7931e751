package org.stencilir.compiler.api;

/**
 * Typed compile-time value of a global variable.
 * <p>
 * Every variant carries an explicit {@code isSet} flag: a global declared without a value must stay
 * distinguishable from one set to the zero value of its type. An unset value always holds the zero
 * value so that equality only depends on the kind.
 */
public sealed interface GlobalValue permits GlobalValue.BoolValue, GlobalValue.IntValue, GlobalValue.DoubleValue {

    /**
     * The value kinds. The codes are those of the exchange format.
     */
    enum Kind {
        BOOLEAN(0),
        INTEGER(1),
        DOUBLE(2);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static Kind fromCode(int code) {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown global value kind " + code);
        }
    }

    Kind kind();

    boolean isSet();

    /**
     * @return The value widened to a double ({@code 1.0}/{@code 0.0} for booleans).
     */
    double asDouble();

    /**
     * A boolean global.
     * @param isSet Whether a value was given.
     * @param value The value, {@code false} when unset.
     */
    record BoolValue(boolean isSet, boolean value) implements GlobalValue {
        public BoolValue {
            if (!isSet) {
                value = false;
            }
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public double asDouble() {
            return value ? 1.0 : 0.0;
        }
    }

    /**
     * An integer global.
     * @param isSet Whether a value was given.
     * @param value The value, {@code 0} when unset.
     */
    record IntValue(boolean isSet, int value) implements GlobalValue {
        public IntValue {
            if (!isSet) {
                value = 0;
            }
        }

        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public double asDouble() {
            return value;
        }
    }

    /**
     * A floating-point global.
     * @param isSet Whether a value was given.
     * @param value The value, {@code 0.0} when unset.
     */
    record DoubleValue(boolean isSet, double value) implements GlobalValue {
        public DoubleValue {
            if (!isSet) {
                value = 0.0;
            }
        }

        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }

        @Override
        public double asDouble() {
            return value;
        }
    }

    static GlobalValue ofBoolean(boolean value) {
        return new BoolValue(true, value);
    }

    static GlobalValue ofInteger(int value) {
        return new IntValue(true, value);
    }

    static GlobalValue ofDouble(double value) {
        return new DoubleValue(true, value);
    }

    /**
     * Creates a declared-but-unset value of the given kind.
     * @param kind The kind of the global.
     * @return The unset value.
     */
    static GlobalValue unset(Kind kind) {
        return switch (kind) {
            case BOOLEAN -> new BoolValue(false, false);
            case INTEGER -> new IntValue(false, 0);
            case DOUBLE -> new DoubleValue(false, 0.0);
        };
    }
}
