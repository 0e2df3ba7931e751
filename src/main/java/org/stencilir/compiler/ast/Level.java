package org.stencilir.compiler.ast;

/**
 * A vertical level used as an interval bound: the symbolic {@link Special#START} or
 * {@link Special#END}, or an exact level index.
 * <p>
 * Levels are ordered {@code START < any exact level < END}.
 */
public sealed interface Level {

    /**
     * The symbolic first and last levels.
     */
    enum Special implements Level {
        START(0),
        END(1);

        private final int code;

        Special(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static Special fromCode(int code) {
            for (Special special : values()) {
                if (special.code == code) {
                    return special;
                }
            }
            throw new IllegalArgumentException("Unknown special level code " + code);
        }
    }

    /**
     * A concrete level index.
     * @param value The index.
     */
    record Exact(int value) implements Level {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    static Level start() {
        return Special.START;
    }

    static Level end() {
        return Special.END;
    }

    static Level of(int value) {
        return new Exact(value);
    }
}
