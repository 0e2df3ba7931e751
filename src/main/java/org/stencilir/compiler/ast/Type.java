package org.stencilir.compiler.ast;

import java.util.Objects;

/**
 * The declared type of a variable: either a custom type name or a builtin type, with optional
 * qualifiers.
 *
 * @param name The custom type name, or {@code null} for a builtin type.
 * @param builtin The builtin type, or {@code null} for a custom type.
 * @param isConst Whether the type is const qualified.
 * @param isVolatile Whether the type is volatile qualified.
 */
public record Type(String name, BuiltinType builtin, boolean isConst, boolean isVolatile) {

    /**
     * Compact constructor ensuring exactly one of {@code name} and {@code builtin} is given.
     */
    public Type {
        if ((name == null) == (builtin == null)) {
            throw new IllegalArgumentException("A type is either custom or builtin");
        }
    }

    public static Type builtin(BuiltinType builtin) {
        return new Type(null, Objects.requireNonNull(builtin), false, false);
    }

    public static Type custom(String name) {
        return new Type(Objects.requireNonNull(name), null, false, false);
    }

    public boolean isBuiltin() {
        return builtin != null;
    }

    /**
     * @return A copy of this type with the const qualifier.
     */
    public Type asConst() {
        return new Type(name, builtin, true, isVolatile);
    }
}
