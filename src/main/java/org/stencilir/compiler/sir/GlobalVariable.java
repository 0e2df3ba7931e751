package org.stencilir.compiler.sir;

import org.stencilir.compiler.api.GlobalValue;

import java.util.Objects;

/**
 * A global variable declaration of the high-level IR.
 *
 * @param value The typed, possibly unset value.
 * @param isConstexpr Whether the value is a compile-time constant.
 */
public record GlobalVariable(GlobalValue value, boolean isConstexpr) {

    public GlobalVariable {
        Objects.requireNonNull(value, "value");
    }
}
