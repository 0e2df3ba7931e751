package org.stencilir.compiler.api;

import java.util.NoSuchElementException;

/**
 * Thrown when an AccessID, name or stencil is absent from the active tables. Callers usually treat
 * it as "not yet assigned" and create a fresh entry.
 */
public class LookupFailureException extends NoSuchElementException {

    private final IrErrorCode code;

    /**
     * @param code The error code.
     * @param message The detail message naming the missing key.
     */
    public LookupFailureException(IrErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @return The error code.
     */
    public IrErrorCode code() {
        return code;
    }
}
