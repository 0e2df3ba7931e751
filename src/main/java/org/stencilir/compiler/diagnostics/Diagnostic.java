package org.stencilir.compiler.diagnostics;

import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.SourceLocation;

/**
 * A single diagnostic message (error or warning) produced while lowering or validating IR.
 *
 * @param type The severity.
 * @param code The error code.
 * @param message The message, naming the offending ID, field or node.
 * @param location The source location, or {@link SourceLocation#UNKNOWN}.
 */
public record Diagnostic(
        Type type,
        IrErrorCode code,
        String message,
        SourceLocation location
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** A problem that makes the IR unusable. */
        ERROR,
        /** A suspicious construct that does not prevent further processing. */
        WARNING
    }

    /**
     * Creates an error diagnostic.
     * @param code The error code.
     * @param message The message.
     * @param location The source location.
     * @return The diagnostic.
     */
    public static Diagnostic error(IrErrorCode code, String message, SourceLocation location) {
        return new Diagnostic(Type.ERROR, code, message, location);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s: %s", type, code, location, message);
    }
}
