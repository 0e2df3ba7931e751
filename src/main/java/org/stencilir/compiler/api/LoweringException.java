package org.stencilir.compiler.api;

/**
 * An exception thrown when lowering a stencil into its internal representation fails.
 */
public class LoweringException extends Exception {

    /**
     * @param message The detail message, usually a diagnostics summary.
     */
    public LoweringException(String message) {
        super(message);
    }
}
