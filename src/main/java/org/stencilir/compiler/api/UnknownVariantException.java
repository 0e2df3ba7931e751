package org.stencilir.compiler.api;

/**
 * Thrown when an encoded union has no branch, more than one branch, or a branch or enum code
 * outside the known set. Never defaulted to a variant.
 */
public class UnknownVariantException extends MalformedEncodingException {

    private final String unionName;

    /**
     * @param unionName The schema name of the union, e.g. {@code Stmt}.
     * @param message The detail message.
     */
    public UnknownVariantException(String unionName, String message) {
        super(IrErrorCode.UNKNOWN_VARIANT, unionName + ": " + message);
        this.unionName = unionName;
    }

    /**
     * @return The schema name of the offending union.
     */
    public String unionName() {
        return unionName;
    }
}
