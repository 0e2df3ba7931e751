package org.stencilir.compiler.api;

/**
 * Thrown when serialized IR does not parse under the schema: truncated input, invalid tags,
 * type mismatches or values the model cannot represent.
 */
public class MalformedEncodingException extends Exception {

    private final IrErrorCode code;

    /**
     * Constructs a new exception with the given code and message.
     * @param code The error code.
     * @param message The detail message.
     */
    public MalformedEncodingException(IrErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a new exception with the given code, message and cause.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public MalformedEncodingException(IrErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The error code identifying the kind of problem.
     */
    public IrErrorCode code() {
        return code;
    }
}
