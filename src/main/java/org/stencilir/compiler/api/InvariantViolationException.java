package org.stencilir.compiler.api;

import org.stencilir.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a structurally valid object violates a domain invariant, e.g. an inverted interval
 * or a re-parented version ID. Carries every violation found.
 */
public class InvariantViolationException extends RuntimeException {

    private final List<Diagnostic> violations;

    /**
     * Creates an exception for a single violation.
     * @param code The error code.
     * @param message The detail message.
     */
    public InvariantViolationException(IrErrorCode code, String message) {
        this(List.of(Diagnostic.error(code, message, SourceLocation.UNKNOWN)));
    }

    /**
     * Creates an exception for a list of violations.
     * @param violations The violations, never empty.
     */
    public InvariantViolationException(List<Diagnostic> violations) {
        super(violations.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return All violations, in the order they were found.
     */
    public List<Diagnostic> violations() {
        return violations;
    }

    /**
     * @return The error code of the first violation.
     */
    public IrErrorCode code() {
        return violations.get(0).code();
    }
}
