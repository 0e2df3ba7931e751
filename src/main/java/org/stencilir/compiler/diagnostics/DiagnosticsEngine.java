package org.stencilir.compiler.diagnostics;

import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics during lowering and validation.
 * <p>
 * This decouples error reporting from the logic that discovers the problems, so that a single
 * pass can report every violation instead of stopping at the first one.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param location The source location of the offending node.
     */
    public void reportError(IrErrorCode code, String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, location));
    }

    /**
     * Reports an error without a source location.
     *
     * @param code    The error code.
     * @param message The error message.
     */
    public void reportError(IrErrorCode code, String message) {
        reportError(code, message, SourceLocation.UNKNOWN);
    }

    /**
     * Reports a warning.
     *
     * @param code     The code of the suspicious condition.
     * @param message  The warning message.
     * @param location The source location.
     */
    public void reportWarning(IrErrorCode code, String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, location));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the reported errors, without warnings.
     *
     * @return An unmodifiable list of errors.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
