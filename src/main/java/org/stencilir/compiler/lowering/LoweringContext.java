package org.stencilir.compiler.lowering;

import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.StencilFunction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Mutable state of one lowering run: the instantiation under construction, the high-level IR it
 * comes from, the diagnostics, and the scopes of the local variables declared so far.
 */
public final class LoweringContext {

    private final StencilInstantiation instantiation;
    private final Sir sir;
    private final DiagnosticsEngine diagnostics;
    private final Deque<Map<String, Integer>> localScopes = new ArrayDeque<>();

    /**
     * @param instantiation The instantiation to fill.
     * @param sir The high-level IR being lowered.
     * @param diagnostics Receives the problems found.
     */
    public LoweringContext(StencilInstantiation instantiation, Sir sir, DiagnosticsEngine diagnostics) {
        this.instantiation = instantiation;
        this.sir = sir;
        this.diagnostics = diagnostics;
    }

    public StencilInstantiation instantiation() {
        return instantiation;
    }

    public StencilMetaInfo metadata() {
        return instantiation.getMetadata();
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public Optional<StencilFunction> findStencilFunction(String name) {
        return sir.findStencilFunction(name);
    }

    /** Opens a scope for local variable declarations. */
    public void enterScope() {
        localScopes.push(new HashMap<>());
    }

    /** Closes the innermost scope. */
    public void leaveScope() {
        localScopes.pop();
    }

    /**
     * Declares a local variable in the innermost scope. The variable's metadata name is its source
     * name, suffixed with {@code _<n>} if the name is already bound in this instantiation.
     *
     * @param name The source name.
     * @return The variable's AccessID.
     */
    public int declareLocal(String name) {
        StencilMetaInfo metadata = metadata();
        String unique = name;
        for (int n = 1; metadata.hasName(unique); n++) {
            unique = name + "_" + n;
        }
        int id = metadata.registerVariable(unique);
        if (localScopes.isEmpty()) {
            enterScope();
        }
        localScopes.peek().put(name, id);
        return id;
    }

    /**
     * Resolves a local variable, innermost scope first.
     * @param name The source name.
     * @param loc Where the variable is used, for the diagnostic.
     * @return The AccessID, or empty if undeclared (an error is reported).
     */
    public OptionalInt resolveLocal(String name, SourceLocation loc) {
        for (Map<String, Integer> scope : localScopes) {
            Integer id = scope.get(name);
            if (id != null) {
                return OptionalInt.of(id);
            }
        }
        diagnostics.reportError(IrErrorCode.UNKNOWN_ACCESS_ID, "Undeclared variable '" + name + "'", loc);
        return OptionalInt.empty();
    }

    /**
     * Resolves a field of the stencil.
     * @param name The field name.
     * @param loc Where the field is accessed, for the diagnostic.
     * @return The AccessID, or empty if the stencil has no such field (an error is reported).
     */
    public OptionalInt resolveField(String name, SourceLocation loc) {
        Optional<Integer> id = metadata().findAccessIdFromName(name).filter(metadata()::isField);
        if (id.isEmpty()) {
            diagnostics.reportError(IrErrorCode.UNKNOWN_FIELD, "Access to undeclared field '" + name + "'", loc);
            return OptionalInt.empty();
        }
        return OptionalInt.of(id.get());
    }

    /**
     * Resolves a global variable, registering it on first use.
     * @param name The global's name.
     * @param loc Where the global is accessed, for the diagnostic.
     * @return The AccessID, or empty if the file declares no such global (an error is reported).
     */
    public OptionalInt resolveGlobal(String name, SourceLocation loc) {
        StencilMetaInfo metadata = metadata();
        Optional<Integer> existing = metadata.findAccessIdFromName(name);
        if (existing.isPresent()) {
            if (metadata.isGlobalVariable(existing.get())) {
                return OptionalInt.of(existing.get());
            }
            diagnostics.reportError(IrErrorCode.DUPLICATE_NAME,
                    "Global '" + name + "' clashes with a field or variable of the same name", loc);
            return OptionalInt.empty();
        }
        if (!sir.globalVariables().containsKey(name)) {
            diagnostics.reportError(IrErrorCode.UNKNOWN_GLOBAL, "Access to undeclared global '" + name + "'", loc);
            return OptionalInt.empty();
        }
        return OptionalInt.of(metadata.registerGlobalVariable(name));
    }
}
