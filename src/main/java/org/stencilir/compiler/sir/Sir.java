package org.stencilir.compiler.sir;

import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.LookupFailureException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The high-level IR of one source file, as produced by a front end: stencils, stencil functions and
 * global variables.
 *
 * @param fileName The file the IR was parsed from, possibly empty.
 * @param stencils The stencils.
 * @param stencilFunctions The stencil functions.
 * @param globalVariables The global variables by name, in declaration order.
 */
public record Sir(String fileName, List<Stencil> stencils, List<StencilFunction> stencilFunctions,
                  Map<String, GlobalVariable> globalVariables) {

    public Sir {
        fileName = fileName == null ? "" : fileName;
        stencils = stencils == null ? List.of() : List.copyOf(stencils);
        stencilFunctions = stencilFunctions == null ? List.of() : List.copyOf(stencilFunctions);
        globalVariables = globalVariables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(globalVariables));
    }

    /**
     * @param name The stencil name.
     * @return The stencil.
     * @throws LookupFailureException if no stencil has that name.
     */
    public Stencil getStencil(String name) {
        return stencils.stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new LookupFailureException(IrErrorCode.UNKNOWN_STENCIL, "No stencil named '" + name + "'"));
    }

    public Optional<StencilFunction> findStencilFunction(String name) {
        return stencilFunctions.stream().filter(f -> Objects.equals(f.name(), name)).findFirst();
    }
}
