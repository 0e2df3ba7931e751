package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

/**
 * A parameter of a stencil function: a field, a direction or an offset.
 */
public sealed interface StencilFunctionArg permits Field, Direction, Offset {

    String name();

    SourceLocation loc();
}
