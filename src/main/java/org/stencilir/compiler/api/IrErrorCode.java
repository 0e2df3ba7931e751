package org.stencilir.compiler.api;

/**
 * Defines unique, testable error codes for every problem the IR layer reports.
 * This decouples test logic from the wording of the messages.
 */
public enum IrErrorCode {
    // region Encoding
    /** The bytes or JSON text do not parse under the schema. */
    MALFORMED_ENCODING,
    /** A union was encoded with no branch, several branches or an unknown branch. */
    UNKNOWN_VARIANT,
    /** An enum code outside the known set. */
    UNKNOWN_ENUM_VALUE,
    /** A required sub-message is absent. */
    MISSING_FIELD,
    // endregion

    // region Invariants
    /** The lower bound of an interval lies above its upper bound. */
    INVALID_INTERVAL,
    /** Two nodes of the same kind share an ID within one stencil. */
    DUPLICATE_NODE_ID,
    /** A version ID was registered under a second original ID. */
    VERSION_REPARENTED,
    /** A field was registered as a version of itself. */
    SELF_VERSION,
    /** The version tables disagree with each other. */
    INCONSISTENT_VERSIONS,
    /** A name is bound to more than one AccessID. */
    DUPLICATE_NAME,
    /** An AccessID is listed in more than one classification set. */
    OVERLAPPING_CLASSIFICATION,
    /** A classified AccessID has no registered name. */
    UNNAMED_ACCESS_ID,
    // endregion

    // region Lookup and lowering
    /** An AccessID or name is absent from the metadata tables. */
    UNKNOWN_ACCESS_ID,
    /** A field access names a field the stencil does not declare. */
    UNKNOWN_FIELD,
    /** A global variable name has no registered value. */
    UNKNOWN_GLOBAL,
    /** A stencil or stencil function was not found. */
    UNKNOWN_STENCIL,
    /** The tree cannot be lowered, e.g. a region body is not a statement block. */
    UNSUPPORTED_CONSTRUCT
    // endregion
}
