package org.stencilir.compiler.serialization;

/**
 * The two encodings of the IR exchange format.
 */
public enum SerializationFormat {
    /** Protobuf binary encoding. */
    BYTE,
    /** Protobuf JSON mapping, UTF-8 encoded. */
    JSON
}
