package org.stencilir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stencilir.compiler.lowering.StencilLowering;
import org.stencilir.compiler.serialization.IirSerializer;
import org.stencilir.compiler.serialization.SerializationFormat;
import org.stencilir.compiler.serialization.SirSerializer;

import java.util.Objects;

/**
 * Typed view of the {@code stencil-ir} configuration block.
 *
 * @param format The encoding serializers built from these settings use when no format is given.
 * @param validateOnRead Whether deserializers validate what they decode.
 * @param codeGenPrefix The callee prefix of the stencil calls created by lowering.
 */
public record IrSettings(SerializationFormat format, boolean validateOnRead, String codeGenPrefix) {

    private static final String ROOT = "stencil-ir";

    public IrSettings {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(codeGenPrefix, "codeGenPrefix");
    }

    /**
     * @return The built-in defaults, identical to those of {@code reference.conf}.
     */
    public static IrSettings defaults() {
        return new IrSettings(SerializationFormat.BYTE, false, StencilLowering.DEFAULT_CODE_GEN_PREFIX);
    }

    /**
     * Reads the settings from a loaded configuration.
     *
     * @param config A configuration as returned by {@link ConfigLoader}.
     * @return The settings.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static IrSettings from(Config config) {
        Config ir = config.getConfig(ROOT);
        return new IrSettings(
                ir.getEnum(SerializationFormat.class, "serialization.format"),
                ir.getBoolean("serialization.validate-on-read"),
                ir.getString("lowering.code-gen-prefix"));
    }

    /**
     * @return An instantiation serializer with the configured format and validation.
     */
    public IirSerializer newIirSerializer() {
        return new IirSerializer(this);
    }

    /**
     * @return A high-level IR serializer with the configured format and validation.
     */
    public SirSerializer newSirSerializer() {
        return new SirSerializer(this);
    }

    /**
     * @return A lowering stage using the configured prefix.
     */
    public StencilLowering newLowering() {
        return new StencilLowering(codeGenPrefix);
    }
}
