package org.stencilir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencilir.compiler.IrFixtures;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.serialization.IirSerializer;
import org.stencilir.compiler.serialization.SerializationFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IrSettingsTest {

    @Test
    void from_readsTheStencilIrBlock() {
        Config config = ConfigFactory.parseString("""
            stencil-ir {
              serialization {
                format = "JSON"
                validate-on-read = true
              }
              lowering.code-gen-prefix = "__gen_"
            }
            """);

        IrSettings settings = IrSettings.from(config);

        assertThat(settings).isEqualTo(new IrSettings(SerializationFormat.JSON, true, "__gen_"));
        assertThat(new IirSerializer(settings).isValidateOnRead()).isTrue();
    }

    @Test
    void defaults_matchTheReferenceConfiguration() {
        Config reference = ConfigFactory.parseResources("reference.conf").resolve();

        assertThat(IrSettings.from(reference)).isEqualTo(IrSettings.defaults());
    }

    @Test
    void newLowering_usesTheConfiguredPrefix() throws Exception {
        IrSettings settings = new IrSettings(SerializationFormat.BYTE, false, "__gen_");

        StencilInstantiation instantiation = settings.newLowering().lower(IrFixtures.horizontalDiffusion(), "hori_diff");

        assertThat(instantiation.getMetadata().getStencilCall(1).call().callee()).isEqualTo("__gen_1");
    }

    @Test
    void newSerializers_carryFormatAndValidation() {
        IrSettings settings = new IrSettings(SerializationFormat.JSON, true, "__gen_");

        assertThat(settings.newIirSerializer().getDefaultFormat()).isEqualTo(SerializationFormat.JSON);
        assertThat(settings.newIirSerializer().isValidateOnRead()).isTrue();
        assertThat(settings.newSirSerializer().getDefaultFormat()).isEqualTo(SerializationFormat.JSON);
        assertThat(IrSettings.defaults().newSirSerializer().isValidateOnRead()).isFalse();
    }

    @Test
    void from_rejectsUnknownFormats() {
        Config config = ConfigFactory.parseString("stencil-ir.serialization.format = XML")
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();

        assertThatThrownBy(() -> IrSettings.from(config)).isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void from_rejectsMissingKeys() {
        assertThatThrownBy(() -> IrSettings.from(ConfigFactory.parseString("stencil-ir {}")))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
