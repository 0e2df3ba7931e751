package org.stencilir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.stencilir.junit.extensions.logging.ExpectLog;
import org.stencilir.junit.extensions.logging.LogLevel;
import org.stencilir.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the precedence of the configuration layers:
 * system properties over the configuration file over reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String VALIDATE_KEY = "stencil-ir.serialization.validate-on-read";
    private static final String PREFIX_KEY = "stencil-ir.lowering.code-gen-prefix";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(VALIDATE_KEY);
        System.clearProperty(PREFIX_KEY);
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("stencil-ir.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file exists")
    void load_withoutFile_usesDefaults() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertFalse(config.getBoolean(VALIDATE_KEY));
        assertEquals("__code_gen_", config.getString(PREFIX_KEY));
        assertEquals("INFO", config.getString("logging.default-level"));
        assertEquals(IrSettings.defaults().codeGenPrefix(), IrSettings.from(config).codeGenPrefix());
    }

    @Test
    @DisplayName("Configuration file should override defaults")
    void load_fileOverridesDefaults() throws IOException {
        File file = writeConfig("stencil-ir.lowering.code-gen-prefix = \"__gen_\"\n");

        Config config = ConfigLoader.load(file);

        assertEquals("__gen_", config.getString(PREFIX_KEY));
        assertFalse(config.getBoolean(VALIDATE_KEY));
    }

    @Test
    @DisplayName("System property should override the configuration file")
    void load_systemPropertyOverridesFile() throws IOException {
        File file = writeConfig("""
            stencil-ir {
              serialization.validate-on-read = false
              lowering.code-gen-prefix = "__file_"
            }
            """);
        System.setProperty(VALIDATE_KEY, "true");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertTrue(config.getBoolean(VALIDATE_KEY));
        assertEquals("__file_", config.getString(PREFIX_KEY));
    }

    @Test
    @DisplayName("A directory in place of the file should be skipped with a warning")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ConfigLoader", messagePattern = ".*is a directory.*")
    void load_ignoresDirectories() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertEquals("__code_gen_", config.getString(PREFIX_KEY));
    }
}
