package org.logsim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.logsim.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("logsim.simulation.default-cycles");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should provide reference defaults when no file is given")
    void load_shouldProvideReferenceDefaults() {
        // Act
        Config config = ConfigLoader.defaults();

        // Assert
        assertEquals(20, config.getInt("logsim.simulation.settle.min-iterations"));
        assertEquals(10, config.getInt("logsim.simulation.default-cycles"));
        assertEquals("logsim> ", config.getString("logsim.cli.prompt"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Explicit file should override reference defaults")
    void load_explicitFileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("logsim.simulation.default-cycles = 42");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(42, config.getInt("logsim.simulation.default-cycles"));
        assertEquals(20, config.getInt("logsim.simulation.settle.min-iterations"));
    }

    @Test
    @DisplayName("System property should override the configuration file")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig("logsim.simulation.default-cycles = 42");
        System.setProperty("logsim.simulation.default-cycles", "7");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(7, config.getInt("logsim.simulation.default-cycles"));
    }

    @Test
    @DisplayName("A missing explicit file is an error")
    void load_missingExplicitFileShouldFail() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThrows(ConfigException.class, () -> ConfigLoader.load(missing));
    }

    @Test
    @DisplayName("A missing working directory file falls back to empty")
    void loadWorkingDirectoryFile_shouldIgnoreMissingFile() {
        Config config = ConfigLoader.loadWorkingDirectoryFile(tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile());

        assertTrue(config.isEmpty());
    }

    @Test
    @DisplayName("Substitutions should be resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("""
                base-cycles = 12
                logsim.simulation.default-cycles = ${base-cycles}
                """);

        Config config = ConfigLoader.load(file);

        assertEquals(12, config.getInt("logsim.simulation.default-cycles"));
    }
}
