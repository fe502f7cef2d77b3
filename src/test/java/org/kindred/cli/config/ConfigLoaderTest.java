package org.kindred.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.OptimizationMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("kindred.artifact-name");
        System.clearProperty("kindred.output-directory");
        ConfigFactory.invalidateCaches();
    }

    private static File testConfig() throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class.getResource("test-config.conf").toURI()).toFile();
    }

    @Test
    @DisplayName("Should provide the reference defaults for every compile option")
    void load_shouldProvideDefaults() {
        // Act
        Config config = ConfigLoader.load(null);
        CompileOptions options = CompileOptions.fromConfig(config);

        // Assert
        assertEquals(OptimizationMode.RELEASE, options.optimizationMode());
        assertEquals("main", options.artifactName());
        assertEquals(List.of("cc"), options.toolchainCommand());
        assertEquals(Duration.ofSeconds(60), options.toolchainTimeout());
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override defaults and keep the rest")
    void load_fileShouldOverrideDefaults() throws URISyntaxException {
        // Act
        CompileOptions options = CompileOptions.fromConfig(ConfigLoader.load(testConfig()));

        // Assert
        assertEquals(Path.of("file-out"), options.outputDirectory());
        assertEquals(OptimizationMode.DEBUG, options.optimizationMode());
        assertEquals(List.of("gcc", "-no-pie"), options.toolchainCommand());
        assertEquals(Path.of("main.kin"), options.sourcePath()); // From reference.conf
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws URISyntaxException {
        // Arrange
        System.setProperty("kindred.output-directory", "prop-out");
        System.setProperty("kindred.artifact-name", "tool");
        ConfigFactory.invalidateCaches();

        // Act
        CompileOptions options = CompileOptions.fromConfig(ConfigLoader.load(testConfig()));

        // Assert
        assertEquals(Path.of("prop-out"), options.outputDirectory());
        assertEquals("tool", options.artifactName());
        assertEquals(OptimizationMode.DEBUG, options.optimizationMode()); // File value (no override)
    }

    @Test
    @DisplayName("Should keep dotted logger names as single keys")
    void load_shouldKeepLoggerNames() throws URISyntaxException {
        // Act
        Config config = ConfigLoader.load(testConfig());

        // Assert
        assertTrue(config.getConfig("logging.levels").root().containsKey("org.kindred.compiler.backend.emit"));
    }

    @Test
    @DisplayName("Should fail if an explicitly given file does not exist")
    void load_shouldFailForMissingExplicitFile() {
        assertThrows(ConfigException.IO.class, () -> ConfigLoader.load(new File("does-not-exist.conf")));
    }
}
