package org.kindred.compiler.api;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * The immutable inputs of one compilation.
 *
 * @param sourcePath The Kindred source file.
 * @param outputDirectory The directory receiving the assembly, IR dump and executable.
 * @param optimizationMode The build mode.
 * @param artifactName The base name of the generated files.
 * @param toolchainCommand The assembler/linker driver and any fixed leading arguments.
 * @param toolchainTimeout How long the toolchain may run before it is destroyed.
 */
public record CompileOptions(
        Path sourcePath,
        Path outputDirectory,
        OptimizationMode optimizationMode,
        String artifactName,
        List<String> toolchainCommand,
        Duration toolchainTimeout
) {
    public CompileOptions {
        toolchainCommand = List.copyOf(toolchainCommand);
        if (toolchainCommand.isEmpty()) {
            throw new IllegalArgumentException("toolchain command must not be empty");
        }
        if (artifactName == null || artifactName.isBlank()) {
            throw new IllegalArgumentException("artifact name must not be blank");
        }
    }

    /**
     * Reads the options from the {@code kindred} section of a configuration.
     * @param config The root configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or malformed.
     */
    public static CompileOptions fromConfig(Config config) {
        Config kindred = config.getConfig("kindred");
        return new CompileOptions(
                Path.of(kindred.getString("source-path")),
                Path.of(kindred.getString("output-directory")),
                kindred.getEnum(OptimizationMode.class, "optimization-mode"),
                kindred.getString("artifact-name"),
                kindred.getStringList("toolchain.command"),
                kindred.getDuration("toolchain.timeout"));
    }

    public CompileOptions withSourcePath(Path path) {
        return new CompileOptions(path, outputDirectory, optimizationMode, artifactName, toolchainCommand, toolchainTimeout);
    }

    public CompileOptions withOutputDirectory(Path directory) {
        return new CompileOptions(sourcePath, directory, optimizationMode, artifactName, toolchainCommand, toolchainTimeout);
    }

    public CompileOptions withOptimizationMode(OptimizationMode mode) {
        return new CompileOptions(sourcePath, outputDirectory, mode, artifactName, toolchainCommand, toolchainTimeout);
    }

    /**
     * @return The path of the executable this compilation produces.
     */
    public Path executablePath() {
        return outputDirectory.resolve(artifactName);
    }

    /**
     * @return The path of the generated assembly file.
     */
    public Path assemblyPath() {
        return outputDirectory.resolve(artifactName + ".s");
    }

    /**
     * @return The path of the IR dump written in debug mode.
     */
    public Path irDumpPath() {
        return outputDirectory.resolve(artifactName + ".ir");
    }
}
