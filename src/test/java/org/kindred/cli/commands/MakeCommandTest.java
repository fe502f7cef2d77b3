package org.kindred.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typesafe.config.ConfigFactory;
import org.kindred.cli.CommandLineInterface;
import org.kindred.compiler.api.CompilationException;
import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.ICompiler;
import org.kindred.compiler.api.OptimizationMode;
import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.Diagnostic;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@code make} subcommand. The compiler is mocked, so these tests
 * cover option resolution, output and exit codes.
 */
@ExtendWith(MockitoExtension.class)
public class MakeCommandTest {

    @Mock
    private ICompiler compiler;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        ConfigFactory.invalidateCaches();
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == MakeCommand.class) {
                    return cls.cast(new MakeCommand(compiler));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        commandLine = CommandLineInterface.createCommandLine(factory);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        configFile = Files.writeString(tempDir.resolve("kindred.conf"), String.join("\n",
                "kindred {",
                "  source-path = \"app.kin\"",
                "  output-directory = \"" + tempDir.resolve("out").toString().replace("\\", "/") + "\"",
                "  artifact-name = \"app\"",
                "}"));
    }

    private static CompilationException failure() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, ErrorCode.UNDEFINED,
                "Cannot find 'x' in this scope.", new Span("app.kin", 2, 5, 1));
        return new CompilationException("Compilation failed with 1 error(s)", List.of(diagnostic));
    }

    /**
     * Verifies that command-line options override the configuration file.
     */
    @Test
    @Tag("unit")
    void testOptionsOverrideConfiguration() throws Exception {
        // Arrange
        Path executable = tempDir.resolve("out/app");
        when(compiler.compile(any())).thenReturn(executable);

        // Act
        int exitCode = commandLine.execute("-c", configFile.toString(), "make", "--mode", "debug", "-s", "other.kin");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("Built " + executable + System.lineSeparator());
        ArgumentCaptor<CompileOptions> options = ArgumentCaptor.forClass(CompileOptions.class);
        verify(compiler).compile(options.capture());
        assertThat(options.getValue().optimizationMode()).isEqualTo(OptimizationMode.DEBUG);
        assertThat(options.getValue().sourcePath()).isEqualTo(Path.of("other.kin"));
        assertThat(options.getValue().outputDirectory()).isEqualTo(tempDir.resolve("out"));
        assertThat(options.getValue().artifactName()).isEqualTo("app");
        assertThat(options.getValue().toolchainCommand()).containsExactly("cc");
    }

    /**
     * Verifies that diagnostics go to standard error and the exit code is 1.
     */
    @Test
    @Tag("unit")
    void testFailurePrintsDiagnostics() throws Exception {
        // Arrange
        when(compiler.compile(any())).thenThrow(failure());

        // Act
        int exitCode = commandLine.execute("-c", configFile.toString(), "make");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("app.kin:2:5: NameError.Undefined: Cannot find 'x' in this scope.");
    }

    /**
     * Verifies the JSON rendering of diagnostics.
     */
    @Test
    @Tag("unit")
    void testJsonDiagnostics() throws Exception {
        // Arrange
        when(compiler.compile(any())).thenThrow(failure());

        // Act
        int exitCode = commandLine.execute("-c", configFile.toString(), "make", "--json");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        JsonArray array = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(array).hasSize(1);
        JsonObject entry = array.get(0).getAsJsonObject();
        assertThat(entry.get("severity").getAsString()).isEqualTo("ERROR");
        assertThat(entry.get("kind").getAsString()).isEqualTo("NameError.Undefined");
        assertThat(entry.get("file").getAsString()).isEqualTo("app.kin");
        assertThat(entry.get("line").getAsInt()).isEqualTo(2);
        assertThat(entry.get("column").getAsInt()).isEqualTo(5);
        assertThat(entry.get("message").getAsString()).isEqualTo("Cannot find 'x' in this scope.");
    }

    /**
     * Verifies that a successful JSON build prints an empty array.
     */
    @Test
    @Tag("unit")
    void testJsonSuccess() throws Exception {
        // Arrange
        when(compiler.compile(any())).thenReturn(tempDir.resolve("out/app"));

        // Act
        int exitCode = commandLine.execute("-c", configFile.toString(), "make", "--json");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("[]");
    }

    /**
     * Verifies that a malformed configuration is reported without compiling.
     */
    @Test
    @Tag("unit")
    void testInvalidConfiguration() throws Exception {
        // Arrange
        Path badConfig = Files.writeString(tempDir.resolve("bad.conf"), "kindred.optimization-mode = FAST");

        // Act
        int exitCode = commandLine.execute("-c", badConfig.toString(), "make");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Invalid configuration:");
        verifyNoInteractions(compiler);
    }

    /**
     * Verifies that a missing configuration file given explicitly is an error.
     */
    @Test
    @Tag("unit")
    void testMissingConfigurationFile() {
        // Act
        int exitCode = commandLine.execute("-c", tempDir.resolve("nope.conf").toString(), "make");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
        verifyNoInteractions(compiler);
    }

    /**
     * Verifies that an unknown build mode is rejected by the parser.
     */
    @Test
    @Tag("unit")
    void testUnknownModeIsUsageError() {
        // Act
        int exitCode = commandLine.execute("make", "--mode", "fast");

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("fast");
        verifyNoInteractions(compiler);
    }
}
