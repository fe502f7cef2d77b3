package org.kindred.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains integration tests for the {@link ProcessToolchain}, using standard POSIX tools in
 * place of a compiler driver.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
public class ProcessToolchainTest {

    @TempDir
    Path tempDir;

    private final ProcessToolchain toolchain = new ProcessToolchain();

    /**
     * Verifies that the exit status and error output are captured.
     */
    @Test
    @Tag("integration")
    void testCapturesExitCodeAndStderr() throws Exception {
        // Act
        ToolchainResult result = toolchain.run(List.of("sh", "-c", "echo out; echo problem >&2; exit 3"),
                tempDir, Duration.ofSeconds(10));

        // Assert
        assertThat(result.timedOut()).isFalse();
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).isEqualTo("problem\n");
        assertThat(result.succeeded()).isFalse();
    }

    /**
     * Verifies that the process runs in the given working directory.
     */
    @Test
    @Tag("integration")
    void testRunsInWorkingDirectory() throws Exception {
        // Act
        ToolchainResult result = toolchain.run(List.of("sh", "-c", "touch marker"), tempDir, Duration.ofSeconds(10));

        // Assert
        assertThat(result.succeeded()).isTrue();
        assertThat(tempDir.resolve("marker")).exists();
    }

    /**
     * Verifies that a process exceeding the timeout is stopped.
     */
    @Test
    @Tag("integration")
    void testTimeoutStopsProcess() throws Exception {
        // Act
        ToolchainResult result = toolchain.run(List.of("sleep", "30"), tempDir, Duration.ofMillis(200));

        // Assert
        assertThat(result.timedOut()).isTrue();
        assertThat(result.succeeded()).isFalse();
    }

    /**
     * Verifies that a missing program surfaces as an IOException.
     */
    @Test
    @Tag("integration")
    void testMissingProgram() {
        assertThatThrownBy(() -> toolchain.run(List.of("kindred-no-such-tool-4711"), tempDir, Duration.ofSeconds(5)))
                .isInstanceOf(IOException.class);
    }
}
