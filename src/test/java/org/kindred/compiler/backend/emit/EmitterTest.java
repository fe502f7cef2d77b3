package org.kindred.compiler.backend.emit;

import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.OptimizationMode;
import org.kindred.compiler.api.Span;
import org.kindred.compiler.backend.codegen.AssemblyListing;
import org.kindred.compiler.diagnostics.Diagnostic;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.ir.BasicBlock;
import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrInstruction;
import org.kindred.compiler.ir.IrOperand;
import org.kindred.compiler.ir.IrProgram;
import org.kindred.compiler.ir.Opcode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link Emitter}. The toolchain is mocked, so these tests check
 * the files written, the command line built and the mapping of toolchain outcomes to errors.
 */
@ExtendWith(MockitoExtension.class)
public class EmitterTest {

    @Mock
    private Toolchain toolchain;

    @TempDir
    Path tempDir;

    private DiagnosticsEngine diagnostics;
    private Emitter emitter;
    private AssemblyListing listing;
    private IrProgram program;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        emitter = new Emitter(toolchain, diagnostics);
        listing = new AssemblyListing();
        listing.directive(".text");
        Span span = new Span("prog.kin", 1, 1, 0);
        BasicBlock entry = new BasicBlock(new IrOperand.Label("L0"),
                List.of(new IrInstruction(Opcode.RETURN, null, List.of())));
        IrFunction init = new IrFunction(IrProgram.INIT_FUNCTION, List.of(), List.of(), 0, List.of(entry), Type.UNIT, span);
        program = new IrProgram(List.of(), init, List.of(), List.of(), false);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private CompileOptions options(OptimizationMode mode) {
        return new CompileOptions(Path.of("prog.kin"), tempDir.resolve("out"), mode, "prog",
                List.of("cc"), Duration.ofSeconds(5));
    }

    /**
     * Verifies the files and the toolchain command of a release build.
     */
    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void testReleaseBuild() throws Exception {
        // Arrange
        CompileOptions options = options(OptimizationMode.RELEASE);
        when(toolchain.run(anyList(), any(), any())).thenReturn(ToolchainResult.finished(0, ""));

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options);

        // Assert
        assertThat(executable).contains(options.executablePath());
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(Files.readString(options.assemblyPath())).isEqualTo("    .text\n");
        assertThat(options.irDumpPath()).doesNotExist();
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(toolchain).run(command.capture(), any(), any());
        assertThat(command.getValue()).containsExactly("cc", "-O2", "-s", "-o",
                options.executablePath().toAbsolutePath().toString(),
                options.assemblyPath().toAbsolutePath().toString());
    }

    /**
     * Verifies that a debug build keeps the IR dump and passes the debug flag.
     */
    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void testDebugBuildWritesIrDump() throws Exception {
        // Arrange
        CompileOptions options = options(OptimizationMode.DEBUG);
        when(toolchain.run(anyList(), any(), any())).thenReturn(ToolchainResult.finished(0, ""));

        // Act
        emitter.emit(listing, program, options);

        // Assert
        assertThat(Files.readString(options.irDumpPath())).contains("fn $init(): Unit");
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(toolchain).run(command.capture(), any(), any());
        assertThat(command.getValue()).startsWith("cc", "-g", "-o");
    }

    /**
     * Verifies that a toolchain that cannot be started is reported against the source file.
     */
    @Test
    @Tag("unit")
    void testToolchainNotFound() throws Exception {
        // Arrange
        when(toolchain.run(anyList(), any(), any())).thenThrow(new IOException("No such file"));

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options(OptimizationMode.RELEASE));

        // Assert
        assertThat(executable).isEmpty();
        assertThat(diagnostics.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(ErrorCode.TOOLCHAIN_NOT_FOUND);
            assertThat(d.span()).isEqualTo(Span.ofFile("prog.kin"));
            assertThat(d.message()).contains("'cc'", "No such file");
        });
    }

    /**
     * Verifies the mapping of a timeout.
     */
    @Test
    @Tag("unit")
    void testToolchainTimeout() throws Exception {
        // Arrange
        when(toolchain.run(anyList(), any(), any())).thenReturn(ToolchainResult.timeout(""));

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options(OptimizationMode.RELEASE));

        // Assert
        assertThat(executable).isEmpty();
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(ErrorCode.TOOLCHAIN_TIMEOUT);
    }

    /**
     * Verifies that a failing toolchain is reported with its error output, abbreviated if long.
     */
    @Test
    @Tag("unit")
    void testToolchainFailureIncludesStderr() throws Exception {
        // Arrange
        String stderr = "prog.s:3: Error: no such instruction\n" + "x".repeat(5000);
        when(toolchain.run(anyList(), any(), any())).thenReturn(ToolchainResult.finished(1, stderr));

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options(OptimizationMode.RELEASE));

        // Assert
        assertThat(executable).isEmpty();
        assertThat(diagnostics.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(ErrorCode.TOOLCHAIN_FAILURE);
            assertThat(d.message()).contains("exited with status 1", "no such instruction").endsWith("...");
            assertThat(d.message().length()).isLessThan(2200);
        });
    }

    /**
     * Verifies that an interrupted wait is reported and the interrupt flag is restored.
     */
    @Test
    @Tag("unit")
    void testInterruptedWhileWaiting() throws Exception {
        // Arrange
        when(toolchain.run(anyList(), any(), any())).thenThrow(new InterruptedException());

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options(OptimizationMode.RELEASE));

        // Assert
        assertThat(executable).isEmpty();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(ErrorCode.TOOLCHAIN_FAILURE);
    }

    /**
     * Verifies that an unusable output directory stops the build before the toolchain runs.
     */
    @Test
    @Tag("unit")
    void testOutputDirectoryNotWritable() throws Exception {
        // Arrange
        Files.writeString(tempDir.resolve("out"), "a file, not a directory");

        // Act
        Optional<Path> executable = emitter.emit(listing, program, options(OptimizationMode.RELEASE));

        // Assert
        assertThat(executable).isEmpty();
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(ErrorCode.OUTPUT_NOT_WRITABLE);
        verifyNoInteractions(toolchain);
    }
}
