package org.kindred.compiler.backend.emit;

import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.Span;
import org.kindred.compiler.backend.codegen.AssemblyListing;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.ir.IrPrinter;
import org.kindred.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The final stage of the pipeline: writes the assembly (and in debug mode the IR dump) to the
 * output directory and turns it into an executable with the configured toolchain.
 */
public class Emitter {

    private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);
    private static final int MAX_STDERR_IN_MESSAGE = 2000;

    private final Toolchain toolchain;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param toolchain The assembler/linker runner.
     * @param diagnostics The engine for reporting build and I/O errors.
     */
    public Emitter(Toolchain toolchain, DiagnosticsEngine diagnostics) {
        this.toolchain = toolchain;
        this.diagnostics = diagnostics;
    }

    /**
     * Writes the output files and runs the toolchain.
     *
     * @param listing The generated assembly.
     * @param program The IR, dumped in debug mode.
     * @param options The compilation inputs.
     * @return The executable, or empty if an error was reported.
     */
    public Optional<Path> emit(AssemblyListing listing, IrProgram program, CompileOptions options) {
        Span fileSpan = Span.ofFile(options.sourcePath().toString());
        Path outputDirectory = options.outputDirectory();
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(options.assemblyPath(), listing.render(), StandardCharsets.UTF_8);
            if (options.optimizationMode().writesIrDump()) {
                Files.writeString(options.irDumpPath(), IrPrinter.print(program), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            diagnostics.reportError(ErrorCode.OUTPUT_NOT_WRITABLE,
                    "Cannot write to output directory '" + outputDirectory + "': " + e.getMessage(), fileSpan);
            return Optional.empty();
        }
        LOG.debug("Wrote {}", options.assemblyPath());

        List<String> command = new ArrayList<>(options.toolchainCommand());
        command.addAll(options.optimizationMode().toolchainFlags());
        command.add("-o");
        command.add(options.executablePath().toAbsolutePath().toString());
        command.add(options.assemblyPath().toAbsolutePath().toString());

        ToolchainResult result;
        try {
            result = toolchain.run(command, outputDirectory.toAbsolutePath(), options.toolchainTimeout());
        } catch (IOException e) {
            diagnostics.reportError(ErrorCode.TOOLCHAIN_NOT_FOUND,
                    "Cannot run toolchain '" + command.get(0) + "': " + e.getMessage(), fileSpan);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            diagnostics.reportError(ErrorCode.TOOLCHAIN_FAILURE,
                    "Interrupted while waiting for toolchain '" + command.get(0) + "'.", fileSpan);
            return Optional.empty();
        }

        if (result.timedOut()) {
            diagnostics.reportError(ErrorCode.TOOLCHAIN_TIMEOUT,
                    "Toolchain '" + command.get(0) + "' did not finish within " + options.toolchainTimeout().toSeconds()
                            + "s and was stopped.", fileSpan);
            return Optional.empty();
        }
        if (result.exitCode() != 0) {
            diagnostics.reportError(ErrorCode.TOOLCHAIN_FAILURE,
                    "Toolchain '" + command.get(0) + "' exited with status " + result.exitCode() + ": "
                            + abbreviate(result.stderr().strip()), fileSpan);
            return Optional.empty();
        }
        LOG.debug("Linked {}", options.executablePath());
        return Optional.of(options.executablePath());
    }

    private static String abbreviate(String text) {
        if (text.length() <= MAX_STDERR_IN_MESSAGE) {
            return text;
        }
        return text.substring(0, MAX_STDERR_IN_MESSAGE) + "...";
    }
}
