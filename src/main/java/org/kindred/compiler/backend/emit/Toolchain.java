package org.kindred.compiler.backend.emit;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs the external assembler/linker. Implementations block until the process has finished
 * or the timeout has expired.
 */
public interface Toolchain {

    /**
     * Runs a command.
     *
     * @param command The program followed by its arguments.
     * @param workingDirectory The directory the process runs in.
     * @param timeout The maximum running time; the process is destroyed after it.
     * @return The outcome of the run.
     * @throws IOException if the program cannot be started, e.g. because it does not exist.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    ToolchainResult run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, InterruptedException;
}
