package org.kindred.compiler.backend.emit;

/**
 * The outcome of a toolchain run.
 *
 * @param exitCode The process exit status; meaningless if {@code timedOut}.
 * @param stderr Everything the process wrote to its error stream.
 * @param timedOut {@code true} if the process was destroyed after the timeout.
 */
public record ToolchainResult(int exitCode, String stderr, boolean timedOut) {

    public static ToolchainResult finished(int exitCode, String stderr) {
        return new ToolchainResult(exitCode, stderr, false);
    }

    public static ToolchainResult timeout(String stderr) {
        return new ToolchainResult(-1, stderr, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
