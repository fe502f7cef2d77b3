package org.kindred.compiler.diagnostics;

import org.kindred.compiler.api.Span;

/**
 * Represents a single diagnostic message (error, warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code identifying the kind of problem.
 * @param message The diagnostic message.
 * @param span The source range the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        ErrorCode code,
        String message,
        Span span
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    /**
     * @return The error category of this diagnostic.
     */
    public ErrorCategory category() {
        return code.category();
    }

    /**
     * Formats the diagnostic as {@code <file>:<line>:<col>: <ErrorKind>: <message>}.
     * @return The user-facing line.
     */
    public String format() {
        return String.format("%s:%d:%d: %s: %s", span.fileName(), span.line(), span.column(), code.displayName(), message);
    }

    @Override
    public String toString() {
        return format();
    }
}
