package org.kindred.compiler.diagnostics;

import org.kindred.compiler.api.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing the diagnostic messages
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * Diagnostics are append-only and kept in report order. One engine belongs to one
 * compilation; it is passed explicitly to every stage.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<ErrorCode> suppressed = EnumSet.noneOf(ErrorCode.class);

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param span    The source range of the error.
     */
    public void reportError(ErrorCode code, String message, Span span) {
        if (suppressed.contains(code)) {
            return;
        }
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, span));
    }

    /**
     * Drops every later report with one of the given codes. Used when a stage runs on a
     * partial AST, where these codes may only reflect declarations lost to error recovery.
     *
     * @param codes The codes to drop from now on.
     */
    public void suppress(Set<ErrorCode> codes) {
        suppressed.addAll(codes);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of errors reported so far.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the errors, in report order.
     *
     * @return A new list containing only diagnostics of type ERROR.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .collect(Collectors.toList());
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining("\n"));
    }
}
