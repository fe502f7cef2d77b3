package org.kindred.compiler.api;

import org.kindred.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * It carries every diagnostic that was reported, in report order.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message The detail message.
     * @param diagnostics All diagnostics of the failed compilation.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return All diagnostics, errors and warnings, in report order.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * @return Only the errors.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }
}
