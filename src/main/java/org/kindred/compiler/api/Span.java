package org.kindred.compiler.api;

/**
 * A pure data class representing a range in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param line The 1-based line number where the range starts.
 * @param column The 1-based column number where the range starts.
 * @param length The number of characters covered by the range.
 */
public record Span(String fileName, int line, int column, int length) {

    /**
     * Creates a span that marks a whole file rather than a position in it.
     * Used for fatal I/O and toolchain errors.
     * @param fileName The file name.
     * @return A span with line and column 0.
     */
    public static Span ofFile(String fileName) {
        return new Span(fileName, 0, 0, 0);
    }

    /**
     * Creates the smallest span that covers both this span and {@code other}.
     * Both spans must lie in the same file; {@code other} must not start before this span.
     * @param other The span that ends the range.
     * @return The combined span.
     */
    public Span to(Span other) {
        if (other == null) {
            return this;
        }
        if (other.line != line) {
            return new Span(fileName, line, column, length);
        }
        int end = Math.max(column + length, other.column + other.length);
        return new Span(fileName, line, column, end - column);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
