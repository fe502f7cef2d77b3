package org.kindred.compiler.frontend.lexer;

import org.kindred.compiler.api.Span;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Int, Plus).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: a {@code Long} for INT, a {@code Double}
 *              for FLOAT, the unescaped content for STRING, otherwise {@code null}.
 * @param span The source range of the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        Span span
) {

    /**
     * Renders the token the way tests and debug output show it, e.g. {@code Identifier(x)},
     * {@code Int(1)} or {@code Plus}.
     * @return The short description.
     */
    public String describe() {
        return switch (type) {
            case IDENTIFIER, INT, FLOAT -> type.displayName() + "(" + text + ")";
            case STRING -> type.displayName() + "(" + value + ")";
            default -> type.displayName();
        };
    }
}
