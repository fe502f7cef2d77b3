package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

/**
 * A literal constant.
 *
 * @param literalKind What kind of literal this is.
 * @param value A {@code Long}, {@code Double}, {@code Boolean} or {@code String}, matching the kind.
 * @param span The range of the literal token.
 */
public record LiteralExpr(LiteralKind literalKind, Object value, Span span) implements Expr {

    /**
     * The literal forms of the language.
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        BOOL,
        STRING
    }

    @Override
    public Kind exprKind() {
        return Kind.LITERAL;
    }
}
