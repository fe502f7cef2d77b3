package org.kindred.compiler.frontend.parser.ast;

/**
 * An expression. Every expression has exactly one type after type checking.
 */
public sealed interface Expr extends AstNode permits BinaryExpr, UnaryExpr, CallExpr, LiteralExpr, IdentifierExpr {

    /**
     * The closed set of expression variants, for exhaustive {@code switch} expressions.
     */
    enum Kind {
        BINARY,
        UNARY,
        CALL,
        LITERAL,
        IDENTIFIER
    }

    Kind exprKind();
}
