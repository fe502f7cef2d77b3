package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

/**
 * A use of a name. The resolver binds each occurrence to exactly one symbol.
 *
 * @param name The referenced name.
 * @param span The range of the identifier token.
 */
public record IdentifierExpr(String name, Span span) implements Expr {

    @Override
    public Kind exprKind() {
        return Kind.IDENTIFIER;
    }
}
