package org.kindred.compiler.frontend.parser.ast;

/**
 * A top-level declaration.
 */
public sealed interface Item extends AstNode permits FunctionDecl, VarDecl {

    /**
     * The closed set of item variants, for exhaustive {@code switch} expressions.
     */
    enum Kind {
        FUNCTION,
        GLOBAL_VARIABLE
    }

    Kind itemKind();
}
