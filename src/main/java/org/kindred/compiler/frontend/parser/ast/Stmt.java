package org.kindred.compiler.frontend.parser.ast;

/**
 * A statement inside a function body.
 */
public sealed interface Stmt extends AstNode
        permits VarDecl, Block, IfStmt, WhileStmt, ReturnStmt, ExpressionStmt, AssignmentStmt {

    /**
     * The closed set of statement variants. Passes dispatch on it with {@code switch}
     * expressions, so a new variant is a compile error in every pass that misses it.
     */
    enum Kind {
        VAR_DECL,
        BLOCK,
        IF,
        WHILE,
        RETURN,
        EXPRESSION,
        ASSIGNMENT
    }

    Kind stmtKind();
}
