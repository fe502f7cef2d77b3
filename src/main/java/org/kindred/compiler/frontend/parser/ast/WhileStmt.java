package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A pre-tested loop.
 *
 * @param condition The loop condition, which must be {@code Bool}.
 * @param body The loop body.
 * @param span The range of the {@code while} keyword.
 */
public record WhileStmt(Expr condition, Block body, Span span) implements Stmt {

    @Override
    public Kind stmtKind() {
        return Kind.WHILE;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
