package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional statement.
 *
 * @param condition The condition, which must be {@code Bool}.
 * @param thenBranch The block executed when the condition holds.
 * @param elseBranch A {@link Block} or a nested {@link IfStmt}, or {@code null}.
 * @param span The range of the {@code if} keyword.
 */
public record IfStmt(Expr condition, Block thenBranch, Stmt elseBranch, Span span) implements Stmt {

    @Override
    public Kind stmtKind() {
        return Kind.IF;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(condition, thenBranch));
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }
}
