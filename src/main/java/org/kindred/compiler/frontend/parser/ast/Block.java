package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A braced statement list that opens a new scope.
 *
 * @param statements The statements, in order.
 * @param span The range of the opening brace.
 */
public record Block(List<Stmt> statements, Span span) implements Stmt {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public Kind stmtKind() {
        return Kind.BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
