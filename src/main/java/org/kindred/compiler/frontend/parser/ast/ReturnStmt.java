package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A return statement.
 *
 * @param value The returned value, or {@code null} in a {@code Unit} function.
 * @param span The range of the {@code return} keyword.
 */
public record ReturnStmt(Expr value, Span span) implements Stmt {

    @Override
    public Kind stmtKind() {
        return Kind.RETURN;
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
