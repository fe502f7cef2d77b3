package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * An assignment {@code target = value;}.
 *
 * @param target The assigned variable.
 * @param value The new value.
 * @param span The range of the {@code =} token.
 */
public record AssignmentStmt(IdentifierExpr target, Expr value, Span span) implements Stmt {

    @Override
    public Kind stmtKind() {
        return Kind.ASSIGNMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }
}
