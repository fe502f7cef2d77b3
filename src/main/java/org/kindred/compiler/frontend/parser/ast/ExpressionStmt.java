package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * An expression evaluated for its effect, typically a call.
 *
 * @param expression The expression.
 * @param span The range of the expression's first token.
 */
public record ExpressionStmt(Expr expression, Span span) implements Stmt {

    @Override
    public Kind stmtKind() {
        return Kind.EXPRESSION;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
