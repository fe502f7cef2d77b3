package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A prefix operation.
 *
 * @param operator The operator.
 * @param operand The operand.
 * @param span The range of the operator token.
 */
public record UnaryExpr(UnaryOperator operator, Expr operand, Span span) implements Expr {

    @Override
    public Kind exprKind() {
        return Kind.UNARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
