package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A binary operation.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 * @param span The range of the operator token.
 */
public record BinaryExpr(BinaryOperator operator, Expr left, Expr right, Span span) implements Expr {

    @Override
    public Kind exprKind() {
        return Kind.BINARY;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
