package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A function call.
 *
 * @param callee The called expression; only identifiers naming functions are callable.
 * @param arguments The arguments, in order.
 * @param span The range of the opening parenthesis.
 */
public record CallExpr(Expr callee, List<Expr> arguments, Span span) implements Expr {

    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Kind exprKind() {
        return Kind.CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
