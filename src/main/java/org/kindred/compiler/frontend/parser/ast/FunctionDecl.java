package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A function declaration: {@code fn name(params): ReturnType { body }}.
 *
 * @param name The function name.
 * @param params The formal parameters, in order.
 * @param returnType The declared return type, or {@code null} for {@code Unit}.
 * @param body The function body.
 * @param span The range of the function name.
 */
public record FunctionDecl(String name, List<Param> params, TypeRef returnType, Block body, Span span) implements Item {

    public FunctionDecl {
        params = List.copyOf(params);
    }

    @Override
    public Kind itemKind() {
        return Kind.FUNCTION;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(params);
        if (returnType != null) {
            children.add(returnType);
        }
        children.add(body);
        return children;
    }
}
