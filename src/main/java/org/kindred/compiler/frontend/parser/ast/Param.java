package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * A formal parameter of a function.
 *
 * @param name The parameter name.
 * @param type The declared parameter type.
 * @param span The range of the parameter name.
 */
public record Param(String name, TypeRef type, Span span) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(type);
    }
}
