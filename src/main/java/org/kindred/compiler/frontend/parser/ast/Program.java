package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.List;

/**
 * The root of the AST: all top-level items of one translation unit, in source order.
 *
 * @param items The top-level function and global variable declarations.
 * @param span The range of the whole file.
 */
public record Program(List<Item> items, Span span) implements AstNode {

    public Program {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(items);
    }
}
