package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable records. Semantic passes never modify them; they record their results
 * in side tables keyed by node identity instead.
 */
public sealed interface AstNode permits Program, Item, Stmt, Expr, Param, TypeRef {

    /**
     * @return The source range covered by this node.
     */
    Span span();

    /**
     * Returns a list of the direct child nodes.
     * This allows generic traversals to walk the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
