package org.kindred.compiler.frontend.semantics;

import org.kindred.compiler.frontend.parser.ast.AstNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The result of name resolution: a side table from AST nodes to the symbols they declare or
 * refer to. Keys are compared by node identity, so two structurally equal nodes at different
 * places in the tree have separate entries.
 * <p>
 * Bound nodes are identifier uses, type annotations, parameters, variable declarations and
 * function declarations. A use that could not be resolved has no entry.
 */
public final class Bindings {

    private final Map<AstNode, Symbol> symbols;
    private final Scope globalScope;

    Bindings(Map<AstNode, Symbol> symbols, Scope globalScope) {
        this.symbols = Collections.unmodifiableMap(new IdentityHashMap<>(symbols));
        this.globalScope = globalScope;
    }

    /**
     * @param node A declaring or referring node.
     * @return The bound symbol, if the node was resolved.
     */
    public Optional<Symbol> lookup(AstNode node) {
        return Optional.ofNullable(symbols.get(node));
    }

    /**
     * @param node A node that must have been resolved.
     * @return The bound symbol.
     * @throws IllegalStateException if the node has no binding.
     */
    public Symbol symbolOf(AstNode node) {
        Symbol symbol = symbols.get(node);
        if (symbol == null) {
            throw new IllegalStateException("No binding for node at " + node.span());
        }
        return symbol;
    }

    /**
     * @return The scope holding all top-level functions and globals.
     */
    public Scope globalScope() {
        return globalScope;
    }

    /**
     * @return The number of bound nodes.
     */
    public int size() {
        return symbols.size();
    }
}
