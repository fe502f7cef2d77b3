package org.kindred.compiler.frontend.semantics;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Represents a single scope in the symbol table. A child scope refers to its parent for
 * lookup chaining; the parent does not own references to its children.
 */
public final class Scope {

    /**
     * The syntactic construct that opened a scope.
     */
    public enum Kind {
        /** Builtin types and functions. */
        PRELUDE,
        /** Top-level functions and globals. */
        GLOBAL,
        /** Function parameters. */
        FUNCTION,
        /** Block-local variables. */
        BLOCK
    }

    private final Scope parent;
    private final Kind kind;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Set<String> pendingNames = new HashSet<>();

    Scope(Scope parent, Kind kind) {
        this.parent = parent;
        this.kind = kind;
    }

    public Scope parent() {
        return parent;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Looks a name up in this scope only.
     * @param name The name.
     * @return The symbol declared here, if any.
     */
    public Optional<Symbol> lookupLocal(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return The symbols declared in this scope, in declaration order.
     */
    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    /**
     * @param name The name.
     * @return {@code true} if the name is declared further down in this block but not yet.
     */
    boolean isPending(String name) {
        return pendingNames.contains(name);
    }

    void markPending(String name) {
        pendingNames.add(name);
    }

    void add(Symbol symbol) {
        pendingNames.remove(symbol.name());
        symbols.put(symbol.name(), symbol);
    }
}
