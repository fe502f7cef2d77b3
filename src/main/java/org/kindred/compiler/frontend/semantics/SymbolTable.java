package org.kindred.compiler.frontend.semantics;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.parser.ast.AstNode;
import org.kindred.compiler.frontend.types.Type;

import java.util.Optional;

/**
 * A symbol table for managing scopes and symbols during name resolution.
 * It supports nested scopes and resolving symbols based on the current scope.
 * <p>
 * The root is a prelude scope with the builtin types and functions; the global scope for
 * top-level declarations is its only child.
 */
public class SymbolTable {

    private static final Span PRELUDE_SPAN = Span.ofFile("<prelude>");

    private final DiagnosticsEngine diagnostics;
    private final Scope preludeScope;
    private final Scope globalScope;
    private Scope currentScope;

    /**
     * Constructs a new symbol table with a fresh prelude.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.preludeScope = new Scope(null, Scope.Kind.PRELUDE);
        definePrelude();
        this.globalScope = new Scope(preludeScope, Scope.Kind.GLOBAL);
        this.currentScope = globalScope;
    }

    private void definePrelude() {
        for (Type.PrimitiveKind kind : Type.PrimitiveKind.values()) {
            preludeScope.add(new Symbol(kind.displayName(), Symbol.Kind.TYPE, new Type.Primitive(kind), preludeScope,
                    Symbol.StorageRole.NONE, false, PRELUDE_SPAN, null));
        }
        for (Builtin builtin : Builtin.values()) {
            preludeScope.add(new Symbol(builtin.sourceName(), Symbol.Kind.FUNCTION, builtin.type(), preludeScope,
                    Symbol.StorageRole.BUILTIN, false, PRELUDE_SPAN, null));
        }
    }

    public Scope globalScope() {
        return globalScope;
    }

    public Scope currentScope() {
        return currentScope;
    }

    /**
     * Enters a new scope below the current one.
     * @param kind The construct opening the scope.
     * @return The new scope.
     */
    public Scope enterScope(Scope.Kind kind) {
        currentScope = new Scope(currentScope, kind);
        return currentScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope != globalScope) {
            currentScope = currentScope.parent();
        }
    }

    /**
     * Announces that the current block declares {@code name} further down.
     * Uses of the name before the declaration are reported as used before declaration.
     * @param name The name declared later in the block.
     */
    public void declareAhead(String name) {
        currentScope.markPending(name);
    }

    /**
     * Defines a new symbol in the current scope.
     * Reports an error if the name is already defined in the current scope, or if it would
     * redefine a builtin.
     * @param name The declared name.
     * @param kind What the name denotes.
     * @param type The declared type.
     * @param storage The storage role.
     * @param mutable Whether the symbol may be assigned.
     * @param declaration The range of the declaring name.
     * @param node The declaring node.
     * @return The new symbol, which is bound even if it was a duplicate.
     */
    public Symbol define(String name, Symbol.Kind kind, Type type, Symbol.StorageRole storage, boolean mutable,
                         Span declaration, AstNode node) {
        Symbol symbol = new Symbol(name, kind, type, currentScope, storage, mutable, declaration, node);
        Optional<Symbol> existing = currentScope.lookupLocal(name);
        if (existing.isPresent()) {
            diagnostics.reportError(ErrorCode.DUPLICATE_DECLARATION,
                    "'" + name + "' is already declared in this scope (first declared at " + existing.get().declaration() + ").",
                    declaration);
            return symbol;
        }
        if (currentScope == globalScope && preludeScope.lookupLocal(name).isPresent()) {
            diagnostics.reportError(ErrorCode.DUPLICATE_DECLARATION,
                    "'" + name + "' is a builtin and cannot be redeclared.", declaration);
            return symbol;
        }
        currentScope.add(symbol);
        return symbol;
    }

    /**
     * Resolves a name, searching from the current scope upwards to the prelude.
     * Reports {@code UsedBeforeDeclaration} if the nearest block declaring the name does so
     * only after this use, and {@code Undefined} if no scope declares it.
     * @param name The name to resolve.
     * @param use The range of the use, for error reporting.
     * @return The symbol, or empty if an error was reported.
     */
    public Optional<Symbol> resolve(String name, Span use) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent()) {
            Optional<Symbol> symbol = scope.lookupLocal(name);
            if (symbol.isPresent()) {
                return symbol;
            }
            if (scope.isPending(name)) {
                diagnostics.reportError(ErrorCode.USED_BEFORE_DECLARATION,
                        "'" + name + "' is used before its declaration in this block.", use);
                return Optional.empty();
            }
        }
        diagnostics.reportError(ErrorCode.UNDEFINED, "Cannot find '" + name + "' in this scope.", use);
        return Optional.empty();
    }
}
