package org.kindred.compiler.frontend.semantics;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.frontend.parser.ast.AstNode;
import org.kindred.compiler.frontend.types.Type;

/**
 * Represents a single symbol (a variable, a function or a type) in the symbol table.
 * Symbols are compared by identity wherever they are used as map keys.
 *
 * @param name The declared name.
 * @param kind What the name denotes.
 * @param declaredType The annotated type, the function signature, or {@link Type#UNKNOWN}
 *                     for variables whose type is inferred from their initializer.
 * @param scope The scope that owns the symbol.
 * @param storage Where the value of the symbol lives at run time.
 * @param mutable {@code true} only for variables declared with {@code var}.
 * @param declaration The range of the declaring name.
 * @param node The declaring AST node; {@code null} for builtins.
 */
public record Symbol(
        String name,
        Kind kind,
        Type declaredType,
        Scope scope,
        StorageRole storage,
        boolean mutable,
        Span declaration,
        AstNode node
) {
    /**
     * What a symbol denotes.
     */
    public enum Kind {
        /** A global, local or parameter. */
        VARIABLE,
        /** A user-defined or builtin function. */
        FUNCTION,
        /** A type name such as {@code Int}. */
        TYPE
    }

    /**
     * Where the value of a symbol lives at run time.
     */
    public enum StorageRole {
        /** A global variable in the data section. */
        GLOBAL,
        /** A block-local variable in the function frame. */
        LOCAL,
        /** A function parameter in the function frame. */
        PARAMETER,
        /** A user-defined function. */
        FUNCTION,
        /** A function supplied by the runtime. */
        BUILTIN,
        /** Has no run-time storage (types). */
        NONE
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return kind + " " + name + " @" + declaration;
    }
}
