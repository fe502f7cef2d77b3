package org.kindred.compiler.frontend.types;

import org.kindred.compiler.frontend.parser.ast.Expr;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.semantics.Bindings;
import org.kindred.compiler.frontend.semantics.Symbol;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * The output of the front end: the AST together with its name bindings and the types of all
 * expressions and variable symbols.
 */
public final class TypedProgram {

    private final Program program;
    private final Bindings bindings;
    private final Map<Expr, Type> expressionTypes;
    private final Map<Symbol, Type> symbolTypes;

    TypedProgram(Program program, Bindings bindings, Map<Expr, Type> expressionTypes, Map<Symbol, Type> symbolTypes) {
        this.program = program;
        this.bindings = bindings;
        this.expressionTypes = Collections.unmodifiableMap(new IdentityHashMap<>(expressionTypes));
        this.symbolTypes = Collections.unmodifiableMap(new IdentityHashMap<>(symbolTypes));
    }

    public Program program() {
        return program;
    }

    public Bindings bindings() {
        return bindings;
    }

    /**
     * @param expr An expression of this program.
     * @return Its type; {@link Type#UNKNOWN} if the expression was never checked.
     */
    public Type typeOf(Expr expr) {
        return expressionTypes.getOrDefault(expr, Type.UNKNOWN);
    }

    /**
     * @param symbol A variable or function symbol.
     * @return The declared or inferred type of the symbol.
     */
    public Type typeOf(Symbol symbol) {
        return symbolTypes.getOrDefault(symbol, symbol.declaredType());
    }
}
