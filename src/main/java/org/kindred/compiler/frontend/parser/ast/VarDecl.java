package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A variable declaration, {@code let} (immutable) or {@code var} (mutable). At top level it
 * declares a global, inside a function body a block-local variable.
 *
 * @param name The variable name.
 * @param mutable {@code true} for {@code var}, {@code false} for {@code let}.
 * @param type The declared type, or {@code null} if it is inferred from the initializer.
 * @param initializer The initializer expression.
 * @param span The range of the variable name.
 */
public record VarDecl(String name, boolean mutable, TypeRef type, Expr initializer, Span span) implements Item, Stmt {

    @Override
    public Item.Kind itemKind() {
        return Item.Kind.GLOBAL_VARIABLE;
    }

    @Override
    public Stmt.Kind stmtKind() {
        return Stmt.Kind.VAR_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (type != null) {
            children.add(type);
        }
        children.add(initializer);
        return children;
    }
}
