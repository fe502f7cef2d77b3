package org.kindred.compiler.frontend.parser.ast;

import org.kindred.compiler.api.Span;

/**
 * A type annotation as written in the source, e.g. the {@code Int} in {@code x: Int}.
 * The resolver binds it to a type symbol.
 *
 * @param name The written type name.
 * @param span The range of the name.
 */
public record TypeRef(String name, Span span) implements AstNode {
}
