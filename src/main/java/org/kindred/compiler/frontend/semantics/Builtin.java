package org.kindred.compiler.frontend.semantics;

import org.kindred.compiler.frontend.types.Type;

import java.util.List;
import java.util.Optional;

/**
 * Functions provided by the runtime support code that the code generator emits with every
 * program.
 */
public enum Builtin {
    /** Prints an integer followed by a newline. */
    PRINT("print", Type.INT),
    /** Prints {@code true} or {@code false} followed by a newline. */
    PRINT_BOOL("print_bool", Type.BOOL),
    /** Prints a string followed by a newline. */
    PRINT_STR("print_str", Type.STRING);

    private final String sourceName;
    private final Type.Function type;

    Builtin(String sourceName, Type parameterType) {
        this.sourceName = sourceName;
        this.type = new Type.Function(List.of(parameterType), Type.UNIT);
    }

    public String sourceName() {
        return sourceName;
    }

    public Type.Function type() {
        return type;
    }

    /**
     * @param name A source-level function name.
     * @return The builtin with that name, if any.
     */
    public static Optional<Builtin> byName(String name) {
        for (Builtin builtin : values()) {
            if (builtin.sourceName.equals(name)) {
                return Optional.of(builtin);
            }
        }
        return Optional.empty();
    }
}
