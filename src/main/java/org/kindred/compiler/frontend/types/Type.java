package org.kindred.compiler.frontend.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The types of the language. A closed set with structural equality: two function types are
 * equal when their parameter and return types are.
 */
public sealed interface Type permits Type.Primitive, Type.Function, Type.Unknown {

    /** The 64-bit signed integer type. */
    Primitive INT = new Primitive(PrimitiveKind.INT);
    /** The boolean type. */
    Primitive BOOL = new Primitive(PrimitiveKind.BOOL);
    /** Immutable string constants. */
    Primitive STRING = new Primitive(PrimitiveKind.STRING);
    /** 64-bit floating point. */
    Primitive FLOAT = new Primitive(PrimitiveKind.FLOAT);
    /** The result type of functions that return nothing. */
    Primitive UNIT = new Primitive(PrimitiveKind.UNIT);
    /** Placeholder before inference and after an error. */
    Unknown UNKNOWN = new Unknown();

    /**
     * The primitive type constructors.
     */
    enum PrimitiveKind {
        INT("Int"),
        BOOL("Bool"),
        STRING("String"),
        FLOAT("Float"),
        UNIT("Unit");

        private final String displayName;

        PrimitiveKind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    /**
     * @return The type as written in source or diagnostics.
     */
    String displayName();

    /**
     * @return {@code true} unless this is {@link Unknown}.
     */
    default boolean isKnown() {
        return !(this instanceof Unknown);
    }

    /**
     * A primitive value type.
     * @param kind The primitive kind.
     */
    record Primitive(PrimitiveKind kind) implements Type {
        @Override
        public String displayName() {
            return kind.displayName();
        }

        @Override
        public String toString() {
            return displayName();
        }
    }

    /**
     * The type of a function.
     * @param parameterTypes The parameter types, in order.
     * @param returnType The result type.
     */
    record Function(List<Type> parameterTypes, Type returnType) implements Type {
        public Function {
            parameterTypes = List.copyOf(parameterTypes);
        }

        @Override
        public String displayName() {
            return "fn(" + parameterTypes.stream().map(Type::displayName).collect(Collectors.joining(", ")) + "): "
                    + returnType.displayName();
        }

        @Override
        public String toString() {
            return displayName();
        }
    }

    /**
     * A type that is not known (yet). Checks involving it are skipped to avoid follow-on errors.
     */
    record Unknown() implements Type {
        @Override
        public String displayName() {
            return "Unknown";
        }

        @Override
        public String toString() {
            return displayName();
        }
    }
}
