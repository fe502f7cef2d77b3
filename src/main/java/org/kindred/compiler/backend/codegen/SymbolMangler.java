package org.kindred.compiler.backend.codegen;

/**
 * Maps source-level names to assembler symbols. User functions get the prefix {@code kin_},
 * globals {@code kinvar_} and runtime helpers {@code kinrt_}, so none of them can collide with
 * each other or with C library symbols. Characters outside {@code [A-Za-z0-9_]} are written as
 * {@code _u} followed by four hex digits of the UTF-16 code unit.
 */
final class SymbolMangler {

    private SymbolMangler() {
    }

    static String function(String name) {
        return "kin_" + escape(name);
    }

    static String global(String name) {
        return "kinvar_" + escape(name);
    }

    static String builtin(String name) {
        return "kinrt_" + escape(name);
    }

    static String escape(String name) {
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
                sb.append(c);
            } else {
                sb.append(String.format("_u%04x", (int) c));
            }
        }
        return sb.toString();
    }
}
