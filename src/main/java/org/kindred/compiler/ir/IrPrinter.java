package org.kindred.compiler.ir;

import java.util.stream.Collectors;

/**
 * Renders an {@link IrProgram} as text for debug builds and tests. The output is a pure
 * function of the program.
 */
public final class IrPrinter {

    private IrPrinter() {
    }

    /**
     * @param program The program to render.
     * @return The textual dump, one instruction per line.
     */
    public static String print(IrProgram program) {
        StringBuilder sb = new StringBuilder();
        for (IrOperand.Global global : program.globals()) {
            sb.append("global ").append(global).append(": ").append(global.type().displayName()).append('\n');
        }
        for (int i = 0; i < program.strings().size(); i++) {
            sb.append("string s").append(i).append(" = \"").append(escape(program.strings().get(i))).append("\"\n");
        }
        for (IrFunction function : program.allFunctions()) {
            sb.append('\n').append(print(function));
        }
        return sb.toString();
    }

    /**
     * @param function The function to render.
     * @return The textual dump of one function.
     */
    public static String print(IrFunction function) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(function.name()).append('(')
                .append(function.parameters().stream().map(p -> p + ": " + p.type().displayName())
                        .collect(Collectors.joining(", ")))
                .append("): ").append(function.returnType().displayName()).append('\n');
        if (!function.locals().isEmpty()) {
            sb.append("  locals ")
                    .append(function.locals().stream().map(l -> l + ": " + l.type().displayName())
                            .collect(Collectors.joining(", ")))
                    .append('\n');
        }
        for (BasicBlock block : function.blocks()) {
            sb.append(block.label()).append(":\n");
            for (IrInstruction instruction : block.instructions()) {
                sb.append("  ").append(instruction).append('\n');
            }
        }
        return sb.toString();
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
