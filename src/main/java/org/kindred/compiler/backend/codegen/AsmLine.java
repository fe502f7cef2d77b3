package org.kindred.compiler.backend.codegen;

import java.util.List;

/**
 * One line of a GNU assembler listing in AT&T syntax.
 */
public sealed interface AsmLine permits AsmLine.Directive, AsmLine.Label, AsmLine.Instruction, AsmLine.Blank {

    /**
     * @return The line as it appears in the {@code .s} file, without line terminator.
     */
    String render();

    /**
     * An assembler directive such as {@code .text} or {@code .quad 0}.
     * @param text The directive with its arguments.
     */
    record Directive(String text) implements AsmLine {
        @Override
        public String render() {
            return "    " + text;
        }
    }

    /**
     * A label definition.
     * @param name The symbol name.
     */
    record Label(String name) implements AsmLine {
        @Override
        public String render() {
            return name + ":";
        }
    }

    /**
     * A machine instruction.
     * @param mnemonic The AT&T mnemonic, e.g. {@code movq}.
     * @param operands Source operands first, destination last.
     */
    record Instruction(String mnemonic, List<String> operands) implements AsmLine {
        public Instruction {
            operands = List.copyOf(operands);
        }

        @Override
        public String render() {
            return operands.isEmpty() ? "    " + mnemonic : "    " + mnemonic + " " + String.join(", ", operands);
        }
    }

    /**
     * An empty separator line.
     */
    record Blank() implements AsmLine {
        @Override
        public String render() {
            return "";
        }
    }
}
