package org.kindred.compiler.backend.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, append-only sequence of assembly lines that renders to the contents of a
 * {@code .s} file.
 */
public final class AssemblyListing {

    private final List<AsmLine> lines = new ArrayList<>();

    public void directive(String text) {
        lines.add(new AsmLine.Directive(text));
    }

    public void label(String name) {
        lines.add(new AsmLine.Label(name));
    }

    public void instruction(String mnemonic, String... operands) {
        lines.add(new AsmLine.Instruction(mnemonic, List.of(operands)));
    }

    public void blank() {
        lines.add(new AsmLine.Blank());
    }

    public List<AsmLine> lines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return The listing text, every line terminated by {@code \n}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (AsmLine line : lines) {
            sb.append(line.render()).append('\n');
        }
        return sb.toString();
    }
}
