package org.kindred.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents an instruction in the intermediate representation.
 *
 * @param opcode The operation.
 * @param result The temporary receiving the result, or {@code null} for instructions without one.
 * @param operands The operands, in the order listed for each {@link Opcode}.
 */
public record IrInstruction(Opcode opcode, IrOperand.Temp result, List<IrOperand> operands) {

    public IrInstruction {
        operands = List.copyOf(operands);
    }

    /**
     * @param index The operand position.
     * @return The operand at {@code index}.
     */
    public IrOperand operand(int index) {
        return operands.get(index);
    }

    @Override
    public String toString() {
        String rendered = opcode.mnemonic();
        if (!operands.isEmpty()) {
            rendered += " " + operands.stream().map(IrOperand::toString).collect(Collectors.joining(", "));
        }
        return result == null ? rendered : result + " = " + rendered;
    }
}
