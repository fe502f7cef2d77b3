package org.kindred.compiler.ir;

import java.util.List;

/**
 * A maximal straight-line sequence of instructions. Only the last instruction transfers
 * control, and every block has one.
 *
 * @param label The label that jumps target.
 * @param instructions The instructions, ending in a terminator.
 */
public record BasicBlock(IrOperand.Label label, List<IrInstruction> instructions) {

    public BasicBlock {
        instructions = List.copyOf(instructions);
        if (instructions.isEmpty() || !instructions.get(instructions.size() - 1).opcode().isTerminator()) {
            throw new IllegalStateException("Basic block " + label + " does not end in a terminator");
        }
    }

    /**
     * @return The final control transfer.
     */
    public IrInstruction terminator() {
        return instructions.get(instructions.size() - 1);
    }
}
