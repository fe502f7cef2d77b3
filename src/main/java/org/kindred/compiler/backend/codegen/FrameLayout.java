package org.kindred.compiler.backend.codegen;

import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrOperand;

/**
 * The stack frame of one function under frame-slot allocation.
 * <p>
 * Slot {@code k} lives at {@code -8*(k+1)(%rbp)}. Parameters take the first slots, then the
 * locals in declaration order, then the temporaries in number order. The frame size is
 * rounded up to a multiple of 16 so that calls see an aligned stack.
 */
public final class FrameLayout {

    private static final int SLOT_SIZE = 8;
    private static final int STACK_ALIGNMENT = 16;

    private final int variableCount;
    private final int slotCount;

    private FrameLayout(int variableCount, int temporaryCount) {
        this.variableCount = variableCount;
        this.slotCount = variableCount + temporaryCount;
    }

    /**
     * @param function The function to lay out.
     * @return Its frame.
     */
    public static FrameLayout of(IrFunction function) {
        return new FrameLayout(function.parameters().size() + function.locals().size(), function.temporaryCount());
    }

    /**
     * @return The number of bytes to reserve below {@code %rbp}.
     */
    public int frameSize() {
        int bytes = slotCount * SLOT_SIZE;
        return (bytes + STACK_ALIGNMENT - 1) / STACK_ALIGNMENT * STACK_ALIGNMENT;
    }

    /**
     * @param var A parameter or local.
     * @return Its memory operand.
     */
    public String slot(IrOperand.Var var) {
        return address(var.index());
    }

    /**
     * @param temp A temporary.
     * @return Its memory operand.
     */
    public String slot(IrOperand.Temp temp) {
        return address(variableCount + temp.index());
    }

    private String address(int slot) {
        if (slot < 0 || slot >= slotCount) {
            throw new IllegalStateException("Frame slot " + slot + " outside of frame with " + slotCount + " slots");
        }
        return "-" + SLOT_SIZE * (slot + 1) + "(%rbp)";
    }
}
