package org.kindred.compiler.backend.codegen;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.ir.BasicBlock;
import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrInstruction;
import org.kindred.compiler.ir.IrOperand;
import org.kindred.compiler.ir.Opcode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link FrameLayout}.
 */
public class FrameLayoutTest {

    private static final Span SPAN = new Span("test.kin", 1, 1, 1);

    private static IrOperand.Var var(String name, int index) {
        return new IrOperand.Var(name, index, Type.INT, SPAN);
    }

    private static IrFunction function(int parameters, int locals, int temporaries) {
        List<IrOperand.Var> params = new ArrayList<>();
        for (int i = 0; i < parameters; i++) {
            params.add(var("p" + i, i));
        }
        List<IrOperand.Var> localVars = new ArrayList<>();
        for (int i = 0; i < locals; i++) {
            localVars.add(var("l" + i, parameters + i));
        }
        BasicBlock entry = new BasicBlock(new IrOperand.Label("L0"),
                List.of(new IrInstruction(Opcode.RETURN, null, List.of())));
        return new IrFunction("f", params, localVars, temporaries, List.of(entry), Type.UNIT, SPAN);
    }

    /**
     * Verifies that variables come before temporaries and each slot is 8 bytes.
     */
    @Test
    @Tag("unit")
    void testSlotOrder() {
        // Arrange
        IrFunction function = function(2, 1, 2);

        // Act
        FrameLayout frame = FrameLayout.of(function);

        // Assert
        assertThat(frame.slot(function.parameters().get(0))).isEqualTo("-8(%rbp)");
        assertThat(frame.slot(function.parameters().get(1))).isEqualTo("-16(%rbp)");
        assertThat(frame.slot(function.locals().get(0))).isEqualTo("-24(%rbp)");
        assertThat(frame.slot(new IrOperand.Temp(0))).isEqualTo("-32(%rbp)");
        assertThat(frame.slot(new IrOperand.Temp(1))).isEqualTo("-40(%rbp)");
    }

    /**
     * Verifies that the frame size is rounded up to the stack alignment.
     */
    @Test
    @Tag("unit")
    void testFrameSizeIsAligned() {
        assertThat(FrameLayout.of(function(0, 0, 0)).frameSize()).isZero();
        assertThat(FrameLayout.of(function(0, 0, 1)).frameSize()).isEqualTo(16);
        assertThat(FrameLayout.of(function(1, 0, 1)).frameSize()).isEqualTo(16);
        assertThat(FrameLayout.of(function(2, 1, 2)).frameSize()).isEqualTo(48);
    }

    /**
     * Verifies that a temporary outside of the function is rejected.
     */
    @Test
    @Tag("unit")
    void testUnknownTemporaryIsRejected() {
        // Arrange
        FrameLayout frame = FrameLayout.of(function(0, 0, 1));

        // Act & Assert
        assertThatThrownBy(() -> frame.slot(new IrOperand.Temp(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("outside of frame");
    }
}
