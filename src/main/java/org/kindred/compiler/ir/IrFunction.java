package org.kindred.compiler.ir;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.frontend.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * A lowered function.
 *
 * @param name The source-level name; {@link IrProgram#INIT_FUNCTION} for the global initializer.
 * @param parameters The parameters, in order.
 * @param locals All local variables of the body, in declaration order.
 * @param temporaryCount The number of temporaries {@code t0 .. t(n-1)}.
 * @param blocks The basic blocks; the first is the entry block.
 * @param returnType The declared result type.
 * @param span The function's declaration.
 */
public record IrFunction(
        String name,
        List<IrOperand.Var> parameters,
        List<IrOperand.Var> locals,
        int temporaryCount,
        List<BasicBlock> blocks,
        Type returnType,
        Span span
) {
    public IrFunction {
        parameters = List.copyOf(parameters);
        locals = List.copyOf(locals);
        blocks = List.copyOf(blocks);
    }

    /**
     * @return Parameters followed by locals, indexed by {@link IrOperand.Var#index()}.
     */
    public List<IrOperand.Var> variables() {
        List<IrOperand.Var> variables = new ArrayList<>(parameters);
        variables.addAll(locals);
        return variables;
    }
}
