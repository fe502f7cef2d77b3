package org.kindred.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a complete program in the intermediate representation.
 *
 * @param functions The user functions in source order.
 * @param initializer The synthetic function that assigns the globals, run before {@code main}.
 * @param globals The global variables in declaration order.
 * @param strings The string constant pool, in first-use order.
 * @param entryReturnsValue Whether the user's {@code main} returns an {@code Int} exit status.
 */
public record IrProgram(
        List<IrFunction> functions,
        IrFunction initializer,
        List<IrOperand.Global> globals,
        List<String> strings,
        boolean entryReturnsValue
) {
    /** The name of the synthetic global initializer. */
    public static final String INIT_FUNCTION = "$init";
    /** The name of the user entry point. */
    public static final String ENTRY_FUNCTION = "main";

    public IrProgram {
        functions = List.copyOf(functions);
        globals = List.copyOf(globals);
        strings = List.copyOf(strings);
    }

    /**
     * @return The initializer followed by all user functions.
     */
    public List<IrFunction> allFunctions() {
        List<IrFunction> all = new ArrayList<>();
        all.add(initializer);
        all.addAll(functions);
        return all;
    }
}
