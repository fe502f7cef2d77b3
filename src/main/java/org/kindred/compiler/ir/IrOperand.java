package org.kindred.compiler.ir;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.frontend.types.Type;

/**
 * An operand of an {@link IrInstruction}. The set of operand forms is closed.
 */
public sealed interface IrOperand permits IrOperand.Temp, IrOperand.Const, IrOperand.FloatConst, IrOperand.Var,
        IrOperand.Global, IrOperand.StringRef, IrOperand.Label, IrOperand.FunctionRef {

    /**
     * A temporary holding the value of one subexpression. Numbered from 0 per function.
     * @param index The temporary number.
     */
    record Temp(int index) implements IrOperand {
        @Override
        public String toString() {
            return "t" + index;
        }
    }

    /**
     * A 64-bit integer constant. Booleans are 0 and 1.
     * @param value The value.
     */
    record Const(long value) implements IrOperand {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A floating-point constant. The x86-64 backend has no representation for it.
     * @param value The value.
     * @param span The literal it came from.
     */
    record FloatConst(double value, Span span) implements IrOperand {
        @Override
        public String toString() {
            return value + "f";
        }
    }

    /**
     * A parameter or local variable of the enclosing function.
     * @param name The source name.
     * @param index The position among the function's parameters followed by its locals.
     * @param type The variable type.
     * @param span The declaration.
     */
    record Var(String name, int index, Type type, Span span) implements IrOperand {
        @Override
        public String toString() {
            return name + "#" + index;
        }
    }

    /**
     * A global variable.
     * @param name The source name.
     * @param type The variable type.
     * @param span The declaration.
     */
    record Global(String name, Type type, Span span) implements IrOperand {
        @Override
        public String toString() {
            return "@" + name;
        }
    }

    /**
     * An entry of the program's string constant pool.
     * @param index The pool index.
     */
    record StringRef(int index) implements IrOperand {
        @Override
        public String toString() {
            return "s" + index;
        }
    }

    /**
     * A basic block label, unique within its function.
     * @param name The label name.
     */
    record Label(String name) implements IrOperand {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A called function.
     * @param name The source-level function name.
     * @param builtin {@code true} for functions supplied by the runtime support code.
     */
    record FunctionRef(String name, boolean builtin) implements IrOperand {
        @Override
        public String toString() {
            return (builtin ? "builtin " : "") + name;
        }
    }
}
