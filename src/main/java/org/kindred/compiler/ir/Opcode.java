package org.kindred.compiler.ir;

import java.util.Locale;

/**
 * The operations of the intermediate representation.
 */
public enum Opcode {
    /** {@code result = const} */
    CONST,
    /** {@code result = var} */
    LOAD_VAR,
    /** {@code var = operand} */
    STORE_VAR,
    /** {@code result = global} */
    LOAD_GLOBAL,
    /** {@code global = operand} */
    STORE_GLOBAL,
    ADD,
    SUB,
    MUL,
    DIV,
    MOD,
    NEG,
    NOT,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    /** {@code [result =] call function(args...)} */
    CALL,
    /** {@code result = address of string constant} */
    STRING_ADDR,
    /** {@code result = operand} */
    COPY,
    /** Unconditional jump; a terminator. */
    JUMP,
    /** {@code branch cond, ifTrue, ifFalse}; a terminator. */
    BRANCH,
    /** Return with an optional value; a terminator. */
    RETURN;

    /**
     * @return {@code true} if the opcode ends a basic block.
     */
    public boolean isTerminator() {
        return this == JUMP || this == BRANCH || this == RETURN;
    }

    /**
     * @return The lower-case mnemonic used in IR dumps.
     */
    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }
}
