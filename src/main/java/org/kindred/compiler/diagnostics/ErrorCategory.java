package org.kindred.compiler.diagnostics;

/**
 * The coarse error taxonomy of the compiler. Each category corresponds to the
 * stage that reports it.
 */
public enum ErrorCategory {
    /** Errors found while splitting the source into tokens. */
    LEX("LexError"),
    /** Syntax errors. */
    PARSE("ParseError"),
    /** Name resolution errors. */
    NAME("NameError"),
    /** Type checking errors. */
    TYPE("TypeError"),
    /** Constructs the code generator cannot translate. */
    CODEGEN("CodegenError"),
    /** Failures of the external assembler/linker. */
    BUILD("BuildError"),
    /** Unreadable sources and unwritable outputs. */
    IO("IoError");

    private final String displayName;

    ErrorCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
