package org.kindred.compiler.diagnostics;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum ErrorCode {
    // region Lexer Errors
    /** A string literal was not closed before the end of the line or file. */
    UNTERMINATED_STRING(ErrorCategory.LEX, "UnterminatedString"),
    /** A backslash in a string literal was followed by an unknown character. */
    INVALID_ESCAPE(ErrorCategory.LEX, "InvalidEscape"),
    /** A character that cannot start any token. */
    UNEXPECTED_CHAR(ErrorCategory.LEX, "UnexpectedChar"),
    /** A numeric literal that does not fit the target type. */
    INVALID_NUMBER(ErrorCategory.LEX, "InvalidNumber"),
    /** A block comment was not closed before the end of the file. */
    UNTERMINATED_COMMENT(ErrorCategory.LEX, "UnterminatedComment"),
    // endregion

    // region Parser Errors
    /** A token that does not fit the grammar at its position. */
    UNEXPECTED_TOKEN(ErrorCategory.PARSE, "UnexpectedToken"),
    /** A specific token (e.g. ';') was required but missing. */
    EXPECTED_TOKEN(ErrorCategory.PARSE, "ExpectedToken"),
    /** An expression was required but missing. */
    EXPECTED_EXPRESSION(ErrorCategory.PARSE, "ExpectedExpression"),
    /** The left-hand side of '=' is not a plain identifier. */
    INVALID_ASSIGNMENT_TARGET(ErrorCategory.PARSE, "InvalidAssignmentTarget"),
    // endregion

    // region Name Resolution Errors
    /** An identifier that refers to no declaration. */
    UNDEFINED(ErrorCategory.NAME, "Undefined"),
    /** A name declared twice in the same scope. */
    DUPLICATE_DECLARATION(ErrorCategory.NAME, "DuplicateDeclaration"),
    /** A block-local name used before its declaration. */
    USED_BEFORE_DECLARATION(ErrorCategory.NAME, "UsedBeforeDeclaration"),
    /** A type annotation that names something other than a type. */
    NOT_A_TYPE(ErrorCategory.NAME, "NotAType"),
    // endregion

    // region Type Errors
    /** A value of one type was found where another was expected. */
    MISMATCH(ErrorCategory.TYPE, "Mismatch"),
    /** A call passes the wrong number of arguments. */
    ARITY_MISMATCH(ErrorCategory.TYPE, "ArityMismatch"),
    /** A call whose callee is not a function. */
    NOT_CALLABLE(ErrorCategory.TYPE, "NotCallable"),
    /** An assignment to a 'let' binding, a parameter or a function. */
    IMMUTABLE_ASSIGNMENT(ErrorCategory.TYPE, "ImmutableAssignment"),
    /** An operator applied to operand types it does not support. */
    INVALID_OPERAND(ErrorCategory.TYPE, "InvalidOperand"),
    /** A function name used as a value rather than called. */
    FUNCTION_AS_VALUE(ErrorCategory.TYPE, "FunctionAsValue"),
    /** A function with a non-Unit result whose body can end without returning. */
    MISSING_RETURN(ErrorCategory.TYPE, "MissingReturn"),
    /** The program has no usable 'main' function. */
    INVALID_ENTRY_POINT(ErrorCategory.TYPE, "InvalidEntryPoint"),
    /** A global whose inferred type depends on its own initializer. */
    CYCLIC_INITIALIZER(ErrorCategory.TYPE, "CyclicInitializer"),
    // endregion

    // region Code Generation Errors
    /** A value type the backend has no representation for. */
    UNSUPPORTED_TYPE(ErrorCategory.CODEGEN, "UnsupportedType"),
    /** A function or call with more arguments than the calling convention passes in registers. */
    TOO_MANY_ARGUMENTS(ErrorCategory.CODEGEN, "TooManyArguments"),
    // endregion

    // region Build Errors
    /** The assembler/linker exited with a non-zero status. */
    TOOLCHAIN_FAILURE(ErrorCategory.BUILD, "ToolchainFailure"),
    /** The assembler/linker binary could not be started. */
    TOOLCHAIN_NOT_FOUND(ErrorCategory.BUILD, "ToolchainNotFound"),
    /** The assembler/linker did not finish within the configured timeout. */
    TOOLCHAIN_TIMEOUT(ErrorCategory.BUILD, "ToolchainTimeout"),
    // endregion

    // region I/O Errors
    /** The source file is missing or unreadable. */
    SOURCE_NOT_READABLE(ErrorCategory.IO, "SourceNotReadable"),
    /** The output directory or one of its files cannot be written. */
    OUTPUT_NOT_WRITABLE(ErrorCategory.IO, "OutputNotWritable");
    // endregion

    private final ErrorCategory category;
    private final String variantName;

    ErrorCode(ErrorCategory category, String variantName) {
        this.category = category;
        this.variantName = variantName;
    }

    public ErrorCategory category() {
        return category;
    }

    public String variantName() {
        return variantName;
    }

    /**
     * @return The user-facing kind, e.g. {@code TypeError.Mismatch}.
     */
    public String displayName() {
        return category.displayName() + "." + variantName;
    }
}
