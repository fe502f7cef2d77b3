package org.kindred.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable, function or type name. */
    IDENTIFIER("Identifier"),
    /** A 64-bit integer literal. */
    INT("Int"),
    /** A floating-point literal. */
    FLOAT("Float"),
    /** A string literal; the token value holds the unescaped content. */
    STRING("String"),

    // Keywords.
    FN("Fn"),
    LET("Let"),
    VAR("Var"),
    IF("If"),
    ELSE("Else"),
    WHILE("While"),
    /** Reserved; there is no for-statement. */
    FOR("For"),
    RETURN("Return"),
    TRUE("True"),
    FALSE("False"),

    // Operators.
    PLUS("Plus"),
    MINUS("Minus"),
    STAR("Star"),
    SLASH("Slash"),
    PERCENT("Percent"),
    ASSIGN("Assign"),
    EQUAL_EQUAL("EqualEqual"),
    BANG_EQUAL("BangEqual"),
    LESS("Less"),
    LESS_EQUAL("LessEqual"),
    GREATER("Greater"),
    GREATER_EQUAL("GreaterEqual"),
    AND_AND("AndAnd"),
    OR_OR("OrOr"),
    BANG("Bang"),

    // Punctuation.
    LEFT_PAREN("LeftParen"),
    RIGHT_PAREN("RightParen"),
    LEFT_BRACE("LeftBrace"),
    RIGHT_BRACE("RightBrace"),
    COMMA("Comma"),
    SEMICOLON("Semicolon"),
    COLON("Colon"),

    // Miscellaneous.
    /** A lexeme that could not be tokenized; the lexer has already reported it. */
    ERROR("Error"),
    /** Represents the end of the source file. */
    END_OF_FILE("EndOfInput");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
