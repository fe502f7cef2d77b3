package org.kindred.compiler.frontend.lexer;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand through {@link #next()} and {@link #peek()}. Lexical errors
 * never stop the scan: the offending lexeme becomes an {@link TokenType#ERROR} token, the
 * error is reported to the diagnostics engine and scanning resumes behind it.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", TokenType.FN,
            "let", TokenType.LET,
            "var", TokenType.VAR,
            "if", TokenType.IF,
            "else", TokenType.ELSE,
            "while", TokenType.WHILE,
            "for", TokenType.FOR,
            "return", TokenType.RETURN,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private Token peeked;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * @return The file name used in the spans of all produced tokens.
     */
    public String fileName() {
        return logicalFileName;
    }

    /**
     * Returns the next token without consuming it.
     * @return The upcoming token; END_OF_FILE once the input is exhausted.
     */
    public Token peek() {
        if (peeked == null) {
            peeked = scanToken();
        }
        return peeked;
    }

    /**
     * Consumes and returns the next token. After the end of the input has been reached,
     * every call returns an END_OF_FILE token.
     * @return The consumed token.
     */
    public Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    /**
     * Performs the tokenization of the remaining source code.
     * @return A list of the recognized tokens, terminated by END_OF_FILE.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    private Token scanToken() {
        skipWhitespaceAndComments();
        markStart();
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, "", null, new Span(logicalFileName, line, column, 0));
        }

        char c = advance();
        switch (c) {
            case '(': return makeToken(TokenType.LEFT_PAREN);
            case ')': return makeToken(TokenType.RIGHT_PAREN);
            case '{': return makeToken(TokenType.LEFT_BRACE);
            case '}': return makeToken(TokenType.RIGHT_BRACE);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case ':': return makeToken(TokenType.COLON);
            case '+': return makeToken(TokenType.PLUS);
            case '-': return makeToken(TokenType.MINUS);
            case '*': return makeToken(TokenType.STAR);
            case '/': return makeToken(TokenType.SLASH);
            case '%': return makeToken(TokenType.PERCENT);
            case '=': return makeToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
            case '!': return makeToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '<': return makeToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>': return makeToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&':
                if (match('&')) return makeToken(TokenType.AND_AND);
                return errorToken(ErrorCode.UNEXPECTED_CHAR, "Unexpected character '&', expected '&&'.");
            case '|':
                if (match('|')) return makeToken(TokenType.OR_OR);
                return errorToken(ErrorCode.UNEXPECTED_CHAR, "Unexpected character '|', expected '||'.");
            case '"':
                return string();
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                return errorToken(ErrorCode.UNEXPECTED_CHAR, "Unexpected character '" + c + "'.");
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peekChar();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // A comment goes until the end of the line.
                while (!isAtEnd() && peekChar() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else {
                return;
            }
        }
    }

    private void blockComment() {
        markStart();
        advance();
        advance();
        while (!isAtEnd()) {
            if (peekChar() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        diagnostics.reportError(ErrorCode.UNTERMINATED_COMMENT, "Unterminated block comment.",
                new Span(logicalFileName, startLine, startColumn, 2));
    }

    private Token identifier() {
        while (isAlphaNumeric(peekChar())) advance();
        String text = source.substring(start, current);
        return makeToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private Token number() {
        while (isDigit(peekChar())) advance();
        boolean isFloat = false;
        if (peekChar() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // consume the '.'
            while (isDigit(peekChar())) advance();
        }

        String numberString = source.substring(start, current);
        if (isFloat) {
            return makeToken(TokenType.FLOAT, Double.parseDouble(numberString));
        }
        try {
            return makeToken(TokenType.INT, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            return errorToken(ErrorCode.INVALID_NUMBER, "Integer literal '" + numberString + "' does not fit in 64 bits.");
        }
    }

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peekChar() != '"' && peekChar() != '\n') {
            char c = advance();
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (isAtEnd() || peekChar() == '\n') {
                break;
            }
            int escapeColumn = column - 1;
            char escaped = advance();
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case '\\' -> value.append('\\');
                case '"' -> value.append('"');
                case '0' -> value.append('\0');
                default -> diagnostics.reportError(ErrorCode.INVALID_ESCAPE,
                        "Invalid escape sequence '\\" + escaped + "'.",
                        new Span(logicalFileName, line, escapeColumn, 2));
            }
        }

        if (isAtEnd() || peekChar() == '\n') {
            // Resume at the line break so the following lines are scanned normally.
            return errorToken(ErrorCode.UNTERMINATED_STRING, "Unterminated string.");
        }

        // The closing "
        advance();
        return makeToken(TokenType.STRING, value.toString());
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        return new Token(type, text, literal, currentSpan());
    }

    private Token errorToken(ErrorCode code, String message) {
        Span span = currentSpan();
        diagnostics.reportError(code, message, span);
        return new Token(TokenType.ERROR, source.substring(start, current), null, span);
    }

    private Span currentSpan() {
        int length = line == startLine ? current - start : 1;
        return new Span(logicalFileName, startLine, startColumn, length);
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peekChar() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
