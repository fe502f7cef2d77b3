package org.kindred.compiler.frontend.parser;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.lexer.Lexer;
import org.kindred.compiler.frontend.lexer.Token;
import org.kindred.compiler.frontend.lexer.TokenType;
import org.kindred.compiler.frontend.parser.ast.AssignmentStmt;
import org.kindred.compiler.frontend.parser.ast.BinaryExpr;
import org.kindred.compiler.frontend.parser.ast.BinaryOperator;
import org.kindred.compiler.frontend.parser.ast.Block;
import org.kindred.compiler.frontend.parser.ast.CallExpr;
import org.kindred.compiler.frontend.parser.ast.Expr;
import org.kindred.compiler.frontend.parser.ast.ExpressionStmt;
import org.kindred.compiler.frontend.parser.ast.FunctionDecl;
import org.kindred.compiler.frontend.parser.ast.IdentifierExpr;
import org.kindred.compiler.frontend.parser.ast.IfStmt;
import org.kindred.compiler.frontend.parser.ast.Item;
import org.kindred.compiler.frontend.parser.ast.LiteralExpr;
import org.kindred.compiler.frontend.parser.ast.Param;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.parser.ast.ReturnStmt;
import org.kindred.compiler.frontend.parser.ast.Stmt;
import org.kindred.compiler.frontend.parser.ast.TypeRef;
import org.kindred.compiler.frontend.parser.ast.UnaryExpr;
import org.kindred.compiler.frontend.parser.ast.UnaryOperator;
import org.kindred.compiler.frontend.parser.ast.VarDecl;
import org.kindred.compiler.frontend.parser.ast.WhileStmt;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The parser for Kindred source. It pulls tokens from the {@link Lexer} and produces an
 * Abstract Syntax Tree (AST): recursive descent for declarations and statements,
 * precedence climbing for expressions.
 * <p>
 * Syntax errors are reported to the diagnostics engine and never abort the parse. After an
 * error the parser discards tokens up to the next statement boundary and continues, so one
 * run reports every independent error and returns a partial tree. Errors located at an
 * {@link TokenType#ERROR} token are not reported again, the lexer already did.
 */
public class Parser {

    private static final Set<TokenType> STATEMENT_START = EnumSet.of(
            TokenType.FN, TokenType.LET, TokenType.VAR, TokenType.IF,
            TokenType.WHILE, TokenType.RETURN, TokenType.FOR);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private Token previous;
    private int consumed = 0;

    /**
     * Constructs a new Parser.
     * @param lexer The token source.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The program; items that failed to parse are left out.
     */
    public Program parse() {
        List<Item> items = new ArrayList<>();
        while (!isAtEnd()) {
            Item item = item();
            if (item != null) {
                items.add(item);
            }
        }
        return new Program(items, new Span(lexer.fileName(), 1, 1, 0));
    }

    /**
     * Parses a single top-level declaration.
     * @return The parsed {@link Item}, or null if an error occurs.
     */
    public Item item() {
        int start = consumed;
        try {
            if (match(TokenType.FN)) {
                return functionDeclaration();
            }
            if (match(TokenType.LET, TokenType.VAR)) {
                return varDeclaration();
            }
            throw error(peek(), ErrorCode.UNEXPECTED_TOKEN,
                    "Expected 'fn', 'let' or 'var' at top level, but found " + describe(peek()) + ".");
        } catch (SyncException e) {
            synchronize(start);
            return null;
        }
    }

    /**
     * Parses a single statement.
     * @return The parsed {@link Stmt}, or null if an error occurs.
     */
    public Stmt statement() {
        int start = consumed;
        try {
            return statementOrThrow();
        } catch (SyncException e) {
            synchronize(start);
            return null;
        }
    }

    private Stmt statementOrThrow() {
        if (match(TokenType.LET, TokenType.VAR)) return varDeclaration();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.LEFT_BRACE)) return blockBody(previous);
        if (check(TokenType.FOR)) {
            throw error(peek(), ErrorCode.UNEXPECTED_TOKEN, "'for' is reserved and cannot start a statement.");
        }
        if (check(TokenType.FN)) {
            throw error(peek(), ErrorCode.UNEXPECTED_TOKEN, "Functions can only be declared at top level.");
        }
        return expressionStatement();
    }

    private FunctionDecl functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "function name after 'fn'");
        consume(TokenType.LEFT_PAREN, "'(' after function name");
        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token paramName = consume(TokenType.IDENTIFIER, "parameter name");
                consume(TokenType.COLON, "':' after parameter name");
                params.add(new Param(paramName.text(), typeRef(), paramName.span()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after parameters");
        TypeRef returnType = null;
        if (match(TokenType.COLON)) {
            returnType = typeRef();
        }
        Token brace = consume(TokenType.LEFT_BRACE, "'{' before function body");
        return new FunctionDecl(name.text(), params, returnType, blockBody(brace), name.span());
    }

    private VarDecl varDeclaration() {
        boolean mutable = previous.type() == TokenType.VAR;
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        TypeRef type = null;
        if (match(TokenType.COLON)) {
            type = typeRef();
        }
        consume(TokenType.ASSIGN, "'=' in variable declaration");
        Expr initializer = expression();
        consume(TokenType.SEMICOLON, "';' after variable declaration");
        return new VarDecl(name.text(), mutable, type, initializer, name.span());
    }

    private TypeRef typeRef() {
        Token name = consume(TokenType.IDENTIFIER, "type name");
        return new TypeRef(name.text(), name.span());
    }

    private Block blockBody(Token openingBrace) {
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt stmt = statement();
            if (stmt != null) {
                statements.add(stmt);
            }
        }
        consume(TokenType.RIGHT_BRACE, "'}' to close the block");
        return new Block(statements, openingBrace.span());
    }

    private Block block() {
        Token brace = consume(TokenType.LEFT_BRACE, "'{'");
        return blockBody(brace);
    }

    private IfStmt ifStatement() {
        Token keyword = previous;
        Expr condition = expression();
        Block thenBranch = block();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = match(TokenType.IF) ? ifStatement() : block();
        }
        return new IfStmt(condition, thenBranch, elseBranch, keyword.span());
    }

    private WhileStmt whileStatement() {
        Token keyword = previous;
        Expr condition = expression();
        return new WhileStmt(condition, block(), keyword.span());
    }

    private ReturnStmt returnStatement() {
        Token keyword = previous;
        Expr value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "';' after return value");
        return new ReturnStmt(value, keyword.span());
    }

    private Stmt expressionStatement() {
        Expr expr = expression();
        if (match(TokenType.ASSIGN)) {
            Token equals = previous;
            Expr value = expression();
            consume(TokenType.SEMICOLON, "';' after assignment");
            if (expr instanceof IdentifierExpr target) {
                return new AssignmentStmt(target, value, equals.span());
            }
            diagnostics.reportError(ErrorCode.INVALID_ASSIGNMENT_TARGET,
                    "Only a variable name can be assigned to.", expr.span());
            return new ExpressionStmt(value, value.span());
        }
        consume(TokenType.SEMICOLON, "';' after expression");
        return new ExpressionStmt(expr, expr.span());
    }

    /**
     * Parses an expression.
     * @return The parsed {@link Expr}.
     */
    public Expr expression() {
        return binary(1);
    }

    private Expr binary(int minPrecedence) {
        Expr left = unary();
        while (true) {
            BinaryOperator operator = binaryOperator(peek().type());
            if (operator == null || operator.precedence() < minPrecedence) {
                return left;
            }
            Token operatorToken = advance();
            // All binary operators are left-associative.
            Expr right = binary(operator.precedence() + 1);
            left = new BinaryExpr(operator, left, right, operatorToken.span());
        }
    }

    private Expr unary() {
        if (match(TokenType.MINUS, TokenType.BANG)) {
            Token operatorToken = previous;
            UnaryOperator operator = operatorToken.type() == TokenType.MINUS ? UnaryOperator.NEGATE : UnaryOperator.NOT;
            return new UnaryExpr(operator, unary(), operatorToken.span());
        }
        return call();
    }

    private Expr call() {
        Expr expr = primary();
        while (match(TokenType.LEFT_PAREN)) {
            Token paren = previous;
            List<Expr> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "')' after arguments");
            expr = new CallExpr(expr, arguments, paren.span());
        }
        return expr;
    }

    private Expr primary() {
        Token token = peek();
        switch (token.type()) {
            case INT:
                advance();
                return new LiteralExpr(LiteralExpr.LiteralKind.INT, token.value(), token.span());
            case FLOAT:
                advance();
                return new LiteralExpr(LiteralExpr.LiteralKind.FLOAT, token.value(), token.span());
            case STRING:
                advance();
                return new LiteralExpr(LiteralExpr.LiteralKind.STRING, token.value(), token.span());
            case TRUE:
            case FALSE:
                advance();
                return new LiteralExpr(LiteralExpr.LiteralKind.BOOL, token.type() == TokenType.TRUE, token.span());
            case IDENTIFIER:
                advance();
                return new IdentifierExpr(token.text(), token.span());
            case LEFT_PAREN:
                advance();
                Expr inner = expression();
                consume(TokenType.RIGHT_PAREN, "')' after expression");
                return inner;
            default:
                throw error(token, ErrorCode.EXPECTED_EXPRESSION, "Expected expression, but found " + describe(token) + ".");
        }
    }

    private static BinaryOperator binaryOperator(TokenType type) {
        return switch (type) {
            case OR_OR -> BinaryOperator.OR;
            case AND_AND -> BinaryOperator.AND;
            case EQUAL_EQUAL -> BinaryOperator.EQUAL;
            case BANG_EQUAL -> BinaryOperator.NOT_EQUAL;
            case LESS -> BinaryOperator.LESS;
            case LESS_EQUAL -> BinaryOperator.LESS_EQUAL;
            case GREATER -> BinaryOperator.GREATER;
            case GREATER_EQUAL -> BinaryOperator.GREATER_EQUAL;
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUBTRACT;
            case STAR -> BinaryOperator.MULTIPLY;
            case SLASH -> BinaryOperator.DIVIDE;
            case PERCENT -> BinaryOperator.REMAINDER;
            default -> null;
        };
    }

    /**
     * Discards tokens until a statement boundary: just behind a ';', or in front of a
     * statement keyword or a '}'. At least one token is consumed if the failed
     * production consumed none, which guarantees progress.
     */
    private void synchronize(int consumedAtStart) {
        if (consumed == consumedAtStart && !isAtEnd()) {
            advance();
        }
        while (!isAtEnd()) {
            if (previous != null && previous.type() == TokenType.SEMICOLON) return;
            if (STATEMENT_START.contains(peek().type()) || check(TokenType.RIGHT_BRACE)) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = lexer.next();
        if (token.type() != TokenType.END_OF_FILE) {
            consumed++;
        }
        previous = token;
        return token;
    }

    private boolean isAtEnd() {
        return check(TokenType.END_OF_FILE);
    }

    private Token peek() {
        return lexer.peek();
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), ErrorCode.EXPECTED_TOKEN, "Expected " + expected + ", but found " + describe(peek()) + ".");
    }

    private SyncException error(Token at, ErrorCode code, String message) {
        if (at.type() != TokenType.ERROR) {
            diagnostics.reportError(code, message, at.span());
        }
        return new SyncException();
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.END_OF_FILE) {
            return "end of input";
        }
        return "'" + token.text() + "'";
    }

    /**
     * Unwinds the current production after an error has been reported.
     */
    private static final class SyncException extends RuntimeException {
        SyncException() {
            super(null, null, false, false);
        }
    }
}
