package org.kindred.compiler.frontend;

import org.kindred.compiler.diagnostics.Diagnostic;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.lexer.Lexer;
import org.kindred.compiler.frontend.parser.Parser;
import org.kindred.compiler.frontend.parser.ast.AstDumper;
import org.kindred.compiler.frontend.parser.ast.AstPrinter;
import org.kindred.compiler.frontend.parser.ast.Expr;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.parser.ast.Stmt;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * Trees are compared through their {@link AstDumper} rendering, which ignores source spans.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private Parser parserFor(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics), diagnostics);
    }

    private Program parse(String source) {
        return parserFor(source).parse();
    }

    /**
     * Verifies that an assignment statement produces the expected tree.
     */
    @Test
    @Tag("unit")
    void testAssignmentStatement() {
        // Act
        Stmt stmt = parserFor("x = 1 + 2;").statement();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(AstDumper.dump(stmt)).isEqualTo("AssignmentStmt(Identifier(x), BinaryExpr(+, Int(1), Int(2)))");
    }

    /**
     * Verifies precedence and left associativity of the binary operators.
     */
    @Test
    @Tag("unit")
    void testOperatorPrecedence() {
        // Act
        Expr arithmetic = parserFor("1 + 2 * 3 - 4").expression();
        Expr logical = parserFor("a || b && c == d < e").expression();
        Expr unary = parserFor("-a * !b").expression();

        // Assert
        assertThat(AstDumper.dump(arithmetic))
                .isEqualTo("BinaryExpr(-, BinaryExpr(+, Int(1), BinaryExpr(*, Int(2), Int(3))), Int(4))");
        assertThat(AstDumper.dump(logical)).isEqualTo(
                "BinaryExpr(||, Identifier(a), BinaryExpr(&&, Identifier(b), "
                        + "BinaryExpr(==, Identifier(c), BinaryExpr(<, Identifier(d), Identifier(e)))))");
        assertThat(AstDumper.dump(unary))
                .isEqualTo("BinaryExpr(*, UnaryExpr(-, Identifier(a)), UnaryExpr(!, Identifier(b)))");
    }

    /**
     * Verifies that parentheses override precedence and calls chain.
     */
    @Test
    @Tag("unit")
    void testGroupingAndCalls() {
        // Act
        Expr expr = parserFor("(1 + 2) * f(x, g())").expression();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(AstDumper.dump(expr)).isEqualTo(
                "BinaryExpr(*, BinaryExpr(+, Int(1), Int(2)), Call(Identifier(f), [Identifier(x), Call(Identifier(g), [])]))");
    }

    /**
     * Verifies a full program with functions, globals and control flow.
     */
    @Test
    @Tag("unit")
    void testProgramStructure() {
        // Arrange
        String source = String.join("\n",
                "let limit: Int = 3;",
                "fn add(a: Int, b: Int): Int { return a + b; }",
                "fn main() {",
                "    var i = 0;",
                "    while i < limit { i = i + 1; }",
                "    if i == 3 { print(i); } else if false { } else { return; }",
                "}");

        // Act
        Program program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(AstDumper.dump(program)).isEqualTo("Program("
                + "VarDecl(let limit: Int, Int(3)), "
                + "FunctionDecl(add, [Param(a: Int), Param(b: Int)], Int, Block(Return(BinaryExpr(+, Identifier(a), Identifier(b))))), "
                + "FunctionDecl(main, [], Unit, Block("
                + "VarDecl(var i: _, Int(0)), "
                + "While(BinaryExpr(<, Identifier(i), Identifier(limit)), Block(AssignmentStmt(Identifier(i), BinaryExpr(+, Identifier(i), Int(1))))), "
                + "If(BinaryExpr(==, Identifier(i), Int(3)), Block(ExpressionStmt(Call(Identifier(print), [Identifier(i)]))), "
                + "If(Bool(false), Block(), Block(Return()))))))");
    }

    /**
     * Verifies that the parser recovers after each error and reports all of them in one run.
     */
    @Test
    @Tag("unit")
    void testErrorRecoveryReportsEveryError() {
        // Arrange
        String source = String.join("\n",
                "fn main() {",
                "    let x = ;",
                "    let y = 1 +;",
                "    x = 2",
                "    let z = 3;",
                "}");

        // Act
        Program program = parse(source);

        // Assert
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(
                ErrorCode.EXPECTED_EXPRESSION, ErrorCode.EXPECTED_EXPRESSION, ErrorCode.EXPECTED_TOKEN);
        assertThat(diagnostics.errors()).extracting(d -> d.span().line()).containsExactly(2, 3, 5);
        assertThat(AstDumper.dump(program)).isEqualTo("Program(FunctionDecl(main, [], Unit, Block(VarDecl(let z: _, Int(3)))))");
    }

    /**
     * Verifies that the reserved 'for' keyword cannot start a statement.
     */
    @Test
    @Tag("unit")
    void testForIsRejected() {
        // Act
        parse("fn main() { for i { } }");

        // Assert
        assertThat(diagnostics.errors()).isNotEmpty();
        assertThat(diagnostics.errors().get(0).code()).isEqualTo(ErrorCode.UNEXPECTED_TOKEN);
    }

    /**
     * Verifies that only identifiers can be assigned to.
     */
    @Test
    @Tag("unit")
    void testInvalidAssignmentTarget() {
        // Act
        parse("fn main() { f() = 1; 3 = 4; }");

        // Assert
        assertThat(diagnostics.errors()).extracting(Diagnostic::code)
                .containsExactly(ErrorCode.INVALID_ASSIGNMENT_TARGET, ErrorCode.INVALID_ASSIGNMENT_TARGET);
    }

    /**
     * Verifies that a statement at top level is rejected and parsing continues.
     */
    @Test
    @Tag("unit")
    void testTopLevelStatementIsRejected() {
        // Act
        Program program = parse("print(1);\nfn main() { }");

        // Assert
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(ErrorCode.UNEXPECTED_TOKEN);
        assertThat(AstDumper.dump(program)).isEqualTo("Program(FunctionDecl(main, [], Unit, Block()))");
    }

    /**
     * Verifies that a lexical error token is not reported a second time by the parser.
     */
    @Test
    @Tag("unit")
    void testLexErrorIsNotReportedTwice() {
        // Act
        parse("let a = @;");

        // Assert
        assertThat(diagnostics.errors()).extracting(Diagnostic::code).containsExactly(ErrorCode.UNEXPECTED_CHAR);
    }

    /**
     * Verifies that printing a tree and parsing the result gives a structurally equal tree.
     */
    @Test
    @Tag("unit")
    void testPrintedProgramReparsesToSameTree() {
        // Arrange
        String source = String.join("\n",
                "var counter = 0;",
                "fn step(n: Int): Int { if n % 2 == 0 { return n / 2; } return 3 * n + 1; }",
                "fn main(): Int {",
                "    let s: String = \"tab\\tquote\\\"\";",
                "    let f = 1.5;",
                "    while counter < 10 && !(counter == 7) { counter = counter + step(counter); }",
                "    { print_str(s); }",
                "    return -(1 - 2 - 3);",
                "}");
        Program original = parse(source);
        assertThat(diagnostics.hasErrors()).isFalse();

        // Act
        String printed = AstPrinter.print(original);
        Program reparsed = parse(printed);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(AstDumper.dump(reparsed)).isEqualTo(AstDumper.dump(original));
    }
}
