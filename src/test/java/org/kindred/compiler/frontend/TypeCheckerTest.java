package org.kindred.compiler.frontend;

import org.kindred.compiler.diagnostics.Diagnostic;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.lexer.Lexer;
import org.kindred.compiler.frontend.parser.Parser;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.parser.ast.VarDecl;
import org.kindred.compiler.frontend.semantics.Bindings;
import org.kindred.compiler.frontend.semantics.Resolver;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.frontend.types.TypeChecker;
import org.kindred.compiler.frontend.types.TypedProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TypeChecker}.
 */
public class TypeCheckerTest {

    private DiagnosticsEngine diagnostics;

    private TypedProgram check(String... lines) {
        diagnostics = new DiagnosticsEngine();
        Program program = new Parser(new Lexer(String.join("\n", lines), diagnostics, "test.kin"), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as("source must parse").isFalse();
        Bindings bindings = new Resolver(diagnostics).resolve(program);
        return new TypeChecker(diagnostics).check(program, bindings);
    }

    private List<ErrorCode> errorCodes() {
        return diagnostics.errors().stream().map(Diagnostic::code).toList();
    }

    private Type globalType(TypedProgram typed, int itemIndex) {
        VarDecl global = (VarDecl) typed.program().items().get(itemIndex);
        return typed.typeOf(typed.bindings().symbolOf(global));
    }

    /**
     * Verifies that a well-typed program passes and that global types are inferred, also
     * from globals declared further down.
     */
    @Test
    @Tag("unit")
    void testWellTypedProgram() {
        // Act
        TypedProgram typed = check(
                "let ratio = scale * 2.0;",
                "let scale = 1.5;",
                "let ready = !(1 > 2) && true;",
                "fn square(n: Int): Int { return n * n; }",
                "fn main(): Int {",
                "    var i = 0;",
                "    while i < 10 { i = i + square(i) % 3; }",
                "    print_str(\"done\");",
                "    return i;",
                "}");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(globalType(typed, 0)).isEqualTo(Type.FLOAT);
        assertThat(globalType(typed, 1)).isEqualTo(Type.FLOAT);
        assertThat(globalType(typed, 2)).isEqualTo(Type.BOOL);
        VarDecl ratio = (VarDecl) typed.program().items().get(0);
        assertThat(typed.typeOf(ratio.initializer())).isEqualTo(Type.FLOAT);
    }

    /**
     * Verifies the message and position of a type mismatch.
     */
    @Test
    @Tag("unit")
    void testMismatchMessage() {
        // Act
        check("fn main() { let x: Int = true; }");

        // Assert
        assertThat(diagnostics.errors()).singleElement().satisfies(d -> assertThat(d.format())
                .isEqualTo("test.kin:1:26: TypeError.Mismatch: Mismatched types: expected Int, found Bool."));
    }

    /**
     * Verifies that conditions must be Bool.
     */
    @Test
    @Tag("unit")
    void testConditionsMustBeBool() {
        // Act
        check("fn main() { if 1 { } while \"s\" { } }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.MISMATCH, ErrorCode.MISMATCH);
    }

    /**
     * Verifies the operand rules of the operators, with one report per faulty operator.
     */
    @Test
    @Tag("unit")
    void testInvalidOperands() {
        // Act
        check(
                "fn main() {",
                "    let a = (1 + true) * 2;",
                "    let b = \"x\" == \"y\";",
                "    let c = 1.5 % 2.0;",
                "    let d = -true;",
                "    let e = 1 < 2.0;",
                "    let f = !3;",
                "    let g = 1 && 2;",
                "}");

        // Assert
        assertThat(errorCodes()).hasSize(7).containsOnly(ErrorCode.INVALID_OPERAND);
        assertThat(diagnostics.errors()).extracting(d -> d.span().line()).containsExactly(2, 3, 4, 5, 6, 7, 8);
    }

    /**
     * Verifies that an unresolved name does not cause follow-on type errors.
     */
    @Test
    @Tag("unit")
    void testUnknownTypesAreNotReportedAgain() {
        // Act
        check("fn main() { let a: Int = missing + 1; if missing { } }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.UNDEFINED, ErrorCode.UNDEFINED);
    }

    /**
     * Verifies argument count and argument type checks, and calls of non-functions.
     */
    @Test
    @Tag("unit")
    void testCallChecks() {
        // Act
        check(
                "fn add(a: Int, b: Int): Int { return a + b; }",
                "fn main() {",
                "    add(1);",
                "    add(1, false);",
                "    let v = 1;",
                "    v(2);",
                "}");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.ARITY_MISMATCH, ErrorCode.MISMATCH, ErrorCode.NOT_CALLABLE);
    }

    /**
     * Verifies that only 'var' bindings can be assigned.
     */
    @Test
    @Tag("unit")
    void testImmutableAssignment() {
        // Act
        check(
                "let limit = 3;",
                "var count = 0;",
                "fn bump(n: Int) { n = 1; count = count + 1; }",
                "fn main() { let x = 1; x = 2; limit = 4; main = 1; }");

        // Assert
        assertThat(errorCodes()).containsExactly(
                ErrorCode.IMMUTABLE_ASSIGNMENT, ErrorCode.IMMUTABLE_ASSIGNMENT,
                ErrorCode.IMMUTABLE_ASSIGNMENT, ErrorCode.IMMUTABLE_ASSIGNMENT);
    }

    /**
     * Verifies that a function name can only appear as a callee.
     */
    @Test
    @Tag("unit")
    void testFunctionAsValue() {
        // Act
        check("fn main() { let f = main; print(print); }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.FUNCTION_AS_VALUE, ErrorCode.FUNCTION_AS_VALUE);
    }

    /**
     * Verifies return value checks, including a bare return in a function with a result.
     */
    @Test
    @Tag("unit")
    void testReturnChecks() {
        // Act
        check(
                "fn one(): Int { return; }",
                "fn nothing() { return 1; }",
                "fn main() { }");

        // Assert
        assertThat(diagnostics.errors()).extracting(Diagnostic::message).containsExactly(
                "Mismatched types: expected Int, found Unit.",
                "Mismatched types: expected Unit, found Int.");
    }

    /**
     * Verifies the conservative all-paths-return analysis.
     */
    @Test
    @Tag("unit")
    void testMissingReturn() {
        // Act
        check(
                "fn onlyThen(a: Int): Int { if a > 0 { return 1; } }",
                "fn loop(a: Int): Int { while true { return a; } }",
                "fn both(a: Int): Int { if a > 0 { return 1; } else { return 2; } }",
                "fn nested(a: Int): Int { { print(a); return a; } }",
                "fn main() { }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.MISSING_RETURN, ErrorCode.MISSING_RETURN);
        assertThat(diagnostics.errors()).extracting(d -> d.span().line()).containsExactly(1, 2);
    }

    /**
     * Verifies that a missing entry point is reported at the program.
     */
    @Test
    @Tag("unit")
    void testMissingEntryPoint() {
        // Act
        check("fn start() { }");

        // Assert
        assertThat(diagnostics.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(ErrorCode.INVALID_ENTRY_POINT);
            assertThat(d.span().line()).isEqualTo(1);
        });
    }

    /**
     * Verifies the entry point signature rules.
     */
    @Test
    @Tag("unit")
    void testInvalidEntryPointSignature() {
        // Act
        check("fn main(a: Int): Bool { return true; }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.INVALID_ENTRY_POINT);
    }

    /**
     * Verifies that globals whose types depend on each other are reported once.
     */
    @Test
    @Tag("unit")
    void testCyclicGlobalInitializers() {
        // Act
        TypedProgram typed = check(
                "let a = b + 1;",
                "let b = a * 2;",
                "fn main() { }");

        // Assert
        assertThat(errorCodes()).containsExactly(ErrorCode.CYCLIC_INITIALIZER);
        assertThat(globalType(typed, 0).isKnown()).isFalse();
    }

    /**
     * Verifies that an annotated global breaks a dependency between initializers, since its
     * type is known without looking at its initializer.
     */
    @Test
    @Tag("unit")
    void testAnnotatedGlobalBreaksInitializerCycle() {
        // Act
        TypedProgram typed = check(
                "let a: Int = b;",
                "let b = a;",
                "fn main() { print(a + b); }");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(globalType(typed, 0)).isEqualTo(Type.INT);
        assertThat(globalType(typed, 1)).isEqualTo(Type.INT);
    }

    /**
     * Verifies that a missing entry point is not reported on top of other errors.
     */
    @Test
    @Tag("unit")
    void testMissingEntryPointIsNotReportedAfterOtherErrors() {
        // Act
        check("var x: Int = true;");

        // Assert
        assertThat(diagnostics.errors()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(ErrorCode.MISMATCH);
            assertThat(d.format()).isEqualTo(
                    "test.kin:1:14: TypeError.Mismatch: Mismatched types: expected Int, found Bool.");
        });
    }

    /**
     * Verifies that checking a second program with the same checker does not share types
     * with the first result.
     */
    @Test
    @Tag("unit")
    void testCheckerKeepsNoStateBetweenPrograms() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();
        TypeChecker checker = new TypeChecker(engine);
        Program first = new Parser(new Lexer("let a = 1;\nfn main() { }", engine, "a.kin"), engine).parse();
        Program second = new Parser(new Lexer("let b = true;\nfn main() { }", engine, "b.kin"), engine).parse();
        Bindings firstBindings = new Resolver(engine).resolve(first);
        Bindings secondBindings = new Resolver(engine).resolve(second);

        // Act
        TypedProgram firstTyped = checker.check(first, firstBindings);
        checker.check(second, secondBindings);

        // Assert
        assertThat(engine.hasErrors()).isFalse();
        VarDecl b = (VarDecl) second.items().get(0);
        assertThat(firstTyped.typeOf(b.initializer())).isEqualTo(Type.UNKNOWN);
        assertThat(globalType(firstTyped, 0)).isEqualTo(Type.INT);
    }
}
