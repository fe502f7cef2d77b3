package org.kindred.compiler.frontend.types;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
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
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.parser.ast.ReturnStmt;
import org.kindred.compiler.frontend.parser.ast.Stmt;
import org.kindred.compiler.frontend.parser.ast.UnaryExpr;
import org.kindred.compiler.frontend.parser.ast.VarDecl;
import org.kindred.compiler.frontend.parser.ast.WhileStmt;
import org.kindred.compiler.frontend.semantics.Bindings;
import org.kindred.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers and checks the types of a resolved program.
 * <p>
 * Expressions are typed bottom-up; declarations, assignments, conditions, returns and call
 * arguments are checked against the type their context expects. An operand of type
 * {@link Type#UNKNOWN} (an earlier error, or an unresolved name) silences all checks it takes
 * part in, so a single mistake is reported once.
 */
public class TypeChecker {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);
    private static final String ENTRY_POINT = "main";

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics The engine for reporting errors.
     */
    public TypeChecker(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Checks a program.
     * @param program The parsed program.
     * @param bindings The resolver's output for {@code program}.
     * @return The typed program. It is only meaningful for code generation if no error was reported.
     */
    public TypedProgram check(Program program, Bindings bindings) {
        return new ProgramCheck(bindings).check(program);
    }

    /**
     * The side tables of one checked program. Created per {@link #check(Program, Bindings)} call.
     */
    private final class ProgramCheck {

        private final Bindings bindings;
        private final Map<Expr, Type> expressionTypes = new IdentityHashMap<>();
        private final Map<Symbol, Type> symbolTypes = new IdentityHashMap<>();
        private final Set<Symbol> globalsInProgress = Collections.newSetFromMap(new IdentityHashMap<>());
        private Type currentReturnType = Type.UNIT;

        ProgramCheck(Bindings bindings) {
            this.bindings = bindings;
        }

        TypedProgram check(Program program) {
            for (Item item : program.items()) {
                if (item.itemKind() == Item.Kind.GLOBAL_VARIABLE) {
                    bindings.lookup(item).ifPresent(symbol -> inferGlobal((VarDecl) item, symbol));
                }
            }
            for (Item item : program.items()) {
                if (item.itemKind() == Item.Kind.FUNCTION) {
                    checkFunction((FunctionDecl) item);
                }
            }
            checkEntryPoint(program);
            LOG.debug("Typed {} expressions", expressionTypes.size());
            return new TypedProgram(program, bindings, expressionTypes, symbolTypes);
        }

        // region Declarations

        /**
         * Infers the type of a global on first demand, so that initializers may refer to globals
         * declared further down.
         */
        private Type inferGlobal(VarDecl global, Symbol symbol) {
            Type known = symbolTypes.get(symbol);
            if (known != null) {
                return known;
            }
            if (!globalsInProgress.add(symbol)) {
                diagnostics.reportError(ErrorCode.CYCLIC_INITIALIZER,
                        "The type of '" + global.name() + "' depends on its own initializer.", global.span());
                symbolTypes.put(symbol, Type.UNKNOWN);
                return Type.UNKNOWN;
            }
            Type type = checkDeclaration(global, symbol);
            globalsInProgress.remove(symbol);
            return type;
        }

        private Type checkDeclaration(VarDecl declaration, Symbol symbol) {
            Type initializerType = inferExpr(declaration.initializer());
            Type type = initializerType;
            if (declaration.type() != null) {
                type = symbol.declaredType();
                expect(type, initializerType, declaration.initializer().span());
            }
            // A cycle may already have settled this symbol.
            symbolTypes.putIfAbsent(symbol, type);
            return symbolTypes.get(symbol);
        }

        private void checkFunction(FunctionDecl function) {
            Optional<Symbol> symbol = bindings.lookup(function);
            if (symbol.isEmpty()) {
                return;
            }
            Type.Function signature = (Type.Function) symbol.get().declaredType();
            symbolTypes.put(symbol.get(), signature);
            function.params().forEach(param ->
                    bindings.lookup(param).ifPresent(p -> symbolTypes.put(p, p.declaredType())));
            currentReturnType = signature.returnType();
            checkBlock(function.body());
            if (currentReturnType.isKnown() && !currentReturnType.equals(Type.UNIT) && !alwaysReturns(function.body())) {
                diagnostics.reportError(ErrorCode.MISSING_RETURN,
                        "Function '" + function.name() + "' must return a value of type "
                                + currentReturnType.displayName() + " on every path.", function.span());
            }
            currentReturnType = Type.UNIT;
        }

        private void checkEntryPoint(Program program) {
            Optional<Symbol> main = bindings.globalScope().lookupLocal(ENTRY_POINT)
                    .filter(s -> s.kind() == Symbol.Kind.FUNCTION);
            if (main.isEmpty()) {
                // Only reported on an otherwise clean program.
                if (diagnostics.hasErrors()) {
                    return;
                }
                diagnostics.reportError(ErrorCode.INVALID_ENTRY_POINT,
                        "The program has no 'fn main()' entry point.", program.span());
                return;
            }
            Type.Function signature = (Type.Function) main.get().declaredType();
            Type result = signature.returnType();
            boolean resultOk = !result.isKnown() || result.equals(Type.INT) || result.equals(Type.UNIT);
            if (!signature.parameterTypes().isEmpty() || !resultOk) {
                diagnostics.reportError(ErrorCode.INVALID_ENTRY_POINT,
                        "'main' must take no parameters and return Int or Unit, but has type "
                                + signature.displayName() + ".", main.get().declaration());
            }
        }

        // endregion

        // region Statements

        private void checkBlock(Block block) {
            block.statements().forEach(this::checkStmt);
        }

        private void checkStmt(Stmt statement) {
            switch (statement.stmtKind()) {
                case VAR_DECL -> {
                    VarDecl local = (VarDecl) statement;
                    Optional<Symbol> symbol = bindings.lookup(local);
                    if (symbol.isPresent()) {
                        checkDeclaration(local, symbol.get());
                    } else {
                        inferExpr(local.initializer());
                    }
                }
                case BLOCK -> checkBlock((Block) statement);
                case IF -> {
                    IfStmt ifStmt = (IfStmt) statement;
                    expect(Type.BOOL, inferExpr(ifStmt.condition()), ifStmt.condition().span());
                    checkBlock(ifStmt.thenBranch());
                    if (ifStmt.elseBranch() != null) {
                        checkStmt(ifStmt.elseBranch());
                    }
                }
                case WHILE -> {
                    WhileStmt whileStmt = (WhileStmt) statement;
                    expect(Type.BOOL, inferExpr(whileStmt.condition()), whileStmt.condition().span());
                    checkBlock(whileStmt.body());
                }
                case RETURN -> {
                    ReturnStmt returnStmt = (ReturnStmt) statement;
                    if (returnStmt.value() == null) {
                        expect(currentReturnType, Type.UNIT, returnStmt.span());
                    } else {
                        expect(currentReturnType, inferExpr(returnStmt.value()), returnStmt.value().span());
                    }
                }
                case EXPRESSION -> inferExpr(((ExpressionStmt) statement).expression());
                case ASSIGNMENT -> checkAssignment((AssignmentStmt) statement);
            }
        }

        private void checkAssignment(AssignmentStmt assignment) {
            Type valueType = inferExpr(assignment.value());
            IdentifierExpr target = assignment.target();
            Optional<Symbol> symbol = bindings.lookup(target);
            if (symbol.isEmpty()) {
                expressionTypes.put(target, Type.UNKNOWN);
                return;
            }
            if (symbol.get().kind() != Symbol.Kind.VARIABLE) {
                diagnostics.reportError(ErrorCode.IMMUTABLE_ASSIGNMENT,
                        "Cannot assign to function '" + target.name() + "'.", target.span());
                expressionTypes.put(target, Type.UNKNOWN);
                return;
            }
            Type targetType = typeOfVariable(symbol.get());
            expressionTypes.put(target, targetType);
            if (!symbol.get().mutable()) {
                String what = symbol.get().storage() == Symbol.StorageRole.PARAMETER ? "parameter" : "immutable variable";
                diagnostics.reportError(ErrorCode.IMMUTABLE_ASSIGNMENT,
                        "Cannot assign twice to " + what + " '" + target.name() + "'; declare it with 'var'.",
                        target.span());
            }
            expect(targetType, valueType, assignment.value().span());
        }

        /**
         * A conservative check that every path through the statement ends in a {@code return}.
         * Loops are assumed to possibly not execute.
         */
        private boolean alwaysReturns(Stmt statement) {
            return switch (statement.stmtKind()) {
                case RETURN -> true;
                case BLOCK -> {
                    List<Stmt> statements = ((Block) statement).statements();
                    yield statements.stream().anyMatch(this::alwaysReturns);
                }
                case IF -> {
                    IfStmt ifStmt = (IfStmt) statement;
                    yield ifStmt.elseBranch() != null
                            && alwaysReturns(ifStmt.thenBranch())
                            && alwaysReturns(ifStmt.elseBranch());
                }
                case VAR_DECL, WHILE, EXPRESSION, ASSIGNMENT -> false;
            };
        }

        // endregion

        // region Expressions

        private Type inferExpr(Expr expr) {
            Type type = switch (expr.exprKind()) {
                case LITERAL -> literalType((LiteralExpr) expr);
                case IDENTIFIER -> identifierType((IdentifierExpr) expr);
                case UNARY -> unaryType((UnaryExpr) expr);
                case BINARY -> binaryType((BinaryExpr) expr);
                case CALL -> callType((CallExpr) expr);
            };
            expressionTypes.put(expr, type);
            return type;
        }

        private Type literalType(LiteralExpr literal) {
            return switch (literal.literalKind()) {
                case INT -> Type.INT;
                case FLOAT -> Type.FLOAT;
                case BOOL -> Type.BOOL;
                case STRING -> Type.STRING;
            };
        }

        private Type identifierType(IdentifierExpr identifier) {
            Optional<Symbol> symbol = bindings.lookup(identifier);
            if (symbol.isEmpty()) {
                return Type.UNKNOWN;
            }
            if (symbol.get().kind() == Symbol.Kind.FUNCTION) {
                diagnostics.reportError(ErrorCode.FUNCTION_AS_VALUE,
                        "Function '" + identifier.name() + "' can only be called, not used as a value.", identifier.span());
                return Type.UNKNOWN;
            }
            return typeOfVariable(symbol.get());
        }

        private Type typeOfVariable(Symbol symbol) {
            Type type = symbolTypes.get(symbol);
            if (type != null) {
                return type;
            }
            if (symbol.storage() == Symbol.StorageRole.GLOBAL && symbol.node() instanceof VarDecl global
                    && global.type() == null) {
                return inferGlobal(global, symbol);
            }
            return symbol.declaredType();
        }

        private Type unaryType(UnaryExpr unary) {
            Type operand = inferExpr(unary.operand());
            if (!operand.isKnown()) {
                return Type.UNKNOWN;
            }
            return switch (unary.operator()) {
                case NEGATE -> {
                    if (operand.equals(Type.INT) || operand.equals(Type.FLOAT)) {
                        yield operand;
                    }
                    yield invalidOperand(unary.span(), "Operator '-' cannot be applied to " + operand.displayName() + ".");
                }
                case NOT -> {
                    if (operand.equals(Type.BOOL)) {
                        yield Type.BOOL;
                    }
                    yield invalidOperand(unary.span(), "Operator '!' cannot be applied to " + operand.displayName() + ".");
                }
            };
        }

        private Type binaryType(BinaryExpr binary) {
            Type left = inferExpr(binary.left());
            Type right = inferExpr(binary.right());
            BinaryOperator operator = binary.operator();
            boolean yieldsBool = operator.isComparison() || operator.isEquality() || operator.isLogical();
            if (!left.isKnown() || !right.isKnown()) {
                return yieldsBool ? Type.BOOL : Type.UNKNOWN;
            }
            boolean accepted = left.equals(right) && switch (operator) {
                case OR, AND -> left.equals(Type.BOOL);
                case EQUAL, NOT_EQUAL -> left.equals(Type.INT) || left.equals(Type.BOOL) || left.equals(Type.FLOAT);
                case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, ADD, SUBTRACT, MULTIPLY, DIVIDE ->
                        left.equals(Type.INT) || left.equals(Type.FLOAT);
                case REMAINDER -> left.equals(Type.INT);
            };
            if (!accepted) {
                return invalidOperand(binary.span(), "Operator '" + operator.symbol() + "' cannot be applied to "
                        + left.displayName() + " and " + right.displayName() + ".");
            }
            return yieldsBool ? Type.BOOL : left;
        }

        private Type callType(CallExpr call) {
            Type.Function signature = calleeSignature(call);
            List<Expr> arguments = call.arguments();
            if (signature == null) {
                arguments.forEach(this::inferExpr);
                return Type.UNKNOWN;
            }
            List<Type> parameterTypes = signature.parameterTypes();
            if (arguments.size() != parameterTypes.size()) {
                diagnostics.reportError(ErrorCode.ARITY_MISMATCH,
                        "Expected " + parameterTypes.size() + " argument(s), but found " + arguments.size() + ".",
                        call.span());
            }
            for (int i = 0; i < arguments.size(); i++) {
                Type argumentType = inferExpr(arguments.get(i));
                if (i < parameterTypes.size()) {
                    expect(parameterTypes.get(i), argumentType, arguments.get(i).span());
                }
            }
            return signature.returnType();
        }

        /**
         * @return The signature of the called function, or {@code null} if the callee is not
         *         callable (reported) or unresolved (already reported by the resolver).
         */
        private Type.Function calleeSignature(CallExpr call) {
            if (call.callee() instanceof IdentifierExpr name) {
                Optional<Symbol> symbol = bindings.lookup(name);
                if (symbol.isEmpty()) {
                    expressionTypes.put(name, Type.UNKNOWN);
                    return null;
                }
                if (symbol.get().kind() == Symbol.Kind.FUNCTION) {
                    Type.Function signature = (Type.Function) symbol.get().declaredType();
                    expressionTypes.put(name, signature);
                    return signature;
                }
            }
            Type calleeType = inferExpr(call.callee());
            if (calleeType.isKnown()) {
                diagnostics.reportError(ErrorCode.NOT_CALLABLE,
                        "A value of type " + calleeType.displayName() + " is not callable.", call.callee().span());
            }
            return null;
        }

        // endregion

        private Type invalidOperand(Span span, String message) {
            diagnostics.reportError(ErrorCode.INVALID_OPERAND, message, span);
            return Type.UNKNOWN;
        }

        private void expect(Type expected, Type found, Span span) {
            if (expected.isKnown() && found.isKnown() && !expected.equals(found)) {
                diagnostics.reportError(ErrorCode.MISMATCH,
                        "Mismatched types: expected " + expected.displayName() + ", found " + found.displayName() + ".",
                        span);
            }
        }
    }
}
