package org.kindred.compiler.frontend.parser.ast;

import java.util.stream.Collectors;

/**
 * Produces a compact, span-free structural rendering of an AST, e.g.
 * {@code AssignmentStmt(Identifier(x), BinaryExpr(+, Int(1), Int(2)))}.
 * Two trees are structurally equal exactly when their dumps are equal.
 */
public final class AstDumper {

    private AstDumper() {}

    /**
     * @param program The program to dump.
     * @return The structural rendering.
     */
    public static String dump(Program program) {
        return "Program(" + program.items().stream().map(AstDumper::dumpItem).collect(Collectors.joining(", ")) + ")";
    }

    /**
     * @param item The item to dump.
     * @return The structural rendering.
     */
    public static String dumpItem(Item item) {
        return switch (item.itemKind()) {
            case FUNCTION -> {
                FunctionDecl fn = (FunctionDecl) item;
                String params = fn.params().stream()
                        .map(p -> "Param(" + p.name() + ": " + p.type().name() + ")")
                        .collect(Collectors.joining(", "));
                String returnType = fn.returnType() == null ? "Unit" : fn.returnType().name();
                yield "FunctionDecl(" + fn.name() + ", [" + params + "], " + returnType + ", " + dump(fn.body()) + ")";
            }
            case GLOBAL_VARIABLE -> dump((VarDecl) item);
        };
    }

    /**
     * @param stmt The statement to dump.
     * @return The structural rendering.
     */
    public static String dump(Stmt stmt) {
        return switch (stmt.stmtKind()) {
            case VAR_DECL -> {
                VarDecl decl = (VarDecl) stmt;
                String type = decl.type() == null ? "_" : decl.type().name();
                yield "VarDecl(" + (decl.mutable() ? "var " : "let ") + decl.name() + ": " + type + ", " + dump(decl.initializer()) + ")";
            }
            case BLOCK -> "Block(" + ((Block) stmt).statements().stream().map(AstDumper::dump).collect(Collectors.joining(", ")) + ")";
            case IF -> {
                IfStmt ifStmt = (IfStmt) stmt;
                String elseBranch = ifStmt.elseBranch() == null ? "" : ", " + dump(ifStmt.elseBranch());
                yield "If(" + dump(ifStmt.condition()) + ", " + dump(ifStmt.thenBranch()) + elseBranch + ")";
            }
            case WHILE -> {
                WhileStmt loop = (WhileStmt) stmt;
                yield "While(" + dump(loop.condition()) + ", " + dump(loop.body()) + ")";
            }
            case RETURN -> {
                ReturnStmt ret = (ReturnStmt) stmt;
                yield ret.value() == null ? "Return()" : "Return(" + dump(ret.value()) + ")";
            }
            case EXPRESSION -> "ExpressionStmt(" + dump(((ExpressionStmt) stmt).expression()) + ")";
            case ASSIGNMENT -> {
                AssignmentStmt assignment = (AssignmentStmt) stmt;
                yield "AssignmentStmt(" + dump(assignment.target()) + ", " + dump(assignment.value()) + ")";
            }
        };
    }

    /**
     * @param expr The expression to dump.
     * @return The structural rendering.
     */
    public static String dump(Expr expr) {
        return switch (expr.exprKind()) {
            case BINARY -> {
                BinaryExpr binary = (BinaryExpr) expr;
                yield "BinaryExpr(" + binary.operator().symbol() + ", " + dump(binary.left()) + ", " + dump(binary.right()) + ")";
            }
            case UNARY -> {
                UnaryExpr unary = (UnaryExpr) expr;
                yield "UnaryExpr(" + unary.operator().symbol() + ", " + dump(unary.operand()) + ")";
            }
            case CALL -> {
                CallExpr call = (CallExpr) expr;
                String args = call.arguments().stream().map(AstDumper::dump).collect(Collectors.joining(", "));
                yield "Call(" + dump(call.callee()) + ", [" + args + "])";
            }
            case LITERAL -> {
                LiteralExpr literal = (LiteralExpr) expr;
                yield switch (literal.literalKind()) {
                    case INT -> "Int(" + literal.value() + ")";
                    case FLOAT -> "Float(" + literal.value() + ")";
                    case BOOL -> "Bool(" + literal.value() + ")";
                    case STRING -> "String(\"" + literal.value() + "\")";
                };
            }
            case IDENTIFIER -> "Identifier(" + ((IdentifierExpr) expr).name() + ")";
        };
    }
}
