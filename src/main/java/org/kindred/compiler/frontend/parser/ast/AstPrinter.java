package org.kindred.compiler.frontend.parser.ast;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders an AST back into Kindred source text. The output re-parses to a structurally
 * equal tree: nested operator expressions are parenthesized, so the original grouping
 * survives without relying on precedence.
 */
public final class AstPrinter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {}

    /**
     * Prints a whole program.
     * @param program The program to print.
     * @return The source text, one item per paragraph.
     */
    public static String print(Program program) {
        AstPrinter printer = new AstPrinter();
        boolean first = true;
        for (Item item : program.items()) {
            if (!first) {
                printer.out.append('\n');
            }
            first = false;
            printer.item(item);
        }
        return printer.out.toString();
    }

    /**
     * Prints a single expression.
     * @param expr The expression.
     * @return The source text of the expression.
     */
    public static String print(Expr expr) {
        return new AstPrinter().expr(expr);
    }

    private void item(Item item) {
        switch (item.itemKind()) {
            case FUNCTION -> function((FunctionDecl) item);
            case GLOBAL_VARIABLE -> stmt((VarDecl) item);
        }
    }

    private void function(FunctionDecl fn) {
        String params = fn.params().stream()
                .map(p -> p.name() + ": " + p.type().name())
                .collect(Collectors.joining(", "));
        out.append("fn ").append(fn.name()).append('(').append(params).append(')');
        if (fn.returnType() != null) {
            out.append(": ").append(fn.returnType().name());
        }
        out.append(' ');
        blockBody(fn.body());
        out.append('\n');
    }

    private void blockBody(Block block) {
        out.append("{\n");
        depth++;
        for (Stmt stmt : block.statements()) {
            stmt(stmt);
        }
        depth--;
        indent();
        out.append('}');
    }

    private void stmt(Stmt stmt) {
        indent();
        switch (stmt.stmtKind()) {
            case VAR_DECL -> {
                VarDecl decl = (VarDecl) stmt;
                out.append(decl.mutable() ? "var " : "let ").append(decl.name());
                if (decl.type() != null) {
                    out.append(": ").append(decl.type().name());
                }
                out.append(" = ").append(expr(decl.initializer())).append(";\n");
            }
            case BLOCK -> {
                blockBody((Block) stmt);
                out.append('\n');
            }
            case IF -> {
                ifChain((IfStmt) stmt);
                out.append('\n');
            }
            case WHILE -> {
                WhileStmt loop = (WhileStmt) stmt;
                out.append("while ").append(expr(loop.condition())).append(' ');
                blockBody(loop.body());
                out.append('\n');
            }
            case RETURN -> {
                ReturnStmt ret = (ReturnStmt) stmt;
                out.append("return");
                if (ret.value() != null) {
                    out.append(' ').append(expr(ret.value()));
                }
                out.append(";\n");
            }
            case EXPRESSION -> out.append(expr(((ExpressionStmt) stmt).expression())).append(";\n");
            case ASSIGNMENT -> {
                AssignmentStmt assignment = (AssignmentStmt) stmt;
                out.append(assignment.target().name()).append(" = ").append(expr(assignment.value())).append(";\n");
            }
        }
    }

    private void ifChain(IfStmt stmt) {
        out.append("if ").append(expr(stmt.condition())).append(' ');
        blockBody(stmt.thenBranch());
        if (stmt.elseBranch() instanceof IfStmt elseIf) {
            out.append(" else ");
            ifChain(elseIf);
        } else if (stmt.elseBranch() instanceof Block elseBlock) {
            out.append(" else ");
            blockBody(elseBlock);
        }
    }

    private String expr(Expr expr) {
        return switch (expr.exprKind()) {
            case BINARY -> {
                BinaryExpr binary = (BinaryExpr) expr;
                yield operand(binary.left()) + " " + binary.operator().symbol() + " " + operand(binary.right());
            }
            case UNARY -> {
                UnaryExpr unary = (UnaryExpr) expr;
                yield unary.operator().symbol() + operand(unary.operand());
            }
            case CALL -> {
                CallExpr call = (CallExpr) expr;
                String args = call.arguments().stream().map(this::expr).collect(Collectors.joining(", "));
                yield operand(call.callee()) + "(" + args + ")";
            }
            case LITERAL -> literal((LiteralExpr) expr);
            case IDENTIFIER -> ((IdentifierExpr) expr).name();
        };
    }

    private String operand(Expr expr) {
        if (expr.exprKind() == Expr.Kind.BINARY || expr.exprKind() == Expr.Kind.UNARY) {
            return "(" + expr(expr) + ")";
        }
        return expr(expr);
    }

    private static String literal(LiteralExpr literal) {
        return switch (literal.literalKind()) {
            case INT, BOOL -> String.valueOf(literal.value());
            case FLOAT -> {
                String plain = BigDecimal.valueOf((Double) literal.value()).toPlainString();
                yield plain.contains(".") ? plain : plain + ".0";
            }
            case STRING -> "\"" + escape((String) literal.value()) + "\"";
        };
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private void indent() {
        out.append(INDENT.repeat(depth));
    }
}
