package org.kindred.compiler.frontend.irgen;

import org.kindred.compiler.frontend.parser.ast.AssignmentStmt;
import org.kindred.compiler.frontend.parser.ast.BinaryExpr;
import org.kindred.compiler.frontend.parser.ast.BinaryOperator;
import org.kindred.compiler.frontend.parser.ast.Block;
import org.kindred.compiler.frontend.parser.ast.CallExpr;
import org.kindred.compiler.frontend.parser.ast.Expr;
import org.kindred.compiler.frontend.parser.ast.ExpressionStmt;
import org.kindred.compiler.frontend.parser.ast.FunctionDecl;
import org.kindred.compiler.frontend.parser.ast.IfStmt;
import org.kindred.compiler.frontend.parser.ast.Item;
import org.kindred.compiler.frontend.parser.ast.LiteralExpr;
import org.kindred.compiler.frontend.parser.ast.Param;
import org.kindred.compiler.frontend.parser.ast.ReturnStmt;
import org.kindred.compiler.frontend.parser.ast.Stmt;
import org.kindred.compiler.frontend.parser.ast.UnaryExpr;
import org.kindred.compiler.frontend.parser.ast.VarDecl;
import org.kindred.compiler.frontend.parser.ast.WhileStmt;
import org.kindred.compiler.frontend.semantics.Bindings;
import org.kindred.compiler.frontend.semantics.Symbol;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.frontend.types.TypedProgram;
import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrOperand;
import org.kindred.compiler.ir.IrProgram;
import org.kindred.compiler.ir.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a type-checked program to the intermediate representation.
 * <p>
 * Every subexpression gets a fresh temporary, control flow becomes explicit basic blocks,
 * and {@code &&}/{@code ||} only evaluate their right operand when needed. Global
 * initializers run in declaration order in the synthetic {@link IrProgram#INIT_FUNCTION}.
 * Instances hold no state between calls, so one lowering may serve concurrent compilations
 * and equal inputs give equal programs.
 */
public class IrLowering {

    private static final Logger LOG = LoggerFactory.getLogger(IrLowering.class);

    /**
     * Lowers the program. It must have passed type checking without errors.
     * @param typedProgram The checked program.
     * @return The IR program.
     */
    public IrProgram lower(TypedProgram typedProgram) {
        return new ProgramLowering(typedProgram).lower();
    }

    /**
     * The string pool and global slots of one program. Created per {@link #lower(TypedProgram)} call.
     */
    private static final class ProgramLowering {

        private final TypedProgram typed;
        private final Bindings bindings;
        private final Map<String, Integer> stringPool = new LinkedHashMap<>();
        private final Map<Symbol, IrOperand.Global> globals = new IdentityHashMap<>();

        ProgramLowering(TypedProgram typed) {
            this.typed = typed;
            this.bindings = typed.bindings();
        }

        IrProgram lower() {
            List<VarDecl> globalDecls = new ArrayList<>();
            List<FunctionDecl> functionDecls = new ArrayList<>();
            for (Item item : typed.program().items()) {
                switch (item.itemKind()) {
                    case GLOBAL_VARIABLE -> {
                        VarDecl global = (VarDecl) item;
                        Symbol symbol = bindings.symbolOf(global);
                        globals.put(symbol, new IrOperand.Global(global.name(), typed.typeOf(symbol), global.span()));
                        globalDecls.add(global);
                    }
                    case FUNCTION -> functionDecls.add((FunctionDecl) item);
                }
            }

            IrFunction initializer = lowerInitializer(globalDecls);
            List<IrFunction> functions = new ArrayList<>();
            boolean entryReturnsValue = false;
            for (FunctionDecl function : functionDecls) {
                IrFunction lowered = lowerFunction(function);
                functions.add(lowered);
                if (function.name().equals(IrProgram.ENTRY_FUNCTION)) {
                    entryReturnsValue = lowered.returnType().equals(Type.INT);
                }
            }

            List<IrOperand.Global> globalList = new ArrayList<>();
            globalDecls.forEach(g -> globalList.add(globals.get(bindings.symbolOf(g))));
            LOG.debug("Lowered {} functions, {} globals, {} strings", functions.size(), globalList.size(), stringPool.size());
            return new IrProgram(functions, initializer, globalList, new ArrayList<>(stringPool.keySet()), entryReturnsValue);
        }

        private IrFunction lowerInitializer(List<VarDecl> globalDecls) {
            LoweringContext context = new LoweringContext(IrProgram.INIT_FUNCTION);
            for (VarDecl global : globalDecls) {
                IrOperand.Temp value = lowerExpr(global.initializer(), context);
                context.emit(Opcode.STORE_GLOBAL, null, globals.get(bindings.symbolOf(global)), value);
            }
            return context.finish(Type.UNIT, typed.program().span());
        }

        private IrFunction lowerFunction(FunctionDecl function) {
            LoweringContext context = new LoweringContext(function.name());
            for (Param param : function.params()) {
                Symbol symbol = bindings.symbolOf(param);
                context.declareParameter(symbol, typed.typeOf(symbol));
            }
            lowerBlock(function.body(), context);
            Type.Function signature = (Type.Function) bindings.symbolOf(function).declaredType();
            return context.finish(signature.returnType(), function.span());
        }

        // region Statements

        private void lowerBlock(Block block, LoweringContext context) {
            for (Stmt statement : block.statements()) {
                lowerStmt(statement, context);
            }
        }

        private void lowerStmt(Stmt statement, LoweringContext context) {
            switch (statement.stmtKind()) {
                case VAR_DECL -> {
                    VarDecl local = (VarDecl) statement;
                    IrOperand.Temp value = lowerExpr(local.initializer(), context);
                    Symbol symbol = bindings.symbolOf(local);
                    IrOperand.Var var = context.declareLocal(symbol, typed.typeOf(symbol));
                    context.emit(Opcode.STORE_VAR, null, var, value);
                }
                case BLOCK -> lowerBlock((Block) statement, context);
                case IF -> lowerIf((IfStmt) statement, context);
                case WHILE -> lowerWhile((WhileStmt) statement, context);
                case RETURN -> {
                    ReturnStmt returnStmt = (ReturnStmt) statement;
                    if (returnStmt.value() == null) {
                        context.emit(Opcode.RETURN, null);
                    } else {
                        context.emit(Opcode.RETURN, null, lowerExpr(returnStmt.value(), context));
                    }
                }
                case EXPRESSION -> lowerExpr(((ExpressionStmt) statement).expression(), context);
                case ASSIGNMENT -> {
                    AssignmentStmt assignment = (AssignmentStmt) statement;
                    IrOperand.Temp value = lowerExpr(assignment.value(), context);
                    Symbol symbol = bindings.symbolOf(assignment.target());
                    if (symbol.storage() == Symbol.StorageRole.GLOBAL) {
                        context.emit(Opcode.STORE_GLOBAL, null, globals.get(symbol), value);
                    } else {
                        context.emit(Opcode.STORE_VAR, null, context.variable(symbol), value);
                    }
                }
            }
        }

        private void lowerIf(IfStmt ifStmt, LoweringContext context) {
            IrOperand.Temp condition = lowerExpr(ifStmt.condition(), context);
            IrOperand.Label thenLabel = context.newLabel();
            IrOperand.Label elseLabel = ifStmt.elseBranch() == null ? null : context.newLabel();
            IrOperand.Label endLabel = context.newLabel();
            context.emit(Opcode.BRANCH, null, condition, thenLabel, elseLabel == null ? endLabel : elseLabel);

            context.startBlock(thenLabel);
            lowerBlock(ifStmt.thenBranch(), context);
            if (context.isBlockOpen()) {
                context.emit(Opcode.JUMP, null, endLabel);
            }
            if (elseLabel != null) {
                context.startBlock(elseLabel);
                lowerStmt(ifStmt.elseBranch(), context);
                if (context.isBlockOpen()) {
                    context.emit(Opcode.JUMP, null, endLabel);
                }
            }
            context.startBlock(endLabel);
        }

        private void lowerWhile(WhileStmt whileStmt, LoweringContext context) {
            IrOperand.Label headLabel = context.newLabel();
            IrOperand.Label bodyLabel = context.newLabel();
            IrOperand.Label endLabel = context.newLabel();
            context.startBlock(headLabel);
            IrOperand.Temp condition = lowerExpr(whileStmt.condition(), context);
            context.emit(Opcode.BRANCH, null, condition, bodyLabel, endLabel);

            context.startBlock(bodyLabel);
            lowerBlock(whileStmt.body(), context);
            if (context.isBlockOpen()) {
                context.emit(Opcode.JUMP, null, headLabel);
            }
            context.startBlock(endLabel);
        }

        // endregion

        // region Expressions

        private IrOperand.Temp lowerExpr(Expr expr, LoweringContext context) {
            return switch (expr.exprKind()) {
                case LITERAL -> lowerLiteral((LiteralExpr) expr, context);
                case IDENTIFIER -> {
                    Symbol symbol = bindings.symbolOf(expr);
                    IrOperand.Temp result = context.newTemp();
                    if (symbol.storage() == Symbol.StorageRole.GLOBAL) {
                        context.emit(Opcode.LOAD_GLOBAL, result, globals.get(symbol));
                    } else {
                        context.emit(Opcode.LOAD_VAR, result, context.variable(symbol));
                    }
                    yield result;
                }
                case UNARY -> {
                    UnaryExpr unary = (UnaryExpr) expr;
                    IrOperand.Temp operand = lowerExpr(unary.operand(), context);
                    IrOperand.Temp result = context.newTemp();
                    Opcode opcode = switch (unary.operator()) {
                        case NEGATE -> Opcode.NEG;
                        case NOT -> Opcode.NOT;
                    };
                    context.emit(opcode, result, operand);
                    yield result;
                }
                case BINARY -> lowerBinary((BinaryExpr) expr, context);
                case CALL -> lowerCall((CallExpr) expr, context);
            };
        }

        private IrOperand.Temp lowerLiteral(LiteralExpr literal, LoweringContext context) {
            IrOperand.Temp result = context.newTemp();
            switch (literal.literalKind()) {
                case INT -> context.emit(Opcode.CONST, result, new IrOperand.Const((Long) literal.value()));
                case BOOL -> context.emit(Opcode.CONST, result, new IrOperand.Const((Boolean) literal.value() ? 1 : 0));
                case FLOAT -> context.emit(Opcode.CONST, result,
                        new IrOperand.FloatConst((Double) literal.value(), literal.span()));
                case STRING -> context.emit(Opcode.STRING_ADDR, result, new IrOperand.StringRef(intern((String) literal.value())));
            }
            return result;
        }

        private IrOperand.Temp lowerBinary(BinaryExpr binary, LoweringContext context) {
            if (binary.operator().isLogical()) {
                return lowerShortCircuit(binary, context);
            }
            IrOperand.Temp left = lowerExpr(binary.left(), context);
            IrOperand.Temp right = lowerExpr(binary.right(), context);
            IrOperand.Temp result = context.newTemp();
            Opcode opcode = switch (binary.operator()) {
                case ADD -> Opcode.ADD;
                case SUBTRACT -> Opcode.SUB;
                case MULTIPLY -> Opcode.MUL;
                case DIVIDE -> Opcode.DIV;
                case REMAINDER -> Opcode.MOD;
                case EQUAL -> Opcode.EQ;
                case NOT_EQUAL -> Opcode.NE;
                case LESS -> Opcode.LT;
                case LESS_EQUAL -> Opcode.LE;
                case GREATER -> Opcode.GT;
                case GREATER_EQUAL -> Opcode.GE;
                case AND, OR -> throw new IllegalStateException("Logical operator lowered as arithmetic");
            };
            context.emit(opcode, result, left, right);
            return result;
        }

        /**
         * {@code a && b} evaluates {@code b} only if {@code a} is true; {@code a || b} only if
         * {@code a} is false. Otherwise the result is the constant {@code a} already decided.
         */
        private IrOperand.Temp lowerShortCircuit(BinaryExpr binary, LoweringContext context) {
            boolean isAnd = binary.operator() == BinaryOperator.AND;
            IrOperand.Temp left = lowerExpr(binary.left(), context);
            IrOperand.Temp result = context.newTemp();
            IrOperand.Label rightLabel = context.newLabel();
            IrOperand.Label shortLabel = context.newLabel();
            IrOperand.Label endLabel = context.newLabel();
            if (isAnd) {
                context.emit(Opcode.BRANCH, null, left, rightLabel, shortLabel);
            } else {
                context.emit(Opcode.BRANCH, null, left, shortLabel, rightLabel);
            }

            context.startBlock(rightLabel);
            IrOperand.Temp right = lowerExpr(binary.right(), context);
            context.emit(Opcode.COPY, result, right);
            context.emit(Opcode.JUMP, null, endLabel);

            context.startBlock(shortLabel);
            context.emit(Opcode.CONST, result, new IrOperand.Const(isAnd ? 0 : 1));
            context.emit(Opcode.JUMP, null, endLabel);

            context.startBlock(endLabel);
            return result;
        }

        private IrOperand.Temp lowerCall(CallExpr call, LoweringContext context) {
            Symbol callee = bindings.symbolOf(call.callee());
            List<IrOperand> operands = new ArrayList<>();
            operands.add(new IrOperand.FunctionRef(callee.name(), callee.storage() == Symbol.StorageRole.BUILTIN));
            for (Expr argument : call.arguments()) {
                operands.add(lowerExpr(argument, context));
            }
            IrOperand.Temp result = context.newTemp();
            context.emit(Opcode.CALL, result, operands.toArray(new IrOperand[0]));
            return result;
        }

        // endregion

        private int intern(String value) {
            return stringPool.computeIfAbsent(value, v -> stringPool.size());
        }
    }
}
