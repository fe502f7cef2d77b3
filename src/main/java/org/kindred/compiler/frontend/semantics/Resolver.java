package org.kindred.compiler.frontend.semantics;

import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.parser.ast.AssignmentStmt;
import org.kindred.compiler.frontend.parser.ast.AstNode;
import org.kindred.compiler.frontend.parser.ast.BinaryExpr;
import org.kindred.compiler.frontend.parser.ast.Block;
import org.kindred.compiler.frontend.parser.ast.CallExpr;
import org.kindred.compiler.frontend.parser.ast.Expr;
import org.kindred.compiler.frontend.parser.ast.ExpressionStmt;
import org.kindred.compiler.frontend.parser.ast.FunctionDecl;
import org.kindred.compiler.frontend.parser.ast.IdentifierExpr;
import org.kindred.compiler.frontend.parser.ast.IfStmt;
import org.kindred.compiler.frontend.parser.ast.Item;
import org.kindred.compiler.frontend.parser.ast.Param;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.parser.ast.ReturnStmt;
import org.kindred.compiler.frontend.parser.ast.Stmt;
import org.kindred.compiler.frontend.parser.ast.TypeRef;
import org.kindred.compiler.frontend.parser.ast.UnaryExpr;
import org.kindred.compiler.frontend.parser.ast.VarDecl;
import org.kindred.compiler.frontend.parser.ast.WhileStmt;
import org.kindred.compiler.frontend.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performs name resolution on the AST. It binds every identifier use and type annotation to
 * the symbol it denotes and reports undefined, duplicate and premature names.
 * <p>
 * The resolver works in two passes over the top-level items:
 * <ol>
 *     <li>Collect all functions and globals into the global scope, so that top-level
 *     declarations may refer to each other regardless of order.</li>
 *     <li>Resolve function bodies and global initializers. Inside a block, a local is only
 *     visible after its declaration.</li>
 * </ol>
 */
public class Resolver {

    private static final Logger LOG = LoggerFactory.getLogger(Resolver.class);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final Map<AstNode, Symbol> bindings = new IdentityHashMap<>();

    /**
     * Constructs a new resolver with a fresh symbol table.
     * @param diagnostics The engine for reporting errors.
     */
    public Resolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.symbolTable = new SymbolTable(diagnostics);
    }

    /**
     * Resolves all names in the program.
     * @param program The parsed program.
     * @return The bindings; unresolvable uses are left unbound.
     */
    public Bindings resolve(Program program) {
        collectDeclarations(program);
        for (Item item : program.items()) {
            switch (item.itemKind()) {
                case FUNCTION -> resolveFunction((FunctionDecl) item);
                case GLOBAL_VARIABLE -> resolveExpr(((VarDecl) item).initializer());
            }
        }
        LOG.debug("Resolved {} names in {} top-level items", bindings.size(), program.items().size());
        return new Bindings(bindings, symbolTable.globalScope());
    }

    private void collectDeclarations(Program program) {
        for (Item item : program.items()) {
            switch (item.itemKind()) {
                case FUNCTION -> {
                    FunctionDecl function = (FunctionDecl) item;
                    List<Type> parameterTypes = new ArrayList<>();
                    for (Param param : function.params()) {
                        parameterTypes.add(resolveType(param.type()));
                    }
                    Type returnType = function.returnType() == null ? Type.UNIT : resolveType(function.returnType());
                    Symbol symbol = symbolTable.define(function.name(), Symbol.Kind.FUNCTION,
                            new Type.Function(parameterTypes, returnType), Symbol.StorageRole.FUNCTION, false,
                            function.span(), function);
                    bindings.put(function, symbol);
                }
                case GLOBAL_VARIABLE -> {
                    VarDecl global = (VarDecl) item;
                    Type type = global.type() == null ? Type.UNKNOWN : resolveType(global.type());
                    Symbol symbol = symbolTable.define(global.name(), Symbol.Kind.VARIABLE, type,
                            Symbol.StorageRole.GLOBAL, global.mutable(), global.span(), global);
                    bindings.put(global, symbol);
                }
            }
        }
    }

    private void resolveFunction(FunctionDecl function) {
        symbolTable.enterScope(Scope.Kind.FUNCTION);
        try {
            Symbol functionSymbol = bindings.get(function);
            List<Type> parameterTypes = ((Type.Function) functionSymbol.declaredType()).parameterTypes();
            for (int i = 0; i < function.params().size(); i++) {
                Param param = function.params().get(i);
                Symbol symbol = symbolTable.define(param.name(), Symbol.Kind.VARIABLE, parameterTypes.get(i),
                        Symbol.StorageRole.PARAMETER, false, param.span(), param);
                bindings.put(param, symbol);
            }
            resolveBlock(function.body());
        } finally {
            symbolTable.leaveScope();
        }
    }

    private void resolveBlock(Block block) {
        symbolTable.enterScope(Scope.Kind.BLOCK);
        try {
            for (Stmt statement : block.statements()) {
                if (statement instanceof VarDecl local) {
                    symbolTable.declareAhead(local.name());
                }
            }
            for (Stmt statement : block.statements()) {
                resolveStmt(statement);
            }
        } finally {
            symbolTable.leaveScope();
        }
    }

    private void resolveStmt(Stmt statement) {
        switch (statement.stmtKind()) {
            case VAR_DECL -> {
                VarDecl local = (VarDecl) statement;
                Type type = local.type() == null ? Type.UNKNOWN : resolveType(local.type());
                // The initializer is resolved while the name is still pending, so `let x = x;` is rejected.
                resolveExpr(local.initializer());
                Symbol symbol = symbolTable.define(local.name(), Symbol.Kind.VARIABLE, type,
                        Symbol.StorageRole.LOCAL, local.mutable(), local.span(), local);
                bindings.put(local, symbol);
            }
            case BLOCK -> resolveBlock((Block) statement);
            case IF -> {
                IfStmt ifStmt = (IfStmt) statement;
                resolveExpr(ifStmt.condition());
                resolveBlock(ifStmt.thenBranch());
                if (ifStmt.elseBranch() != null) {
                    resolveStmt(ifStmt.elseBranch());
                }
            }
            case WHILE -> {
                WhileStmt whileStmt = (WhileStmt) statement;
                resolveExpr(whileStmt.condition());
                resolveBlock(whileStmt.body());
            }
            case RETURN -> {
                ReturnStmt returnStmt = (ReturnStmt) statement;
                if (returnStmt.value() != null) {
                    resolveExpr(returnStmt.value());
                }
            }
            case EXPRESSION -> resolveExpr(((ExpressionStmt) statement).expression());
            case ASSIGNMENT -> {
                AssignmentStmt assignment = (AssignmentStmt) statement;
                resolveExpr(assignment.value());
                resolveExpr(assignment.target());
            }
        }
    }

    private void resolveExpr(Expr expr) {
        switch (expr.exprKind()) {
            case BINARY -> {
                BinaryExpr binary = (BinaryExpr) expr;
                resolveExpr(binary.left());
                resolveExpr(binary.right());
            }
            case UNARY -> resolveExpr(((UnaryExpr) expr).operand());
            case CALL -> {
                CallExpr call = (CallExpr) expr;
                resolveExpr(call.callee());
                call.arguments().forEach(this::resolveExpr);
            }
            case LITERAL -> {
                // Nothing to resolve.
            }
            case IDENTIFIER -> {
                IdentifierExpr identifier = (IdentifierExpr) expr;
                symbolTable.resolve(identifier.name(), identifier.span())
                        .ifPresent(symbol -> {
                            if (symbol.kind() == Symbol.Kind.TYPE) {
                                diagnostics.reportError(ErrorCode.UNDEFINED,
                                        "'" + identifier.name() + "' is a type, not a value.", identifier.span());
                            } else {
                                bindings.put(identifier, symbol);
                            }
                        });
            }
        }
    }

    private Type resolveType(TypeRef typeRef) {
        Optional<Symbol> symbol = symbolTable.resolve(typeRef.name(), typeRef.span());
        if (symbol.isEmpty()) {
            return Type.UNKNOWN;
        }
        if (symbol.get().kind() != Symbol.Kind.TYPE) {
            diagnostics.reportError(ErrorCode.NOT_A_TYPE, "'" + typeRef.name() + "' is not a type.", typeRef.span());
            return Type.UNKNOWN;
        }
        bindings.put(typeRef, symbol.get());
        return symbol.get().declaredType();
    }
}
