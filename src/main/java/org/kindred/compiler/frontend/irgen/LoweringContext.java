package org.kindred.compiler.frontend.irgen;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.frontend.semantics.Symbol;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.ir.BasicBlock;
import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrInstruction;
import org.kindred.compiler.ir.IrOperand;
import org.kindred.compiler.ir.Opcode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state for lowering one function: the temporaries and labels handed out so far,
 * the finished basic blocks and the block under construction.
 * <p>
 * Temporaries and labels are numbered in creation order from zero, which makes the
 * lowering output a pure function of its input.
 */
final class LoweringContext {

    private final String functionName;
    private final Map<Symbol, IrOperand.Var> variables = new IdentityHashMap<>();
    private final List<IrOperand.Var> parameters = new ArrayList<>();
    private final List<IrOperand.Var> locals = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private int nextTemp = 0;
    private int nextLabel = 0;
    private IrOperand.Label currentLabel;
    private List<IrInstruction> currentInstructions;

    LoweringContext(String functionName) {
        this.functionName = functionName;
        startBlock(newLabel());
    }

    IrOperand.Temp newTemp() {
        return new IrOperand.Temp(nextTemp++);
    }

    IrOperand.Label newLabel() {
        return new IrOperand.Label("L" + nextLabel++);
    }

    IrOperand.Var declareParameter(Symbol symbol, Type type) {
        IrOperand.Var var = new IrOperand.Var(symbol.name(), parameters.size(), type, symbol.declaration());
        parameters.add(var);
        variables.put(symbol, var);
        return var;
    }

    IrOperand.Var declareLocal(Symbol symbol, Type type) {
        IrOperand.Var var = new IrOperand.Var(symbol.name(), parameters.size() + locals.size(), type,
                symbol.declaration());
        locals.add(var);
        variables.put(symbol, var);
        return var;
    }

    IrOperand.Var variable(Symbol symbol) {
        IrOperand.Var var = variables.get(symbol);
        if (var == null) {
            throw new IllegalStateException("Variable '" + symbol.name() + "' is not declared in " + functionName);
        }
        return var;
    }

    /**
     * Appends an instruction to the current block. A terminator closes the block; anything
     * emitted after it lands in a fresh, unreachable block.
     */
    void emit(Opcode opcode, IrOperand.Temp result, IrOperand... operands) {
        if (currentInstructions == null) {
            startBlock(newLabel());
        }
        currentInstructions.add(new IrInstruction(opcode, result, List.of(operands)));
        if (opcode.isTerminator()) {
            blocks.add(new BasicBlock(currentLabel, currentInstructions));
            currentInstructions = null;
            currentLabel = null;
        }
    }

    /**
     * Starts a new block at {@code label}, falling through from the current block with an
     * explicit jump if it is still open.
     */
    void startBlock(IrOperand.Label label) {
        if (currentInstructions != null) {
            emit(Opcode.JUMP, null, label);
        }
        currentLabel = label;
        currentInstructions = new ArrayList<>();
    }

    boolean isBlockOpen() {
        return currentInstructions != null;
    }

    IrFunction finish(Type returnType, Span span) {
        if (currentInstructions != null) {
            emit(Opcode.RETURN, null);
        }
        return new IrFunction(functionName, parameters, locals, nextTemp, blocks, returnType, span);
    }
}
