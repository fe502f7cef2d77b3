package org.kindred.compiler.backend.codegen;

import org.kindred.compiler.api.Span;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.semantics.Builtin;
import org.kindred.compiler.frontend.types.Type;
import org.kindred.compiler.ir.BasicBlock;
import org.kindred.compiler.ir.IrFunction;
import org.kindred.compiler.ir.IrInstruction;
import org.kindred.compiler.ir.IrOperand;
import org.kindred.compiler.ir.IrProgram;
import org.kindred.compiler.ir.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Translates an {@link IrProgram} into x86-64 assembly for the System V ABI, in GNU
 * assembler AT&T syntax.
 * <p>
 * Every value lives in its own frame slot (see {@link FrameLayout}). Each instruction loads
 * its operands into {@code %rax} and {@code %rcx}, computes, and stores the result back, so
 * no register state survives between IR instructions. Up to six arguments are passed in
 * registers.
 * <p>
 * The listing also contains the runtime helpers for the builtins and a C-ABI {@code main}
 * that runs the global initializer and then the user's {@code main}.
 */
public class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    /** System V integer argument registers, in order. */
    static final List<String> ARGUMENT_REGISTERS = List.of("%rdi", "%rsi", "%rdx", "%rcx", "%r8", "%r9");

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics The engine for reporting unsupported constructs.
     */
    public CodeGenerator(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Generates the assembly listing for a program.
     * @param program The lowered program.
     * @return The listing, or empty if the program uses something the backend cannot represent
     *         (the reason is reported to the diagnostics engine).
     */
    public Optional<AssemblyListing> generate(IrProgram program) {
        int errorsBefore = diagnostics.errorCount();
        checkSupported(program);
        if (diagnostics.errorCount() > errorsBefore) {
            return Optional.empty();
        }

        AssemblyListing listing = new AssemblyListing();
        emitData(program, listing);
        listing.blank();
        listing.directive(".text");
        for (IrFunction function : program.allFunctions()) {
            emitFunction(function, listing);
            listing.blank();
        }
        emitEntryPoint(program, listing);
        listing.blank();
        RuntimeSupport.emitHelpers(listing);
        listing.blank();
        listing.directive(".section .note.GNU-stack,\"\",@progbits");
        LOG.debug("Generated {} assembly lines for {} functions", listing.lines().size(), program.allFunctions().size());
        return Optional.of(listing);
    }

    // region Checks

    private void checkSupported(IrProgram program) {
        for (IrOperand.Global global : program.globals()) {
            requireSupported(global.type(), "global '" + global.name() + "'", global.span());
        }
        for (IrFunction function : program.allFunctions()) {
            if (function.parameters().size() > ARGUMENT_REGISTERS.size()) {
                diagnostics.reportError(ErrorCode.TOO_MANY_ARGUMENTS,
                        "Function '" + function.name() + "' has " + function.parameters().size()
                                + " parameters; at most " + ARGUMENT_REGISTERS.size() + " are supported.",
                        function.span());
            }
            requireSupported(function.returnType(), "the result of '" + function.name() + "'", function.span());
            for (IrOperand.Var var : function.variables()) {
                requireSupported(var.type(), "variable '" + var.name() + "'", var.span());
            }
            for (BasicBlock block : function.blocks()) {
                for (IrInstruction instruction : block.instructions()) {
                    for (IrOperand operand : instruction.operands()) {
                        if (operand instanceof IrOperand.FloatConst floatConst) {
                            requireSupported(Type.FLOAT, "float literal", floatConst.span());
                        }
                    }
                }
            }
        }
    }

    private void requireSupported(Type type, String what, Span span) {
        if (type.equals(Type.FLOAT)) {
            diagnostics.reportError(ErrorCode.UNSUPPORTED_TYPE,
                    "Float values are not supported by the x86-64 backend (" + what + ").", span);
        }
    }

    // endregion

    // region Sections

    private void emitData(IrProgram program, AssemblyListing listing) {
        if (!program.globals().isEmpty()) {
            listing.directive(".data");
            listing.directive(".balign 8");
            for (IrOperand.Global global : program.globals()) {
                listing.label(SymbolMangler.global(global.name()));
                listing.directive(".quad 0");
            }
        }
        listing.directive(".section .rodata");
        for (int i = 0; i < program.strings().size(); i++) {
            listing.label(stringLabel(i));
            listing.directive(".string \"" + RuntimeSupport.escape(program.strings().get(i)) + "\"");
        }
        RuntimeSupport.emitConstants(listing);
    }

    private void emitEntryPoint(IrProgram program, AssemblyListing listing) {
        listing.directive(".globl main");
        listing.directive(".type main, @function");
        listing.label("main");
        listing.instruction("pushq", "%rbp");
        listing.instruction("movq", "%rsp", "%rbp");
        listing.instruction("call", SymbolMangler.function(IrProgram.INIT_FUNCTION));
        listing.instruction("call", SymbolMangler.function(IrProgram.ENTRY_FUNCTION));
        if (!program.entryReturnsValue()) {
            listing.instruction("xorl", "%eax", "%eax");
        }
        listing.instruction("popq", "%rbp");
        listing.instruction("ret");
    }

    // endregion

    // region Functions

    private void emitFunction(IrFunction function, AssemblyListing listing) {
        FrameLayout frame = FrameLayout.of(function);
        String symbol = SymbolMangler.function(function.name());
        listing.label(symbol);
        listing.instruction("pushq", "%rbp");
        listing.instruction("movq", "%rsp", "%rbp");
        if (frame.frameSize() > 0) {
            listing.instruction("subq", "$" + frame.frameSize(), "%rsp");
        }
        for (int i = 0; i < function.parameters().size(); i++) {
            listing.instruction("movq", ARGUMENT_REGISTERS.get(i), frame.slot(function.parameters().get(i)));
        }
        for (BasicBlock block : function.blocks()) {
            listing.label(blockLabel(symbol, block.label()));
            for (IrInstruction instruction : block.instructions()) {
                emitInstruction(instruction, symbol, frame, listing);
            }
        }
    }

    private void emitInstruction(IrInstruction instruction, String function, FrameLayout frame, AssemblyListing listing) {
        switch (instruction.opcode()) {
            case CONST -> {
                long value = ((IrOperand.Const) instruction.operand(0)).value();
                String mnemonic = value == (int) value ? "movq" : "movabsq";
                listing.instruction(mnemonic, "$" + value, "%rax");
                store(instruction, frame, listing);
            }
            case LOAD_VAR -> {
                listing.instruction("movq", frame.slot((IrOperand.Var) instruction.operand(0)), "%rax");
                store(instruction, frame, listing);
            }
            case STORE_VAR -> {
                load(instruction.operand(1), "%rax", frame, listing);
                listing.instruction("movq", "%rax", frame.slot((IrOperand.Var) instruction.operand(0)));
            }
            case LOAD_GLOBAL -> {
                listing.instruction("movq", globalAddress(instruction.operand(0)), "%rax");
                store(instruction, frame, listing);
            }
            case STORE_GLOBAL -> {
                load(instruction.operand(1), "%rax", frame, listing);
                listing.instruction("movq", "%rax", globalAddress(instruction.operand(0)));
            }
            case ADD -> arithmetic("addq", instruction, frame, listing);
            case SUB -> arithmetic("subq", instruction, frame, listing);
            case MUL -> arithmetic("imulq", instruction, frame, listing);
            case DIV, MOD -> {
                load(instruction.operand(0), "%rax", frame, listing);
                load(instruction.operand(1), "%rcx", frame, listing);
                listing.instruction("cqto");
                listing.instruction("idivq", "%rcx");
                if (instruction.opcode() == Opcode.MOD) {
                    listing.instruction("movq", "%rdx", "%rax");
                }
                store(instruction, frame, listing);
            }
            case NEG -> {
                load(instruction.operand(0), "%rax", frame, listing);
                listing.instruction("negq", "%rax");
                store(instruction, frame, listing);
            }
            case NOT -> {
                load(instruction.operand(0), "%rax", frame, listing);
                listing.instruction("xorq", "$1", "%rax");
                store(instruction, frame, listing);
            }
            case EQ -> comparison("sete", instruction, frame, listing);
            case NE -> comparison("setne", instruction, frame, listing);
            case LT -> comparison("setl", instruction, frame, listing);
            case LE -> comparison("setle", instruction, frame, listing);
            case GT -> comparison("setg", instruction, frame, listing);
            case GE -> comparison("setge", instruction, frame, listing);
            case CALL -> emitCall(instruction, frame, listing);
            case STRING_ADDR -> {
                int index = ((IrOperand.StringRef) instruction.operand(0)).index();
                listing.instruction("leaq", stringLabel(index) + "(%rip)", "%rax");
                store(instruction, frame, listing);
            }
            case COPY -> {
                load(instruction.operand(0), "%rax", frame, listing);
                store(instruction, frame, listing);
            }
            case JUMP -> listing.instruction("jmp", blockLabel(function, (IrOperand.Label) instruction.operand(0)));
            case BRANCH -> {
                load(instruction.operand(0), "%rax", frame, listing);
                listing.instruction("testq", "%rax", "%rax");
                listing.instruction("jne", blockLabel(function, (IrOperand.Label) instruction.operand(1)));
                listing.instruction("jmp", blockLabel(function, (IrOperand.Label) instruction.operand(2)));
            }
            case RETURN -> {
                if (instruction.operands().isEmpty()) {
                    listing.instruction("xorl", "%eax", "%eax");
                } else {
                    load(instruction.operand(0), "%rax", frame, listing);
                }
                listing.instruction("leave");
                listing.instruction("ret");
            }
        }
    }

    private void emitCall(IrInstruction instruction, FrameLayout frame, AssemblyListing listing) {
        IrOperand.FunctionRef callee = (IrOperand.FunctionRef) instruction.operand(0);
        List<IrOperand> arguments = instruction.operands().subList(1, instruction.operands().size());
        if (arguments.size() > ARGUMENT_REGISTERS.size()) {
            throw new IllegalStateException("Call to '" + callee.name() + "' with " + arguments.size() + " arguments");
        }
        for (int i = 0; i < arguments.size(); i++) {
            load(arguments.get(i), ARGUMENT_REGISTERS.get(i), frame, listing);
        }
        String target = callee.builtin()
                ? SymbolMangler.builtin(Builtin.byName(callee.name())
                        .orElseThrow(() -> new IllegalStateException("Unknown builtin '" + callee.name() + "'"))
                        .sourceName())
                : SymbolMangler.function(callee.name());
        listing.instruction("call", target);
        if (instruction.result() != null) {
            store(instruction, frame, listing);
        }
    }

    private void arithmetic(String mnemonic, IrInstruction instruction, FrameLayout frame, AssemblyListing listing) {
        load(instruction.operand(0), "%rax", frame, listing);
        load(instruction.operand(1), "%rcx", frame, listing);
        listing.instruction(mnemonic, "%rcx", "%rax");
        store(instruction, frame, listing);
    }

    private void comparison(String setcc, IrInstruction instruction, FrameLayout frame, AssemblyListing listing) {
        load(instruction.operand(0), "%rax", frame, listing);
        load(instruction.operand(1), "%rcx", frame, listing);
        listing.instruction("cmpq", "%rcx", "%rax");
        listing.instruction(setcc, "%al");
        listing.instruction("movzbq", "%al", "%rax");
        store(instruction, frame, listing);
    }

    private void load(IrOperand operand, String register, FrameLayout frame, AssemblyListing listing) {
        if (operand instanceof IrOperand.Temp temp) {
            listing.instruction("movq", frame.slot(temp), register);
        } else if (operand instanceof IrOperand.Var var) {
            listing.instruction("movq", frame.slot(var), register);
        } else if (operand instanceof IrOperand.Const constant) {
            listing.instruction(constant.value() == (int) constant.value() ? "movq" : "movabsq",
                    "$" + constant.value(), register);
        } else {
            throw new IllegalStateException("Operand " + operand + " cannot be loaded into a register");
        }
    }

    private void store(IrInstruction instruction, FrameLayout frame, AssemblyListing listing) {
        listing.instruction("movq", "%rax", frame.slot(instruction.result()));
    }

    // endregion

    private static String globalAddress(IrOperand operand) {
        return SymbolMangler.global(((IrOperand.Global) operand).name()) + "(%rip)";
    }

    private static String stringLabel(int index) {
        return ".Lstr" + index;
    }

    private static String blockLabel(String function, IrOperand.Label label) {
        return ".L" + function + "_" + label.name();
    }
}
