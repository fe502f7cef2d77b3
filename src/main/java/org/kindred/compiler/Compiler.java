package org.kindred.compiler;

import org.kindred.compiler.api.CompilationException;
import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.ICompiler;
import org.kindred.compiler.api.Span;
import org.kindred.compiler.backend.codegen.AssemblyListing;
import org.kindred.compiler.backend.codegen.CodeGenerator;
import org.kindred.compiler.backend.emit.Emitter;
import org.kindred.compiler.backend.emit.ProcessToolchain;
import org.kindred.compiler.backend.emit.Toolchain;
import org.kindred.compiler.diagnostics.DiagnosticsEngine;
import org.kindred.compiler.diagnostics.ErrorCode;
import org.kindred.compiler.frontend.irgen.IrLowering;
import org.kindred.compiler.frontend.lexer.Lexer;
import org.kindred.compiler.frontend.parser.Parser;
import org.kindred.compiler.frontend.parser.ast.Program;
import org.kindred.compiler.frontend.semantics.Bindings;
import org.kindred.compiler.frontend.semantics.Resolver;
import org.kindred.compiler.frontend.types.TypeChecker;
import org.kindred.compiler.frontend.types.TypedProgram;
import org.kindred.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The main compiler implementation. This class orchestrates the entire compilation
 * pipeline from source code to a native executable.
 * <p>
 * Every compilation uses a fresh {@link DiagnosticsEngine} and fresh stage objects, so one
 * instance may be used for several compilations in sequence. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    /** Errors that a declaration or return statement discarded by parser recovery can cause. */
    private static final Set<ErrorCode> RECOVERY_ARTIFACTS =
            EnumSet.of(ErrorCode.UNDEFINED, ErrorCode.MISSING_RETURN, ErrorCode.INVALID_ENTRY_POINT);

    private final Toolchain toolchain;

    /**
     * Creates a compiler that runs the toolchain as an operating system process.
     */
    public Compiler() {
        this(new ProcessToolchain());
    }

    /**
     * @param toolchain The assembler/linker runner.
     */
    public Compiler(Toolchain toolchain) {
        this.toolchain = toolchain;
    }

    @Override
    public Path compile(CompileOptions options) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Span fileSpan = Span.ofFile(options.sourcePath().toString());

        // A failed build must not leave the previous executable behind.
        try {
            Files.deleteIfExists(options.executablePath());
        } catch (IOException e) {
            diagnostics.reportError(ErrorCode.OUTPUT_NOT_WRITABLE,
                    "Cannot remove previous executable '" + options.executablePath() + "': " + e.getMessage(), fileSpan);
            throw failure(diagnostics);
        }

        String source;
        try {
            source = Files.readString(options.sourcePath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            diagnostics.reportError(ErrorCode.SOURCE_NOT_READABLE,
                    "Cannot read source file: " + e.getMessage(), fileSpan);
            throw failure(diagnostics);
        }

        LOG.info("Compiling {} ({} mode)", options.sourcePath(), options.optimizationMode());
        IrProgram ir = lowerToIr(source, options.sourcePath().toString(), diagnostics);
        AssemblyListing listing = generate(ir, diagnostics);

        // Phase 7: Emission
        Emitter emitter = new Emitter(toolchain, diagnostics);
        Optional<Path> executable = emitter.emit(listing, ir, options);
        if (executable.isEmpty()) {
            throw failure(diagnostics);
        }
        LOG.info("Built {}", executable.get());
        return executable.get();
    }

    @Override
    public String compileToAssembly(String source, String fileName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        IrProgram ir = lowerToIr(source, fileName, diagnostics);
        return generate(ir, diagnostics).render();
    }

    /**
     * Runs the front end and the IR lowering.
     * Name resolution and type checking also run on a partial AST, so that independent name
     * and type errors are reported together with the syntax errors. Lowering only runs on an
     * error-free front end.
     */
    private IrProgram lowerToIr(String source, String fileName, DiagnosticsEngine diagnostics) throws CompilationException {
        // Phase 1+2: Lexing and parsing
        Lexer lexer = new Lexer(source, diagnostics, fileName);
        Program program = new Parser(lexer, diagnostics).parse();
        LOG.debug("Parsed {} top-level items", program.items().size());
        if (diagnostics.hasErrors()) {
            LOG.debug("Checking a partial AST after {} syntax error(s)", diagnostics.errorCount());
            diagnostics.suppress(RECOVERY_ARTIFACTS);
        }

        // Phase 3: Name resolution
        Bindings bindings = new Resolver(diagnostics).resolve(program);

        // Phase 4: Type checking
        TypedProgram typed = new TypeChecker(diagnostics).check(program, bindings);
        if (diagnostics.hasErrors()) {
            throw failure(diagnostics);
        }

        // Phase 5: IR lowering
        return new IrLowering().lower(typed);
    }

    private AssemblyListing generate(IrProgram ir, DiagnosticsEngine diagnostics) throws CompilationException {
        // Phase 6: Code generation
        Optional<AssemblyListing> listing = new CodeGenerator(diagnostics).generate(ir);
        if (listing.isEmpty() || diagnostics.hasErrors()) {
            throw failure(diagnostics);
        }
        return listing.get();
    }

    private static CompilationException failure(DiagnosticsEngine diagnostics) {
        LOG.debug("Compilation failed with {} error(s)", diagnostics.errorCount());
        return new CompilationException("Compilation failed with " + diagnostics.errorCount() + " error(s):\n"
                + diagnostics.summary(), diagnostics.getDiagnostics());
    }
}
