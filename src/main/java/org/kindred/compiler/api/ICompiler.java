package org.kindred.compiler.api;

import java.nio.file.Path;

/**
 * Defines the public interface of the Kindred compiler.
 */
public interface ICompiler {

    /**
     * Compiles the configured source file into a native executable.
     *
     * @param options The compilation inputs.
     * @return The path of the produced executable.
     * @throws CompilationException if any stage reports an error; no executable is left behind.
     */
    Path compile(CompileOptions options) throws CompilationException;

    /**
     * Runs the pipeline up to code generation, without touching the file system.
     *
     * @param source The Kindred source text.
     * @param fileName The logical file name used in diagnostics.
     * @return The assembly listing.
     * @throws CompilationException if any stage reports an error.
     */
    String compileToAssembly(String source, String fileName) throws CompilationException;
}
