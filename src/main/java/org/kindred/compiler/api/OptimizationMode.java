package org.kindred.compiler.api;

import java.util.List;

/**
 * The build mode of {@code make}. It selects the toolchain flags and whether the IR dump is kept.
 */
public enum OptimizationMode {
    /** Debug information, no optimization, IR dump written next to the assembly. */
    DEBUG(List.of("-g")),
    /** Optimized and stripped. */
    RELEASE(List.of("-O2", "-s"));

    private final List<String> toolchainFlags;

    OptimizationMode(List<String> toolchainFlags) {
        this.toolchainFlags = toolchainFlags;
    }

    /**
     * @return The flags passed to the assembler/linker driver.
     */
    public List<String> toolchainFlags() {
        return toolchainFlags;
    }

    /**
     * @return {@code true} if the IR dump is written.
     */
    public boolean writesIrDump() {
        return this == DEBUG;
    }
}
