package org.kindred.compiler.backend.codegen;

import java.nio.charset.StandardCharsets;

/**
 * The runtime helpers behind the builtin functions. They are emitted into every listing and
 * delegate to the C library: {@code print} uses {@code printf}, the others {@code puts}.
 * Each helper takes its argument in {@code %rdi} and returns 0 in {@code %rax}.
 */
final class RuntimeSupport {

    private static final String INT_FORMAT = ".Lrt_int_format";
    private static final String TRUE_TEXT = ".Lrt_true";
    private static final String FALSE_TEXT = ".Lrt_false";

    private RuntimeSupport() {
    }

    /**
     * Emits the read-only constants used by the helpers. Must be called inside {@code .rodata}.
     */
    static void emitConstants(AssemblyListing listing) {
        listing.label(INT_FORMAT);
        listing.directive(".string \"%ld\\n\"");
        listing.label(TRUE_TEXT);
        listing.directive(".string \"true\"");
        listing.label(FALSE_TEXT);
        listing.directive(".string \"false\"");
    }

    /**
     * Emits the helper functions. Must be called inside {@code .text}.
     */
    static void emitHelpers(AssemblyListing listing) {
        listing.label(SymbolMangler.builtin("print"));
        prologue(listing);
        listing.instruction("movq", "%rdi", "%rsi");
        listing.instruction("leaq", INT_FORMAT + "(%rip)", "%rdi");
        listing.instruction("xorl", "%eax", "%eax");
        listing.instruction("call", "printf@PLT");
        epilogue(listing);
        listing.blank();

        listing.label(SymbolMangler.builtin("print_bool"));
        prologue(listing);
        listing.instruction("testq", "%rdi", "%rdi");
        listing.instruction("leaq", TRUE_TEXT + "(%rip)", "%rdi");
        listing.instruction("leaq", FALSE_TEXT + "(%rip)", "%rax");
        listing.instruction("cmove", "%rax", "%rdi");
        listing.instruction("call", "puts@PLT");
        epilogue(listing);
        listing.blank();

        listing.label(SymbolMangler.builtin("print_str"));
        prologue(listing);
        listing.instruction("call", "puts@PLT");
        epilogue(listing);
    }

    private static void prologue(AssemblyListing listing) {
        listing.instruction("pushq", "%rbp");
        listing.instruction("movq", "%rsp", "%rbp");
    }

    private static void epilogue(AssemblyListing listing) {
        listing.instruction("xorl", "%eax", "%eax");
        listing.instruction("popq", "%rbp");
        listing.instruction("ret");
    }

    /**
     * Escapes a string for a GNU assembler {@code .string} directive.
     * @param value The raw string content.
     * @return The escaped text, without quotes.
     */
    static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        value.codePoints().forEach(c -> {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        // Octal escapes of the UTF-8 bytes.
                        for (byte b : new String(Character.toChars(c)).getBytes(StandardCharsets.UTF_8)) {
                            sb.append(String.format("\\%03o", b & 0xff));
                        }
                    } else {
                        sb.append((char) c);
                    }
                }
            }
        });
        return sb.toString();
    }
}
