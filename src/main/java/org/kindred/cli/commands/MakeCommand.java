package org.kindred.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;
import org.kindred.cli.CommandLineInterface;
import org.kindred.compiler.Compiler;
import org.kindred.compiler.api.CompilationException;
import org.kindred.compiler.api.CompileOptions;
import org.kindred.compiler.api.ICompiler;
import org.kindred.compiler.api.OptimizationMode;
import org.kindred.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "make", description = "Compiles a Kindred source file into a native executable.")
public class MakeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(MakeCommand.class);

    @Option(names = {"-m", "--mode"}, description = "Build mode: ${COMPLETION-CANDIDATES} (default from configuration: RELEASE)")
    private OptimizationMode mode;

    @Option(names = {"-s", "--source"}, description = "The source file (default from configuration: main.kin)")
    private Path source;

    @Option(names = {"-o", "--out"}, description = "The output directory (default from configuration: build)")
    private Path out;

    @Option(names = "--json", description = "Print diagnostics as a JSON array on standard output")
    private boolean json;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final ICompiler compiler;

    public MakeCommand() {
        this(new Compiler());
    }

    /**
     * @param compiler The compiler to run; replaced in tests.
     */
    public MakeCommand(ICompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();

        CompileOptions options;
        try {
            options = resolveOptions();
        } catch (ConfigException | IllegalArgumentException e) {
            stderr.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try {
            Path executable = compiler.compile(options);
            if (json) {
                stdout.println("[]");
            } else {
                stdout.println("Built " + executable);
            }
            return 0;
        } catch (CompilationException e) {
            LOG.debug("make failed", e);
            report(e.diagnostics(), json ? stdout : stderr);
            return 1;
        }
    }

    private CompileOptions resolveOptions() {
        CompileOptions options = CompileOptions.fromConfig(parent.getConfig());
        if (mode != null) {
            options = options.withOptimizationMode(mode);
        }
        if (source != null) {
            options = options.withSourcePath(source);
        }
        if (out != null) {
            options = options.withOutputDirectory(out);
        }
        return options;
    }

    private void report(List<Diagnostic> diagnostics, PrintWriter writer) {
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            writer.println(gson.toJson(diagnostics.stream().map(DiagnosticView::of).toList()));
        } else {
            diagnostics.forEach(d -> writer.println(d.format()));
        }
        writer.flush();
    }

    /**
     * The JSON shape of one diagnostic.
     */
    record DiagnosticView(String severity, String kind, String file, int line, int column, String message) {
        static DiagnosticView of(Diagnostic diagnostic) {
            return new DiagnosticView(diagnostic.type().name(), diagnostic.code().displayName(),
                    diagnostic.span().fileName(), diagnostic.span().line(), diagnostic.span().column(),
                    diagnostic.message());
        }
    }
}
