package org.kindred.cli.commands;

import com.typesafe.config.ConfigException;
import org.kindred.cli.CommandLineInterface;
import org.kindred.compiler.build.BuildDirectoryCleaner;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "clean", description = "Removes the build output directory.")
public class CleanCommand implements Callable<Integer> {

    @Option(names = {"-o", "--out"}, description = "The output directory (default from configuration: build)")
    private Path out;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final BuildDirectoryCleaner cleaner = new BuildDirectoryCleaner();

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();
        Path directory;
        try {
            directory = out != null ? out : Path.of(parent.getConfig().getString("kindred.output-directory"));
        } catch (ConfigException e) {
            stderr.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try {
            if (cleaner.clean(directory)) {
                stdout.println("Removed " + directory);
            } else {
                stdout.println("Nothing to clean at " + directory);
            }
            return 0;
        } catch (IOException e) {
            stderr.println("Cannot clean " + directory + ": " + e.getMessage());
            return 1;
        }
    }
}
