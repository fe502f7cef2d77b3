package org.kindred.cli;

import com.typesafe.config.Config;
import org.kindred.cli.commands.CleanCommand;
import org.kindred.cli.commands.MakeCommand;
import org.kindred.cli.config.ConfigLoader;
import org.kindred.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "kindred",
    mixinStandardHelpOptions = true,
    version = "Kindred 0.1.0",
    description = "Kindred - compiles Kindred programs to native x86-64 executables",
    subcommands = {
        MakeCommand.class,
        CleanCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a HOCON configuration file (default: kindred.conf in the working directory, if present)"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log compiler phases at DEBUG level")
    private boolean verbose;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Builds the configured picocli command line. Enum values such as the build mode are
     * accepted in any case.
     *
     * @return The command line for {@code kindred}.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(CommandLine.defaultFactory());
    }

    /**
     * Builds the command line with a custom factory for the subcommand instances.
     *
     * @param factory Creates the command objects.
     * @return The command line for {@code kindred}.
     */
    public static CommandLine createCommandLine(final CommandLine.IFactory factory) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface(), factory);
        commandLine.setCommandName("kindred");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            if (verbose) {
                LoggingConfigurator.setRootLevel("DEBUG");
            }
        }
        return config;
    }
}
