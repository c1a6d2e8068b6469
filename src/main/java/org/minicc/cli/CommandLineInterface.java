package org.minicc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minicc.cli.commands.AnalyzeCommand;
import org.minicc.cli.commands.node.NodeCommand;
import org.minicc.node.config.ConfigLoader;
import org.minicc.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "minicc",
    mixinStandardHelpOptions = true,
    version = "minicc 1.0",
    description = "minicc - lexer, parser, semantic analyzer and three-address code generator for a small C subset",
    subcommands = {
        AnalyzeCommand.class,
        NodeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: minicc.conf in the working directory)"
    )
    private Path configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the exception handling used by {@link #main(String[])}.
     *
     * @return A ready-to-execute command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minicc");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOGGER.error("{}", ex.getMessage(), ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    /**
     * Returns the configuration, loading it and applying its logging settings on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalStateException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            } catch (final IllegalArgumentException | ConfigException e) {
                throw new IllegalStateException("Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
