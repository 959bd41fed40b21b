package org.logsim.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.logsim.cli.commands.CheckCommand;
import org.logsim.cli.commands.RunCommand;
import org.logsim.cli.commands.ShellCommand;
import org.logsim.cli.config.ConfigLoader;
import org.logsim.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "logsim",
    mixinStandardHelpOptions = true,
    version = "logsim 1.0",
    description = "Builds logic circuits from their textual definition and simulates them cycle by cycle.",
    subcommands = {
        CheckCommand.class,
        RunCommand.class,
        ShellCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

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
     * @return The command line with the error handling shared by every subcommand.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("logsim");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException) {
                LOG.error("Failed to load or parse configuration: {}", ex.getMessage());
            } else {
                LOG.error("Command failed", ex);
            }
            cmd.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
