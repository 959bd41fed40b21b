package org.logsim.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.logsim.cli.CircuitLoadException;
import org.logsim.cli.CircuitLoader;
import org.logsim.cli.CommandLineInterface;
import org.logsim.cli.rendering.TraceRenderer;
import org.logsim.cli.shell.ShellSession;
import org.logsim.compiler.api.BuildResult;
import org.logsim.runtime.SimulationSettings;
import org.logsim.runtime.Simulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "shell",
    description = "Build a circuit and control its simulation interactively"
)
public class ShellCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ShellCommand.class);

    @Parameters(index = "0", description = "The circuit definition file")
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        PrintWriter err = spec.commandLine().getErr();
        Config config = parent.getConfig();
        SimulationSettings settings = SimulationSettings.fromConfig(config);

        BuildResult result;
        try {
            result = new CircuitLoader(settings).load(file);
        } catch (CircuitLoadException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        CircuitLoader.printDiagnostics(result, err);
        if (!result.success()) {
            return 1;
        }

        try (Terminal terminal = openTerminal()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            ShellSession session = new ShellSession(new Simulator(result.circuit()),
                    TraceRenderer.fromConfig(config), terminal.writer(), settings.defaultCycles());
            String prompt = config.getString("logsim.cli.prompt");

            terminal.writer().println("Logic Simulator: interactive command line user interface.");
            terminal.writer().println("Enter 'h' for help.");
            while (true) {
                String line;
                try {
                    line = lineReader.readLine(prompt);
                } catch (UserInterruptException | EndOfFileException e) {
                    // Ctrl+C or Ctrl+D
                    return 0;
                }
                if (line == null || !session.execute(line)) {
                    return 0;
                }
            }
        }
    }

    private static Terminal openTerminal() throws IOException {
        try {
            return TerminalBuilder.builder().system(true).build();
        } catch (IOException e) {
            // Fallback to dumb terminal if system terminal is not available (e.g., in an IDE)
            LOG.debug("System terminal unavailable, using a dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder().dumb(true).build();
        }
    }
}
