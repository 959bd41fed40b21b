package org.logsim.cli.commands;

import com.typesafe.config.Config;
import org.logsim.cli.CircuitLoadException;
import org.logsim.cli.CircuitLoader;
import org.logsim.cli.CommandLineInterface;
import org.logsim.cli.rendering.TraceRenderer;
import org.logsim.compiler.api.BuildResult;
import org.logsim.runtime.SimulationException;
import org.logsim.runtime.SimulationSettings;
import org.logsim.runtime.Simulator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Build a circuit, run it from a cold start and print the monitored traces"
)
public class RunCommand implements Callable<Integer> {

    /** Exit code for a circuit that built but failed while running. */
    public static final int EXIT_RUNTIME_ERROR = 2;

    @Parameters(index = "0", description = "The circuit definition file")
    private Path file;

    @Option(
        names = {"-n", "--cycles"},
        description = "Number of cycles to run (default: logsim.simulation.default-cycles)"
    )
    private Integer cycles;

    @Option(
        names = {"-s", "--switch"},
        description = "Switch state before the run, e.g. --switch sw1=1 (repeatable)"
    )
    private Map<String, Integer> switches = new LinkedHashMap<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
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

        Simulator simulator = new Simulator(result.circuit());
        Map<String, Boolean> switchSettings = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : switches.entrySet()) {
            int state = entry.getValue();
            if ((state != 0 && state != 1) || simulator.getSwitchState(entry.getKey()) == null) {
                err.println("Error: cannot set switch '" + entry.getKey() + "' to " + state + ".");
                return 1;
            }
            switchSettings.put(entry.getKey(), state == 1);
        }

        int exitCode = 0;
        int requested = cycles != null ? cycles : settings.defaultCycles();
        if (requested < 0) {
            err.println("Error: the number of cycles must not be negative.");
            return 1;
        }
        try {
            simulator.run(requested, switchSettings);
        } catch (SimulationException e) {
            err.println("Error in cycle " + (simulator.getCyclesCompleted() + 1) + ": " + e.getMessage());
            exitCode = EXIT_RUNTIME_ERROR;
        }
        TraceRenderer renderer = TraceRenderer.fromConfig(config);
        renderer.render(simulator.getSignals(), simulator.getCyclesCompleted()).forEach(out::println);
        out.flush();
        return exitCode;
    }
}
