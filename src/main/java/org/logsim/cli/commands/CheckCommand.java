package org.logsim.cli.commands;

import org.logsim.cli.CircuitLoadException;
import org.logsim.cli.CircuitLoader;
import org.logsim.cli.CommandLineInterface;
import org.logsim.compiler.api.BuildResult;
import org.logsim.runtime.Circuit;
import org.logsim.runtime.SimulationSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Build a circuit definition and report its errors and warnings"
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The circuit definition file")
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        CircuitLoader loader = new CircuitLoader(SimulationSettings.fromConfig(parent.getConfig()));
        BuildResult result;
        try {
            result = loader.load(file);
        } catch (CircuitLoadException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        CircuitLoader.printDiagnostics(result, err);
        if (!result.success()) {
            return 1;
        }
        Circuit circuit = result.circuit();
        out.printf("%s: OK (%d devices, %d monitors%s)%n", file, circuit.devices().size(),
                circuit.monitors().getMonitors().size(),
                circuit.network().checkNetwork() ? "" : ", some inputs unconnected");
        return 0;
    }
}
