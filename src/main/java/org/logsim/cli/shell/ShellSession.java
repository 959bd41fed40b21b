package org.logsim.cli.shell;

import org.logsim.cli.rendering.TraceRenderer;
import org.logsim.runtime.SimulationException;
import org.logsim.runtime.Simulator;
import org.logsim.runtime.model.MonitorResult;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interprets the single-letter commands of the interactive shell against a simulator.
 * The terminal handling lives in the command that owns the session, so a session can be
 * driven from any line source.
 * <p>
 * Switches set with {@code s} are re-applied after the cold start of every later {@code r}.
 */
public class ShellSession {

    static final String HELP = String.join(System.lineSeparator(),
            "User commands:",
            "r N       - run the simulation from a cold start for N cycles",
            "c N       - continue the simulation for N cycles",
            "s X N     - set switch X to N (0 or 1)",
            "m X       - set a monitor on signal X (device or device.PIN)",
            "z X       - zap the monitor on signal X",
            "l         - list switches and outputs",
            "h         - help (this command)",
            "q         - quit the program");

    private final Simulator simulator;
    private final TraceRenderer renderer;
    private final PrintWriter out;
    private final int defaultCycles;
    private final Map<String, Boolean> switchSettings = new LinkedHashMap<>();
    private boolean started = false;

    /**
     * @param simulator The simulator to drive.
     * @param renderer Renders the traces printed after every run.
     * @param out Where all output goes.
     * @param defaultCycles Cycles used when {@code r} or {@code c} is given no count.
     */
    public ShellSession(Simulator simulator, TraceRenderer renderer, PrintWriter out, int defaultCycles) {
        this.simulator = simulator;
        this.renderer = renderer;
        this.out = out;
        this.defaultCycles = defaultCycles;
    }

    /**
     * Executes one line of input.
     * @param line The line as typed.
     * @return {@code false} if the user asked to quit.
     */
    public boolean execute(String line) {
        String[] parts = line.trim().split("\\s+");
        String command = parts[0];
        try {
            switch (command) {
                case "" -> { }
                case "r" -> run(parts);
                case "c" -> continueRun(parts);
                case "s" -> setSwitch(parts);
                case "m" -> monitor(parts, true);
                case "z" -> monitor(parts, false);
                case "l" -> list();
                case "h" -> out.println(HELP);
                case "q" -> {
                    return false;
                }
                default -> out.println("Invalid command '" + command + "'. Enter 'h' for help.");
            }
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
        } finally {
            out.flush();
        }
        return true;
    }

    private void run(String[] parts) {
        int cycles = cycles(parts);
        try {
            simulator.run(cycles, switchSettings);
            started = true;
            out.println("Running for " + cycles + " cycles");
        } catch (SimulationException e) {
            started = true;
            out.println("Error: " + e.getMessage());
        }
        printTraces();
    }

    private void continueRun(String[] parts) {
        int cycles = cycles(parts);
        if (!started) {
            out.println("Error: nothing to continue. Run first.");
            return;
        }
        try {
            simulator.continueRun(cycles);
            out.println("Continuing for " + cycles + " cycles. Total: " + simulator.getCyclesCompleted());
        } catch (SimulationException e) {
            out.println("Error: " + e.getMessage());
        }
        printTraces();
    }

    private void setSwitch(String[] parts) {
        if (parts.length != 3 || !(parts[2].equals("0") || parts[2].equals("1"))) {
            throw new IllegalArgumentException("usage: s X N, with N 0 or 1.");
        }
        if (simulator.setSwitch(parts[1], parts[2].equals("1"))) {
            switchSettings.put(parts[1], parts[2].equals("1"));
            out.println("Successfully set switch " + parts[1] + " to " + parts[2]);
        } else {
            out.println("Error: '" + parts[1] + "' is not a switch.");
        }
    }

    private void monitor(String[] parts, boolean on) {
        if (parts.length != 2) {
            throw new IllegalArgumentException("usage: " + (on ? "m" : "z") + " X, with X a device or device.PIN.");
        }
        MonitorResult result = simulator.setMonitor(parts[1], on);
        String message = switch (result) {
            case OK -> on ? "Successfully made monitor " + parts[1] : "Successfully zapped monitor " + parts[1];
            case DEVICE_ABSENT -> "Error: there is no device '" + parts[1].split("\\.")[0] + "'.";
            case NOT_OUTPUT -> "Error: '" + parts[1] + "' is not an output.";
            case MONITOR_PRESENT -> "Error: '" + parts[1] + "' is already monitored.";
            case NOT_MONITORED -> "Error: '" + parts[1] + "' is not monitored.";
        };
        out.println(message);
    }

    private void list() {
        out.println("Switches:");
        for (String name : simulator.listSwitches()) {
            out.println("  " + name + " = " + (simulator.getSwitchState(name) ? "1" : "0"));
        }
        out.println("Outputs (* = monitored):");
        for (String name : simulator.listOutputs()) {
            out.println((simulator.isMonitored(name) ? "* " : "  ") + name);
        }
    }

    private void printTraces() {
        List<String> lines = renderer.render(simulator.getSignals(), simulator.getCyclesCompleted());
        lines.forEach(out::println);
    }

    private int cycles(String[] parts) {
        if (parts.length == 1) {
            return defaultCycles;
        }
        if (parts.length == 2 && parts[1].matches("[0-9]{1,9}") && Integer.parseInt(parts[1]) > 0) {
            return Integer.parseInt(parts[1]);
        }
        throw new IllegalArgumentException("the number of cycles must be a positive integer.");
    }
}
