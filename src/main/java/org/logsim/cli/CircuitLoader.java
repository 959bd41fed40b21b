package org.logsim.cli;

import org.logsim.compiler.api.BuildResult;
import org.logsim.compiler.api.CircuitCompiler;
import org.logsim.compiler.api.ICircuitCompiler;
import org.logsim.compiler.diagnostics.Diagnostic;
import org.logsim.runtime.SimulationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a definition file and builds it, printing the diagnostics the way the commands
 * share.
 */
public class CircuitLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitLoader.class);

    private final ICircuitCompiler compiler;

    public CircuitLoader(SimulationSettings settings) {
        this(new CircuitCompiler(settings));
    }

    CircuitLoader(ICircuitCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * Builds the circuit in a file.
     * @param file The definition file.
     * @return The build result, successful or not.
     * @throws CircuitLoadException if the file does not exist or cannot be read.
     */
    public BuildResult load(Path file) throws CircuitLoadException {
        if (!Files.isRegularFile(file)) {
            LOG.error("Circuit file not found: {}", file.toAbsolutePath());
            throw new CircuitLoadException("Circuit file not found: " + file);
        }
        try {
            return compiler.buildNetwork(file);
        } catch (IOException e) {
            LOG.error("Failed to read circuit file {}: {}", file, e.getMessage());
            throw new CircuitLoadException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Prints every diagnostic with its source line, followed by a summary if there were errors.
     * @param result The build result.
     * @param err The stream to print to.
     */
    public static void printDiagnostics(BuildResult result, PrintWriter err) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic.render());
        }
        if (!result.success()) {
            err.printf("%d error(s), %d warning(s).%n", result.errors().size(), result.warnings().size());
        }
        err.flush();
    }
}
