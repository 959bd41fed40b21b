package org.logsim.compiler.api;

import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Lexer;
import org.logsim.compiler.frontend.parser.Parser;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.semantics.SemanticAnalyzer;
import org.logsim.names.NameTable;
import org.logsim.runtime.Circuit;
import org.logsim.runtime.Devices;
import org.logsim.runtime.Monitors;
import org.logsim.runtime.Network;
import org.logsim.runtime.SimulationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main implementation of {@link ICircuitCompiler}.
 * <p>
 * The pipeline is lexer, parser and semantic analysis in one pass over the source. Syntax
 * errors do not stop the analysis of the statements that did parse, so one build reports
 * every independent problem. Each call builds fresh registries.
 */
public class CircuitCompiler implements ICircuitCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitCompiler.class);

    private final SimulationSettings settings;

    public CircuitCompiler() {
        this(SimulationSettings.DEFAULTS);
    }

    /**
     * @param settings The settings handed to the network of every built circuit.
     */
    public CircuitCompiler(SimulationSettings settings) {
        this.settings = settings;
    }

    @Override
    public BuildResult buildNetwork(String source, String fileName, NameTable names) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(source);

        Devices devices = new Devices(names);
        Network network = new Network(names, devices, settings);
        Monitors monitors = new Monitors(names, devices, network);
        Circuit circuit = new Circuit(names, devices, network, monitors);

        Lexer lexer = new Lexer(source, names, diagnostics, fileName);
        Parser parser = new Parser(lexer, diagnostics);
        List<AstNode> statements = parser.parse();
        LOG.debug("Parsed {} statements from {}", statements.size(), fileName);

        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, circuit);
        analyzer.excludeDevices(parser.getIncompleteDevices());
        analyzer.analyze(statements);

        if (diagnostics.hasErrors()) {
            LOG.debug("Build of {} failed: {}", fileName, diagnostics.summary());
            return new BuildResult(false, diagnostics.getDiagnostics(), null);
        }
        LOG.debug("Built {}: {} devices, {} monitors", fileName, devices.size(), monitors.getMonitors().size());
        return new BuildResult(true, diagnostics.getDiagnostics(), circuit);
    }
}
