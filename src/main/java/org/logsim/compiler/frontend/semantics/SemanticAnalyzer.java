package org.logsim.compiler.frontend.semantics;

import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.parser.ast.ConnectionNode;
import org.logsim.compiler.frontend.parser.ast.DeviceNode;
import org.logsim.compiler.frontend.parser.ast.MonitorNode;
import org.logsim.compiler.frontend.semantics.analysis.ConnectionAnalysisHandler;
import org.logsim.compiler.frontend.semantics.analysis.DeviceAnalysisHandler;
import org.logsim.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.logsim.compiler.frontend.semantics.analysis.MonitorAnalysisHandler;
import org.logsim.runtime.Circuit;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs semantic analysis on the parsed statements and builds the circuit from them.
 * Every statement is dispatched to the handler for its node type; statements are
 * processed in source order, so all devices exist before the first connection is checked.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final Circuit circuit;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Set<Integer> rejectedDevices = new HashSet<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param circuit The empty circuit to populate.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, Circuit circuit) {
        this.diagnostics = diagnostics;
        this.circuit = circuit;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(DeviceNode.class, new DeviceAnalysisHandler(rejectedDevices));
        handlers.put(ConnectionNode.class, new ConnectionAnalysisHandler(rejectedDevices));
        handlers.put(MonitorNode.class, new MonitorAnalysisHandler(rejectedDevices));
    }

    /**
     * Marks devices whose declarations never reached analysis, so references to them are
     * not reported as undefined.
     * @param deviceIds The name ids of the incomplete declarations.
     */
    public void excludeDevices(Collection<Integer> deviceIds) {
        rejectedDevices.addAll(deviceIds);
    }

    /**
     * Analyzes the statements and applies the valid ones to the circuit.
     * @param statements The statements returned by the parser.
     */
    public void analyze(List<AstNode> statements) {
        for (AstNode node : statements) {
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, circuit, diagnostics);
            }
        }
    }
}
