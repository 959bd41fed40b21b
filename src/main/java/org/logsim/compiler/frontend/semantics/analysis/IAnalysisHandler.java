package org.logsim.compiler.frontend.semantics.analysis;

import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.runtime.Circuit;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for validating one type of statement and applying it to the circuit under construction.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single statement.
     * @param node The node to analyze.
     * @param circuit The circuit being built.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, Circuit circuit, DiagnosticsEngine diagnostics);
}
