package org.logsim.compiler.frontend.semantics.analysis;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.parser.ast.MonitorNode;
import org.logsim.runtime.Circuit;
import org.logsim.runtime.model.MonitorResult;

import java.util.Set;

/**
 * Registers a monitor point. Monitoring the same output twice is only a warning.
 */
public class MonitorAnalysisHandler implements IAnalysisHandler {

    private final Set<Integer> rejectedDevices;

    public MonitorAnalysisHandler(Set<Integer> rejectedDevices) {
        this.rejectedDevices = rejectedDevices;
    }

    @Override
    public void analyze(AstNode node, Circuit circuit, DiagnosticsEngine diagnostics) {
        MonitorNode monitor = (MonitorNode) node;
        int deviceId = monitor.device().nameId();
        Integer pin = monitor.pin() == null ? null : monitor.pin().nameId();

        MonitorResult result = circuit.monitors().makeMonitor(deviceId, pin);
        switch (result) {
            case OK, NOT_MONITORED -> { }
            case DEVICE_ABSENT -> {
                if (!rejectedDevices.contains(deviceId)) {
                    diagnostics.reportError(CircuitErrorCode.UNDEFINED_DEVICE,
                            "Device '" + monitor.device().text() + "' is not defined in the DEVICES section.", monitor.device());
                }
            }
            case NOT_OUTPUT -> diagnostics.reportError(CircuitErrorCode.INVALID_PIN,
                    "'" + monitor.text() + "' is not an output of " + circuit.devices().getDevice(deviceId).getKind()
                            + " '" + monitor.device().text() + "'.",
                    monitor.pin() != null ? monitor.pin() : monitor.device());
            case MONITOR_PRESENT -> diagnostics.reportWarning(CircuitErrorCode.DUPLICATE_MONITOR,
                    "'" + monitor.text() + "' is already monitored; ignoring the repeat.", monitor.device());
        }
    }
}
