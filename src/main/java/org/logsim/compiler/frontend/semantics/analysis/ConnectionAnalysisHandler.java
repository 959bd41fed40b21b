package org.logsim.compiler.frontend.semantics.analysis;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Token;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.parser.ast.ConnectionNode;
import org.logsim.runtime.Circuit;
import org.logsim.runtime.model.ConnectionResult;
import org.logsim.runtime.model.Device;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.OutputRef;

import java.util.Set;

/**
 * Validates a connection against the declared devices and adds it to the network.
 * Problems are checked in order: undefined devices, then pins, then fan-in.
 */
public class ConnectionAnalysisHandler implements IAnalysisHandler {

    private final Set<Integer> rejectedDevices;

    public ConnectionAnalysisHandler(Set<Integer> rejectedDevices) {
        this.rejectedDevices = rejectedDevices;
    }

    @Override
    public void analyze(AstNode node, Circuit circuit, DiagnosticsEngine diagnostics) {
        ConnectionNode connection = (ConnectionNode) node;
        Device source = circuit.devices().getDevice(connection.sourceDevice().nameId());
        Device target = circuit.devices().getDevice(connection.targetDevice().nameId());

        boolean undefined = false;
        if (source == null) {
            undefined = true;
            reportUndefined(connection.sourceDevice(), diagnostics);
        }
        if (target == null) {
            undefined = true;
            reportUndefined(connection.targetDevice(), diagnostics);
        }
        if (undefined) {
            return;
        }

        Integer sourcePin = connection.sourcePin() == null ? null : connection.sourcePin().nameId();
        if (!source.hasOutput(sourcePin)) {
            Token at = connection.sourcePin() != null ? connection.sourcePin() : connection.sourceDevice();
            String message = source.getKind() == DeviceKind.DTYPE
                    ? "The output of DTYPE '" + connection.sourceDevice().text() + "' must be given as .Q or .QBAR."
                    : "'" + connection.sourceText() + "' is not an output: " + source.getKind() + " '"
                            + connection.sourceDevice().text() + "' has a single unnamed output.";
            diagnostics.reportError(CircuitErrorCode.INVALID_PIN, message, at);
            return;
        }
        int targetPin = connection.targetPin().nameId();
        if (!target.hasInput(targetPin)) {
            diagnostics.reportError(CircuitErrorCode.INVALID_PIN,
                    target.getKind() + " '" + connection.targetDevice().text() + "' has no input "
                            + connection.targetPin().text() + ".", connection.targetPin());
            return;
        }

        ConnectionResult result = circuit.network().makeConnection(source.getId(), sourcePin, target.getId(), targetPin);
        if (result == ConnectionResult.INPUT_CONNECTED) {
            OutputRef existing = circuit.network().getConnectedOutput(target.getId(), targetPin);
            diagnostics.reportError(CircuitErrorCode.INPUT_ALREADY_CONNECTED,
                    "Input " + connection.targetText() + " is already connected to "
                            + circuit.monitors().displayName(existing) + ".", connection.targetPin());
        }
    }

    private void reportUndefined(Token device, DiagnosticsEngine diagnostics) {
        if (rejectedDevices.contains(device.nameId())) {
            return;
        }
        diagnostics.reportError(CircuitErrorCode.UNDEFINED_DEVICE,
                "Device '" + device.text() + "' is not defined in the DEVICES section.", device);
    }
}
