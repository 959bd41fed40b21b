package org.logsim.compiler.frontend.semantics.analysis;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.parser.ast.DeviceNode;
import org.logsim.runtime.Circuit;
import org.logsim.runtime.DuplicateDeviceException;
import org.logsim.runtime.InvalidDeviceParameterException;
import org.logsim.runtime.DeviceException;

import java.util.HashSet;
import java.util.Set;

/**
 * Creates the device of a declaration. A declaration that fails only because of its
 * parameter is remembered as rejected, so statements using the device are not reported
 * a second time as referring to an undefined device. A name counts as declared from its
 * first declaration on, whether or not that declaration was accepted.
 */
public class DeviceAnalysisHandler implements IAnalysisHandler {

    private final Set<Integer> rejectedDevices;
    private final Set<Integer> declaredNames = new HashSet<>();

    /**
     * @param rejectedDevices Shared set receiving the ids of declarations that could not be built.
     */
    public DeviceAnalysisHandler(Set<Integer> rejectedDevices) {
        this.rejectedDevices = rejectedDevices;
    }

    @Override
    public void analyze(AstNode node, Circuit circuit, DiagnosticsEngine diagnostics) {
        DeviceNode device = (DeviceNode) node;
        int deviceId = device.nameToken().nameId();
        if (!declaredNames.add(deviceId)) {
            diagnostics.reportError(CircuitErrorCode.DUPLICATE_DEVICE,
                    "Device '" + device.nameToken().text() + "' is already defined.", device.nameToken());
            return;
        }
        String parameter = device.parameterToken() == null ? null : device.parameterToken().text();
        try {
            circuit.devices().createDevice(device.kind(), deviceId, parameter);
        } catch (DuplicateDeviceException e) {
            diagnostics.reportError(CircuitErrorCode.DUPLICATE_DEVICE, e.getMessage(), device.nameToken());
        } catch (InvalidDeviceParameterException e) {
            rejectedDevices.add(deviceId);
            diagnostics.reportError(CircuitErrorCode.INVALID_ARGUMENT, e.getMessage(),
                    device.parameterToken() != null ? device.parameterToken() : device.nameToken());
        } catch (DeviceException e) {
            diagnostics.reportError(CircuitErrorCode.INVALID_ARGUMENT, e.getMessage(), device.nameToken());
        }
    }
}
