package org.logsim.runtime;

import org.logsim.runtime.model.DeviceKind;

/**
 * Thrown when the parameter of a device declaration is missing, superfluous or out of range.
 */
public class InvalidDeviceParameterException extends DeviceException {

    private final DeviceKind kind;
    private final String parameter;

    /**
     * @param kind The kind being created.
     * @param parameter The rejected parameter text, may be {@code null}.
     * @param message What is wrong with it.
     */
    public InvalidDeviceParameterException(DeviceKind kind, String parameter, String message) {
        super(message);
        this.kind = kind;
        this.parameter = parameter;
    }

    public DeviceKind getKind() {
        return kind;
    }

    public String getParameter() {
        return parameter;
    }
}
