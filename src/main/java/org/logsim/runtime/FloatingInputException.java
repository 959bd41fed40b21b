package org.logsim.runtime;

/**
 * Thrown when a cycle is started while some input has no source.
 */
public class FloatingInputException extends SimulationException {

    private final String deviceName;
    private final String pinName;

    public FloatingInputException(String deviceName, String pinName) {
        super("Input " + deviceName + "." + pinName + " is not connected.");
        this.deviceName = deviceName;
        this.pinName = pinName;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getPinName() {
        return pinName;
    }
}
