package org.logsim.runtime;

/**
 * Thrown when a device id is already registered.
 */
public class DuplicateDeviceException extends DeviceException {

    private final int deviceId;

    public DuplicateDeviceException(int deviceId, String deviceName) {
        super("Device '" + deviceName + "' is already defined.");
        this.deviceId = deviceId;
    }

    public int getDeviceId() {
        return deviceId;
    }
}
