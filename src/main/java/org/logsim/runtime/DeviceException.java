package org.logsim.runtime;

/**
 * Thrown when a device cannot be created.
 */
public class DeviceException extends Exception {

    /**
     * @param message The detail message.
     */
    public DeviceException(String message) {
        super(message);
    }
}
