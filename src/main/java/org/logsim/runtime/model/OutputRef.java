package org.logsim.runtime.model;

/**
 * Identifies a device output.
 *
 * @param deviceId The id of the device.
 * @param pinId The id of the named output (Q, QBAR), or {@code null} for the unnamed output.
 */
public record OutputRef(int deviceId, Integer pinId) {
}
