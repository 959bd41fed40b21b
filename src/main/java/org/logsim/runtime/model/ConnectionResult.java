package org.logsim.runtime.model;

/**
 * Outcome of connecting an output to an input.
 */
public enum ConnectionResult {
    /** The connection was made. */
    OK,
    /** The source or the target device does not exist. */
    DEVICE_ABSENT,
    /** The input pin or the source output does not exist on its device. */
    PORT_ABSENT,
    /** The input already has a source. */
    INPUT_CONNECTED
}
