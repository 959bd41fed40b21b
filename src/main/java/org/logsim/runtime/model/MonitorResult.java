package org.logsim.runtime.model;

/**
 * Outcome of adding or removing a monitor point.
 */
public enum MonitorResult {
    /** The operation succeeded. */
    OK,
    /** The device does not exist. */
    DEVICE_ABSENT,
    /** The pin is not an output of the device. */
    NOT_OUTPUT,
    /** The output is already monitored. */
    MONITOR_PRESENT,
    /** The output is not monitored, so there is nothing to remove. */
    NOT_MONITORED
}
