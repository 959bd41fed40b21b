package org.logsim.runtime;

/**
 * Thrown when a simulation cycle cannot complete. The circuit is left exactly as it was
 * before the failed cycle.
 */
public class SimulationException extends Exception {

    /**
     * @param message The detail message.
     */
    public SimulationException(String message) {
        super(message);
    }
}
