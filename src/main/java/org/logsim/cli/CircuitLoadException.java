package org.logsim.cli;

/**
 * Thrown when a circuit definition file cannot be read.
 */
public class CircuitLoadException extends Exception {

    /**
     * @param message The detail message.
     */
    public CircuitLoadException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public CircuitLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
