package org.logsim.runtime;

/**
 * Thrown when the gates of a circuit do not reach a stable state within the iteration cap.
 */
public class OscillationException extends SimulationException {

    private final int iterations;

    /**
     * @param iterations The number of settle passes that were attempted.
     */
    public OscillationException(int iterations) {
        super("The network did not settle after " + iterations + " iterations; the circuit oscillates.");
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
