package org.logsim.runtime;

import com.typesafe.config.Config;

/**
 * Tunables of the simulation engine, read from the {@code logsim.simulation} block.
 *
 * @param minSettleIterations Lower bound of the settle-loop cap; the cap grows with the circuit.
 * @param defaultCycles Number of cycles run when the user does not give one.
 */
public record SimulationSettings(int minSettleIterations, int defaultCycles) {

    /** Values used when no configuration is available. */
    public static final SimulationSettings DEFAULTS = new SimulationSettings(20, 10);

    public SimulationSettings {
        if (minSettleIterations < 1) {
            throw new IllegalArgumentException("min-iterations must be positive, got " + minSettleIterations);
        }
        if (defaultCycles < 1) {
            throw new IllegalArgumentException("default-cycles must be positive, got " + defaultCycles);
        }
    }

    /**
     * Reads the settings from a configuration.
     * @param config The root configuration, containing {@code logsim.simulation}.
     * @return The settings; missing keys fall back to {@link #DEFAULTS}.
     */
    public static SimulationSettings fromConfig(Config config) {
        final String base = "logsim.simulation";
        if (!config.hasPath(base)) {
            return DEFAULTS;
        }
        Config simulation = config.getConfig(base);
        int minIterations = simulation.hasPath("settle.min-iterations")
                ? simulation.getInt("settle.min-iterations") : DEFAULTS.minSettleIterations();
        int cycles = simulation.hasPath("default-cycles")
                ? simulation.getInt("default-cycles") : DEFAULTS.defaultCycles();
        return new SimulationSettings(minIterations, cycles);
    }
}
