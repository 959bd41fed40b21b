package org.logsim.runtime.model;

import java.util.List;

/**
 * The hidden, kind-specific state of a device. Each variant carries only what its kind
 * needs; instances are immutable so that a device can be rolled back to the state it
 * had before a failed cycle by keeping a reference.
 */
public sealed interface DeviceState permits DeviceState.Gate, DeviceState.Switch, DeviceState.Clock,
        DeviceState.DType, DeviceState.Rc, DeviceState.SigGen {

    /**
     * AND, OR, NAND, NOR and XOR gates: no memory beyond their output.
     * @param inputCount The number of inputs.
     */
    record Gate(int inputCount) implements DeviceState {}

    /**
     * @param initialState The state declared in the definition, restored on a cold start.
     * @param on The current state.
     */
    record Switch(boolean initialState, boolean on) implements DeviceState {
        public Switch withOn(boolean value) {
            return new Switch(initialState, value);
        }
    }

    /**
     * @param halfPeriod Number of cycles between two output toggles.
     * @param counter Cycles elapsed since the last toggle.
     */
    record Clock(int halfPeriod, int counter) implements DeviceState {
        public Clock withCounter(int value) {
            return new Clock(halfPeriod, value);
        }
    }

    /**
     * @param q The latched Q value; QBAR is always its complement.
     * @param previousClock The CLK input sampled in the previous cycle, for edge detection.
     */
    record DType(boolean q, boolean previousClock) implements DeviceState {}

    /**
     * @param period Number of cycles the output stays high after a cold start.
     * @param remaining Cycles left before the output drops.
     */
    record Rc(int period, int remaining) implements DeviceState {
        public Rc withRemaining(int value) {
            return new Rc(period, value);
        }
    }

    /**
     * @param waveform The repeating bit pattern.
     * @param cursor Index of the bit emitted in the next cycle.
     */
    record SigGen(List<Boolean> waveform, int cursor) implements DeviceState {
        public SigGen {
            waveform = List.copyOf(waveform);
        }

        public SigGen withCursor(int value) {
            return new SigGen(waveform, value);
        }
    }
}
