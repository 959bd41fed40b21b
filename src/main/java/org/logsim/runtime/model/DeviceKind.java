package org.logsim.runtime.model;

import java.util.Arrays;
import java.util.List;

/**
 * The closed set of device kinds a circuit can contain. The enum constant names are
 * also the keywords used in circuit definitions.
 */
public enum DeviceKind {
    /** A manually controlled constant source. Parameter: initial state 0 or 1. */
    SWITCH,
    /** A square-wave source. Parameter: half-period in cycles. */
    CLOCK,
    /** AND gate. Parameter: number of inputs 1..16. */
    AND,
    /** OR gate. Parameter: number of inputs 1..16. */
    OR,
    /** NAND gate. Parameter: number of inputs 1..16. */
    NAND,
    /** NOR gate. Parameter: number of inputs 1..16. */
    NOR,
    /** Two-input exclusive OR gate. No parameter. */
    XOR,
    /** Edge-triggered D flip-flop with asynchronous SET and CLEAR. No parameter. */
    DTYPE,
    /** Power-on pulse: high for a number of cycles after a cold start, then low. Parameter: period. */
    RC,
    /** Repeating bit pattern source. Parameter: waveform of 0s and 1s. */
    SIGGEN;

    /**
     * @return {@code true} for the multi-input gates whose parameter is an input count.
     */
    public boolean isMultiInputGate() {
        return switch (this) {
            case AND, OR, NAND, NOR -> true;
            case SWITCH, CLOCK, XOR, DTYPE, RC, SIGGEN -> false;
        };
    }

    /**
     * @return {@code true} if a declaration of this kind takes a parameter.
     */
    public boolean takesParameter() {
        return switch (this) {
            case XOR, DTYPE -> false;
            case SWITCH, CLOCK, AND, OR, NAND, NOR, RC, SIGGEN -> true;
        };
    }

    /**
     * @return The names of all kinds, as used in circuit definitions.
     */
    public static List<String> keywords() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }

    /**
     * Resolves a keyword to a kind.
     * @param text The keyword text.
     * @return The kind, or {@code null} if the text is not a kind keyword.
     */
    public static DeviceKind fromKeyword(String text) {
        for (DeviceKind kind : values()) {
            if (kind.name().equals(text)) {
                return kind;
            }
        }
        return null;
    }
}
