package org.logsim.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Pin vocabulary shared by the lexer (as reserved words) and the device registry.
 */
public final class Pins {

    /** Maximum number of inputs of a multi-input gate. */
    public static final int MAX_GATE_INPUTS = 16;

    /** DTYPE data input. */
    public static final String DATA = "DATA";
    /** DTYPE clock input. */
    public static final String CLK = "CLK";
    /** DTYPE asynchronous set input. */
    public static final String SET = "SET";
    /** DTYPE asynchronous clear input. */
    public static final String CLEAR = "CLEAR";
    /** DTYPE output. */
    public static final String Q = "Q";
    /** DTYPE inverted output. */
    public static final String QBAR = "QBAR";

    /** DTYPE inputs in declaration order. */
    public static final List<String> DTYPE_INPUTS = List.of(DATA, CLK, SET, CLEAR);
    /** DTYPE outputs in declaration order. */
    public static final List<String> DTYPE_OUTPUTS = List.of(Q, QBAR);

    private Pins() {
    }

    /**
     * Returns the name of the n-th gate input.
     * @param number The 1-based input number.
     * @return The pin name, e.g. {@code I3}.
     */
    public static String gateInput(int number) {
        return "I" + number;
    }

    /**
     * @param count The number of gate inputs.
     * @return The names {@code I1..Icount}.
     */
    public static List<String> gateInputs(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(Pins::gateInput).toList();
    }

    /**
     * @return Every input pin name the language knows: I1..I16 and the DTYPE inputs.
     */
    public static List<String> allInputPins() {
        List<String> pins = new ArrayList<>(gateInputs(MAX_GATE_INPUTS));
        pins.addAll(DTYPE_INPUTS);
        return pins;
    }

    /**
     * @param name A pin name.
     * @return {@code true} if the name is one of the known input pins.
     */
    public static boolean isInputPin(String name) {
        return allInputPins().contains(name);
    }

    /**
     * @param name A pin name.
     * @return {@code true} if the name is one of the named outputs.
     */
    public static boolean isOutputPin(String name) {
        return DTYPE_OUTPUTS.contains(name);
    }
}
