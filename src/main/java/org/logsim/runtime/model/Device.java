package org.logsim.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single device instance: its kind, its pins and its hidden state.
 * <p>
 * Devices hold pin data only. They never reference each other directly: an input
 * stores the {@link OutputRef} of its source, which is resolved through the registry,
 * so feedback loops in the circuit are plain data. The behaviour of a device lives in
 * the {@code Network}.
 */
public class Device {

    private final int id;
    private final DeviceKind kind;
    private final Map<Integer, OutputRef> inputs = new LinkedHashMap<>();
    private final Map<Integer, Boolean> outputs = new LinkedHashMap<>();
    private DeviceState state;

    /**
     * Creates a device with unconnected inputs and all outputs low.
     * @param id The device id (the interned id of its name).
     * @param kind The device kind.
     * @param inputPins The ids of its input pins.
     * @param outputPins The ids of its outputs; {@code null} stands for the unnamed output.
     * @param state The initial hidden state.
     */
    public Device(int id, DeviceKind kind, List<Integer> inputPins, List<Integer> outputPins, DeviceState state) {
        this.id = id;
        this.kind = kind;
        this.state = state;
        for (Integer pin : inputPins) {
            inputs.put(pin, null);
        }
        for (Integer pin : outputPins) {
            outputs.put(pin, false);
        }
    }

    public int getId() {
        return id;
    }

    public DeviceKind getKind() {
        return kind;
    }

    public DeviceState getState() {
        return state;
    }

    public void setState(DeviceState state) {
        this.state = state;
    }

    /**
     * @return Input pin id to source; a {@code null} value is an unconnected input.
     */
    public Map<Integer, OutputRef> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /**
     * @return Output pin id (or {@code null}) to current value.
     */
    public Map<Integer, Boolean> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public boolean hasInput(int pinId) {
        return inputs.containsKey(pinId);
    }

    public boolean hasOutput(Integer pinId) {
        return outputs.containsKey(pinId);
    }

    /**
     * @param pinId An input pin of this device.
     * @return The source of the input, or {@code null} if unconnected.
     */
    public OutputRef getSource(int pinId) {
        return inputs.get(pinId);
    }

    /**
     * Connects an input. The caller checks that the pin exists and is free.
     */
    public void setSource(int pinId, OutputRef source) {
        inputs.put(pinId, source);
    }

    /**
     * @param pinId An output of this device, {@code null} for the unnamed one.
     * @return The current value, or {@code null} if the output does not exist.
     */
    public Boolean getOutput(Integer pinId) {
        return outputs.get(pinId);
    }

    /**
     * Sets an existing output.
     * @return {@code true} if the value changed.
     */
    public boolean setOutput(Integer pinId, boolean value) {
        Boolean old = outputs.put(pinId, value);
        return old == null || old != value;
    }

    /**
     * @return A copy of the mutable parts of this device.
     */
    public Snapshot snapshot() {
        return new Snapshot(state, new LinkedHashMap<>(outputs));
    }

    /**
     * Puts the device back into a previously captured condition.
     */
    public void restore(Snapshot snapshot) {
        this.state = snapshot.state();
        this.outputs.clear();
        this.outputs.putAll(snapshot.outputs());
    }

    /**
     * Captured hidden state and output values of a device.
     *
     * @param state The hidden state.
     * @param outputs The output values.
     */
    public record Snapshot(DeviceState state, Map<Integer, Boolean> outputs) {}
}
