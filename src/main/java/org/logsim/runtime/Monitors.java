package org.logsim.runtime;

import org.logsim.names.NameTable;
import org.logsim.runtime.model.Device;
import org.logsim.runtime.model.MonitorResult;
import org.logsim.runtime.model.OutputRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of monitored outputs and the signal history recorded for each of them.
 * <p>
 * A history holds one sample per cycle completed since the monitor was added or the
 * histories were last reset; a monitor added mid-run is never backfilled.
 */
public class Monitors {

    private final NameTable names;
    private final Devices devices;
    private final Network network;
    private final Map<OutputRef, List<Boolean>> histories = new LinkedHashMap<>();

    public Monitors(NameTable names, Devices devices, Network network) {
        this.names = names;
        this.devices = devices;
        this.network = network;
    }

    /**
     * Starts monitoring an output with an empty history.
     * @param deviceId The device.
     * @param outputPin The output, {@code null} for the unnamed output.
     * @return {@link MonitorResult#OK}, or why the monitor could not be added.
     */
    public MonitorResult makeMonitor(int deviceId, Integer outputPin) {
        Device device = devices.getDevice(deviceId);
        if (device == null) {
            return MonitorResult.DEVICE_ABSENT;
        }
        if (!device.hasOutput(outputPin)) {
            return MonitorResult.NOT_OUTPUT;
        }
        OutputRef key = new OutputRef(deviceId, outputPin);
        if (histories.containsKey(key)) {
            return MonitorResult.MONITOR_PRESENT;
        }
        histories.put(key, new ArrayList<>());
        return MonitorResult.OK;
    }

    /**
     * Stops monitoring an output and discards its history.
     * @return {@link MonitorResult#OK} or {@link MonitorResult#NOT_MONITORED}.
     */
    public MonitorResult removeMonitor(int deviceId, Integer outputPin) {
        return histories.remove(new OutputRef(deviceId, outputPin)) == null
                ? MonitorResult.NOT_MONITORED : MonitorResult.OK;
    }

    /**
     * Appends the current value of every monitored output to its history.
     */
    public void recordSignals() {
        for (Map.Entry<OutputRef, List<Boolean>> entry : histories.entrySet()) {
            OutputRef ref = entry.getKey();
            entry.getValue().add(network.getOutputSignal(ref.deviceId(), ref.pinId()));
        }
    }

    /**
     * Clears every history; the monitors themselves stay registered.
     */
    public void resetMonitors() {
        for (List<Boolean> history : histories.values()) {
            history.clear();
        }
    }

    public boolean isMonitored(int deviceId, Integer outputPin) {
        return histories.containsKey(new OutputRef(deviceId, outputPin));
    }

    /**
     * @return The monitored outputs in the order they were added.
     */
    public List<OutputRef> getMonitors() {
        return new ArrayList<>(histories.keySet());
    }

    /**
     * @return The samples of a monitored output, or {@code null} if it is not monitored.
     */
    public List<Boolean> getSignalHistory(int deviceId, Integer outputPin) {
        List<Boolean> history = histories.get(new OutputRef(deviceId, outputPin));
        return history == null ? null : Collections.unmodifiableList(history);
    }

    /**
     * @return Every history keyed by its display name, in the order the monitors were added.
     */
    public Map<String, List<Boolean>> getSignals() {
        Map<String, List<Boolean>> signals = new LinkedHashMap<>();
        for (Map.Entry<OutputRef, List<Boolean>> entry : histories.entrySet()) {
            signals.put(displayName(entry.getKey()), Collections.unmodifiableList(entry.getValue()));
        }
        return signals;
    }

    /**
     * @return The names of the monitored outputs and of every other output of the circuit.
     */
    public SignalNames getSignalNames() {
        List<String> monitored = new ArrayList<>();
        for (OutputRef ref : histories.keySet()) {
            monitored.add(displayName(ref));
        }
        List<String> unmonitored = new ArrayList<>();
        for (Device device : devices.getDevices()) {
            for (Integer pin : device.getOutputs().keySet()) {
                OutputRef ref = new OutputRef(device.getId(), pin);
                if (!histories.containsKey(ref)) {
                    unmonitored.add(displayName(ref));
                }
            }
        }
        return new SignalNames(monitored, unmonitored);
    }

    /**
     * @return {@code device} or {@code device.PIN}.
     */
    public String displayName(OutputRef ref) {
        String device = names.getNameString(ref.deviceId());
        return ref.pinId() == null ? device : device + "." + names.getNameString(ref.pinId());
    }

    /**
     * Output names split by whether they are monitored.
     *
     * @param monitored Monitored outputs in the order they were added.
     * @param unmonitored All other outputs in device creation order.
     */
    public record SignalNames(List<String> monitored, List<String> unmonitored) {
        public SignalNames {
            monitored = List.copyOf(monitored);
            unmonitored = List.copyOf(unmonitored);
        }
    }
}
