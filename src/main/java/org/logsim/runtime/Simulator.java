package org.logsim.runtime;

import org.logsim.names.NameTable;
import org.logsim.runtime.model.Device;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.DeviceState;
import org.logsim.runtime.model.MonitorResult;
import org.logsim.runtime.model.OutputRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives a built {@link Circuit} for interactive front ends. Devices and outputs are
 * addressed by their names as written in the definition ({@code sw1}, {@code ff1.QBAR}).
 * <p>
 * Every cycle executes the network and then records the monitored outputs. A runtime
 * error stops the run; the cycles completed before it keep their samples.
 */
public class Simulator {

    private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

    private final Circuit circuit;
    private int cyclesCompleted = 0;

    public Simulator(Circuit circuit) {
        this.circuit = circuit;
    }

    /**
     * @return The names of all switches in creation order.
     */
    public List<String> listSwitches() {
        List<String> switches = new ArrayList<>();
        for (int id : circuit.devices().findDevices(DeviceKind.SWITCH)) {
            switches.add(circuit.names().getNameString(id));
        }
        return switches;
    }

    /**
     * @return The names of every output, monitored ones first.
     */
    public List<String> listOutputs() {
        Monitors.SignalNames signalNames = circuit.monitors().getSignalNames();
        List<String> outputs = new ArrayList<>(signalNames.monitored());
        outputs.addAll(signalNames.unmonitored());
        return outputs;
    }

    /**
     * @return The current state of the named switch, or {@code null} if there is no such switch.
     */
    public Boolean getSwitchState(String name) {
        Integer id = circuit.names().query(name);
        Device device = id == null ? null : circuit.devices().getDevice(id);
        if (device == null || !(device.getState() instanceof DeviceState.Switch state)) {
            return null;
        }
        return state.on();
    }

    /**
     * Sets the named switch; the change takes effect in the next cycle.
     * @return {@code false} if there is no such switch.
     */
    public boolean setSwitch(String name, boolean on) {
        Integer id = circuit.names().query(name);
        return id != null && circuit.devices().setSwitch(id, on);
    }

    /**
     * @param signal {@code device} or {@code device.PIN}.
     */
    public boolean isMonitored(String signal) {
        OutputRef ref = resolve(signal);
        return ref != null && circuit.monitors().isMonitored(ref.deviceId(), ref.pinId());
    }

    /**
     * Adds or removes a monitor.
     * @param signal {@code device} or {@code device.PIN}.
     * @param on {@code true} to add, {@code false} to remove.
     * @return The outcome of the operation.
     */
    public MonitorResult setMonitor(String signal, boolean on) {
        NameTable names = circuit.names();
        int dot = signal.indexOf('.');
        Integer deviceId = names.query(dot < 0 ? signal : signal.substring(0, dot));
        if (deviceId == null || circuit.devices().getDevice(deviceId) == null) {
            return MonitorResult.DEVICE_ABSENT;
        }
        OutputRef ref = resolve(signal);
        if (ref == null) {
            return on ? MonitorResult.NOT_OUTPUT : MonitorResult.NOT_MONITORED;
        }
        return on ? circuit.monitors().makeMonitor(ref.deviceId(), ref.pinId())
                : circuit.monitors().removeMonitor(ref.deviceId(), ref.pinId());
    }

    /**
     * Cold-starts the circuit, clears the histories and runs a number of cycles.
     * @param cycles The number of cycles to run.
     * @throws SimulationException if a cycle fails; earlier cycles stay recorded.
     */
    public void run(int cycles) throws SimulationException {
        run(cycles, Map.of());
    }

    /**
     * Cold-starts the circuit, sets switches away from their declared state, clears the
     * histories and runs a number of cycles.
     * @param cycles The number of cycles to run.
     * @param switchSettings Switch name to state, applied after the cold start.
     * @throws IllegalArgumentException if a name does not denote a switch; nothing is changed then.
     * @throws SimulationException if a cycle fails; earlier cycles stay recorded.
     */
    public void run(int cycles, Map<String, Boolean> switchSettings) throws SimulationException {
        if (cycles < 0) {
            throw new IllegalArgumentException("Number of cycles must not be negative: " + cycles);
        }
        for (String name : switchSettings.keySet()) {
            if (getSwitchState(name) == null) {
                throw new IllegalArgumentException("'" + name + "' is not a switch.");
            }
        }
        LOG.info("Running {} cycles from a cold start", cycles);
        circuit.devices().coldStartup();
        switchSettings.forEach(this::setSwitch);
        circuit.monitors().resetMonitors();
        cyclesCompleted = 0;
        step(cycles);
    }

    /**
     * Runs more cycles without resetting anything.
     * @param cycles The number of cycles to run.
     * @throws SimulationException if a cycle fails; earlier cycles stay recorded.
     */
    public void continueRun(int cycles) throws SimulationException {
        LOG.info("Continuing for {} cycles after cycle {}", cycles, cyclesCompleted);
        step(cycles);
    }

    /**
     * @return Cycles completed since the last cold start.
     */
    public int getCyclesCompleted() {
        return cyclesCompleted;
    }

    /**
     * @return Monitored output name to history, in the order the monitors were added.
     */
    public Map<String, List<Boolean>> getSignals() {
        return circuit.monitors().getSignals();
    }

    private void step(int cycles) throws SimulationException {
        if (cycles < 0) {
            throw new IllegalArgumentException("Number of cycles must not be negative: " + cycles);
        }
        for (int i = 0; i < cycles; i++) {
            try {
                circuit.network().executeCycle();
            } catch (SimulationException e) {
                LOG.warn("Simulation stopped in cycle {}: {}", cyclesCompleted + 1, e.getMessage());
                throw e;
            }
            circuit.monitors().recordSignals();
            cyclesCompleted++;
        }
    }

    /**
     * Resolves a signal name without adding anything to the name table.
     * @return The output, or {@code null} if the device or the pin is unknown.
     */
    private OutputRef resolve(String signal) {
        NameTable names = circuit.names();
        int dot = signal.indexOf('.');
        Integer deviceId = names.query(dot < 0 ? signal : signal.substring(0, dot));
        if (deviceId == null) {
            return null;
        }
        Integer pinId = null;
        if (dot >= 0) {
            pinId = names.query(signal.substring(dot + 1));
            if (pinId == null) {
                return null;
            }
        }
        return new OutputRef(deviceId, pinId);
    }
}
