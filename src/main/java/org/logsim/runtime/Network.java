package org.logsim.runtime;

import org.logsim.names.NameTable;
import org.logsim.runtime.model.ConnectionResult;
import org.logsim.runtime.model.Device;
import org.logsim.runtime.model.DeviceState;
import org.logsim.runtime.model.OutputRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The connectivity of a circuit and its cycle-by-cycle evaluation.
 * <p>
 * A cycle runs in fixed phases: sources (switches, clocks, signal generators, RC devices)
 * are advanced, the gates are settled, every DTYPE latches once and the gates are settled
 * again. A cycle either completes or leaves every device exactly as it was.
 */
public class Network {

    private static final Logger LOG = LoggerFactory.getLogger(Network.class);

    private final NameTable names;
    private final Devices devices;
    private final SimulationSettings settings;

    /**
     * Creates a network over a device registry.
     * @param names The shared name table.
     * @param devices The devices to connect and evaluate.
     * @param settings The engine settings.
     */
    public Network(NameTable names, Devices devices, SimulationSettings settings) {
        this.names = names;
        this.devices = devices;
        this.settings = settings;
    }

    /**
     * Connects a source output to an input.
     * @see Devices#connectInput(int, int, int, Integer)
     */
    public ConnectionResult makeConnection(int sourceDeviceId, Integer sourcePin, int targetDeviceId, int targetPin) {
        return devices.connectInput(targetDeviceId, targetPin, sourceDeviceId, sourcePin);
    }

    /**
     * @return The source of an input, or {@code null} if the device or pin does not exist or the input is floating.
     */
    public OutputRef getConnectedOutput(int deviceId, int inputPin) {
        Device device = devices.getDevice(deviceId);
        return device == null ? null : device.getSource(inputPin);
    }

    /**
     * @return The current value of an output, or {@code null} if the device or output does not exist.
     */
    public Boolean getOutputSignal(int deviceId, Integer outputPin) {
        Device device = devices.getDevice(deviceId);
        return device == null ? null : device.getOutput(outputPin);
    }

    /**
     * @return {@code true} if every input of every device has a source.
     */
    public boolean checkNetwork() {
        for (Device device : devices.getDevices()) {
            if (device.getInputs().containsValue(null)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Executes one simulation cycle.
     * @throws FloatingInputException if some input is not connected.
     * @throws OscillationException if the gates do not settle.
     */
    public void executeCycle() throws SimulationException {
        Map<Integer, Device.Snapshot> snapshot = new LinkedHashMap<>();
        for (Device device : devices.getDevices()) {
            snapshot.put(device.getId(), device.snapshot());
        }
        try {
            requireConnectedInputs();
            updateSources();
            settle();
            updateDTypes();
            settle();
        } catch (SimulationException e) {
            for (Device device : devices.getDevices()) {
                device.restore(snapshot.get(device.getId()));
            }
            LOG.debug("Cycle aborted and rolled back: {}", e.getMessage());
            throw e;
        }
    }

    private void requireConnectedInputs() throws FloatingInputException {
        for (Device device : devices.getDevices()) {
            for (Map.Entry<Integer, OutputRef> input : device.getInputs().entrySet()) {
                if (input.getValue() == null) {
                    throw new FloatingInputException(names.getNameString(device.getId()), names.getNameString(input.getKey()));
                }
            }
        }
    }

    private void updateSources() {
        for (Device device : devices.getDevices()) {
            switch (device.getKind()) {
                case SWITCH -> device.setOutput(null, ((DeviceState.Switch) device.getState()).on());
                case CLOCK -> {
                    DeviceState.Clock clock = (DeviceState.Clock) device.getState();
                    int counter = clock.counter() + 1;
                    if (counter >= clock.halfPeriod()) {
                        device.setOutput(null, !device.getOutput(null));
                        counter = 0;
                    }
                    device.setState(clock.withCounter(counter));
                }
                case SIGGEN -> {
                    DeviceState.SigGen generator = (DeviceState.SigGen) device.getState();
                    device.setOutput(null, generator.waveform().get(generator.cursor()));
                    device.setState(generator.withCursor((generator.cursor() + 1) % generator.waveform().size()));
                }
                case RC -> {
                    DeviceState.Rc rc = (DeviceState.Rc) device.getState();
                    if (rc.remaining() > 0) {
                        device.setOutput(null, true);
                        device.setState(rc.withRemaining(rc.remaining() - 1));
                    } else {
                        device.setOutput(null, false);
                    }
                }
                case AND, OR, NAND, NOR, XOR, DTYPE -> {
                    // driven by their inputs
                }
            }
        }
    }

    /**
     * Re-evaluates the gates in creation order until no output changes.
     */
    private void settle() throws OscillationException {
        int cap = Math.max(settings.minSettleIterations(), 2 * devices.size() + 1);
        for (int pass = 0; pass < cap; pass++) {
            boolean changed = false;
            for (Device device : devices.getDevices()) {
                Boolean value = switch (device.getKind()) {
                    case AND -> allHigh(device);
                    case NAND -> !allHigh(device);
                    case OR -> anyHigh(device);
                    case NOR -> !anyHigh(device);
                    case XOR -> parity(device);
                    case SWITCH, CLOCK, DTYPE, RC, SIGGEN -> null;
                };
                if (value != null && device.setOutput(null, value)) {
                    changed = true;
                }
            }
            if (!changed) {
                return;
            }
        }
        throw new OscillationException(cap);
    }

    /**
     * Latches every DTYPE from the values its inputs had before any of them changed, so
     * chained flip-flops shift by one stage per cycle.
     */
    private void updateDTypes() {
        List<Integer> pins = devices.dtypeInputPins();
        List<Device> latched = new ArrayList<>();
        List<DeviceState.DType> next = new ArrayList<>();
        for (Device device : devices.getDevices()) {
            if (!(device.getState() instanceof DeviceState.DType state)) {
                continue;
            }
            boolean data = input(device, pins.get(0));
            boolean clock = input(device, pins.get(1));
            boolean set = input(device, pins.get(2));
            boolean clear = input(device, pins.get(3));

            boolean q = state.q();
            if (set) {
                q = true;
            } else if (clear) {
                q = false;
            } else if (clock && !state.previousClock()) {
                q = data;
            }
            latched.add(device);
            next.add(new DeviceState.DType(q, clock));
        }
        for (int i = 0; i < latched.size(); i++) {
            Device device = latched.get(i);
            DeviceState.DType state = next.get(i);
            device.setState(state);
            device.setOutput(devices.qPin(), state.q());
            device.setOutput(devices.qbarPin(), !state.q());
        }
    }

    private boolean input(Device device, int pin) {
        OutputRef source = device.getSource(pin);
        return devices.getDevice(source.deviceId()).getOutput(source.pinId());
    }

    private boolean allHigh(Device device) {
        for (int pin : device.getInputs().keySet()) {
            if (!input(device, pin)) return false;
        }
        return true;
    }

    private boolean anyHigh(Device device) {
        for (int pin : device.getInputs().keySet()) {
            if (input(device, pin)) return true;
        }
        return false;
    }

    private boolean parity(Device device) {
        boolean result = false;
        for (int pin : device.getInputs().keySet()) {
            result ^= input(device, pin);
        }
        return result;
    }
}
