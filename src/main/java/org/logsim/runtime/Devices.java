package org.logsim.runtime;

import org.logsim.names.NameTable;
import org.logsim.runtime.model.ConnectionResult;
import org.logsim.runtime.model.Device;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.DeviceState;
import org.logsim.runtime.model.OutputRef;
import org.logsim.runtime.model.Pins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The device registry: owns every device of a circuit, keyed by id, in creation order.
 * <p>
 * Pin names are interned in the shared {@link NameTable} when the registry is created,
 * so pins are compared by id everywhere else.
 */
public class Devices {

    private static final Logger LOG = LoggerFactory.getLogger(Devices.class);

    private final NameTable names;
    private final Map<Integer, Device> devices = new LinkedHashMap<>();

    private final List<Integer> gateInputIds;
    private final List<Integer> dtypeInputIds;
    private final int qId;
    private final int qbarId;

    /**
     * Creates an empty registry.
     * @param names The name table shared with the compiler.
     */
    public Devices(NameTable names) {
        this.names = names;
        this.gateInputIds = names.lookup(Pins.gateInputs(Pins.MAX_GATE_INPUTS));
        this.dtypeInputIds = names.lookup(Pins.DTYPE_INPUTS);
        this.qId = names.lookup(Pins.Q);
        this.qbarId = names.lookup(Pins.QBAR);
    }

    /**
     * Creates a device and puts it into its cold-start state.
     * @param kind The kind of device.
     * @param deviceId The id of the device name.
     * @param parameter The parameter text as written, or {@code null} if none was given.
     * @return The id of the new device.
     * @throws DuplicateDeviceException if a device with this id already exists.
     * @throws InvalidDeviceParameterException if the parameter is missing, superfluous or out of range.
     */
    public int createDevice(DeviceKind kind, int deviceId, String parameter) throws DeviceException {
        if (devices.containsKey(deviceId)) {
            throw new DuplicateDeviceException(deviceId, names.getNameString(deviceId));
        }
        Device device = switch (kind) {
            case SWITCH -> singleOutput(deviceId, kind, List.of(),
                    new DeviceState.Switch(parseSwitchState(parameter), false));
            case CLOCK -> singleOutput(deviceId, kind, List.of(),
                    new DeviceState.Clock(parsePositive(kind, parameter), 0));
            case RC -> singleOutput(deviceId, kind, List.of(),
                    new DeviceState.Rc(parsePositive(kind, parameter), 0));
            case SIGGEN -> singleOutput(deviceId, kind, List.of(),
                    new DeviceState.SigGen(parseWaveform(parameter), 0));
            case AND, OR, NAND, NOR -> {
                int inputs = parseInputCount(kind, parameter);
                yield singleOutput(deviceId, kind, gateInputIds.subList(0, inputs), new DeviceState.Gate(inputs));
            }
            case XOR -> {
                requireNoParameter(kind, parameter);
                yield singleOutput(deviceId, kind, gateInputIds.subList(0, 2), new DeviceState.Gate(2));
            }
            case DTYPE -> {
                requireNoParameter(kind, parameter);
                yield new Device(deviceId, kind, dtypeInputIds, List.of(qId, qbarId),
                        new DeviceState.DType(false, false));
            }
        };
        devices.put(deviceId, device);
        coldStart(device);
        LOG.debug("Created {} '{}'", kind, names.getNameString(deviceId));
        return deviceId;
    }

    /**
     * Connects an input pin to a source output.
     * @param deviceId The device owning the input.
     * @param inputPin The input pin id.
     * @param sourceDeviceId The device owning the output.
     * @param sourcePin The output pin id, {@code null} for the unnamed output.
     * @return The outcome; the registry is only changed on {@link ConnectionResult#OK}.
     */
    public ConnectionResult connectInput(int deviceId, int inputPin, int sourceDeviceId, Integer sourcePin) {
        Device target = devices.get(deviceId);
        Device source = devices.get(sourceDeviceId);
        if (target == null || source == null) {
            return ConnectionResult.DEVICE_ABSENT;
        }
        if (!target.hasInput(inputPin) || !source.hasOutput(sourcePin)) {
            return ConnectionResult.PORT_ABSENT;
        }
        if (target.getSource(inputPin) != null) {
            return ConnectionResult.INPUT_CONNECTED;
        }
        target.setSource(inputPin, new OutputRef(sourceDeviceId, sourcePin));
        return ConnectionResult.OK;
    }

    /**
     * @return The ids of all devices in creation order.
     */
    public List<Integer> findDevices() {
        return new ArrayList<>(devices.keySet());
    }

    /**
     * @param kind The kind to filter by.
     * @return The ids of all devices of that kind in creation order.
     */
    public List<Integer> findDevices(DeviceKind kind) {
        List<Integer> ids = new ArrayList<>();
        for (Device device : devices.values()) {
            if (device.getKind() == kind) {
                ids.add(device.getId());
            }
        }
        return ids;
    }

    /**
     * @param deviceId A device id.
     * @return The device, or {@code null} if there is none with this id.
     */
    public Device getDevice(int deviceId) {
        return devices.get(deviceId);
    }

    /**
     * @return All devices in creation order.
     */
    public Collection<Device> getDevices() {
        return Collections.unmodifiableCollection(devices.values());
    }

    public int size() {
        return devices.size();
    }

    /**
     * Sets the state of a switch. The new state is driven onto the output at the start
     * of the next cycle.
     * @param deviceId The switch id.
     * @param on The new state.
     * @return {@code false} if the id does not name a switch.
     */
    public boolean setSwitch(int deviceId, boolean on) {
        Device device = devices.get(deviceId);
        if (device == null || !(device.getState() instanceof DeviceState.Switch state)) {
            return false;
        }
        device.setState(state.withOn(on));
        return true;
    }

    /**
     * Resets every device to its power-on state.
     */
    public void coldStartup() {
        for (Device device : devices.values()) {
            coldStart(device);
        }
        LOG.debug("Cold startup of {} devices", devices.size());
    }

    /**
     * @return The interned id of an output pin name, e.g. the id of {@code Q}.
     */
    public int qPin() {
        return qId;
    }

    public int qbarPin() {
        return qbarId;
    }

    /**
     * @return The ids of DATA, CLK, SET and CLEAR in that order.
     */
    public List<Integer> dtypeInputPins() {
        return dtypeInputIds;
    }

    private void coldStart(Device device) {
        switch (device.getKind()) {
            case SWITCH -> {
                DeviceState.Switch state = (DeviceState.Switch) device.getState();
                device.setState(state.withOn(state.initialState()));
                device.setOutput(null, state.initialState());
            }
            case CLOCK -> {
                device.setState(((DeviceState.Clock) device.getState()).withCounter(0));
                device.setOutput(null, false);
            }
            case DTYPE -> {
                device.setState(new DeviceState.DType(false, false));
                device.setOutput(qId, false);
                device.setOutput(qbarId, true);
            }
            case RC -> {
                DeviceState.Rc state = (DeviceState.Rc) device.getState();
                device.setState(state.withRemaining(state.period()));
                device.setOutput(null, true);
            }
            case SIGGEN -> {
                DeviceState.SigGen state = (DeviceState.SigGen) device.getState();
                device.setState(state.withCursor(0));
                device.setOutput(null, state.waveform().get(0));
            }
            case AND, OR, NAND, NOR, XOR -> device.setOutput(null, false);
        }
    }

    private Device singleOutput(int deviceId, DeviceKind kind, List<Integer> inputs, DeviceState state) {
        List<Integer> outputs = new ArrayList<>();
        outputs.add(null);
        return new Device(deviceId, kind, inputs, outputs, state);
    }

    private static boolean parseSwitchState(String parameter) throws InvalidDeviceParameterException {
        if ("0".equals(parameter)) return false;
        if ("1".equals(parameter)) return true;
        throw new InvalidDeviceParameterException(DeviceKind.SWITCH, parameter,
                "The initial state of a SWITCH must be 0 or 1, but got '" + parameter + "'.");
    }

    private static int parsePositive(DeviceKind kind, String parameter) throws InvalidDeviceParameterException {
        if (!isDecimal(parameter)) {
            throw new InvalidDeviceParameterException(kind, parameter,
                    "The period of a " + kind + " must be a positive integer without leading zeros, but got '" + parameter + "'.");
        }
        try {
            return Integer.parseInt(parameter);
        } catch (NumberFormatException e) {
            throw new InvalidDeviceParameterException(kind, parameter,
                    "The period of a " + kind + " is too large: " + parameter + ".");
        }
    }

    private static int parseInputCount(DeviceKind kind, String parameter) throws InvalidDeviceParameterException {
        if (isDecimal(parameter) && parameter.length() <= 2) {
            int count = Integer.parseInt(parameter);
            if (count <= Pins.MAX_GATE_INPUTS) {
                return count;
            }
        }
        throw new InvalidDeviceParameterException(kind, parameter,
                "The number of inputs of " + kind + " must be between 1 and " + Pins.MAX_GATE_INPUTS + ", but got '" + parameter + "'.");
    }

    private static List<Boolean> parseWaveform(String parameter) throws InvalidDeviceParameterException {
        if (parameter == null || parameter.isEmpty() || !parameter.chars().allMatch(c -> c == '0' || c == '1')) {
            throw new InvalidDeviceParameterException(DeviceKind.SIGGEN, parameter,
                    "The waveform of a SIGGEN must be a non-empty string of 0s and 1s, but got '" + parameter + "'.");
        }
        List<Boolean> bits = new ArrayList<>(parameter.length());
        for (char c : parameter.toCharArray()) {
            bits.add(c == '1');
        }
        return bits;
    }

    private static void requireNoParameter(DeviceKind kind, String parameter) throws InvalidDeviceParameterException {
        if (parameter != null) {
            throw new InvalidDeviceParameterException(kind, parameter, kind + " takes no parameter.");
        }
    }

    /**
     * A positive decimal literal: digits only, no leading zero.
     */
    private static boolean isDecimal(String text) {
        return text != null && !text.isEmpty() && text.charAt(0) != '0' && text.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
