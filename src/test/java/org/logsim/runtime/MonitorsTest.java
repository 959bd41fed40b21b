package org.logsim.runtime;

import org.logsim.names.NameTable;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.MonitorResult;
import org.logsim.runtime.model.OutputRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link Monitors}.
 */
@Tag("unit")
class MonitorsTest {

    private NameTable names;
    private Devices devices;
    private Network network;
    private Monitors monitors;
    private int clock;
    private int flipFlop;
    private int q;
    private int qbar;

    @BeforeEach
    void setUp() throws DeviceException {
        names = new NameTable();
        devices = new Devices(names);
        network = new Network(names, devices, SimulationSettings.DEFAULTS);
        monitors = new Monitors(names, devices, network);

        clock = devices.createDevice(DeviceKind.CLOCK, names.lookup("clk"), "1");
        int low = devices.createDevice(DeviceKind.SWITCH, names.lookup("low"), "0");
        flipFlop = devices.createDevice(DeviceKind.DTYPE, names.lookup("ff"), null);
        q = names.lookup("Q");
        qbar = names.lookup("QBAR");
        network.makeConnection(clock, null, flipFlop, names.lookup("CLK"));
        network.makeConnection(flipFlop, qbar, flipFlop, names.lookup("DATA"));
        network.makeConnection(low, null, flipFlop, names.lookup("SET"));
        network.makeConnection(low, null, flipFlop, names.lookup("CLEAR"));
    }

    private void cycles(int count) throws SimulationException {
        for (int i = 0; i < count; i++) {
            network.executeCycle();
            monitors.recordSignals();
        }
    }

    @Test
    void makeMonitorValidatesTheOutput() {
        assertThat(monitors.makeMonitor(names.lookup("nothing"), null)).isEqualTo(MonitorResult.DEVICE_ABSENT);
        assertThat(monitors.makeMonitor(flipFlop, null)).isEqualTo(MonitorResult.NOT_OUTPUT);
        assertThat(monitors.makeMonitor(clock, q)).isEqualTo(MonitorResult.NOT_OUTPUT);
        assertThat(monitors.makeMonitor(flipFlop, q)).isEqualTo(MonitorResult.OK);
        assertThat(monitors.makeMonitor(flipFlop, q)).isEqualTo(MonitorResult.MONITOR_PRESENT);

        assertThat(monitors.getMonitors()).containsExactly(new OutputRef(flipFlop, q));
        assertThat(monitors.getSignalHistory(flipFlop, q)).isEmpty();
        assertThat(monitors.getSignalHistory(clock, null)).isNull();
    }

    @Test
    void recordsOneSamplePerCycleWithoutBackfill() throws Exception {
        monitors.makeMonitor(clock, null);
        cycles(3);
        monitors.makeMonitor(flipFlop, q);
        cycles(2);

        assertThat(monitors.getSignalHistory(clock, null)).containsExactly(true, false, true, false, true);
        assertThat(monitors.getSignalHistory(flipFlop, q)).containsExactly(false, true);
    }

    @Test
    void resetClearsHistoriesButKeepsMonitors() throws Exception {
        monitors.makeMonitor(clock, null);
        cycles(2);

        devices.coldStartup();
        assertThat(monitors.getSignalHistory(clock, null)).hasSize(2);

        monitors.resetMonitors();
        assertThat(monitors.isMonitored(clock, null)).isTrue();
        assertThat(monitors.getSignalHistory(clock, null)).isEmpty();

        cycles(1);
        assertThat(monitors.getSignalHistory(clock, null)).containsExactly(true);
    }

    @Test
    void removeMonitorDiscardsTheHistory() throws Exception {
        monitors.makeMonitor(clock, null);
        cycles(1);

        assertThat(monitors.removeMonitor(clock, null)).isEqualTo(MonitorResult.OK);
        assertThat(monitors.removeMonitor(clock, null)).isEqualTo(MonitorResult.NOT_MONITORED);
        assertThat(monitors.isMonitored(clock, null)).isFalse();

        monitors.makeMonitor(clock, null);
        assertThat(monitors.getSignalHistory(clock, null)).isEmpty();
    }

    @Test
    void namesSignalsByDeviceAndPin() throws Exception {
        monitors.makeMonitor(flipFlop, qbar);
        monitors.makeMonitor(clock, null);
        cycles(1);

        assertThat(monitors.getSignals()).containsExactly(
                entry("ff.QBAR", List.of(false)),
                entry("clk", List.of(true)));

        Monitors.SignalNames signalNames = monitors.getSignalNames();
        assertThat(signalNames.monitored()).containsExactly("ff.QBAR", "clk");
        assertThat(signalNames.unmonitored()).containsExactly("low", "ff.Q");
    }
}
