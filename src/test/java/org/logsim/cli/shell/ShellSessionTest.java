package org.logsim.cli.shell;

import org.logsim.cli.rendering.TraceRenderer;
import org.logsim.runtime.OscillationException;
import org.logsim.runtime.Simulator;
import org.logsim.runtime.model.MonitorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the shell command interpreter, run against a mocked simulator.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ShellSessionTest {

    @Mock
    private Simulator simulator;
    private StringWriter output;
    private ShellSession session;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        session = new ShellSession(simulator, new TraceRenderer('-', '_'), new PrintWriter(output), 10);
    }

    private String printed() {
        return output.toString();
    }

    @Test
    void quitEndsTheSession() {
        assertThat(session.execute("q")).isFalse();
        assertThat(session.execute("  ")).isTrue();
        assertThat(printed()).isEmpty();
    }

    @Test
    void helpListsTheCommands() {
        session.execute("h");

        assertThat(printed()).contains(ShellSession.HELP);
    }

    @Test
    void unknownCommandIsReported() {
        assertThat(session.execute("x 1")).isTrue();

        assertThat(printed()).contains("Invalid command 'x'. Enter 'h' for help.");
    }

    @Test
    void runPrintsTraces() throws Exception {
        // Arrange
        Map<String, List<Boolean>> signals = new LinkedHashMap<>();
        signals.put("a1", List.of(true, true, false));
        when(simulator.getSignals()).thenReturn(signals);
        when(simulator.getCyclesCompleted()).thenReturn(3);

        // Act
        session.execute("r 3");

        // Assert
        verify(simulator).run(eq(3), anyMap());
        assertThat(printed()).contains("Running for 3 cycles", "a1 --_");
    }

    @Test
    void runWithoutCountUsesTheDefault() throws Exception {
        when(simulator.getSignals()).thenReturn(Map.of());

        session.execute("r");

        verify(simulator).run(eq(10), anyMap());
    }

    @Test
    void invalidCycleCountsAreRejected() throws Exception {
        session.execute("r 0");
        session.execute("r abc");
        session.execute("c -1");

        verify(simulator, never()).run(anyInt(), anyMap());
        verify(simulator, never()).continueRun(anyInt());
        assertThat(printed()).contains("Error: the number of cycles must be a positive integer.");
    }

    @Test
    void continueRequiresAPriorRun() throws Exception {
        when(simulator.getSignals()).thenReturn(Map.of());
        when(simulator.getCyclesCompleted()).thenReturn(7);

        session.execute("c 2");
        assertThat(printed()).contains("Error: nothing to continue. Run first.");
        verify(simulator, never()).continueRun(anyInt());

        session.execute("r 5");
        session.execute("c 2");
        verify(simulator).continueRun(2);
        assertThat(printed()).contains("Continuing for 2 cycles. Total: 7");
    }

    @Test
    void runtimeErrorIsPrintedAndTracesKept() throws Exception {
        doThrow(new OscillationException(20)).when(simulator).run(eq(5), anyMap());
        when(simulator.getSignals()).thenReturn(Map.of("ring", List.of(false)));
        when(simulator.getCyclesCompleted()).thenReturn(1);

        assertThat(session.execute("r 5")).isTrue();

        assertThat(printed()).contains("Error: The network did not settle after 20 iterations", "ring _");
    }

    @Test
    void setsSwitches() {
        when(simulator.setSwitch("sw1", true)).thenReturn(true);
        when(simulator.setSwitch("clk", false)).thenReturn(false);

        session.execute("s sw1 1");
        session.execute("s clk 0");
        session.execute("s sw1 2");

        assertThat(printed()).contains(
                "Successfully set switch sw1 to 1",
                "Error: 'clk' is not a switch.",
                "Error: usage: s X N, with N 0 or 1.");
        verify(simulator, times(2)).setSwitch(anyString(), anyBoolean());
    }

    @Test
    void switchSettingsSurviveTheColdStartOfLaterRuns() throws Exception {
        when(simulator.setSwitch("sw1", false)).thenReturn(true);
        when(simulator.getSignals()).thenReturn(Map.of());

        session.execute("s sw1 0");
        session.execute("r 2");

        verify(simulator).run(2, Map.of("sw1", false));
    }

    @Test
    void makesAndZapsMonitors() {
        when(simulator.setMonitor("ff1.Q", true)).thenReturn(MonitorResult.OK);
        when(simulator.setMonitor("ff1.Q", false)).thenReturn(MonitorResult.OK);
        when(simulator.setMonitor("ghost.Q", true)).thenReturn(MonitorResult.DEVICE_ABSENT);
        when(simulator.setMonitor("sw1", false)).thenReturn(MonitorResult.NOT_MONITORED);

        session.execute("m ff1.Q");
        session.execute("z ff1.Q");
        session.execute("m ghost.Q");
        session.execute("z sw1");
        session.execute("m");

        assertThat(printed()).contains(
                "Successfully made monitor ff1.Q",
                "Successfully zapped monitor ff1.Q",
                "Error: there is no device 'ghost'.",
                "Error: 'sw1' is not monitored.",
                "Error: usage: m X");
    }

    @Test
    void listsSwitchesAndOutputs() {
        when(simulator.listSwitches()).thenReturn(List.of("sw1"));
        when(simulator.getSwitchState("sw1")).thenReturn(true);
        when(simulator.listOutputs()).thenReturn(List.of("a1", "sw1"));
        when(simulator.isMonitored("a1")).thenReturn(true);
        when(simulator.isMonitored("sw1")).thenReturn(false);

        session.execute("l");

        assertThat(printed()).contains("  sw1 = 1", "* a1", "  sw1");
    }
}
