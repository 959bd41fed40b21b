package org.logsim.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.logsim.cli.commands.RunCommand;
import org.logsim.cli.config.LoggingConfigurator;
import org.logsim.junit.extensions.logging.AllowLog;
import org.logsim.junit.extensions.logging.ExpectLog;
import org.logsim.junit.extensions.logging.LogLevel;
import org.logsim.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code logsim} command line end to end against the circuit fixtures.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    }

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(CommandLineInterfaceTest.class.getResource("/circuits/" + name).toURI()).toString();
    }

    @Test
    void checkReportsAValidCircuit() throws Exception {
        int exitCode = execute("check", fixture("fanout.txt"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("fanout.txt: OK (2 devices, 1 monitors)");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void checkPrintsEveryDiagnosticWithItsSourceLine() throws Exception {
        int exitCode = execute("check", fixture("broken.txt"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains(
                "Device 'sw1' is already defined.",
                "Line 3: ",
                "SWITCH sw1 0,",
                "4 error(s), 0 warning(s).");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*CircuitLoader", messagePattern = "Circuit file not found: .*")
    void missingFileFailsCleanly() {
        int exitCode = execute("check", tempDir.resolve("nothing.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Circuit file not found");
    }

    @Test
    void runPrintsOneTracePerMonitor() throws Exception {
        int exitCode = execute("run", fixture("counter.txt"), "-n", "4");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "clk    -_-_",
                "bit0.Q --__",
                "bit1.Q ---_");
    }

    @Test
    void runUsesTheDefaultCycleCount() throws Exception {
        execute("run", fixture("fanout.txt"));

        assertThat(out.toString().lines()).containsExactly("a1 ----------");
    }

    @Test
    void runAppliesSwitchOptions() throws Exception {
        int exitCode = execute("run", fixture("fanout.txt"), "-n", "3", "--switch", "s1=0");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("a1 ___");
    }

    @Test
    void runRejectsUnknownSwitches() throws Exception {
        int exitCode = execute("run", fixture("fanout.txt"), "-s", "a1=1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("cannot set switch 'a1'");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Simulator", messagePattern = "Simulation stopped in cycle 1: .*")
    void runtimeErrorExitsWithItsOwnCode() throws Exception {
        int exitCode = execute("run", fixture("oscillator.txt"), "-n", "3");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("Error in cycle 1: The network did not settle");
        assertThat(out.toString().lines()).containsExactly("ring ");
    }

    @Test
    void configFileOverridesDefaults() throws Exception {
        Path config = tempDir.resolve("custom.conf");
        Files.writeString(config, """
                logsim.simulation.default-cycles = 3
                logsim.cli.trace { high = "1", low = "0" }
                """);

        int exitCode = execute("-c", config.toString(), "run", fixture("fanout.txt"));

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("a1 111");
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*CommandLineInterface", messagePattern = "Failed to load or parse configuration: .*")
    void missingConfigFileIsReported() throws Exception {
        int exitCode = execute("-c", tempDir.resolve("absent.conf").toString(), "check", fixture("fanout.txt"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: ");
    }
}
