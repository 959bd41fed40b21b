package org.logsim.compiler.diagnostics;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.frontend.lexer.Token;
import org.logsim.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void warningsDoNotCountAsErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine("MONITOR: s, s;");
        Token at = new Token(TokenType.NAME, "s", 0, 1, 13, "c.txt");

        engine.reportWarning(CircuitErrorCode.DUPLICATE_MONITOR, "'s' is already monitored.", at);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.errorCount()).isZero();
        assertThat(engine.getDiagnostics()).hasSize(1);
    }

    @Test
    void renderPointsAtTheReportedColumn() {
        DiagnosticsEngine engine = new DiagnosticsEngine("DEVICES:\nSWITCH sw1 7;\n");

        engine.reportError(CircuitErrorCode.INVALID_ARGUMENT, "bad state", "c.txt", 2, 12);

        Diagnostic diagnostic = engine.getDiagnostics().get(0);
        assertThat(diagnostic.toString()).isEqualTo("[ERROR] c.txt:2:12: SEMANTIC bad state");
        assertThat(diagnostic.render()).isEqualTo(
                "[ERROR] c.txt:2:12: SEMANTIC bad state\n"
                        + "Line 2: SWITCH sw1 7;\n"
                        + " ".repeat("Line 2: ".length() + 11) + "^");
        assertThat(engine.summary()).isEqualTo(diagnostic.toString());
    }

    @Test
    void renderKeepsTabIndentationUnderTheCaret() {
        DiagnosticsEngine engine = new DiagnosticsEngine("DEVICES:\n\t\tSWITCH sw1 7;\n");

        engine.reportError(CircuitErrorCode.INVALID_ARGUMENT, "bad state", "c.txt", 2, 14);

        assertThat(engine.getDiagnostics().get(0).render()).endsWith(
                "Line 2: \t\tSWITCH sw1 7;\n"
                        + " ".repeat("Line 2: ".length()) + "\t\t" + " ".repeat(11) + "^");
    }

    @Test
    void renderWithoutSourceIsASingleLine() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportError(CircuitErrorCode.MISSING_SECTION, "missing", "c.txt", 4, 1);

        assertThat(engine.getDiagnostics().get(0).render()).doesNotContain("\n");
    }
}
