package org.logsim.compiler.frontend.parser.ast;

import org.logsim.compiler.frontend.lexer.Token;

/**
 * A monitor point from the MONITOR section, e.g. {@code dtype1.Q}.
 *
 * @param device The monitored device.
 * @param pin The named output, or {@code null} for the unnamed output.
 */
public record MonitorNode(
        Token device,
        Token pin
) implements AstNode {

    /**
     * @return The monitor point as written.
     */
    public String text() {
        return pin == null ? device.text() : device.text() + "." + pin.text();
    }
}
