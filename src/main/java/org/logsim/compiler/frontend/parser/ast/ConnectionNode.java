package org.logsim.compiler.frontend.parser.ast;

import org.logsim.compiler.frontend.lexer.Token;

/**
 * A connection from the CONNECT section, e.g. {@code dtype1.QBAR > and1.I2}.
 *
 * @param sourceDevice The device driving the connection.
 * @param sourcePin The named output of the source, or {@code null} for the unnamed output.
 * @param targetDevice The device receiving the signal.
 * @param targetPin The input pin of the target.
 */
public record ConnectionNode(
        Token sourceDevice,
        Token sourcePin,
        Token targetDevice,
        Token targetPin
) implements AstNode {

    /**
     * @return The source end as written, e.g. {@code dtype1.QBAR}.
     */
    public String sourceText() {
        return sourcePin == null ? sourceDevice.text() : sourceDevice.text() + "." + sourcePin.text();
    }

    /**
     * @return The target end as written, e.g. {@code and1.I2}.
     */
    public String targetText() {
        return targetDevice.text() + "." + targetPin.text();
    }
}
