package org.logsim.compiler.frontend.parser.ast;

import org.logsim.compiler.frontend.lexer.Token;
import org.logsim.runtime.model.DeviceKind;

/**
 * A device declaration from the DEVICES section, e.g. {@code SWITCH sw1 0}.
 *
 * @param kindToken The keyword naming the device kind.
 * @param nameToken The device name.
 * @param parameterToken The parameter, or {@code null} for kinds without one.
 */
public record DeviceNode(
        Token kindToken,
        Token nameToken,
        Token parameterToken
) implements AstNode {

    /**
     * @return The declared device kind.
     */
    public DeviceKind kind() {
        return DeviceKind.fromKeyword(kindToken.text());
    }
}
