package org.logsim.compiler.diagnostics;

import org.logsim.compiler.api.CircuitErrorCode;

/**
 * Represents a single diagnostic message (error or warning) produced while
 * building a circuit.
 *
 * @param type The severity of the diagnostic.
 * @param code The stable code identifying the problem.
 * @param message The message, naming the devices and pins involved.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue (1-based).
 * @param columnNumber The column of the offending token (1-based).
 * @param lineContent The text of the offending source line, or an empty string.
 */
public record Diagnostic(
        Type type,
        CircuitErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        String lineContent
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the circuit from being built. */
        ERROR,
        /** A warning that does not prevent the circuit from being built. */
        WARNING
    }

    /**
     * @return The category of the underlying code.
     */
    public CircuitErrorCode.Category category() {
        return code.category();
    }

    /**
     * Renders the diagnostic for a terminal: the summary line, then the offending
     * source line with a caret under the reported column.
     * @return The multi-line rendering.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(toString());
        if (lineContent != null && !lineContent.isEmpty()) {
            String prefix = "Line " + lineNumber + ": ";
            sb.append('\n').append(prefix).append(lineContent).append('\n');
            sb.append(" ".repeat(prefix.length())).append(caretIndent()).append('^');
        }
        return sb.toString();
    }

    // Tabs before the column are copied from the line.
    private String caretIndent() {
        int width = Math.max(0, columnNumber - 1);
        StringBuilder indent = new StringBuilder(width);
        for (int i = 0; i < width; i++) {
            indent.append(i < lineContent.length() && lineContent.charAt(i) == '\t' ? '\t' : ' ');
        }
        return indent.toString();
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s %s", type, fileName, lineNumber, columnNumber, category(), message);
    }
}
