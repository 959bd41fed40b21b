package org.logsim.compiler.diagnostics;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) while a circuit
 * definition is scanned, parsed and analysed.
 * <p>
 * This decouples error reporting from the actual compiler logic. When the source
 * text is known, each diagnostic captures the offending line so it can be rendered
 * without access to the file.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String[] sourceLines;

    /**
     * Creates an engine without source text; diagnostics carry no line content.
     */
    public DiagnosticsEngine() {
        this("");
    }

    /**
     * Creates an engine for the given source text.
     * @param source The complete source being compiled.
     */
    public DiagnosticsEngine(String source) {
        this.sourceLines = source.split("\\r?\\n", -1);
    }

    /**
     * Reports an error located at a token.
     * @param code The error code.
     * @param message The error message.
     * @param at The offending token.
     */
    public void reportError(CircuitErrorCode code, String message, Token at) {
        reportError(code, message, at.fileName(), at.line(), at.column());
    }

    /**
     * Reports an error at an explicit position.
     * @param code The error code.
     * @param message The error message.
     * @param fileName The file in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param columnNumber The column of the error.
     */
    public void reportError(CircuitErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber, columnNumber, lineContent(lineNumber)));
    }

    /**
     * Reports a warning located at a token.
     * @param code The warning code.
     * @param message The warning message.
     * @param at The offending token.
     */
    public void reportWarning(CircuitErrorCode code, String message, Token at) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, at.fileName(), at.line(), at.column(), lineContent(at.line())));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of reported errors.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private String lineContent(int lineNumber) {
        if (lineNumber < 1 || lineNumber > sourceLines.length) {
            return "";
        }
        return sourceLines[lineNumber - 1];
    }
}
